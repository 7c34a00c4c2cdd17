package com.krickert.hacluster.config.report;

import java.util.Map;

/**
 * Decides, when a check is constructed, how its violations are reported.
 * <ul>
 *   <li>already forced: WARNING without a force code</li>
 *   <li>forceable, not forced: ERROR carrying the force code</li>
 *   <li>not forceable: plain ERROR</li>
 * </ul>
 *
 * @param forceCode The code the caller may use to force the check, null if the check is not forceable.
 * @param forced    True if the caller has already forced the check.
 */
public record Forceability(ForceCode forceCode, boolean forced) {

    private static final Forceability NONE = new Forceability(null, false);

    public static Forceability none() {
        return NONE;
    }

    public static Forceability of(ForceCode forceCode, boolean forced) {
        return new Forceability(forceCode, forced);
    }

    public ReportItem create(ReportCode code, Map<String, Object> info) {
        if (forced) {
            return ReportItem.warning(code, info);
        }
        if (forceCode != null) {
            return ReportItem.error(code, forceCode, info);
        }
        return ReportItem.error(code, info);
    }
}
