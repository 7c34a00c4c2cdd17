package com.krickert.hacluster.config.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single immutable diagnostic.
 *
 * @param code      The kind of problem.
 * @param severity  ERROR blocks the operation, WARNING does not.
 * @param forceCode Token which lets the caller downgrade the error, null if the error is not forceable.
 *                  Warnings never carry one.
 * @param info      Structured payload used to render the message. Keys keep their insertion order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Serdeable
public record ReportItem(
        @JsonProperty("code") ReportCode code,
        @JsonProperty("severity") ReportSeverity severity,
        @JsonProperty("forceCode") ForceCode forceCode,
        @JsonProperty("info") Map<String, Object> info
) {
    public ReportItem {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        if (severity == ReportSeverity.WARNING && forceCode != null) {
            throw new IllegalArgumentException("A warning cannot carry a force code: " + code);
        }
        info = Collections.unmodifiableMap(info == null ? new LinkedHashMap<>() : new LinkedHashMap<>(info));
    }

    public static ReportItem error(ReportCode code, Map<String, Object> info) {
        return new ReportItem(code, ReportSeverity.ERROR, null, info);
    }

    public static ReportItem error(ReportCode code, ForceCode forceCode, Map<String, Object> info) {
        return new ReportItem(code, ReportSeverity.ERROR, forceCode, info);
    }

    public static ReportItem warning(ReportCode code, Map<String, Object> info) {
        return new ReportItem(code, ReportSeverity.WARNING, null, info);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == ReportSeverity.ERROR;
    }

    @JsonIgnore
    public boolean isForceable() {
        return forceCode != null;
    }
}
