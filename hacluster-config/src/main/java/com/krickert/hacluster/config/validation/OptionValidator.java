package com.krickert.hacluster.config.validation;

import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ReportItem;

import java.util.List;
import java.util.Map;

/**
 * A check applied to a whole option map. A validator looks up its own target option and returns
 * no reports when the option is not there, unless the check is about presence itself.
 */
@FunctionalInterface
public interface OptionValidator {
    /**
     * @param options The options to check, keyed by option name.
     * @return The problems found, an empty list if there are none.
     */
    List<ReportItem> validate(Map<String, ValuePair> options);
}
