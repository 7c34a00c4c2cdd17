package com.krickert.hacluster.config.validation;

import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Building blocks for option validation.
 *
 * <p>Value validators only look at their target option and stay silent when it is missing. Whether
 * a violation is forceable, and whether it has already been forced, is fixed when the validator is
 * built by passing a {@link Forceability}. Validators built without one report plain errors.
 */
public final class OptionValidators {

    private static final Logger LOG = LoggerFactory.getLogger(OptionValidators.class);

    private OptionValidators() {
    }

    /**
     * Applies every validator to the whole option map in the given order and concatenates the reports.
     */
    public static List<ReportItem> runCollection(Map<String, ValuePair> options, List<OptionValidator> validators) {
        List<ReportItem> reports = new ArrayList<>();
        for (OptionValidator validator : validators) {
            reports.addAll(validator.validate(options));
        }
        LOG.debug("Ran {} option validators over options {}: {} report(s)", validators.size(), options.keySet(), reports.size());
        return reports;
    }

    /**
     * Skips the wrapped validator entirely when the option is not present.
     */
    public static OptionValidator ifOptionExists(String optionName, OptionValidator validator) {
        return options -> options.containsKey(optionName) ? validator.validate(options) : List.of();
    }

    public static OptionValidator isRequired(String optionName, String optionType) {
        return options -> options.containsKey(optionName)
                ? List.of()
                : List.of(ReportItems.requiredOptionIsMissing(List.of(optionName), optionType));
    }

    /**
     * Reports when the option is set and its prerequisite is not.
     */
    public static OptionValidator dependsOnOption(String optionName, String prerequisiteName) {
        return options -> options.containsKey(optionName) && !options.containsKey(prerequisiteName)
                ? List.of(ReportItems.prerequisiteOptionIsMissing(optionName, prerequisiteName))
                : List.of();
    }

    /**
     * Generic value check. The predicate gets the normalized value, the report carries the original one.
     *
     * @param allowedDescription Allowed values or their description, put in the report as is.
     * @param optionNameForReport The name used in the report, null to use the option name.
     */
    public static OptionValidator valueCond(String optionName, Predicate<String> predicate, Object allowedDescription,
                                            String optionNameForReport, Forceability forceability) {
        String reportedName = optionNameForReport != null ? optionNameForReport : optionName;
        return ifOptionExists(optionName, options -> {
            ValuePair value = options.get(optionName);
            String normalized = value == null ? null : value.normalized();
            if (predicate.test(normalized)) {
                return List.of();
            }
            return List.of(ReportItems.invalidOptionValue(
                    forceability, reportedName, value == null ? null : value.original(), allowedDescription));
        });
    }

    public static OptionValidator valueNotEmpty(String optionName, String valueDescription) {
        return valueNotEmpty(optionName, valueDescription, null);
    }

    public static OptionValidator valueNotEmpty(String optionName, String valueDescription, String optionNameForReport) {
        return valueCond(optionName, value -> !OptionValues.isEmpty(value), valueDescription, optionNameForReport,
                Forceability.none());
    }

    public static OptionValidator valueIn(String optionName, Collection<String> allowedValues) {
        return valueIn(optionName, allowedValues, Forceability.none());
    }

    public static OptionValidator valueIn(String optionName, Collection<String> allowedValues, Forceability forceability) {
        List<String> allowed = List.copyOf(allowedValues);
        return valueCond(optionName, value -> value != null && allowed.contains(value), allowed, null, forceability);
    }

    public static OptionValidator valueIntegerInRange(String optionName, long atLeast, long atMost) {
        return valueIntegerInRange(optionName, atLeast, atMost, Forceability.none());
    }

    public static OptionValidator valueIntegerInRange(String optionName, long atLeast, long atMost,
                                                      Forceability forceability) {
        return valueCond(optionName, value -> OptionValues.isInteger(value, atLeast, atMost),
                atLeast + ".." + atMost, null, forceability);
    }

    public static OptionValidator valueNonNegativeInteger(String optionName) {
        return valueNonNegativeInteger(optionName, Forceability.none());
    }

    public static OptionValidator valueNonNegativeInteger(String optionName, Forceability forceability) {
        return valueCond(optionName, value -> OptionValues.isInteger(value, 0L, null),
                "a non-negative integer", null, forceability);
    }

    public static OptionValidator valuePositiveInteger(String optionName) {
        return valuePositiveInteger(optionName, Forceability.none());
    }

    public static OptionValidator valuePositiveInteger(String optionName, Forceability forceability) {
        return valueCond(optionName, value -> OptionValues.isInteger(value, 1L, null),
                "a positive integer", null, forceability);
    }

    public static OptionValidator valuePortNumber(String optionName) {
        return valuePortNumber(optionName, Forceability.none());
    }

    public static OptionValidator valuePortNumber(String optionName, Forceability forceability) {
        return valueCond(optionName, OptionValues::isPortNumber, "a port number (1-65535)", null, forceability);
    }

    public static OptionValidator valueIpAddress(String optionName) {
        return valueCond(optionName, OptionValues::isIpAddress, "an IP address", null, Forceability.none());
    }

    /**
     * Accepts an empty value as a request to unset the option, otherwise delegates to the wrapped validator.
     */
    public static OptionValidator valueEmptyOrValid(String optionName, OptionValidator validator) {
        return options -> {
            if (!options.containsKey(optionName)) {
                return List.of();
            }
            ValuePair value = options.get(optionName);
            if (value == null || value.isEmpty()) {
                return List.of();
            }
            return validator.validate(options);
        };
    }

    public static List<ReportItem> namesIn(Collection<String> allowedNames, Collection<String> givenNames,
                                           String optionType) {
        return namesIn(allowedNames, givenNames, optionType, Forceability.none(), List.of());
    }

    public static List<ReportItem> namesIn(Collection<String> allowedNames, Collection<String> givenNames,
                                           String optionType, Forceability forceability) {
        return namesIn(allowedNames, givenNames, optionType, forceability, List.of());
    }

    /**
     * Reports, in a single report item, every given name which is neither allowed nor matches one of the
     * allowed patterns.
     */
    public static List<ReportItem> namesIn(Collection<String> allowedNames, Collection<String> givenNames,
                                           String optionType, Forceability forceability,
                                           Collection<OptionNamePattern> allowedPatterns) {
        TreeSet<String> invalidNames = new TreeSet<>();
        for (String name : givenNames) {
            if (!allowedNames.contains(name) && allowedPatterns.stream().noneMatch(pattern -> pattern.matches(name))) {
                invalidNames.add(name);
            }
        }
        if (invalidNames.isEmpty()) {
            return List.of();
        }
        return List.of(ReportItems.invalidOptions(
                forceability,
                invalidNames,
                allowedNames,
                optionType,
                allowedPatterns.stream().map(OptionNamePattern::displayName).toList()));
    }

    /**
     * {@link #namesIn} packaged as a validator so it can be run with the value validators.
     */
    public static OptionValidator allowedNames(Collection<String> allowedNames, String optionType,
                                               Forceability forceability) {
        return options -> namesIn(allowedNames, options.keySet(), optionType, forceability, List.of());
    }
}
