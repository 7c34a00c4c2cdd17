package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.validation.OptionValidator;
import com.krickert.hacluster.config.validation.OptionValues;

import java.util.List;

import static com.krickert.hacluster.config.validation.OptionValidators.isRequired;
import static com.krickert.hacluster.config.validation.OptionValidators.valueCond;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIn;
import static com.krickert.hacluster.config.validation.OptionValidators.valueNotEmpty;

/**
 * Constraint kinds which can be created with resource sets.
 */
public enum ConstraintType {
    ORDER("rsc_order", "order", List.of("kind", "symmetrical"), List.of(
            valueIn("kind", List.of("Optional", "Mandatory", "Serialize")),
            valueIn("symmetrical", List.of("true", "false")))),
    COLOCATION("rsc_colocation", "colocation", List.of("score"), List.of(
            valueCond("score", OptionValues::isScore, "an integer or INFINITY or -INFINITY", null,
                    Forceability.none()))),
    TICKET("rsc_ticket", "ticket", List.of("ticket", "loss-policy"), List.of(
            isRequired("ticket", "ticket constraint"),
            valueNotEmpty("ticket", "a ticket name"),
            valueIn("loss-policy", List.of("fence", "stop", "freeze", "demote"))));

    private final String tag;
    private final String idPrefix;
    private final List<String> allowedOptions;
    private final List<OptionValidator> optionValidators;

    ConstraintType(String tag, String idPrefix, List<String> allowedOptions, List<OptionValidator> optionValidators) {
        this.tag = tag;
        this.idPrefix = idPrefix;
        this.allowedOptions = allowedOptions;
        this.optionValidators = optionValidators;
    }

    public String tag() {
        return tag;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Constraint level option names, the id excluded.
     */
    public List<String> allowedOptions() {
        return allowedOptions;
    }

    public List<OptionValidator> optionValidators() {
        return optionValidators;
    }
}
