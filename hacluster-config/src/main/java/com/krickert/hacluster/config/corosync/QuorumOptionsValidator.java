package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import com.krickert.hacluster.config.validation.OptionValidator;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.krickert.hacluster.config.validation.OptionValidators.dependsOnOption;
import static com.krickert.hacluster.config.validation.OptionValidators.namesIn;
import static com.krickert.hacluster.config.validation.OptionValidators.runCollection;
import static com.krickert.hacluster.config.validation.OptionValidators.valueEmptyOrValid;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIn;
import static com.krickert.hacluster.config.validation.OptionValidators.valuePositiveInteger;

/**
 * Validates the quorum section of corosync.conf.
 *
 * <p>Nothing here is forceable: the values are booleans or unbounded numbers and the names are a
 * closed set.
 */
@Singleton
public class QuorumOptionsValidator {

    private static final Logger LOG = LoggerFactory.getLogger(QuorumOptionsValidator.class);

    /**
     * @param hasQdevice true if a quorum device is already configured
     */
    public List<ReportItem> createQuorumOptions(Map<String, String> quorumOptions, boolean hasQdevice) {
        Map<String, ValuePair> options = ValuePair.wrap(quorumOptions);
        List<ReportItem> reports = validate(options, hasQdevice, false);
        reports.addAll(runCollection(options, List.of(
                dependsOnOption("last_man_standing_window", "last_man_standing"))));
        return reports;
    }

    /**
     * Same as {@link #createQuorumOptions} except an empty value unsets the option and is always valid.
     */
    public List<ReportItem> updateQuorumOptions(Map<String, String> quorumOptions, boolean hasQdevice) {
        return validate(ValuePair.wrap(quorumOptions), hasQdevice, true);
    }

    private List<ReportItem> validate(Map<String, ValuePair> options, boolean hasQdevice, boolean allowEmptyValues) {
        List<ReportItem> reports = new ArrayList<>(runCollection(options, validators(allowEmptyValues)));
        reports.addAll(namesIn(CorosyncOptions.QUORUM_OPTIONS, options.keySet(), "quorum"));
        if (hasQdevice) {
            List<String> incompatible = options.keySet().stream()
                    .filter(CorosyncOptions.QUORUM_OPTIONS_INCOMPATIBLE_WITH_QDEVICE::contains)
                    .toList();
            if (!incompatible.isEmpty()) {
                LOG.debug("Quorum options {} cannot be used with a quorum device", incompatible);
                reports.add(ReportItems.corosyncOptionsIncompatibleWithQdevice(incompatible));
            }
        }
        return reports;
    }

    private static List<OptionValidator> validators(boolean allowEmptyValues) {
        Map<String, OptionValidator> validators = new LinkedHashMap<>();
        validators.put("auto_tie_breaker", valueIn("auto_tie_breaker", CorosyncOptions.BOOLEAN_VALUES));
        validators.put("last_man_standing", valueIn("last_man_standing", CorosyncOptions.BOOLEAN_VALUES));
        validators.put("last_man_standing_window", valuePositiveInteger("last_man_standing_window"));
        validators.put("wait_for_all", valueIn("wait_for_all", CorosyncOptions.BOOLEAN_VALUES));
        if (!allowEmptyValues) {
            return List.copyOf(validators.values());
        }
        return validators.entrySet().stream()
                .map(entry -> valueEmptyOrValid(entry.getKey(), entry.getValue()))
                .toList();
    }
}
