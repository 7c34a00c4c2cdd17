package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.corosync.model.QuorumDeviceModel;
import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ForceCode;
import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import com.krickert.hacluster.config.validation.OptionValidator;
import com.krickert.hacluster.config.validation.OptionValues;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.krickert.hacluster.config.validation.OptionValidators.ifOptionExists;
import static com.krickert.hacluster.config.validation.OptionValidators.isRequired;
import static com.krickert.hacluster.config.validation.OptionValidators.namesIn;
import static com.krickert.hacluster.config.validation.OptionValidators.runCollection;
import static com.krickert.hacluster.config.validation.OptionValidators.valueEmptyOrValid;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIn;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIntegerInRange;
import static com.krickert.hacluster.config.validation.OptionValidators.valueNotEmpty;
import static com.krickert.hacluster.config.validation.OptionValidators.valuePortNumber;
import static com.krickert.hacluster.config.validation.OptionValidators.valuePositiveInteger;

/**
 * Validates adding and updating a quorum device: model options, generic device options and heuristics.
 */
@Singleton
public class QuorumDeviceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(QuorumDeviceValidator.class);

    private static final String MODEL_OPTION_TYPE = "quorum device model";
    private static final String GENERIC_OPTION_TYPE = "quorum device";
    private static final String HEURISTICS_OPTION_TYPE = "heuristics";

    /**
     * Validates a new quorum device.
     *
     * @param nodeIds      ids of the existing corosync nodes, valid tie breakers
     * @param forceModel   accept a model with no validation implemented
     * @param forceOptions turn forceable errors into warnings
     */
    public List<ReportItem> addQuorumDevice(String model, Map<String, String> modelOptions,
                                            Map<String, String> genericOptions,
                                            Map<String, String> heuristicsOptions, List<String> nodeIds,
                                            boolean forceModel, boolean forceOptions) {
        List<ReportItem> reports = new ArrayList<>();
        Optional<QuorumDeviceModel> knownModel = QuorumDeviceModel.fromValue(model);
        if (knownModel.isPresent()) {
            reports.addAll(switch (knownModel.get()) {
                case NET -> netModelOptions(ValuePair.wrap(modelOptions), nodeIds, false, forceOptions);
            });
        } else {
            LOG.debug("Quorum device model '{}' has no validation, forced: {}", model, forceModel);
            Map<String, ValuePair> modelOption = new LinkedHashMap<>();
            modelOption.put(CorosyncOptions.QDEVICE_MODEL_OPTION, ValuePair.of(model));
            reports.addAll(runCollection(modelOption, List.of(valueIn(
                    CorosyncOptions.QDEVICE_MODEL_OPTION,
                    QuorumDeviceModel.allValues(),
                    Forceability.of(ForceCode.FORCE_QDEVICE_MODEL, forceModel)))));
        }
        reports.addAll(genericOptions(ValuePair.wrap(genericOptions), false, forceOptions));
        reports.addAll(heuristicsOptions(ValuePair.wrap(heuristicsOptions), false, forceOptions));
        return reports;
    }

    /**
     * Validates changed options of an existing quorum device. The model itself cannot be changed, options
     * of a model with no validation are not checked. An empty value removes the option.
     */
    public List<ReportItem> updateQuorumDevice(String model, Map<String, String> modelOptions,
                                               Map<String, String> genericOptions,
                                               Map<String, String> heuristicsOptions, List<String> nodeIds,
                                               boolean forceOptions) {
        List<ReportItem> reports = new ArrayList<>();
        QuorumDeviceModel.fromValue(model).ifPresent(knownModel -> reports.addAll(switch (knownModel) {
            case NET -> netModelOptions(ValuePair.wrap(modelOptions), nodeIds, true, forceOptions);
        }));
        reports.addAll(genericOptions(ValuePair.wrap(genericOptions), true, forceOptions));
        reports.addAll(heuristicsOptions(ValuePair.wrap(heuristicsOptions), true, forceOptions));
        return reports;
    }

    private static List<ReportItem> netModelOptions(Map<String, ValuePair> options, List<String> nodeIds,
                                                    boolean update, boolean forceOptions) {
        Forceability forceability = Forceability.of(ForceCode.FORCE_OPTIONS, forceOptions);
        List<String> tieBreakers = new ArrayList<>(CorosyncOptions.QDEVICE_NET_TIE_BREAKERS);
        if (nodeIds != null) {
            tieBreakers.addAll(nodeIds);
        }

        Map<String, OptionValidator> optional = new LinkedHashMap<>();
        optional.put("connect_timeout", valueIntegerInRange("connect_timeout", 1000, 2 * 60 * 1000, forceability));
        optional.put("force_ip_version", valueIn("force_ip_version", List.of("0", "4", "6"), forceability));
        optional.put("port", valuePortNumber("port", forceability));
        optional.put("tie_breaker", valueIn("tie_breaker", tieBreakers, forceability));

        List<OptionValidator> validators = new ArrayList<>();
        if (!update) {
            CorosyncOptions.QDEVICE_NET_REQUIRED_OPTIONS
                    .forEach(name -> validators.add(isRequired(name, MODEL_OPTION_TYPE)));
        }
        validators.add(valueNotEmpty("host", "a qdevice host address"));
        validators.add(netAlgorithm(forceability));
        validators.addAll(update ? emptyOrValid(optional) : List.copyOf(optional.values()));

        List<String> allowedNames = new ArrayList<>(CorosyncOptions.QDEVICE_NET_REQUIRED_OPTIONS);
        allowedNames.addAll(CorosyncOptions.QDEVICE_NET_OPTIONAL_OPTIONS);
        List<ReportItem> reports = new ArrayList<>(runCollection(options, validators));
        reports.addAll(namesIn(allowedNames, options.keySet(), MODEL_OPTION_TYPE, forceability));
        return reports;
    }

    /**
     * An empty algorithm is reported on its own and cannot be forced, other values must be known ones.
     */
    private static OptionValidator netAlgorithm(Forceability forceability) {
        OptionValidator knownAlgorithm = valueIn("algorithm", CorosyncOptions.QDEVICE_NET_ALGORITHMS, forceability);
        return ifOptionExists("algorithm", options -> {
            ValuePair value = options.get("algorithm");
            if (value == null || OptionValues.isEmpty(value.normalized())) {
                return List.of(ReportItems.invalidOptionValue(Forceability.none(), "algorithm",
                        value == null ? null : value.original(), CorosyncOptions.QDEVICE_NET_ALGORITHMS));
            }
            return knownAlgorithm.validate(options);
        });
    }

    private static List<ReportItem> genericOptions(Map<String, ValuePair> options, boolean update,
                                                   boolean forceOptions) {
        Forceability forceability = Forceability.of(ForceCode.FORCE_OPTIONS, forceOptions);
        Map<String, OptionValidator> validators = new LinkedHashMap<>();
        validators.put("sync_timeout", valuePositiveInteger("sync_timeout", forceability));
        validators.put("timeout", valuePositiveInteger("timeout", forceability));
        List<ReportItem> reports = new ArrayList<>(runCollection(options,
                update ? emptyOrValid(validators) : List.copyOf(validators.values())));

        // the model is a generic option in corosync.conf but it is set on its own, never among these
        List<String> otherNames = options.keySet().stream()
                .filter(name -> !CorosyncOptions.QDEVICE_GENERIC_OPTIONS.contains(name))
                .filter(name -> !CorosyncOptions.QDEVICE_MODEL_OPTION.equals(name))
                .toList();
        if (options.containsKey(CorosyncOptions.QDEVICE_MODEL_OPTION)) {
            reports.add(ReportItems.invalidOptions(Forceability.none(),
                    List.of(CorosyncOptions.QDEVICE_MODEL_OPTION), CorosyncOptions.QDEVICE_GENERIC_OPTIONS,
                    GENERIC_OPTION_TYPE, List.of()));
        }
        if (!otherNames.isEmpty()) {
            reports.add(ReportItems.invalidOptions(forceability, otherNames, CorosyncOptions.QDEVICE_GENERIC_OPTIONS,
                    GENERIC_OPTION_TYPE, List.of()));
        }
        return reports;
    }

    private static List<ReportItem> heuristicsOptions(Map<String, ValuePair> options, boolean update,
                                                      boolean forceOptions) {
        Forceability forceability = Forceability.of(ForceCode.FORCE_OPTIONS, forceOptions);
        List<String> execNames = new ArrayList<>();
        List<String> otherNames = new ArrayList<>();
        for (String name : options.keySet()) {
            if (CorosyncOptions.HEURISTICS_EXEC_PATTERN.matches(name)) {
                execNames.add(name);
            } else {
                otherNames.add(name);
            }
        }

        Map<String, OptionValidator> byName = new LinkedHashMap<>();
        byName.put("mode", valueIn("mode", CorosyncOptions.HEURISTICS_MODES, forceability));
        byName.put("interval", valuePositiveInteger("interval", forceability));
        byName.put("sync_timeout", valuePositiveInteger("sync_timeout", forceability));
        byName.put("timeout", valuePositiveInteger("timeout", forceability));
        List<OptionValidator> validators = new ArrayList<>(
                update ? emptyOrValid(byName) : List.copyOf(byName.values()));

        // exec names end up as corosync.conf keys, so a bad one is never forceable
        List<String> invalidExecNames = new ArrayList<>();
        for (String name : execNames) {
            if (CorosyncOptions.HEURISTICS_EXEC_NAME.matcher(name).matches()) {
                // on update an empty command removes the heuristic
                if (!update) {
                    validators.add(valueNotEmpty(name, "a command to be run"));
                }
            } else {
                invalidExecNames.add(name);
            }
        }

        List<ReportItem> reports = new ArrayList<>(runCollection(options, validators));
        reports.addAll(namesIn(CorosyncOptions.HEURISTICS_OPTIONS, otherNames, HEURISTICS_OPTION_TYPE,
                forceability, List.of(CorosyncOptions.HEURISTICS_EXEC_PATTERN)));
        if (!invalidExecNames.isEmpty()) {
            LOG.debug("Rejecting heuristics exec option names {}", invalidExecNames);
            reports.add(ReportItems.invalidUserdefinedOptions(invalidExecNames,
                    "exec_NAME cannot contain '.:{}#' and whitespace characters", HEURISTICS_OPTION_TYPE));
        }
        return reports;
    }

    private static List<OptionValidator> emptyOrValid(Map<String, OptionValidator> validators) {
        return validators.entrySet().stream()
                .map(entry -> valueEmptyOrValid(entry.getKey(), entry.getValue()))
                .toList();
    }
}
