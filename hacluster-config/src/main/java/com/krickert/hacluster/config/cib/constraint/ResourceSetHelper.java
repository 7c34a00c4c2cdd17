package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.cib.CibTools;
import com.krickert.hacluster.config.cib.model.CibElement;
import com.krickert.hacluster.config.cib.model.ExportedResourceSet;
import com.krickert.hacluster.config.cib.model.ResourceSetSpec;
import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.validation.ValidationOutcome;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.krickert.hacluster.config.validation.OptionValidators.namesIn;
import static com.krickert.hacluster.config.validation.OptionValidators.runCollection;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIn;

/**
 * Turns resource set requests into resource_set elements and back.
 */
@Singleton
public class ResourceSetHelper {

    public static final String TAG_RESOURCE_SET = "resource_set";
    public static final String TAG_RESOURCE_REF = "resource_ref";

    static final String SET_ID_PREFIX = "hac_rsc_set_";

    private static final List<String> BOOLEAN_VALUES = List.of("true", "false");
    private static final List<String> ALLOWED_OPTIONS = List.of("sequential", "require-all", "action", "role");

    /**
     * Resolves every id of the set and validates the set options.
     *
     * @param resolveId maps a requested id to the id to use, reporting ids which cannot be used
     * @return the set with resolved ids; ids which could not be resolved are kept as requested
     */
    public ValidationOutcome<ResourceSetSpec> prepareSet(Function<String, ValidationOutcome<String>> resolveId,
                                                         ResourceSetSpec resourceSet) {
        List<ReportItem> reports = new ArrayList<>(validateOptions(resourceSet.options()));
        List<String> resolvedIds = new ArrayList<>();
        for (String id : resourceSet.ids()) {
            ValidationOutcome<String> resolved = resolveId.apply(id);
            reports.addAll(resolved.reports());
            resolvedIds.add(resolved.value() != null ? resolved.value() : id);
        }
        return ValidationOutcome.of(resourceSet.withIds(resolvedIds), reports);
    }

    public List<ReportItem> validateOptions(Map<String, String> setOptions) {
        Map<String, ValuePair> options = ValuePair.wrap(setOptions);
        List<ReportItem> reports = new ArrayList<>(runCollection(options, List.of(
                valueIn("sequential", BOOLEAN_VALUES),
                valueIn("require-all", BOOLEAN_VALUES),
                valueIn("action", List.of("start", "promote", "demote", "stop")),
                valueIn("role", List.of("Stopped", "Started", "Master", "Slave"))
        )));
        reports.addAll(namesIn(ALLOWED_OPTIONS, options.keySet(), "set"));
        return reports;
    }

    /**
     * Appends a resource_set with a generated unique id and one resource_ref per resource.
     */
    public CibElement create(CibElement parent, ResourceSetSpec resourceSet) {
        CibElement element = parent.appendChild(TAG_RESOURCE_SET);
        element.setAttribute(CibElement.ID,
                CibTools.findUniqueId(parent, SET_ID_PREFIX + String.join("_", resourceSet.ids())));
        element.setAttributes(resourceSet.options());
        for (String id : resourceSet.ids()) {
            element.appendChild(TAG_RESOURCE_REF).setAttribute(CibElement.ID, id);
        }
        return element;
    }

    public ExportedResourceSet export(CibElement resourceSetElement) {
        return new ExportedResourceSet(
                getResourceIdSetList(resourceSetElement),
                CibTools.exportAttributes(resourceSetElement));
    }

    public List<List<String>> extractIdSetList(List<ResourceSetSpec> resourceSets) {
        return resourceSets.stream().map(ResourceSetSpec::ids).toList();
    }

    /**
     * Ids of the resources referenced by a resource_set element, in document order.
     */
    public List<String> getResourceIdSetList(CibElement resourceSetElement) {
        return resourceSetElement.findDescendants(TAG_RESOURCE_REF).stream()
                .map(CibElement::getId)
                .toList();
    }
}
