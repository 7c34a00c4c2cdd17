package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.cib.CibResources;
import com.krickert.hacluster.config.cib.CibTools;
import com.krickert.hacluster.config.cib.model.CibElement;
import com.krickert.hacluster.config.cib.model.ExportedConstraint;
import com.krickert.hacluster.config.cib.model.ResourceSetSpec;
import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import com.krickert.hacluster.config.validation.ValidationOutcome;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.krickert.hacluster.config.validation.OptionValidators.namesIn;

/**
 * Building blocks of constraint creation: resource id resolution, option preparation, id generation,
 * duplicate detection and the tree mutation itself.
 *
 * <p>Only {@link #createWithSet} modifies the tree. Callers run it after the other steps reported no errors.
 */
@Slf4j
@Singleton
public class ConstraintBuilder {

    static final String ID_PREFIX = "hac_";

    private final ResourceSetHelper resourceSetHelper;

    @Inject
    public ConstraintBuilder(ResourceSetHelper resourceSetHelper) {
        this.resourceSetHelper = resourceSetHelper;
    }

    /**
     * Resolves the id of a resource a constraint should reference.
     *
     * @param canRepairToClone a resource inside a clone or master is replaced by the wrapper
     * @param inCloneAllowed   a resource inside a clone or master is kept when it cannot be replaced
     * @return the id to use, or the reports explaining why the resource cannot be referenced
     */
    public ValidationOutcome<String> findValidResourceId(CibElement cib, boolean canRepairToClone,
                                                        boolean inCloneAllowed, String id) {
        Optional<CibElement> resource = CibResources.findResource(cib, id);
        if (resource.isEmpty()) {
            log.debug("Resource '{}' not found", id);
            return ValidationOutcome.failed(ReportItems.resourceDoesNotExist(id));
        }
        CibElement resourceElement = resource.get();
        if (CibResources.isClone(resourceElement)) {
            return ValidationOutcome.valid(resourceElement.getId());
        }

        Optional<CibElement> clone = resourceElement.findNearestAncestor(CibResources.TAGS_CLONE);
        if (clone.isEmpty()) {
            return ValidationOutcome.valid(resourceElement.getId());
        }
        CibElement cloneElement = clone.get();
        if (canRepairToClone) {
            log.debug("Resource '{}' replaced by its wrapper '{}'", id, cloneElement.getId());
            return ValidationOutcome.valid(cloneElement.getId());
        }
        if (inCloneAllowed) {
            return ValidationOutcome.valid(resourceElement.getId());
        }
        return ValidationOutcome.failed(CibResources.TAG_MASTER.equals(cloneElement.getTag())
                ? ReportItems.resourceIsInMaster(resourceElement.getId(), cloneElement.getId())
                : ReportItems.resourceIsInClone(resourceElement.getId(), cloneElement.getId()));
    }

    /**
     * Resolves the resource ids of every set and validates the set options.
     */
    public ValidationOutcome<List<ResourceSetSpec>> prepareResourceSetList(CibElement cib, boolean canRepairToClone,
                                                                           boolean inCloneAllowed,
                                                                           List<ResourceSetSpec> resourceSets) {
        Function<String, ValidationOutcome<String>> resolveId =
                id -> findValidResourceId(cib, canRepairToClone, inCloneAllowed, id);
        List<ResourceSetSpec> prepared = new ArrayList<>();
        List<ReportItem> reports = new ArrayList<>();
        for (ResourceSetSpec resourceSet : resourceSets) {
            ValidationOutcome<ResourceSetSpec> outcome = resourceSetHelper.prepareSet(resolveId, resourceSet);
            reports.addAll(outcome.reports());
            prepared.add(outcome.value());
        }
        return ValidationOutcome.of(prepared, reports);
    }

    /**
     * Checks option names and makes sure the options carry an id.
     *
     * @param allowedNames allowed option names, the id is always allowed
     * @param createId     produces an id when none was given
     * @param validateId   validates a given id
     */
    public ValidationOutcome<Map<String, String>> prepareOptions(List<String> allowedNames,
                                                                 Map<String, String> options,
                                                                 Supplier<String> createId,
                                                                 Function<String, List<ReportItem>> validateId) {
        List<String> allowed = new ArrayList<>(allowedNames);
        allowed.add(CibElement.ID);
        List<ReportItem> reports = new ArrayList<>(namesIn(allowed, options.keySet(), "constraint"));

        Map<String, String> prepared = new LinkedHashMap<>(options);
        if (prepared.containsKey(CibElement.ID)) {
            reports.addAll(validateId.apply(prepared.get(CibElement.ID)));
        } else {
            prepared.put(CibElement.ID, createId.get());
        }
        return ValidationOutcome.of(prepared, reports);
    }

    /**
     * {@code hac_<prefix>_set_<ids of set 1>_set_<ids of set 2>...}, made unique in the tree.
     */
    public String createId(CibElement cib, String typePrefix, List<ResourceSetSpec> resourceSets) {
        StringBuilder id = new StringBuilder(ID_PREFIX).append(typePrefix);
        for (List<String> idSet : resourceSetHelper.extractIdSetList(resourceSets)) {
            id.append("_set_").append(String.join("_", idSet));
        }
        return CibTools.findUniqueId(cib, id.toString());
    }

    /**
     * Two constraints are duplicates when they reference the same resources in the same sets in the
     * same order.
     */
    public boolean haveDuplicateResourceSets(CibElement element, CibElement otherElement) {
        return idSetList(element).equals(idSetList(otherElement));
    }

    /**
     * Checks an element already placed in the constraint section against its siblings of the same tag.
     */
    public List<ReportItem> checkIsWithoutDuplication(CibElement constraintSection, CibElement element,
                                                      BiPredicate<CibElement, CibElement> areDuplicates,
                                                      Function<CibElement, ExportedConstraint> exportElement,
                                                      Forceability forceability) {
        List<ExportedConstraint> duplicates = constraintSection.findDescendants(element.getTag()).stream()
                .filter(other -> other != element)
                .filter(other -> areDuplicates.test(element, other))
                .map(exportElement)
                .toList();
        return duplicateReports(element.getTag(), duplicates, forceability);
    }

    /**
     * Checks a constraint to be created from the given id sets against existing constraints of the tag.
     */
    public List<ReportItem> checkSetsWithoutDuplication(CibElement constraintSection, String tag,
                                                        List<List<String>> idSetList, Forceability forceability) {
        List<ExportedConstraint> duplicates = constraintSection.findDescendants(tag).stream()
                .filter(other -> idSetList.equals(idSetList(other)))
                .map(this::exportWithSet)
                .toList();
        return duplicateReports(tag, duplicates, forceability);
    }

    /**
     * Appends a constraint element with the options as attributes and one resource_set per set.
     * Nothing is validated here.
     */
    public CibElement createWithSet(CibElement constraintSection, String tag, Map<String, String> options,
                                    List<ResourceSetSpec> resourceSets) {
        CibElement element = constraintSection.appendChild(tag, options);
        for (ResourceSetSpec resourceSet : resourceSets) {
            resourceSetHelper.create(element, resourceSet);
        }
        log.info("Created constraint {} '{}' with {} resource set(s)", tag, element.getId(), resourceSets.size());
        return element;
    }

    public ExportedConstraint exportWithSet(CibElement element) {
        return new ExportedConstraint(
                element.findDescendants(ResourceSetHelper.TAG_RESOURCE_SET).stream()
                        .map(resourceSetHelper::export)
                        .toList(),
                CibTools.exportAttributes(element));
    }

    public ExportedConstraint exportPlain(CibElement element) {
        return new ExportedConstraint(List.of(), CibTools.exportAttributes(element));
    }

    private List<List<String>> idSetList(CibElement element) {
        return element.findDescendants(ResourceSetHelper.TAG_RESOURCE_SET).stream()
                .map(resourceSetHelper::getResourceIdSetList)
                .toList();
    }

    private static List<ReportItem> duplicateReports(String tag, List<ExportedConstraint> duplicates,
                                                     Forceability forceability) {
        if (duplicates.isEmpty()) {
            return List.of();
        }
        log.debug("Found {} existing {} constraint(s) with the same resource sets", duplicates.size(), tag);
        return List.of(ReportItems.duplicateConstraintsExist(forceability, tag, duplicates));
    }
}
