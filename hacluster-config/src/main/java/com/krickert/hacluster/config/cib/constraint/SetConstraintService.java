package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.cib.CibTools;
import com.krickert.hacluster.config.cib.model.CibElement;
import com.krickert.hacluster.config.cib.model.ResourceSetSpec;
import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ForceCode;
import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import com.krickert.hacluster.config.validation.ValidationOutcome;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.krickert.hacluster.config.validation.OptionValidators.runCollection;

/**
 * Creates constraints with resource sets. Every check runs before the tree is touched, and the tree is
 * only modified when none of them reported an error.
 */
@Singleton
public class SetConstraintService {

    private static final Logger LOG = LoggerFactory.getLogger(SetConstraintService.class);

    private final ConstraintBuilder constraintBuilder;
    private final ResourceSetHelper resourceSetHelper;

    @Inject
    public SetConstraintService(ConstraintBuilder constraintBuilder, ResourceSetHelper resourceSetHelper) {
        this.constraintBuilder = constraintBuilder;
        this.resourceSetHelper = resourceSetHelper;
    }

    /**
     * Validates and, when no error was found, creates a constraint.
     *
     * @param cib          any element of the tree to modify
     * @param resourceSets at least one resource set
     * @return all reports, plus the created element if the constraint was created
     */
    public ConstraintCreationResult createWithSet(CibElement cib, ConstraintType type,
                                                  List<ResourceSetSpec> resourceSets,
                                                  Map<String, String> options, ConstraintCreationFlags flags) {
        if (resourceSets == null || resourceSets.isEmpty()) {
            throw new IllegalArgumentException("A constraint needs at least one resource set.");
        }
        Optional<CibElement> constraintSection = CibTools.getConstraints(cib);
        if (constraintSection.isEmpty()) {
            LOG.warn("Cannot create {} constraint, the tree has no {} section", type.tag(), CibTools.CONSTRAINTS_SECTION);
            return ConstraintCreationResult.rejected(List.of(ReportItems.cibSectionMissing(CibTools.CONSTRAINTS_SECTION)));
        }

        List<ReportItem> reports = new ArrayList<>();
        ValidationOutcome<List<ResourceSetSpec>> preparedSets = constraintBuilder.prepareResourceSetList(
                cib, flags.canRepairToClone(), flags.resourceInCloneAllowed(), resourceSets);
        reports.addAll(preparedSets.reports());

        ValidationOutcome<Map<String, String>> preparedOptions = constraintBuilder.prepareOptions(
                type.allowedOptions(),
                options,
                () -> constraintBuilder.createId(cib, type.idPrefix(), preparedSets.value()),
                id -> CibTools.validateNewId(cib, id, "constraint id"));
        reports.addAll(preparedOptions.reports());
        reports.addAll(runCollection(ValuePair.wrap(options), type.optionValidators()));

        // sets with unknown resources cannot be compared meaningfully
        if (!ReportItems.hasErrors(reports)) {
            reports.addAll(constraintBuilder.checkSetsWithoutDuplication(
                    constraintSection.get(),
                    type.tag(),
                    resourceSetHelper.extractIdSetList(preparedSets.value()),
                    Forceability.of(ForceCode.FORCE_CONSTRAINT_DUPLICATE, flags.duplicationAllowed())));
        }

        if (ReportItems.hasErrors(reports)) {
            LOG.warn("{} constraint not created, {} error(s) reported", type.tag(), ReportItems.errorsOf(reports).size());
            return ConstraintCreationResult.rejected(reports);
        }
        CibElement created = constraintBuilder.createWithSet(
                constraintSection.get(), type.tag(), preparedOptions.value(), preparedSets.value());
        return ConstraintCreationResult.created(created, reports);
    }

    /**
     * Same as {@link #createWithSet} but fails with an exception instead of returning a rejected result.
     *
     * @throws ConstraintCreationException when an error was reported
     */
    public CibElement createWithSetOrThrow(CibElement cib, ConstraintType type, List<ResourceSetSpec> resourceSets,
                                           Map<String, String> options, ConstraintCreationFlags flags) {
        ConstraintCreationResult result = createWithSet(cib, type, resourceSets, options, flags);
        return result.createdConstraint().orElseThrow(() -> new ConstraintCreationException(
                "Unable to create " + type.tag() + " constraint", result.reports()));
    }
}
