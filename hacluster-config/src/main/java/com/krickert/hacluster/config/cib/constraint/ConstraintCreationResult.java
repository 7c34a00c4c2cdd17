package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.cib.model.CibElement;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;

import java.util.List;
import java.util.Optional;

/**
 * Reports of a constraint creation and the created element, absent when an error blocked the creation.
 */
public record ConstraintCreationResult(CibElement constraint, List<ReportItem> reports) {

    public ConstraintCreationResult {
        reports = List.copyOf(reports);
    }

    public static ConstraintCreationResult created(CibElement constraint, List<ReportItem> reports) {
        return new ConstraintCreationResult(constraint, reports);
    }

    public static ConstraintCreationResult rejected(List<ReportItem> reports) {
        return new ConstraintCreationResult(null, reports);
    }

    public Optional<CibElement> createdConstraint() {
        return Optional.ofNullable(constraint);
    }

    public boolean hasErrors() {
        return ReportItems.hasErrors(reports);
    }
}
