package com.krickert.hacluster.config.cib.constraint;

import com.krickert.hacluster.config.report.ReportItem;

import java.util.List;

/**
 * Thrown when a constraint cannot be created. Carries every report of the rejected attempt.
 */
public class ConstraintCreationException extends RuntimeException {

    private final List<ReportItem> reports;

    public ConstraintCreationException(String message, List<ReportItem> reports) {
        super(message);
        this.reports = List.copyOf(reports);
    }

    public List<ReportItem> getReports() {
        return reports;
    }
}
