package com.krickert.hacluster.config.validation;

import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A prepared value together with the reports produced while preparing it.
 *
 * @param value   The prepared value, null if it could not be prepared.
 * @param reports Problems found. The value is only usable when none of them is an error.
 */
public record ValidationOutcome<T>(T value, List<ReportItem> reports) {

    public ValidationOutcome {
        reports = Collections.unmodifiableList(reports == null ? new ArrayList<>() : new ArrayList<>(reports));
    }

    public static <T> ValidationOutcome<T> valid(T value) {
        return new ValidationOutcome<>(value, List.of());
    }

    public static <T> ValidationOutcome<T> of(T value, List<ReportItem> reports) {
        return new ValidationOutcome<>(value, reports);
    }

    public static <T> ValidationOutcome<T> failed(ReportItem report) {
        return new ValidationOutcome<>(null, List.of(report));
    }

    public boolean hasErrors() {
        return ReportItems.hasErrors(reports);
    }

    public Optional<T> valueIfValid() {
        return hasErrors() ? Optional.empty() : Optional.ofNullable(value);
    }
}
