package com.krickert.hacluster.config.report;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Severity of a report item. An ERROR blocks the operation the report was produced for,
 * a WARNING never does.
 */
@Serdeable
public enum ReportSeverity {
    ERROR,
    WARNING
}
