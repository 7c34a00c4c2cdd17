package com.krickert.hacluster.config.report;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Tokens a caller passes back to acknowledge a forceable error and turn it into a warning.
 */
@Serdeable
public enum ForceCode {
    FORCE_OPTIONS,
    FORCE_QDEVICE_MODEL,
    FORCE_NODE_ADDRESSES_UNRESOLVABLE,
    FORCE_CONSTRAINT_DUPLICATE
}
