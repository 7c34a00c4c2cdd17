package com.krickert.hacluster.config.report;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Closed set of report kinds produced by the validators and the constraint builder.
 */
@Serdeable
public enum ReportCode {
    // generic option checks
    REQUIRED_OPTION_IS_MISSING,
    INVALID_OPTION_VALUE,
    INVALID_OPTIONS,
    INVALID_USERDEFINED_OPTIONS,
    PREREQUISITE_OPTION_IS_MISSING,

    // corosync
    COROSYNC_BAD_NODE_ADDRESSES_COUNT,
    NODE_ADDRESSES_UNRESOLVABLE,
    COROSYNC_NODE_NAME_DUPLICATION,
    COROSYNC_NODE_ADDRESS_DUPLICATION,
    COROSYNC_NODE_ADDRESS_COUNT_MISMATCH,
    COROSYNC_IP_VERSION_MISMATCH_IN_LINKS,
    COROSYNC_BROADCAST_DISALLOWS_MCASTADDR,
    COROSYNC_TOO_MANY_LINKS,
    COROSYNC_LINK_NUMBER_DUPLICATION,
    COROSYNC_CRYPTO_CIPHER_REQUIRES_CRYPTO_HASH,
    COROSYNC_OPTIONS_INCOMPATIBLE_WITH_QDEVICE,

    // cib
    RESOURCE_DOES_NOT_EXIST,
    RESOURCE_IS_IN_CLONE,
    RESOURCE_IS_IN_MASTER,
    DUPLICATE_CONSTRAINTS_EXIST,
    EMPTY_ID,
    INVALID_ID,
    ID_ALREADY_EXISTS,
    CIB_SECTION_MISSING
}
