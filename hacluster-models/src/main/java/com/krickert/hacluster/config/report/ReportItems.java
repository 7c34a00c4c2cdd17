package com.krickert.hacluster.config.report;

import com.krickert.hacluster.config.cib.model.ExportedConstraint;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Factory methods for every report kind, one per {@link ReportCode}. Name lists in payloads are
 * sorted so that reports are deterministic regardless of the iteration order of the input.
 */
public final class ReportItems {

    private ReportItems() {
    }

    public static boolean hasErrors(Collection<ReportItem> reports) {
        return reports.stream().anyMatch(ReportItem::isError);
    }

    public static List<ReportItem> errorsOf(Collection<ReportItem> reports) {
        return reports.stream().filter(ReportItem::isError).toList();
    }

    // generic option checks

    public static ReportItem requiredOptionIsMissing(Collection<String> optionNames, String optionType) {
        return ReportItem.error(ReportCode.REQUIRED_OPTION_IS_MISSING, info(
                "option_names", sorted(optionNames),
                "option_type", optionType));
    }

    public static ReportItem invalidOptionValue(Forceability forceability, String optionName, String optionValue,
                                                Object allowedValues) {
        return forceability.create(ReportCode.INVALID_OPTION_VALUE, info(
                "option_name", optionName,
                "option_value", optionValue,
                "allowed_values", allowedValues));
    }

    public static ReportItem invalidOptions(Forceability forceability, Collection<String> optionNames,
                                            Collection<String> allowedNames, String optionType,
                                            Collection<String> allowedPatterns) {
        return forceability.create(ReportCode.INVALID_OPTIONS, info(
                "option_names", sorted(optionNames),
                "allowed", sorted(allowedNames),
                "option_type", optionType,
                "allowed_patterns", sorted(allowedPatterns)));
    }

    public static ReportItem invalidUserdefinedOptions(Collection<String> optionNames, String allowedDescription,
                                                       String optionType) {
        return ReportItem.error(ReportCode.INVALID_USERDEFINED_OPTIONS, info(
                "option_names", sorted(optionNames),
                "allowed_description", allowedDescription,
                "option_type", optionType));
    }

    public static ReportItem prerequisiteOptionIsMissing(String optionName, String prerequisiteName) {
        return ReportItem.error(ReportCode.PREREQUISITE_OPTION_IS_MISSING, info(
                "option_name", optionName,
                "prerequisite_name", prerequisiteName));
    }

    // corosync

    public static ReportItem corosyncBadNodeAddressesCount(int actualCount, int minCount, int maxCount,
                                                           String nodeName, int nodeIndex) {
        Map<String, Object> info = info(
                "actual_count", actualCount,
                "min_count", minCount,
                "max_count", maxCount,
                "node_index", nodeIndex);
        if (nodeName != null) {
            info.put("node_name", nodeName);
        }
        return ReportItem.error(ReportCode.COROSYNC_BAD_NODE_ADDRESSES_COUNT, info);
    }

    public static ReportItem nodeAddressesUnresolvable(Forceability forceability, Collection<String> addresses) {
        return forceability.create(ReportCode.NODE_ADDRESSES_UNRESOLVABLE, info(
                "address_list", sorted(addresses)));
    }

    public static ReportItem corosyncNodeNameDuplication(Collection<String> names) {
        return ReportItem.error(ReportCode.COROSYNC_NODE_NAME_DUPLICATION, info(
                "name_list", sorted(names)));
    }

    public static ReportItem corosyncNodeAddressDuplication(Collection<String> addresses) {
        return ReportItem.error(ReportCode.COROSYNC_NODE_ADDRESS_DUPLICATION, info(
                "address_list", sorted(addresses)));
    }

    public static ReportItem corosyncNodeAddressCountMismatch(Map<String, Integer> addressCountPerNode) {
        return ReportItem.error(ReportCode.COROSYNC_NODE_ADDRESS_COUNT_MISMATCH, info(
                "node_addr_count", new LinkedHashMap<>(addressCountPerNode)));
    }

    public static ReportItem corosyncIpVersionMismatchInLinks(List<Integer> linkIndexes) {
        return ReportItem.error(ReportCode.COROSYNC_IP_VERSION_MISMATCH_IN_LINKS, info(
                "link_numbers", List.copyOf(linkIndexes)));
    }

    public static ReportItem corosyncBroadcastDisallowsMcastaddr() {
        return ReportItem.error(ReportCode.COROSYNC_BROADCAST_DISALLOWS_MCASTADDR, Map.of());
    }

    public static ReportItem corosyncTooManyLinks(int actualCount, int maxCount, String transport) {
        return ReportItem.error(ReportCode.COROSYNC_TOO_MANY_LINKS, info(
                "actual_count", actualCount,
                "max_count", maxCount,
                "transport", transport));
    }

    public static ReportItem corosyncLinkNumberDuplication(Collection<String> linkNumbers) {
        return ReportItem.error(ReportCode.COROSYNC_LINK_NUMBER_DUPLICATION, info(
                "link_number_list", sorted(linkNumbers)));
    }

    public static ReportItem corosyncCryptoCipherRequiresCryptoHash() {
        return ReportItem.error(ReportCode.COROSYNC_CRYPTO_CIPHER_REQUIRES_CRYPTO_HASH, Map.of());
    }

    public static ReportItem corosyncOptionsIncompatibleWithQdevice(Collection<String> optionNames) {
        return ReportItem.error(ReportCode.COROSYNC_OPTIONS_INCOMPATIBLE_WITH_QDEVICE, info(
                "options_names", sorted(optionNames)));
    }

    // cib

    public static ReportItem resourceDoesNotExist(String resourceId) {
        return ReportItem.error(ReportCode.RESOURCE_DOES_NOT_EXIST, info(
                "resource_id", resourceId));
    }

    public static ReportItem resourceIsInClone(String resourceId, String cloneId) {
        return ReportItem.error(ReportCode.RESOURCE_IS_IN_CLONE, info(
                "resource_id", resourceId,
                "clone_id", cloneId));
    }

    public static ReportItem resourceIsInMaster(String resourceId, String masterId) {
        return ReportItem.error(ReportCode.RESOURCE_IS_IN_MASTER, info(
                "resource_id", resourceId,
                "master_id", masterId));
    }

    public static ReportItem duplicateConstraintsExist(Forceability forceability, String constraintType,
                                                       List<ExportedConstraint> constraints) {
        return forceability.create(ReportCode.DUPLICATE_CONSTRAINTS_EXIST, info(
                "constraint_type", constraintType,
                "constraint_info_list", List.copyOf(constraints)));
    }

    public static ReportItem emptyId(String idDescription) {
        return ReportItem.error(ReportCode.EMPTY_ID, info(
                "id_description", idDescription));
    }

    public static ReportItem invalidId(String id, String idDescription, char invalidCharacter,
                                       boolean isFirstCharacter) {
        return ReportItem.error(ReportCode.INVALID_ID, info(
                "id", id,
                "id_description", idDescription,
                "invalid_character", String.valueOf(invalidCharacter),
                "is_first_char", isFirstCharacter));
    }

    public static ReportItem idAlreadyExists(String id) {
        return ReportItem.error(ReportCode.ID_ALREADY_EXISTS, info(
                "id", id));
    }

    public static ReportItem cibSectionMissing(String section) {
        return ReportItem.error(ReportCode.CIB_SECTION_MISSING, info(
                "section", section));
    }

    private static List<String> sorted(Collection<String> values) {
        return values == null ? List.of() : List.copyOf(new TreeSet<>(values));
    }

    private static Map<String, Object> info(Object... keysAndValues) {
        Map<String, Object> info = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            info.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return info;
    }
}
