package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.corosync.model.AddressType;
import com.krickert.hacluster.config.corosync.model.NodeSpec;
import com.krickert.hacluster.config.corosync.model.Transport;
import com.krickert.hacluster.config.corosync.model.TransportFamily;
import com.krickert.hacluster.config.option.ValuePair;
import com.krickert.hacluster.config.report.ForceCode;
import com.krickert.hacluster.config.report.Forceability;
import com.krickert.hacluster.config.report.ReportItem;
import com.krickert.hacluster.config.report.ReportItems;
import com.krickert.hacluster.config.validation.OptionValidator;
import com.krickert.hacluster.config.validation.OptionValues;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static com.krickert.hacluster.config.validation.OptionValidators.dependsOnOption;
import static com.krickert.hacluster.config.validation.OptionValidators.isRequired;
import static com.krickert.hacluster.config.validation.OptionValidators.namesIn;
import static com.krickert.hacluster.config.validation.OptionValidators.runCollection;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIn;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIntegerInRange;
import static com.krickert.hacluster.config.validation.OptionValidators.valueIpAddress;
import static com.krickert.hacluster.config.validation.OptionValidators.valueNonNegativeInteger;
import static com.krickert.hacluster.config.validation.OptionValidators.valueNotEmpty;
import static com.krickert.hacluster.config.validation.OptionValidators.valuePortNumber;
import static com.krickert.hacluster.config.validation.OptionValidators.valuePositiveInteger;

/**
 * Validates a new corosync.conf: cluster name, node list, links, transport and totem options.
 *
 * <p>Transport and totem options cannot be forced. Their values rarely change and a wrong one can
 * break the cluster communication, so unknown names and bad values are always errors.
 */
@Singleton
public class CorosyncConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CorosyncConfigValidator.class);

    private final AddressResolver addressResolver;
    private final CorosyncValidationConfig config;

    @Inject
    public CorosyncConfigValidator(AddressResolver addressResolver, CorosyncValidationConfig config) {
        this.addressResolver = addressResolver;
        this.config = config;
    }

    /**
     * Validates the minimal corosync.conf of a new cluster.
     *
     * @param clusterName       name of the new cluster
     * @param nodes             nodes of the new cluster
     * @param transport         transport value, validated here
     * @param forceUnresolvable report unresolvable node addresses as warnings
     */
    public List<ReportItem> create(String clusterName, List<NodeSpec> nodes, String transport,
                                   boolean forceUnresolvable) {
        LOG.debug("Validating new cluster '{}' with {} node(s) and transport '{}'", clusterName, nodes.size(), transport);
        Map<String, ValuePair> clusterOptions = new LinkedHashMap<>();
        clusterOptions.put("name", ValuePair.of(clusterName));
        clusterOptions.put("transport", ValuePair.of(transport));
        List<ReportItem> reports = new ArrayList<>(runCollection(clusterOptions, List.of(
                valueNotEmpty("name", "a cluster name", "cluster name"),
                valueIn("transport", Transport.allValues())
        )));

        TransportFamily family = Transport.fromValue(transport).map(Transport::family).orElse(null);
        AddressTypeCache addressTypes = new AddressTypeCache(addressResolver);
        // node names identify nodes in reports only if none is missing and none is duplicated
        boolean allNamesUsable = true;
        Map<String, Integer> nameCounts = new LinkedHashMap<>();
        Map<String, Integer> addressCounts = new LinkedHashMap<>();
        List<List<AddressType>> addressTypesPerNode = new ArrayList<>();

        int nodeIndex = 0;
        for (NodeSpec node : nodes) {
            nodeIndex++;
            Map<String, ValuePair> nodeOptions = new LinkedHashMap<>();
            if (node.name() != null) {
                nodeOptions.put("name", ValuePair.of(node.name()));
            }
            reports.addAll(runCollection(nodeOptions, List.of(
                    isRequired("name", "node " + nodeIndex),
                    valueNotEmpty("name", "a non-empty string", "node " + nodeIndex + " name")
            )));
            if (OptionValues.isEmpty(node.name())) {
                allNamesUsable = false;
            } else {
                nameCounts.merge(node.name(), 1, Integer::sum);
            }

            int addressCount = node.addrs().size();
            if (family != null && (addressCount < family.minLinks() || addressCount > family.maxLinks())) {
                reports.add(ReportItems.corosyncBadNodeAddressesCount(
                        addressCount, family.minLinks(), family.maxLinks(), node.name(), nodeIndex));
            }

            List<AddressType> nodeAddressTypes = new ArrayList<>();
            for (String address : node.addrs()) {
                addressCounts.merge(address, 1, Integer::sum);
                nodeAddressTypes.add(addressTypes.typeOf(address));
            }
            addressTypesPerNode.add(nodeAddressTypes);
        }

        Set<String> unresolvable = addressTypes.unresolvableAddresses();
        if (!unresolvable.isEmpty()) {
            LOG.warn("Cluster '{}' has unresolvable node addresses: {}", clusterName, unresolvable);
            reports.add(ReportItems.nodeAddressesUnresolvable(
                    Forceability.of(ForceCode.FORCE_NODE_ADDRESSES_UNRESOLVABLE, forceUnresolvable), unresolvable));
        }
        Set<String> duplicateNames = moreThanOnce(nameCounts);
        if (!duplicateNames.isEmpty()) {
            allNamesUsable = false;
            reports.add(ReportItems.corosyncNodeNameDuplication(duplicateNames));
        }
        Set<String> duplicateAddresses = moreThanOnce(addressCounts);
        if (!duplicateAddresses.isEmpty()) {
            reports.add(ReportItems.corosyncNodeAddressDuplication(duplicateAddresses));
        }

        // udp transports allow a single address per node, that has been checked above
        if (allNamesUsable && family != TransportFamily.UDP && config.isReportAddressCountMismatch()) {
            Map<String, Integer> addressCountPerNode = new LinkedHashMap<>();
            for (NodeSpec node : nodes) {
                addressCountPerNode.put(node.name(), node.addrs().size());
            }
            if (new HashSet<>(addressCountPerNode.values()).size() > 1) {
                reports.add(ReportItems.corosyncNodeAddressCountMismatch(addressCountPerNode));
            }
        }

        List<Integer> linksWithMixedIpVersions = linksWithMixedIpVersions(addressTypesPerNode);
        if (!linksWithMixedIpVersions.isEmpty()) {
            reports.add(ReportItems.corosyncIpVersionMismatchInLinks(linksWithMixedIpVersions));
        }

        logOutcome("cluster '" + clusterName + "'", reports);
        return reports;
    }

    /**
     * Validates udp/udpu link options. Only a single link is allowed, its options are validated.
     */
    public List<ReportItem> createLinkListUdp(List<Map<String, String>> linkList) {
        // link options are optional
        if (linkList == null || linkList.isEmpty()) {
            return List.of();
        }
        Map<String, ValuePair> options = ValuePair.wrap(linkList.get(0));
        List<ReportItem> reports = new ArrayList<>(runCollection(options, List.of(
                valueIpAddress("bindnetaddr"),
                valueIn("broadcast", CorosyncOptions.BOOLEAN_VALUES),
                valueIpAddress("mcastaddr"),
                valuePortNumber("mcastport"),
                valueIntegerInRange("ttl", 0, 255)
        )));
        reports.addAll(namesIn(CorosyncOptions.LINK_UDP_OPTIONS, options.keySet(), "link"));

        ValuePair broadcast = options.get("broadcast");
        if (broadcast != null && "1".equals(broadcast.normalized()) && options.containsKey("mcastaddr")) {
            reports.add(ReportItems.corosyncBroadcastDisallowsMcastaddr());
        }
        if (linkList.size() > TransportFamily.UDP.maxLinks()) {
            reports.add(ReportItems.corosyncTooManyLinks(
                    linkList.size(), TransportFamily.UDP.maxLinks(), TransportFamily.UDP.displayName()));
        }
        logOutcome("udp links", reports);
        return reports;
    }

    /**
     * Validates knet link options.
     *
     * @param maxLinkNumber highest link number the caller allows, capped by what knet supports
     */
    public List<ReportItem> createLinkListKnet(List<Map<String, String>> linkList, int maxLinkNumber) {
        // link options are optional, and may be set for some of the links only
        if (linkList == null || linkList.isEmpty()) {
            return List.of();
        }
        int highestLinkNumber = Math.max(0, Math.min(TransportFamily.KNET.maxLinks() - 1, maxLinkNumber));
        List<OptionValidator> validators = List.of(
                valueIn("ip_version", CorosyncOptions.IP_VERSIONS),
                valueIntegerInRange("linknumber", 0, highestLinkNumber),
                valueIntegerInRange("link_priority", 0, 255),
                valuePortNumber("mcastport"),
                valueNonNegativeInteger("ping_interval"),
                valueNonNegativeInteger("ping_precision"),
                valueNonNegativeInteger("ping_timeout"),
                dependsOnOption("ping_interval", "ping_timeout"),
                dependsOnOption("ping_timeout", "ping_interval"),
                valueNonNegativeInteger("pong_count"),
                valueIn("transport", List.of("sctp", "udp"))
        );

        List<ReportItem> reports = new ArrayList<>();
        Map<String, Integer> linkNumberCounts = new LinkedHashMap<>();
        for (Map<String, String> link : linkList) {
            Map<String, ValuePair> options = ValuePair.wrap(link);
            if (options.containsKey("linknumber")) {
                linkNumberCounts.merge(Objects.toString(link.get("linknumber"), ""), 1, Integer::sum);
            }
            reports.addAll(runCollection(options, validators));
            reports.addAll(namesIn(CorosyncOptions.LINK_KNET_OPTIONS, options.keySet(), "link"));
        }
        Set<String> duplicateLinkNumbers = moreThanOnce(linkNumberCounts);
        if (!duplicateLinkNumbers.isEmpty()) {
            reports.add(ReportItems.corosyncLinkNumberDuplication(duplicateLinkNumbers));
        }
        if (linkList.size() > TransportFamily.KNET.maxLinks()) {
            reports.add(ReportItems.corosyncTooManyLinks(
                    linkList.size(), TransportFamily.KNET.maxLinks(), TransportFamily.KNET.displayName()));
        }
        logOutcome("knet links", reports);
        return reports;
    }

    public List<ReportItem> createTransportUdp(Map<String, String> transportOptions) {
        Map<String, ValuePair> options = ValuePair.wrap(transportOptions);
        List<ReportItem> reports = new ArrayList<>(runCollection(options, List.of(
                valueIn("ip_version", CorosyncOptions.IP_VERSIONS),
                valuePositiveInteger("netmtu")
        )));
        reports.addAll(namesIn(CorosyncOptions.TRANSPORT_UDP_OPTIONS, options.keySet(), "udp/udpu transport"));
        return reports;
    }

    public List<ReportItem> createTransportKnet(Map<String, String> genericOptions) {
        return createTransportKnet(genericOptions, Map.of(), Map.of());
    }

    /**
     * Validates knet transport options in their three groups and the cipher/hash combination.
     */
    public List<ReportItem> createTransportKnet(Map<String, String> genericOptions,
                                                Map<String, String> compressionOptions,
                                                Map<String, String> cryptoOptions) {
        Map<String, ValuePair> generic = ValuePair.wrap(genericOptions);
        Map<String, ValuePair> compression = ValuePair.wrap(compressionOptions);
        Map<String, ValuePair> crypto = ValuePair.wrap(cryptoOptions);

        List<ReportItem> reports = new ArrayList<>(runCollection(generic, List.of(
                valueIn("ip_version", CorosyncOptions.IP_VERSIONS),
                valueNonNegativeInteger("knet_pmtud_interval"),
                valueIn("link_mode", List.of("active", "passive", "rr"))
        )));
        reports.addAll(namesIn(CorosyncOptions.TRANSPORT_KNET_OPTIONS, generic.keySet(), "transport"));

        reports.addAll(runCollection(compression, List.of(
                valueNotEmpty("level", "a compression level e.g. 0..9"),
                valueNotEmpty("model", "a compression model e.g. zlib, lz4 or bzip2"),
                valueNonNegativeInteger("threshold")
        )));
        reports.addAll(namesIn(CorosyncOptions.COMPRESSION_OPTIONS, compression.keySet(), "compression"));

        reports.addAll(runCollection(crypto, List.of(
                valueIn("cipher", CorosyncOptions.CRYPTO_CIPHERS),
                valueIn("hash", CorosyncOptions.CRYPTO_HASHES),
                valueIn("model", List.of("nss", "openssl"))
        )));
        reports.addAll(namesIn(CorosyncOptions.CRYPTO_OPTIONS, crypto.keySet(), "crypto"));

        // corosync defaults apply to the options not specified
        String cipher = crypto.containsKey("cipher")
                ? crypto.get("cipher").normalized() : CorosyncOptions.DEFAULT_CRYPTO_CIPHER;
        String hash = crypto.containsKey("hash")
                ? crypto.get("hash").normalized() : CorosyncOptions.DEFAULT_CRYPTO_HASH;
        if (!"none".equals(cipher) && "none".equals(hash)) {
            reports.add(ReportItems.corosyncCryptoCipherRequiresCryptoHash());
        }
        logOutcome("knet transport", reports);
        return reports;
    }

    public List<ReportItem> createTotem(Map<String, String> totemOptions) {
        Map<String, ValuePair> options = ValuePair.wrap(totemOptions);
        List<OptionValidator> validators = CorosyncOptions.TOTEM_OPTIONS.stream()
                .map(name -> valueNonNegativeInteger(name))
                .toList();
        List<ReportItem> reports = new ArrayList<>(runCollection(options, validators));
        reports.addAll(namesIn(CorosyncOptions.TOTEM_OPTIONS, options.keySet(), "totem"));
        return reports;
    }

    /**
     * Link indexes at which some node has an IPv4 and another node an IPv6 address. Nodes with fewer
     * addresses simply do not take part in the higher links.
     */
    private static List<Integer> linksWithMixedIpVersions(List<List<AddressType>> addressTypesPerNode) {
        int linkCount = addressTypesPerNode.stream().mapToInt(List::size).max().orElse(0);
        List<Integer> mismatchedLinks = new ArrayList<>();
        for (int link = 0; link < linkCount; link++) {
            Set<AddressType> typesInLink = new HashSet<>();
            for (List<AddressType> nodeTypes : addressTypesPerNode) {
                if (link < nodeTypes.size()) {
                    typesInLink.add(nodeTypes.get(link));
                }
            }
            if (typesInLink.contains(AddressType.IPV4) && typesInLink.contains(AddressType.IPV6)) {
                mismatchedLinks.add(link);
            }
        }
        return mismatchedLinks;
    }

    private static Set<String> moreThanOnce(Map<String, Integer> counts) {
        TreeSet<String> repeated = new TreeSet<>();
        counts.forEach((value, count) -> {
            if (count > 1) {
                repeated.add(value);
            }
        });
        return Collections.unmodifiableSet(repeated);
    }

    private static void logOutcome(String subject, List<ReportItem> reports) {
        if (ReportItems.hasErrors(reports)) {
            LOG.warn("Validation of {} found {} error(s), first: {}",
                    subject, ReportItems.errorsOf(reports).size(), ReportItems.errorsOf(reports).get(0).code());
        } else {
            LOG.debug("Validation of {} passed with {} report(s)", subject, reports.size());
        }
    }
}
