package com.krickert.hacluster.config.corosync;

import com.krickert.hacluster.config.corosync.model.AddressType;
import com.krickert.hacluster.config.validation.OptionValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.Set;

/**
 * Classifies node addresses, resolving each distinct non-literal address at most once. An instance
 * belongs to a single validation run and is discarded with it.
 */
class AddressTypeCache {

    private static final Logger LOG = LoggerFactory.getLogger(AddressTypeCache.class);

    private final AddressResolver resolver;
    private final Map<String, AddressType> types = new HashMap<>();

    AddressTypeCache(AddressResolver resolver) {
        this.resolver = resolver;
    }

    AddressType typeOf(String address) {
        return types.computeIfAbsent(address, this::classify);
    }

    Set<String> unresolvableAddresses() {
        TreeSet<String> unresolvable = new TreeSet<>();
        types.forEach((address, type) -> {
            if (type == AddressType.UNRESOLVABLE) {
                unresolvable.add(address);
            }
        });
        return Collections.unmodifiableSet(unresolvable);
    }

    private AddressType classify(String address) {
        AddressType type;
        if (OptionValues.isIpv4Address(address)) {
            type = AddressType.IPV4;
        } else if (OptionValues.isIpv6Address(address)) {
            type = AddressType.IPV6;
        } else if (resolver.isResolvable(address)) {
            type = AddressType.FQDN;
        } else {
            type = AddressType.UNRESOLVABLE;
        }
        LOG.debug("Address '{}' classified as {}", address, type.label());
        return type;
    }
}
