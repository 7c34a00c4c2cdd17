package com.krickert.hacluster.config.corosync.model;

/**
 * Classification of a node address literal.
 */
public enum AddressType {
    IPV4("IPv4"),
    IPV6("IPv6"),
    FQDN("FQDN"),
    UNRESOLVABLE("unresolvable");

    private final String label;

    AddressType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
