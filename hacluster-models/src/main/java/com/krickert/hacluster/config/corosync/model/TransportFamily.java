package com.krickert.hacluster.config.corosync.model;

/**
 * Corosync transport families. Each family bounds how many links (and so how many addresses per
 * node) a cluster may use.
 */
public enum TransportFamily {
    KNET(1, 8, "knet"),
    UDP(1, 1, "udp/udpu");

    private final int minLinks;
    private final int maxLinks;
    private final String displayName;

    TransportFamily(int minLinks, int maxLinks, String displayName) {
        this.minLinks = minLinks;
        this.maxLinks = maxLinks;
        this.displayName = displayName;
    }

    public int minLinks() {
        return minLinks;
    }

    public int maxLinks() {
        return maxLinks;
    }

    public String displayName() {
        return displayName;
    }
}
