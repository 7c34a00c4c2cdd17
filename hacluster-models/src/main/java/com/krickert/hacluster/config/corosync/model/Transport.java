package com.krickert.hacluster.config.corosync.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Transports corosync can be configured with.
 */
public enum Transport {
    KNET("knet", TransportFamily.KNET),
    UDP("udp", TransportFamily.UDP),
    UDPU("udpu", TransportFamily.UDP);

    private final String value;
    private final TransportFamily family;

    Transport(String value, TransportFamily family) {
        this.value = value;
        this.family = family;
    }

    public String value() {
        return value;
    }

    public TransportFamily family() {
        return family;
    }

    public static Optional<Transport> fromValue(String value) {
        return Arrays.stream(values())
                .filter(transport -> transport.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(Transport::value).toList();
    }
}
