package com.krickert.hacluster.config.corosync.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Quorum device models with a validation implementation.
 */
public enum QuorumDeviceModel {
    NET("net");

    private final String value;

    QuorumDeviceModel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<QuorumDeviceModel> fromValue(String value) {
        return Arrays.stream(values())
                .filter(model -> model.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(QuorumDeviceModel::value).toList();
    }
}
