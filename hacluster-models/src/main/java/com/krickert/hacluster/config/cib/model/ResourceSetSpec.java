package com.krickert.hacluster.config.cib.model;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

/**
 * A resource set requested by the user: resource ids in order plus set level options.
 */
@Builder(toBuilder = true)
public record ResourceSetSpec(
        List<String> ids,
        Map<String, String> options
) {
    public ResourceSetSpec {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("ResourceSetSpec ids cannot be null or empty.");
        }
        ids = List.copyOf(ids);
        options = Collections.unmodifiableMap(options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options));
    }

    public static ResourceSetSpec of(String... ids) {
        return new ResourceSetSpec(List.of(ids), Map.of());
    }

    public ResourceSetSpec withIds(List<String> newIds) {
        return new ResourceSetSpec(newIds, options);
    }
}
