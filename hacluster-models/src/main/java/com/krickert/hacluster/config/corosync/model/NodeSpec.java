package com.krickert.hacluster.config.corosync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;
import lombok.Builder;

import java.util.List;

/**
 * A node of a cluster being created.
 *
 * @param name  Node name, null when the user did not specify one.
 * @param addrs Node addresses in link order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Builder(toBuilder = true)
@Serdeable
public record NodeSpec(
        @JsonProperty("name") String name,
        @JsonProperty("addrs") List<String> addrs
) {
    public NodeSpec {
        addrs = (addrs == null) ? List.of() : List.copyOf(addrs);
    }

    public static NodeSpec of(String name, String... addrs) {
        return new NodeSpec(name, List.of(addrs));
    }
}
