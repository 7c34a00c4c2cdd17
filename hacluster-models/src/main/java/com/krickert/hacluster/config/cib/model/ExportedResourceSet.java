package com.krickert.hacluster.config.cib.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain form of a resource_set element.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Serdeable
public record ExportedResourceSet(
        @JsonProperty("ids") List<String> ids,
        @JsonProperty("options") Map<String, String> options
) {
    public ExportedResourceSet {
        ids = List.copyOf(ids);
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
