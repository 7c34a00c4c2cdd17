package com.krickert.hacluster.config.cib.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain form of a constraint element. Constraints without resource sets export an empty list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Serdeable
public record ExportedConstraint(
        @JsonProperty("resourceSets") List<ExportedResourceSet> resourceSets,
        @JsonProperty("options") Map<String, String> options
) {
    public ExportedConstraint {
        resourceSets = (resourceSets == null) ? List.of() : List.copyOf(resourceSets);
        options = Collections.unmodifiableMap(options == null ? new LinkedHashMap<>() : new LinkedHashMap<>(options));
    }
}
