package com.modelsync.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Declared diagram edge type.
 *
 * @param type diagram edge type
 * @param property AST reference field producing this edge
 * @param label palette label
 * @param creatable whether the palette offers a tool for it
 * @param allowDuplicates whether several edges of this type may join the same endpoints
 * @param dashed rendering hint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EdgeTypeConfig(
    @JsonProperty("type") String type,
    @JsonProperty("property") String property,
    @JsonProperty("label") String label,
    @JsonProperty("creatable") Boolean creatable,
    @JsonProperty("allowDuplicates") boolean allowDuplicates,
    @JsonProperty("dashed") boolean dashed
) {
    public EdgeTypeConfig {
        Objects.requireNonNull(type, "type must not be null");
        creatable = creatable == null || creatable;
    }

    public static EdgeTypeConfig of(String type, String property) {
        return new EdgeTypeConfig(type, property, null, true, false, false);
    }
}
