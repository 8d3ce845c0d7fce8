package com.modelsync.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modelsync.core.model.PortSide;

import java.util.List;
import java.util.Objects;

/**
 * Port declared for a node type.
 *
 * @param id port identifier, referenced by connection rules
 * @param label display label
 * @param side boundary side
 * @param offset fraction along the side, defaults to 0.5
 * @param style CSS style hint
 * @param allowedConnections edge types this port accepts, empty for any
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("label") String label,
    @JsonProperty("side") PortSide side,
    @JsonProperty("offset") Double offset,
    @JsonProperty("style") String style,
    @JsonProperty("allowedConnections") List<String> allowedConnections
) {
    public PortDefinition {
        Objects.requireNonNull(id, "id must not be null");
        side = side != null ? side : PortSide.RIGHT;
        offset = offset != null ? Math.max(0.0, Math.min(1.0, offset)) : 0.5;
        allowedConnections = allowedConnections != null ? List.copyOf(allowedConnections) : List.of();
    }

    public static PortDefinition of(String id, PortSide side) {
        return new PortDefinition(id, id, side, 0.5, null, List.of());
    }

    public boolean accepts(String edgeType) {
        return allowedConnections.isEmpty() || allowedConnections.contains(edgeType);
    }
}
