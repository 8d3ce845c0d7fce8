package com.modelsync.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declarative constraint on legal connections.
 *
 * <p>Every type field accepts {@value #WILDCARD}. A null port matches any port and no port.
 *
 * @param edgeType edge type or wildcard
 * @param sourceType source node type or wildcard
 * @param sourcePort source port ID, wildcard or null
 * @param targetType target node type or wildcard
 * @param targetPort target port ID, wildcard or null
 * @param allowSelfConnection whether source and target may be the same element
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionRule(
    @JsonProperty("edgeType") String edgeType,
    @JsonProperty("sourceType") String sourceType,
    @JsonProperty("sourcePort") String sourcePort,
    @JsonProperty("targetType") String targetType,
    @JsonProperty("targetPort") String targetPort,
    @JsonProperty("allowSelfConnection") boolean allowSelfConnection
) {
    public static final String WILDCARD = "*";

    public ConnectionRule {
        edgeType = edgeType != null ? edgeType : WILDCARD;
        sourceType = sourceType != null ? sourceType : WILDCARD;
        targetType = targetType != null ? targetType : WILDCARD;
    }

    public static ConnectionRule of(String edgeType, String sourceType, String targetType) {
        return new ConnectionRule(edgeType, sourceType, null, targetType, null, false);
    }

    public ConnectionRule withPorts(String newSourcePort, String newTargetPort) {
        return new ConnectionRule(edgeType, sourceType, newSourcePort, targetType, newTargetPort, allowSelfConnection);
    }

    public ConnectionRule allowingSelfConnection() {
        return new ConnectionRule(edgeType, sourceType, sourcePort, targetType, targetPort, true);
    }
}
