package com.modelsync.core.server.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Validation finding attached to a diagram element.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DiagramMarker marker = DiagramMarker.error(edgeId, DiagramValidator.MISSING_TARGET,
 *     "Edge target does not exist: 42");
 * }</pre>
 *
 * @param elementId element the finding is about, null for descriptor-level findings
 * @param severity severity
 * @param code stable finding code
 * @param message human-readable description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramMarker(
    String elementId,
    MarkerSeverity severity,
    String code,
    String message
) {
    public DiagramMarker {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static DiagramMarker error(String elementId, String code, String message) {
        return new DiagramMarker(elementId, MarkerSeverity.ERROR, code, message);
    }

    public static DiagramMarker warning(String elementId, String code, String message) {
        return new DiagramMarker(elementId, MarkerSeverity.WARNING, code, message);
    }

    public static DiagramMarker info(String elementId, String code, String message) {
        return new DiagramMarker(elementId, MarkerSeverity.INFO, code, message);
    }

    public static DiagramMarker hint(String elementId, String code, String message) {
        return new DiagramMarker(elementId, MarkerSeverity.HINT, code, message);
    }
}
