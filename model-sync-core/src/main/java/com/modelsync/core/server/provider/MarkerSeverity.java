package com.modelsync.core.server.provider;

/**
 * Severity of a diagram validation marker.
 */
public enum MarkerSeverity {
    /**
     * The diagram is inconsistent.
     */
    ERROR,

    /**
     * Likely unintended, should be reviewed.
     */
    WARNING,

    /**
     * Informational only.
     */
    INFO,

    /**
     * Suggestion.
     */
    HINT
}
