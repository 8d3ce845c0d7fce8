package com.modelsync.core.sync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a single element change.
 */
public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
