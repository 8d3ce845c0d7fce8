package com.modelsync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Boundary side a port sits on. The side alone determines the port direction.
 */
public enum PortSide {
    TOP,
    BOTTOM,
    LEFT,
    RIGHT;

    @JsonCreator
    public static PortSide fromValue(String value) {
        return value == null ? null : PortSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public PortDirection direction() {
        return switch (this) {
            case TOP, LEFT -> PortDirection.INPUT;
            case BOTTOM, RIGHT -> PortDirection.OUTPUT;
        };
    }
}
