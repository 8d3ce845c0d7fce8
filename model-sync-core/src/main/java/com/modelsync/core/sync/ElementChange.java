package com.modelsync.core.sync;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single element change inside a {@link ModelChangeEvent}.
 *
 * @param type added, removed or modified
 * @param nodeId element ID
 * @param nodeType diagram type of the element
 * @param property changed property, modifications only
 * @param oldValue previous value, modifications only
 * @param newValue new value, modifications only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ElementChange(
    ChangeType type,
    String nodeId,
    String nodeType,
    String property,
    Object oldValue,
    Object newValue
) {
    public ElementChange {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
    }

    public static ElementChange added(String nodeId, String nodeType) {
        return new ElementChange(ChangeType.ADDED, nodeId, nodeType, null, null, null);
    }

    public static ElementChange removed(String nodeId, String nodeType) {
        return new ElementChange(ChangeType.REMOVED, nodeId, nodeType, null, null, null);
    }

    public static ElementChange modified(String nodeId, String nodeType, String property, Object oldValue, Object newValue) {
        return new ElementChange(ChangeType.MODIFIED, nodeId, nodeType, property, oldValue, newValue);
    }
}
