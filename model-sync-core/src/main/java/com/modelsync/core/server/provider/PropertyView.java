package com.modelsync.core.server.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelsync.core.ast.FieldKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Properties of a diagram element as shown in a property sheet.
 *
 * @param elementId element ID
 * @param elementType diagram type
 * @param astType type of the backing AST node, null when there is none
 * @param entries property entries in field order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyView(String elementId, String elementType, String astType, List<PropertyEntry> entries) {

    public PropertyView {
        Objects.requireNonNull(elementId, "elementId must not be null");
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public Optional<PropertyEntry> entry(String name) {
        return entries.stream().filter(entry -> entry.name().equals(name)).findFirst();
    }

    /**
     * A single property.
     *
     * @param name field name
     * @param value display value: scalar, reference text, child name or a list of those
     * @param kind field kind
     * @param editable whether {@code updateProperty} accepts this field
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PropertyEntry(String name, Object value, FieldKind kind, boolean editable) {
        public PropertyEntry {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }
}
