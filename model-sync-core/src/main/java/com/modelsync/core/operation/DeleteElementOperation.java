package com.modelsync.core.operation;

import java.util.List;

/**
 * Deletes nodes and edges.
 *
 * @param elementIds element IDs to delete
 */
public record DeleteElementOperation(List<String> elementIds) implements Operation {

    public DeleteElementOperation {
        elementIds = elementIds != null ? List.copyOf(elementIds) : List.of();
    }

    public static DeleteElementOperation of(String... elementIds) {
        return new DeleteElementOperation(List.of(elementIds));
    }

    @Override
    public String kind() {
        return DELETE_ELEMENT;
    }
}
