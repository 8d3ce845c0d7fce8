package com.modelsync.core.model;

import java.util.Objects;

/**
 * Replacement of a text range.
 *
 * @param range range to replace
 * @param newText replacement text, empty for deletions
 */
public record TextEdit(TextRange range, String newText) {

    public TextEdit {
        Objects.requireNonNull(range, "range must not be null");
        newText = newText != null ? newText : "";
    }

    public static TextEdit insert(TextPosition position, String text) {
        return new TextEdit(TextRange.at(position), text);
    }

    public static TextEdit delete(TextRange range) {
        return new TextEdit(range, "");
    }
}
