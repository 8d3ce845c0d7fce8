package com.modelsync.core.model;

/**
 * Character span of a syntax element in its source document.
 *
 * @param offset start offset, inclusive
 * @param length number of characters
 */
public record SourceRange(int offset, int length) {

    public SourceRange {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Source range must not be negative: " + offset + "+" + length);
        }
    }

    public int end() {
        return offset + length;
    }

    public boolean contains(int position) {
        return position >= offset && position < end();
    }
}
