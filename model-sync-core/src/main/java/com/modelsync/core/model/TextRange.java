package com.modelsync.core.model;

import java.util.Objects;

/**
 * Range between two text positions, end exclusive.
 *
 * @param start start position
 * @param end end position
 */
public record TextRange(TextPosition start, TextPosition end) {

    public TextRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }

    public static TextRange of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new TextRange(new TextPosition(startLine, startCharacter), new TextPosition(endLine, endCharacter));
    }

    public static TextRange at(TextPosition position) {
        return new TextRange(position, position);
    }

    /**
     * A range is well formed when both positions are non-negative and start does not
     * come after end.
     */
    public boolean isWellFormed() {
        return !start.isNegative() && !end.isNegative() && start.compareTo(end) <= 0;
    }

    /**
     * Returns true when the ranges overlap or touch.
     */
    public boolean overlapsOrTouches(TextRange other) {
        return end.compareTo(other.start) >= 0 && other.end.compareTo(start) >= 0;
    }

    public TextRange union(TextRange other) {
        TextPosition unionStart = start.compareTo(other.start) <= 0 ? start : other.start;
        TextPosition unionEnd = end.compareTo(other.end) >= 0 ? end : other.end;
        return new TextRange(unionStart, unionEnd);
    }
}
