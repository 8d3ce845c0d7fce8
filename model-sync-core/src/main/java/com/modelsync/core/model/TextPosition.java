package com.modelsync.core.model;

/**
 * Zero-based line and character position in a text document.
 *
 * @param line line index
 * @param character character index within the line
 */
public record TextPosition(int line, int character) implements Comparable<TextPosition> {

    @Override
    public int compareTo(TextPosition other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(character, other.character);
    }

    public boolean isNegative() {
        return line < 0 || character < 0;
    }
}
