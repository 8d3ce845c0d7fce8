package com.modelsync.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable text of a document at one version.
 *
 * @param uri document URI
 * @param text full content
 * @param version document version, increases with every change
 */
public record SourceDocument(String uri, String text, long version) {

    public SourceDocument {
        Objects.requireNonNull(uri, "uri must not be null");
        text = text != null ? text : "";
    }

    /**
     * Converts a character offset to a line/character position. Offsets beyond the end are
     * clamped to the end of the document.
     */
    public TextPosition positionAt(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int line = 0;
        int lineStart = 0;
        for (int i = 0; i < clamped; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new TextPosition(line, clamped - lineStart);
    }

    /**
     * Converts a line/character position to an offset. Positions past the end of a line are
     * clamped to the line end; lines past the end of the document map to the document end.
     */
    public int offsetAt(TextPosition position) {
        List<Integer> lineStarts = lineStarts();
        if (position.line() >= lineStarts.size()) {
            return text.length();
        }
        int lineStart = lineStarts.get(position.line());
        int lineEnd = position.line() + 1 < lineStarts.size()
            ? lineStarts.get(position.line() + 1) - 1
            : text.length();
        return Math.min(lineStart + Math.max(0, position.character()), lineEnd);
    }

    public TextRange rangeOf(SourceRange range) {
        return new TextRange(positionAt(range.offset()), positionAt(range.end()));
    }

    public TextPosition endPosition() {
        return positionAt(text.length());
    }

    public SourceDocument withText(String newText) {
        return new SourceDocument(uri, newText, version + 1);
    }

    private List<Integer> lineStarts() {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}
