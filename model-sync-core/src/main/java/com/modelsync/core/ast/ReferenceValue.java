package com.modelsync.core.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A cross-reference as produced by the parser: the raw reference token plus an
 * optionally resolved target node.
 *
 * <p>References are created unresolved and bound once by the linking step of the parser
 * that produced the tree. The source span of the token is optional; when present it lets
 * a deleted reference edge be removed from the text.
 */
public final class ReferenceValue {

    private final String rawText;
    private final int offset;
    private final int length;
    private AstNode target;

    private ReferenceValue(String rawText, AstNode target, int offset, int length) {
        this.rawText = Objects.requireNonNull(rawText, "rawText must not be null");
        this.target = target;
        this.offset = offset;
        this.length = length;
    }

    public static ReferenceValue resolved(String rawText, AstNode target) {
        return new ReferenceValue(rawText, Objects.requireNonNull(target, "target must not be null"), -1, 0);
    }

    public static ReferenceValue unresolved(String rawText) {
        return new ReferenceValue(rawText, null, -1, 0);
    }

    public static ReferenceValue at(String rawText, int offset, int length) {
        return new ReferenceValue(rawText, null, offset, length);
    }

    /**
     * Binds the reference to its target. Only the linking step of a parse calls this.
     */
    void bind(AstNode resolvedTarget) {
        if (target != null && target != resolvedTarget) {
            throw new IllegalStateException("Reference '" + rawText + "' is already bound");
        }
        this.target = resolvedTarget;
    }

    public String rawText() {
        return rawText;
    }

    public Optional<AstNode> target() {
        return Optional.ofNullable(target);
    }

    public boolean isResolved() {
        return target != null;
    }

    public boolean hasSpan() {
        return offset >= 0;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    @Override
    public String toString() {
        return "ReferenceValue[" + rawText + (target != null ? " -> " + target.type() : " (unresolved)") + "]";
    }
}
