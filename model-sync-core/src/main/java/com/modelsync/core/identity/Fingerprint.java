package com.modelsync.core.identity;

import com.modelsync.core.ast.AstNode;

import java.util.List;
import java.util.Objects;

/**
 * Structural fingerprint of an AST node: its type, the names of its named ancestors and
 * its own name. Unnamed nodes fall back to their source offset, which keeps them apart but
 * changes whenever text before them is edited.
 *
 * @param astType node type
 * @param ancestorPath names of named ancestors, outermost first
 * @param name node name, null for unnamed nodes
 * @param offset source offset, used only for unnamed nodes
 */
public record Fingerprint(String astType, List<String> ancestorPath, String name, int offset) {

    public Fingerprint {
        Objects.requireNonNull(astType, "astType must not be null");
        ancestorPath = ancestorPath != null ? List.copyOf(ancestorPath) : List.of();
    }

    public static Fingerprint of(AstNode node) {
        return new Fingerprint(node.type(), node.namedAncestorPath(), node.hasName() ? node.name() : null, node.offset());
    }

    /**
     * Fingerprint a node will have once it has been written to the text and reparsed.
     *
     * @param astType type of the new node
     * @param containerPath named path of the container, including the container's own name
     * @param name name of the new node
     * @return expected fingerprint
     */
    public static Fingerprint expected(String astType, List<String> containerPath, String name) {
        return new Fingerprint(astType, containerPath, Objects.requireNonNull(name, "name must not be null"), -1);
    }

    /**
     * Stable string form used as registry key and in exported layout data.
     */
    public String key() {
        return astType + "|" + String.join("/", ancestorPath) + "|" + (name != null ? name : "@" + offset);
    }
}
