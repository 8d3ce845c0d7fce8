package com.modelsync.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A node of a parsed syntax tree.
 *
 * <p>Nodes are created fresh for every parse and never mutated afterwards, except for the
 * container link which is set once when the parent is built. Two nodes are equal only if
 * they are the same instance; stable identity across parses is the job of the
 * element identity registry.
 *
 * <p>Fields keep their declaration order. A field value is one of:
 * <ul>
 *   <li>a scalar ({@code String}, {@code Number}, {@code Boolean})</li>
 *   <li>a {@link ReferenceValue}</li>
 *   <li>a contained {@code AstNode}</li>
 *   <li>a {@code List} of any of the above</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * AstNode a = AstNode.builder("Entity").name("A").span(0, 12).build();
 * AstNode b = AstNode.builder("Entity").name("B").span(13, 20)
 *     .field("target", ReferenceValue.resolved("A", a))
 *     .build();
 * AstNode root = AstNode.builder("Model").child("entities", a).child("entities", b).build();
 * }</pre>
 */
public final class AstNode {

    /** Field name holding the node name */
    public static final String NAME_FIELD = "name";

    private final String type;
    private final int offset;
    private final int length;
    private final String name;
    private final Map<String, Object> fields;
    private AstNode container;
    private String containerProperty;

    private AstNode(Builder builder) {
        this.type = builder.type;
        this.offset = builder.offset;
        this.length = builder.length;
        this.name = builder.name;
        Map<String, Object> copy = new LinkedHashMap<>();
        builder.fields.forEach((key, value) ->
            copy.put(key, value instanceof List<?> list ? List.copyOf(list) : value));
        this.fields = Collections.unmodifiableMap(copy);
        adoptChildren();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    private void adoptChildren() {
        fields.forEach((property, value) -> {
            if (value instanceof AstNode child) {
                adopt(child, property);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof AstNode child) {
                        adopt(child, property);
                    }
                }
            }
        });
    }

    private void adopt(AstNode child, String property) {
        if (child.container != null) {
            throw new IllegalArgumentException("Node " + child + " already has a container");
        }
        child.container = this;
        child.containerProperty = property;
    }

    public String type() {
        return type;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public int end() {
        return offset + length;
    }

    /**
     * Returns the node name, or null for unnamed nodes.
     *
     * @return name or null
     */
    public String name() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public Optional<AstNode> container() {
        return Optional.ofNullable(container);
    }

    public String containerProperty() {
        return containerProperty;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Object field(String fieldName) {
        if (NAME_FIELD.equals(fieldName)) {
            return name;
        }
        return fields.get(fieldName);
    }

    /**
     * Returns direct children in field declaration order.
     *
     * @return contained child nodes
     */
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>();
        for (Object value : fields.values()) {
            if (value instanceof AstNode child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof AstNode child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    /**
     * Visits this node and all descendants depth-first, pre-order.
     *
     * @param visitor callback invoked per node
     */
    public void walk(Consumer<AstNode> visitor) {
        visitor.accept(this);
        for (AstNode child : children()) {
            child.walk(visitor);
        }
    }

    /**
     * Returns all nodes of this subtree in pre-order.
     *
     * @return this node and its descendants
     */
    public List<AstNode> descendantsAndSelf() {
        List<AstNode> nodes = new ArrayList<>();
        walk(nodes::add);
        return nodes;
    }

    /**
     * Returns the names of named ancestors from the outermost to the direct container.
     *
     * @return ancestor name path, empty for top-level nodes
     */
    public List<String> namedAncestorPath() {
        List<String> path = new ArrayList<>();
        AstNode current = container;
        while (current != null) {
            if (current.hasName()) {
                path.add(current.name);
            }
            current = current.container;
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Returns the root of the tree this node belongs to.
     */
    public AstNode root() {
        AstNode current = this;
        while (current.container != null) {
            current = current.container;
        }
        return current;
    }

    @Override
    public String toString() {
        return type + (hasName() ? "(" + name + ")" : "") + "@" + offset;
    }

    /**
     * Builder for {@link AstNode}.
     */
    public static final class Builder {

        private final String type;
        private int offset;
        private int length;
        private String name;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder span(int offset, int length) {
            if (offset < 0 || length < 0) {
                throw new IllegalArgumentException("Span must not be negative: " + offset + "+" + length);
            }
            this.offset = offset;
            this.length = length;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder field(String fieldName, Object value) {
            Objects.requireNonNull(fieldName, "fieldName must not be null");
            if (NAME_FIELD.equals(fieldName)) {
                this.name = value != null ? value.toString() : null;
                return this;
            }
            fields.put(fieldName, value);
            return this;
        }

        /**
         * Appends a child to a list-valued field.
         */
        public Builder child(String fieldName, AstNode child) {
            return appendTo(fieldName, Objects.requireNonNull(child, "child must not be null"));
        }

        /**
         * Appends a reference to a list-valued field.
         */
        public Builder reference(String fieldName, ReferenceValue reference) {
            return appendTo(fieldName, Objects.requireNonNull(reference, "reference must not be null"));
        }

        @SuppressWarnings("unchecked")
        private Builder appendTo(String fieldName, Object value) {
            Object existing = fields.get(fieldName);
            List<Object> list = existing instanceof List<?>
                ? new ArrayList<>((List<Object>) existing)
                : new ArrayList<>();
            list.add(value);
            fields.put(fieldName, list);
            return this;
        }

        public AstNode build() {
            return new AstNode(this);
        }
    }
}
