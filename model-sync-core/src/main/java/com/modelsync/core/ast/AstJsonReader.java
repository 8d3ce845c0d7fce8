package com.modelsync.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a serialized syntax tree from JSON or YAML.
 *
 * <p>The format mirrors what language servers emit when dumping their ASTs:
 * <pre>{@code
 * {
 *   "$type": "Model",
 *   "entities": [
 *     { "$type": "Entity", "$offset": 0, "$length": 10, "name": "A" },
 *     { "$type": "Entity", "name": "B", "target": { "$ref": "A" } }
 *   ]
 * }
 * }</pre>
 *
 * <p>Objects carrying {@code $type} become child nodes, objects carrying {@code $ref}
 * become {@link ReferenceValue}s and any other object becomes a scalar map (for example an
 * embedded {@code position}). After the tree is built, references are linked by
 * qualified name ({@code Outer.Inner}) first and by simple name second. Unknown targets
 * stay unresolved.
 */
public class AstJsonReader {

    private static final Logger log = LoggerFactory.getLogger(AstJsonReader.class);

    private static final String TYPE = "$type";
    private static final String REF = "$ref";
    private static final String OFFSET = "$offset";
    private static final String LENGTH = "$length";

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Reads an AST file. Files ending in {@code .yaml} or {@code .yml} are read as YAML,
     * anything else as JSON.
     *
     * @param file AST file
     * @return root node
     * @throws IOException if the file cannot be read or is not a valid tree
     */
    public AstNode read(Path file) throws IOException {
        String fileName = file.getFileName().toString().toLowerCase();
        ObjectMapper mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? yamlMapper : jsonMapper;
        log.debug("Reading AST from: {}", file);
        return fromTree(mapper.readTree(Files.readString(file)));
    }

    /**
     * Reads an AST from a JSON string.
     *
     * @param json serialized tree
     * @return root node
     * @throws IOException if the content is not a valid tree
     */
    public AstNode readJson(String json) throws IOException {
        return fromTree(jsonMapper.readTree(json));
    }

    private AstNode fromTree(JsonNode tree) throws IOException {
        if (tree == null || !tree.isObject() || !tree.has(TYPE)) {
            throw new IOException("AST root must be an object with a '" + TYPE + "' property");
        }
        List<ReferenceValue> references = new ArrayList<>();
        AstNode root = readNode(tree, references);
        link(root, references);
        return root;
    }

    private AstNode readNode(JsonNode json, List<ReferenceValue> references) throws IOException {
        AstNode.Builder builder = AstNode.builder(json.get(TYPE).asText())
            .span(json.path(OFFSET).asInt(0), json.path(LENGTH).asInt(0));

        Iterator<Map.Entry<String, JsonNode>> properties = json.fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            String key = property.getKey();
            if (key.startsWith("$")) {
                continue;
            }
            builder.field(key, readValue(property.getValue(), references));
        }
        return builder.build();
    }

    private Object readValue(JsonNode value, List<ReferenceValue> references) throws IOException {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            List<Object> elements = new ArrayList<>();
            for (JsonNode element : value) {
                elements.add(readValue(element, references));
            }
            return elements;
        }
        if (value.isObject()) {
            if (value.has(TYPE)) {
                return readNode(value, references);
            }
            if (value.has(REF)) {
                ReferenceValue reference = value.has(OFFSET)
                    ? ReferenceValue.at(value.get(REF).asText(), value.get(OFFSET).asInt(), value.path(LENGTH).asInt(0))
                    : ReferenceValue.unresolved(value.get(REF).asText());
                references.add(reference);
                return reference;
            }
            Map<String, Object> plain = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                plain.put(entry.getKey(), readValue(entry.getValue(), references));
            }
            return plain;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return value.asText();
    }

    private void link(AstNode root, List<ReferenceValue> references) {
        Map<String, AstNode> byQualifiedName = new HashMap<>();
        Map<String, AstNode> bySimpleName = new HashMap<>();
        root.walk(node -> {
            if (node.hasName()) {
                List<String> path = new ArrayList<>(node.namedAncestorPath());
                path.add(node.name());
                byQualifiedName.putIfAbsent(String.join(".", path), node);
                bySimpleName.putIfAbsent(node.name(), node);
            }
        });

        int unresolved = 0;
        for (ReferenceValue reference : references) {
            AstNode target = byQualifiedName.get(reference.rawText());
            if (target == null) {
                target = bySimpleName.get(reference.rawText());
            }
            if (target != null) {
                reference.bind(target);
            } else {
                unresolved++;
                log.debug("Unresolved reference: {}", reference.rawText());
            }
        }
        if (unresolved > 0) {
            log.warn("{} of {} references could not be resolved", unresolved, references.size());
        }
    }
}
