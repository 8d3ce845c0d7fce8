package com.modelsync.core.server.provider;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.ast.FieldKind;
import com.modelsync.core.ast.ReferenceValue;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.identity.Fingerprint;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.model.SourceRange;
import com.modelsync.core.model.TextEdit;
import com.modelsync.core.server.provider.PropertyView.PropertyEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the properties behind a diagram element and turns scalar property changes into
 * text edits.
 *
 * <p>Values are located textually inside the source range of the element's AST node: the
 * name is the first whole-word occurrence of the current name, other scalars are the first
 * occurrence of the current value after the field's keyword. Renaming re-registers the
 * element ID under its new fingerprint so the element keeps its ID after the reparse.
 */
public class PropertyProvider {

    private static final Logger log = LoggerFactory.getLogger(PropertyProvider.class);

    public Optional<PropertyView> getProperties(DiagramContext context, String elementId) {
        Optional<DiagramNode> node = context.snapshot().findNode(elementId);
        if (node.isPresent()) {
            return Optional.of(nodeProperties(context, node.get()));
        }
        return context.snapshot().findEdge(elementId).map(PropertyProvider::edgeProperties);
    }

    /**
     * Computes the edits that set a scalar property of the AST node behind an element.
     *
     * @param context document context
     * @param elementId diagram node ID
     * @param property AST field name
     * @param newValue new value as written in the text
     * @return edits, or the reason the update is not possible
     */
    public PropertyUpdateResult updateProperty(DiagramContext context, String elementId, String property, String newValue) {
        if (newValue == null) {
            return PropertyUpdateResult.failed("New value must not be null");
        }
        Optional<AstNode> astNode = context.astNodeFor(elementId);
        if (astNode.isEmpty()) {
            return PropertyUpdateResult.failed("No source element for " + elementId);
        }
        AstNode node = astNode.get();
        if (!fieldsOf(node).containsKey(property)) {
            return PropertyUpdateResult.failed("Unknown property " + property + " on " + node.type());
        }
        Object current = node.field(property);
        if (!isEditable(context, node, property, current)) {
            return PropertyUpdateResult.failed("Property " + property + " is not editable");
        }
        boolean rename = AstNode.NAME_FIELD.equals(property);
        if (rename && newValue.isBlank()) {
            return PropertyUpdateResult.failed("Name must not be blank");
        }

        String currentText = String.valueOf(current);
        if (currentText.equals(newValue)) {
            return PropertyUpdateResult.succeeded(List.of());
        }

        SourceDocument document = context.document();
        int spanStart = Math.min(node.offset(), document.text().length());
        int spanEnd = Math.min(node.end(), document.text().length());
        String span = document.text().substring(spanStart, spanEnd);

        int found = rename ? findWord(span, currentText, 0) : findAfterKeyword(span, property, currentText);
        if (found < 0) {
            log.warn("Could not locate {} = {} in source of {}", property, currentText, elementId);
            return PropertyUpdateResult.failed("Cannot locate the value of " + property + " in the source text");
        }

        SourceRange valueRange = new SourceRange(spanStart + found, currentText.length());
        TextEdit edit = new TextEdit(document.rangeOf(valueRange), newValue);
        if (rename) {
            context.registry().registerPending(elementId,
                Fingerprint.expected(node.type(), node.namedAncestorPath(), newValue));
        }
        log.debug("Updating {}.{} from {} to {}", elementId, property, currentText, newValue);
        return PropertyUpdateResult.succeeded(List.of(edit));
    }

    private PropertyView nodeProperties(DiagramContext context, DiagramNode node) {
        Optional<AstNode> astNode = context.astNodeFor(node.id());
        if (astNode.isEmpty()) {
            return new PropertyView(node.id(), node.type(), null,
                List.of(new PropertyEntry("label", node.label(), FieldKind.SCALAR, false)));
        }

        AstNode ast = astNode.get();
        List<PropertyEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Object> field : fieldsOf(ast).entrySet()) {
            FieldKind kind = context.descriptor().fieldKind(ast.type(), field.getKey(), field.getValue());
            entries.add(new PropertyEntry(field.getKey(), displayValue(field.getValue()), kind,
                isEditable(context, ast, field.getKey(), field.getValue())));
        }
        return new PropertyView(node.id(), node.type(), ast.type(), entries);
    }

    private static PropertyView edgeProperties(DiagramEdge edge) {
        List<PropertyEntry> entries = new ArrayList<>();
        entries.add(new PropertyEntry("type", edge.type(), FieldKind.SCALAR, false));
        entries.add(new PropertyEntry("source", edge.sourceId(), FieldKind.SCALAR, false));
        entries.add(new PropertyEntry("target", edge.targetId(), FieldKind.SCALAR, false));
        if (edge.property() != null) {
            entries.add(new PropertyEntry("property", edge.property(), FieldKind.SCALAR, false));
        }
        if (edge.label() != null) {
            entries.add(new PropertyEntry("label", edge.label(), FieldKind.SCALAR, false));
        }
        return new PropertyView(edge.id(), edge.type(), null, entries);
    }

    private static Map<String, Object> fieldsOf(AstNode node) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (node.hasName()) {
            fields.put(AstNode.NAME_FIELD, node.name());
        }
        fields.putAll(node.fields());
        return fields;
    }

    private static boolean isEditable(DiagramContext context, AstNode node, String field, Object value) {
        return context.descriptor().fieldKind(node.type(), field, value) == FieldKind.SCALAR
            && (value instanceof String || value instanceof Number || value instanceof Boolean);
    }

    private static Object displayValue(Object value) {
        if (value instanceof ReferenceValue reference) {
            return reference.rawText();
        }
        if (value instanceof AstNode child) {
            return child.hasName() ? child.name() : child.type();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(PropertyProvider::displayValue).toList();
        }
        return value;
    }

    private static int findAfterKeyword(String span, String keyword, String value) {
        int keywordAt = findWord(span, keyword, 0);
        if (keywordAt < 0) {
            return -1;
        }
        return span.indexOf(value, keywordAt + keyword.length());
    }

    private static int findWord(String text, String word, int from) {
        Matcher matcher = Pattern.compile("(?<![\\w])" + Pattern.quote(word) + "(?![\\w])").matcher(text);
        return matcher.find(from) ? matcher.start() : -1;
    }
}
