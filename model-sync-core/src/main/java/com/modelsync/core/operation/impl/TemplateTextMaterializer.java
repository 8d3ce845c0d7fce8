package com.modelsync.core.operation.impl;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.descriptor.NodeMapping;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.EdgeKind;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.model.SourceRange;
import com.modelsync.core.model.TextEdit;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.TextMaterializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Materializer for brace-delimited languages driven by descriptor templates.
 *
 * <p>New nodes are rendered from the mapping's {@code template} (default
 * <code>${keyword} ${name} {\n}</code>, where {@code keyword} is the lower-cased AST type)
 * and inserted before the container's closing brace, or at the end of the document for top
 * level nodes. References are written as {@code property Target} lines before the source
 * node's closing brace. Deletions remove the source ranges recorded by the converter; a
 * deleted reference also takes its keyword or list separator with it.
 *
 * <p>Elements that exist only on the diagram so far have no source text to anchor on;
 * requests that need one fail.
 */
public class TemplateTextMaterializer implements TextMaterializer {

    private static final Logger log = LoggerFactory.getLogger(TemplateTextMaterializer.class);

    public static final String DEFAULT_NODE_TEMPLATE = "${keyword} ${name} {\n}";

    private static final String INDENT = "    ";

    @Override
    public MaterializeResult createNode(DiagramContext context, String astType, String name, String containerId,
                                        Map<String, Object> args) {
        SourceDocument document = context.document();
        String template = context.descriptor().mappingFor(astType)
            .map(NodeMapping::template)
            .orElse(DEFAULT_NODE_TEMPLATE);
        String body = template
            .replace("${keyword}", astType.toLowerCase(Locale.ROOT))
            .replace("${name}", name);

        int offset;
        if (containerId != null) {
            Optional<AstNode> container = context.astNodeFor(containerId);
            if (container.isEmpty()) {
                return MaterializeResult.failed("Container " + containerId + " has no source text yet");
            }
            offset = bodyEnd(document.text(), container.get());
            body = indent(body);
        } else {
            offset = document.text().length();
        }

        log.debug("Inserting {} '{}' at offset {}", astType, name, offset);
        return MaterializeResult.of(List.of(TextEdit.insert(document.positionAt(offset),
            lineBreakBefore(document.text(), offset) + body + "\n")));
    }

    @Override
    public MaterializeResult createEdge(DiagramContext context, String edgeType, String property, String sourceId,
                                        String targetId, Map<String, Object> args) {
        Optional<AstNode> source = context.astNodeFor(sourceId);
        if (source.isEmpty()) {
            return MaterializeResult.failed("Source " + sourceId + " has no source text yet");
        }
        Optional<String> targetName = targetName(context, targetId);
        if (targetName.isEmpty()) {
            return MaterializeResult.failed("Target " + targetId + " has no name");
        }

        SourceDocument document = context.document();
        int offset = bodyEnd(document.text(), source.get());
        String line = INDENT + property + " " + targetName.get() + "\n";
        return MaterializeResult.of(List.of(TextEdit.insert(document.positionAt(offset),
            lineBreakBefore(document.text(), offset) + line)));
    }

    @Override
    public MaterializeResult deleteElements(DiagramContext context, List<String> elementIds) {
        SourceDocument document = context.document();
        List<SourceRange> ranges = new ArrayList<>();
        for (String id : elementIds) {
            Optional<SourceRange> range = context.metadata().sourceRange(id);
            if (range.isEmpty()) {
                continue;
            }
            boolean reference = context.snapshot().findEdge(id)
                .filter(edge -> edge.kind() == EdgeKind.REFERENCE)
                .isPresent();
            ranges.add(reference ? referenceRange(document.text(), range.get()) : range.get());
        }
        List<TextEdit> edits = new ArrayList<>();
        for (SourceRange range : union(ranges)) {
            edits.add(TextEdit.delete(document.rangeOf(range)));
        }
        return MaterializeResult.of(edits);
    }

    @Override
    public MaterializeResult reconnectEdge(DiagramContext context, DiagramEdge previous, DiagramEdge updated) {
        if (previous.kind() == EdgeKind.CONTAINMENT) {
            return MaterializeResult.noEdits();
        }
        SourceDocument document = context.document();
        Optional<SourceRange> range = context.metadata().sourceRange(previous.id());

        if (range.isPresent() && previous.sourceId().equals(updated.sourceId())) {
            Optional<String> targetName = targetName(context, updated.targetId());
            if (targetName.isEmpty()) {
                return MaterializeResult.failed("Target " + updated.targetId() + " has no name");
            }
            return MaterializeResult.of(List.of(new TextEdit(document.rangeOf(range.get()), targetName.get())));
        }

        List<TextEdit> edits = new ArrayList<>();
        range.ifPresent(oldRange -> edits.add(
            TextEdit.delete(document.rangeOf(referenceRange(document.text(), oldRange)))));
        String property = previous.property() != null
            ? previous.property()
            : context.descriptor().propertyForEdgeType(previous.type());
        MaterializeResult inserted = createEdge(context, updated.type(), property, updated.sourceId(),
            updated.targetId(), Map.of());
        if (!inserted.success()) {
            return inserted;
        }
        edits.addAll(inserted.edits());
        return MaterializeResult.of(edits);
    }

    private static Optional<String> targetName(DiagramContext context, String targetId) {
        return context.astNodeFor(targetId)
            .filter(AstNode::hasName)
            .map(AstNode::name)
            .or(() -> context.snapshot().findNode(targetId).map(DiagramNode::label));
    }

    /**
     * Offset of the node's closing brace, or its end if it has none.
     */
    private static int bodyEnd(String text, AstNode node) {
        int end = Math.min(node.end(), text.length());
        int closing = end > 0 ? text.lastIndexOf('}', end - 1) : -1;
        return closing >= node.offset() ? closing : end;
    }

    /**
     * Widens a reference token to the text that must go with it for the source to stay valid.
     *
     * <p>A list element takes one adjacent comma with it. A single {@code property Target}
     * assignment loses its keyword, and the whole line when nothing else is on it.
     */
    static SourceRange referenceRange(String text, SourceRange token) {
        int start = Math.min(token.offset(), text.length());
        int end = Math.min(token.end(), text.length());

        int after = skipBlanks(text, end);
        if (after < text.length() && text.charAt(after) == ',') {
            return span(start, skipBlanks(text, after + 1));
        }
        int before = skipBlanksBack(text, start);
        if (before > 0 && text.charAt(before - 1) == ',') {
            return span(before - 1, end);
        }

        int keywordStart = before;
        while (keywordStart > 0 && Character.isJavaIdentifierPart(text.charAt(keywordStart - 1))) {
            keywordStart--;
        }
        if (keywordStart == before) {
            return token;
        }
        int lineStart = skipBlanksBack(text, keywordStart);
        boolean ownsLine = (lineStart == 0 || text.charAt(lineStart - 1) == '\n')
            && (after == text.length() || text.charAt(after) == '\n');
        if (ownsLine) {
            return span(lineStart, after < text.length() ? after + 1 : after);
        }
        return span(keywordStart, end);
    }

    /**
     * Sorts ranges and merges the ones that overlap, so nested deletions become one edit.
     */
    private static List<SourceRange> union(List<SourceRange> ranges) {
        List<SourceRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt(SourceRange::offset));
        List<SourceRange> merged = new ArrayList<>();
        for (SourceRange range : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && range.offset() < merged.get(last).end()) {
                SourceRange previous = merged.get(last);
                merged.set(last, span(previous.offset(), Math.max(previous.end(), range.end())));
            } else {
                merged.add(range);
            }
        }
        return merged;
    }

    private static SourceRange span(int start, int end) {
        return new SourceRange(start, end - start);
    }

    private static int skipBlanks(String text, int offset) {
        int i = offset;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static int skipBlanksBack(String text, int offset) {
        int i = offset;
        while (i > 0 && (text.charAt(i - 1) == ' ' || text.charAt(i - 1) == '\t')) {
            i--;
        }
        return i;
    }

    private static String lineBreakBefore(String text, int offset) {
        return offset > 0 && text.charAt(offset - 1) != '\n' ? "\n" : "";
    }

    private static String indent(String body) {
        return INDENT + body.replace("\n", "\n" + INDENT);
    }
}
