package com.modelsync.core;

import com.modelsync.core.ast.AstJsonReader;
import com.modelsync.core.ast.AstNode;
import com.modelsync.core.convert.AstToDiagramConverter;
import com.modelsync.core.descriptor.DescriptorLoader;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.SourceDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared fixtures: the ECML descriptor and a two-entity document where {@code B.target}
 * references {@code A}.
 */
public final class TestModels {

    public static final String URI = "file:///models/shop.ecml";

    public static final String AB_TEXT = "entity A {\n}\nentity B {\n    target A\n}\n";

    private TestModels() {
    }

    public static LanguageDescriptor ecml() {
        try {
            return DescriptorLoader.loadResource("descriptors/ecml.yaml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses the A/B model again. Every call returns new node instances, like a reparse.
     */
    public static AstNode abModel() {
        return readAst("ast/ab-model.json");
    }

    public static AstNode readAst(String resource) {
        try (InputStream in = TestModels.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Missing test resource " + resource);
            }
            return new AstJsonReader().readJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SourceDocument abDocument() {
        return new SourceDocument(URI, AB_TEXT, 1);
    }

    /**
     * Context of the A/B document, reconciled and converted.
     */
    public static DiagramContext abContext() {
        DiagramContext context = new DiagramContext(abDocument(), abModel(), ecml());
        context.registry().reconcile(context.root(), URI);
        context.setSnapshot(new AstToDiagramConverter().convert(context));
        return context;
    }

    /**
     * Context of an empty document with nothing converted yet.
     */
    public static DiagramContext emptyContext() {
        DiagramContext context = new DiagramContext(new SourceDocument(URI, "", 1), null, ecml());
        context.setSnapshot(new AstToDiagramConverter().convert(context));
        return context;
    }

    public static String nodeId(DiagramContext context, String label) {
        return context.snapshot().nodes().stream()
            .filter(node -> label.equals(node.label()))
            .map(DiagramNode::id)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No node labelled " + label));
    }
}
