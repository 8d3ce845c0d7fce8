package com.modelsync.core.diagram;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.identity.ElementIdRegistry;
import com.modelsync.core.model.SourceDocument;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-document state shared by the converter, the operation handlers and the providers:
 * the current text and AST, the identity registry, the layout metadata and the latest
 * diagram snapshot.
 *
 * <p>Mutated only from the document's task queue. The volatile fields may be read from
 * other threads to observe the latest published state.
 */
public class DiagramContext {

    private final String uri;
    private final LanguageDescriptor descriptor;
    private final ElementIdRegistry registry;
    private final DiagramMetadata metadata;
    private volatile SourceDocument document;
    private volatile AstNode root;
    private volatile DiagramSnapshot snapshot;

    public DiagramContext(SourceDocument document, AstNode root, LanguageDescriptor descriptor) {
        this(document, root, descriptor, new ElementIdRegistry(), new DiagramMetadata());
    }

    public DiagramContext(SourceDocument document, AstNode root, LanguageDescriptor descriptor,
                          ElementIdRegistry registry, DiagramMetadata metadata) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.uri = document.uri();
        this.root = root;
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.snapshot = DiagramSnapshot.empty(uri);
    }

    public String uri() {
        return uri;
    }

    public LanguageDescriptor descriptor() {
        return descriptor;
    }

    public ElementIdRegistry registry() {
        return registry;
    }

    public DiagramMetadata metadata() {
        return metadata;
    }

    public SourceDocument document() {
        return document;
    }

    public AstNode root() {
        return root;
    }

    public DiagramSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Replaces the document text and AST after a reparse.
     */
    public void update(SourceDocument newDocument, AstNode newRoot) {
        this.document = Objects.requireNonNull(newDocument, "document must not be null");
        this.root = newRoot;
    }

    public void updateDocument(SourceDocument newDocument) {
        this.document = Objects.requireNonNull(newDocument, "document must not be null");
    }

    public void setSnapshot(DiagramSnapshot newSnapshot) {
        this.snapshot = Objects.requireNonNull(newSnapshot, "snapshot must not be null");
    }

    public Optional<AstNode> astNodeFor(String elementId) {
        return registry.getAstNode(elementId);
    }
}
