package com.modelsync.core.server;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.config.ModelSyncConfig;
import com.modelsync.core.convert.AstToDiagramConverter;
import com.modelsync.core.descriptor.LanguageDescriptor;
import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.identity.ElementIdRegistry;
import com.modelsync.core.layout.LayoutAlgorithm;
import com.modelsync.core.layout.LayoutEngine;
import com.modelsync.core.layout.LayoutOptions;
import com.modelsync.core.layout.LayoutResult;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Point;
import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.operation.Operation;
import com.modelsync.core.operation.OperationHandlerRegistry;
import com.modelsync.core.operation.OperationResult;
import com.modelsync.core.operation.TextMaterializer;
import com.modelsync.core.operation.impl.ChangeBoundsHandler;
import com.modelsync.core.operation.impl.CreateEdgeHandler;
import com.modelsync.core.operation.impl.CreateNodeHandler;
import com.modelsync.core.operation.impl.DeleteElementHandler;
import com.modelsync.core.operation.impl.ReconnectEdgeHandler;
import com.modelsync.core.operation.impl.TemplateTextMaterializer;
import com.modelsync.core.rules.PortGeometry;
import com.modelsync.core.server.provider.ContextMenuProvider;
import com.modelsync.core.server.provider.DiagramValidator;
import com.modelsync.core.server.provider.MenuItem;
import com.modelsync.core.server.provider.PropertyProvider;
import com.modelsync.core.server.provider.PropertyUpdateResult;
import com.modelsync.core.server.provider.PropertyView;
import com.modelsync.core.server.provider.ToolPalette;
import com.modelsync.core.server.provider.ToolPaletteProvider;
import com.modelsync.core.server.provider.ValidationReport;
import com.modelsync.core.sync.DiagramToTextSync;
import com.modelsync.core.sync.DocumentScheduler;
import com.modelsync.core.sync.ExecutorDocumentScheduler;
import com.modelsync.core.sync.ModelChangeEvent;
import com.modelsync.core.sync.ModelChangeListener;
import com.modelsync.core.sync.TextEditApplier;
import com.modelsync.core.sync.TextSyncListener;
import com.modelsync.core.sync.TextToDiagramSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Host-facing coordinator of the synchronization engine.
 *
 * <p>Owns the per-document contexts (snapshot, identity registry and metadata) keyed by
 * URI, together with the converter, the operation handlers and both sync directions. Every
 * call that reads or mutates a document's state runs on that document's queue of the
 * {@link DocumentScheduler}, so work for one URI never overlaps while different URIs
 * proceed independently. Several servers may coexist since no state is global.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DiagramServer server = new DiagramServer(ModelSyncConfig.defaults(), documentStore);
 * server.registerLanguage(descriptor);
 * server.addModelChangeListener(event -> render(event.content()));
 * server.onDocumentOpened(document, ast, "ecml");
 * server.executeOperation(uri, CreateNodeOperation.named("node:entity", new Point(40, 40), "Order"));
 * }</pre>
 */
public class DiagramServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DiagramServer.class);

    private final ModelSyncConfig config;
    private final DocumentScheduler scheduler;
    private final LayoutEngine layoutEngine;
    private final LayoutOptions layoutOptions;
    private final AstToDiagramConverter converter;
    private final OperationHandlerRegistry handlers;
    private final DiagramToTextSync diagramToText;
    private final TextToDiagramSync textToDiagram;

    private final DiagramValidator validator = new DiagramValidator();
    private final ToolPaletteProvider paletteProvider = new ToolPaletteProvider();
    private final ContextMenuProvider contextMenuProvider = new ContextMenuProvider();
    private final PropertyProvider propertyProvider = new PropertyProvider();

    private final Map<String, LanguageDescriptor> languages = new ConcurrentHashMap<>();
    private final Map<String, DiagramContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, SourceDocument> changedDocuments = new ConcurrentHashMap<>();

    public DiagramServer(ModelSyncConfig config, TextEditApplier applier) {
        this(config, applier, new ExecutorDocumentScheduler(), new TemplateTextMaterializer());
    }

    public DiagramServer(ModelSyncConfig config, TextEditApplier applier, DocumentScheduler scheduler,
                         TextMaterializer materializer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        Objects.requireNonNull(applier, "applier must not be null");
        Objects.requireNonNull(materializer, "materializer must not be null");

        PortGeometry portGeometry = new PortGeometry(config.ports().size());
        this.layoutEngine = new LayoutEngine();
        this.layoutOptions = LayoutOptions.from(config.layout());
        this.converter = new AstToDiagramConverter(layoutEngine, portGeometry, layoutOptions);
        this.handlers = new OperationHandlerRegistry()
            .register(new CreateNodeHandler(materializer, portGeometry))
            .register(new CreateEdgeHandler(materializer))
            .register(new ReconnectEdgeHandler(materializer))
            .register(new DeleteElementHandler(materializer))
            .register(new ChangeBoundsHandler(portGeometry));

        ModelSyncConfig.SyncSettings sync = config.sync();
        this.diagramToText = new DiagramToTextSync(applier, scheduler, sync.editBatchDebounceMs(), sync.validateEdits());
        this.textToDiagram = new TextToDiagramSync(this::reconvert, scheduler, sync.textDebounceMs());
        this.textToDiagram.addListener(this::adoptPublishedModel);
    }

    // ==================== Languages and contexts ====================

    public void registerLanguage(LanguageDescriptor descriptor) {
        languages.put(descriptor.languageId(), descriptor);
        log.info("Registered language {} ({} node types)", descriptor.languageId(), descriptor.nodes().size());
    }

    public Optional<LanguageDescriptor> language(String languageId) {
        return Optional.ofNullable(languages.get(languageId));
    }

    /**
     * Creates the context of a document, or refreshes the document and AST of an existing
     * one so its registry and metadata are kept.
     *
     * @throws IllegalArgumentException if the language is not registered
     */
    public DiagramContext createContext(SourceDocument document, AstNode root, String languageId) {
        LanguageDescriptor descriptor = languages.get(languageId);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown language: " + languageId);
        }
        DiagramContext context = contexts.compute(document.uri(), (uri, existing) -> {
            if (existing != null && existing.descriptor().equals(descriptor)) {
                existing.update(document, root);
                return existing;
            }
            return new DiagramContext(document, root, descriptor);
        });
        diagramToText.setDocumentVersion(document.uri(), document.version());
        return context;
    }

    public Optional<DiagramContext> context(String uri) {
        return Optional.ofNullable(contexts.get(uri));
    }

    // ==================== Model ====================

    /**
     * Reconciles element IDs and converts the document's current AST.
     */
    public CompletableFuture<DiagramSnapshot> convert(String uri) {
        return scheduler.submit(uri, () -> {
            DiagramContext context = requireContext(uri);
            DiagramSnapshot snapshot = convertContext(context);
            context.setSnapshot(snapshot);
            return snapshot;
        });
    }

    /**
     * Loads a model for display. Element IDs persisted by the client are restored first.
     * A model with no stored positions is laid out with the configured algorithm when
     * auto-layout is enabled.
     *
     * @param uri document URI
     * @param layoutData element ID to fingerprint pairs from {@link #exportLayoutData}, may be null
     * @return loaded snapshot
     */
    public CompletableFuture<DiagramSnapshot> loadModel(String uri, Map<String, String> layoutData) {
        return scheduler.submit(uri, () -> {
            DiagramContext context = requireContext(uri);
            if (layoutData != null && !layoutData.isEmpty()) {
                context.registry().loadFromLayoutData(layoutData);
            }
            boolean unpositioned = !context.metadata().hasPositions();
            context.setSnapshot(convertContext(context));
            if (unpositioned && config.layout().autoLayout() && !context.snapshot().nodes().isEmpty()) {
                applyLayout(context, layoutOptions);
            }
            log.info("Loaded model {} ({} nodes, {} edges)", uri,
                context.snapshot().nodes().size(), context.snapshot().edges().size());
            return context.snapshot();
        });
    }

    public CompletableFuture<Map<String, String>> exportLayoutData(String uri) {
        return scheduler.submit(uri, () -> requireContext(uri).registry().exportToLayoutData());
    }

    // ==================== Operations ====================

    /**
     * Executes a diagram operation. Text edits of a successful operation are handed to the
     * diagram to text sync, computed against the document version the context holds.
     */
    public CompletableFuture<OperationResult> executeOperation(String uri, Operation operation) {
        return scheduler.submit(uri, () -> {
            DiagramContext context = requireContext(uri);
            OperationResult result = handlers.execute(context, operation);
            if (result.success() && !result.textEdits().isEmpty()) {
                diagramToText.submit(uri, operation.kind(), result.textEdits(), context.document().version());
            }
            return result;
        });
    }

    public CompletableFuture<Boolean> undoOperation(String uri, OperationResult result) {
        return scheduler.submit(uri, () -> handlers.undo(requireContext(uri), result));
    }

    // ==================== Layout and validation ====================

    public CompletableFuture<LayoutResult> applyLayout(String uri, String algorithm) {
        LayoutOptions options = algorithm != null
            ? layoutOptions.withAlgorithm(LayoutAlgorithm.fromName(algorithm))
            : layoutOptions;
        return scheduler.submit(uri, () -> applyLayout(requireContext(uri), options));
    }

    public CompletableFuture<ValidationReport> validate(String uri) {
        return scheduler.submit(uri, () -> {
            DiagramContext context = requireContext(uri);
            return validator.validate(context.snapshot(), context.descriptor());
        });
    }

    // ==================== Providers ====================

    public ToolPalette getToolPalette(String languageId) {
        LanguageDescriptor descriptor = languages.get(languageId);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown language: " + languageId);
        }
        return paletteProvider.getToolPalette(descriptor);
    }

    public CompletableFuture<List<MenuItem>> getContextMenu(String uri, List<String> selectedIds) {
        return scheduler.submit(uri, () -> contextMenuProvider.getContextMenu(requireContext(uri), selectedIds));
    }

    public CompletableFuture<Optional<PropertyView>> getProperties(String uri, String elementId) {
        return scheduler.submit(uri, () -> propertyProvider.getProperties(requireContext(uri), elementId));
    }

    /**
     * Writes a scalar property of the AST node behind an element back to the text.
     */
    public CompletableFuture<PropertyUpdateResult> updateProperty(String uri, String elementId, String property,
                                                                  String value) {
        return scheduler.submit(uri, () -> {
            DiagramContext context = requireContext(uri);
            PropertyUpdateResult result = propertyProvider.updateProperty(context, elementId, property, value);
            if (result.success() && !result.edits().isEmpty()) {
                diagramToText.submit(uri, "updateProperty", result.edits(), context.document().version());
            }
            return result;
        });
    }

    // ==================== Document lifecycle ====================

    /**
     * Starts tracking a document and converts it right away.
     */
    public void onDocumentOpened(SourceDocument document, AstNode root, String languageId) {
        createContext(document, root, languageId);
        log.info("Opened {}", document.uri());
        textToDiagram.onDocumentOpened(document.uri(), root);
    }

    /**
     * Records a reparsed document. Conversion follows once the document has been idle for
     * the configured debounce window.
     */
    public void onDocumentChanged(SourceDocument document, AstNode root) {
        String uri = document.uri();
        if (!contexts.containsKey(uri)) {
            log.warn("Change for unknown document {} ignored", uri);
            return;
        }
        changedDocuments.put(uri, document);
        diagramToText.setDocumentVersion(uri, document.version());
        textToDiagram.onDocumentChanged(uri, root);
    }

    /**
     * Drops all state of a document and publishes its removal.
     */
    public void onDocumentClosed(String uri) {
        DiagramContext context = contexts.remove(uri);
        changedDocuments.remove(uri);
        diagramToText.forget(uri);
        textToDiagram.onDocumentClosed(uri);
        if (context != null) {
            scheduler.execute(uri, () -> {
                context.registry().clear();
                context.metadata().clear();
            });
        }
        scheduler.release(uri);
        log.info("Closed {}", uri);
    }

    public void addModelChangeListener(ModelChangeListener listener) {
        textToDiagram.addListener(listener);
    }

    public void removeModelChangeListener(ModelChangeListener listener) {
        textToDiagram.removeListener(listener);
    }

    public void addTextSyncListener(TextSyncListener listener) {
        diagramToText.addListener(listener);
    }

    public Collection<String> openDocuments() {
        return List.copyOf(contexts.keySet());
    }

    /**
     * Flushes pending text edits of all documents.
     */
    public CompletableFuture<Void> flushEdits() {
        return diagramToText.flushAll();
    }

    @Override
    public void close() {
        textToDiagram.close();
        diagramToText.close();
        scheduler.close();
        contexts.clear();
        changedDocuments.clear();
        log.info("Diagram server closed");
    }

    // ==================== Internals ====================

    private DiagramContext requireContext(String uri) {
        DiagramContext context = contexts.get(uri);
        if (context == null) {
            throw new IllegalStateException("Document is not open: " + uri);
        }
        return context;
    }

    private DiagramSnapshot convertContext(DiagramContext context) {
        if (context.root() != null) {
            ElementIdRegistry.ReconcileStats stats = context.registry().reconcile(context.root(), context.uri());
            log.debug("Reconciled {}: {}", context.uri(), stats);
        }
        return converter.convert(context);
    }

    /**
     * Conversion step of the text to diagram sync, run on the document's queue. The
     * snapshot is adopted only once the sync publishes it.
     */
    private DiagramSnapshot reconvert(String uri, AstNode root) {
        DiagramContext context = requireContext(uri);
        SourceDocument document = changedDocuments.remove(uri);
        context.update(document != null ? document : context.document(), root);
        return convertContext(context);
    }

    private void adoptPublishedModel(ModelChangeEvent event) {
        if (event.isRemoval()) {
            return;
        }
        DiagramContext context = contexts.get(event.uri());
        if (context != null && event.content() != null) {
            context.setSnapshot(event.content());
        }
    }

    private LayoutResult applyLayout(DiagramContext context, LayoutOptions options) {
        DiagramSnapshot snapshot = context.snapshot();
        LayoutResult result = layoutEngine.layout(snapshot.nodes(), snapshot.edges(), options);

        List<DiagramNode> moved = new ArrayList<>();
        for (DiagramNode node : snapshot.nodes()) {
            Point position = result.positions().get(node.id());
            if (position != null) {
                context.metadata().setPosition(node.id(), position);
                moved.add(node.withPosition(position));
            }
        }
        moved.forEach(snapshot::replaceNode);

        for (DiagramEdge edge : List.copyOf(snapshot.edges())) {
            if (!edge.routingPoints().isEmpty()) {
                snapshot.replaceEdge(edge.withRoutingPoints(List.of()));
            }
            context.metadata().clearRoutingPoints(edge.id());
        }
        snapshot.incrementRevision();
        log.info("Applied {} layout to {} ({} nodes)", options.algorithm().id(), context.uri(), moved.size());
        return result;
    }
}
