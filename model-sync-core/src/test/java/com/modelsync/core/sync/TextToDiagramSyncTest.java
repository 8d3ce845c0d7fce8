package com.modelsync.core.sync;

import com.modelsync.core.ast.AstNode;
import com.modelsync.core.diagram.DiagramSnapshot;
import com.modelsync.core.model.DiagramNode;
import com.modelsync.core.model.Dimension;
import com.modelsync.core.model.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TextToDiagramSync}.
 */
class TextToDiagramSyncTest {

    private static final String URI = "file:///models/shop.ecml";

    private final ManualDocumentScheduler scheduler = new ManualDocumentScheduler();
    private final List<ModelChangeEvent> events = new ArrayList<>();
    private final List<Exception> failures = new ArrayList<>();
    private final List<AstNode> converted = new ArrayList<>();

    private TextToDiagramSync.ModelConverter converter = this::convert;
    private TextToDiagramSync sync;

    @BeforeEach
    void setUp() {
        sync = new TextToDiagramSync((uri, root) -> converter.convert(uri, root), scheduler, 100);
        sync.addListener(new ModelChangeListener() {
            @Override
            public void onModelChanged(ModelChangeEvent event) {
                events.add(event);
            }

            @Override
            public void onSyncFailed(String uri, Exception error) {
                failures.add(error);
            }
        });
    }

    @Test
    void onDocumentOpened_convertsImmediately() {
        sync.onDocumentOpened(URI, model("A", "B"));

        assertThat(sync.state(URI)).isEqualTo(SyncState.TRACKED_SYNCED);
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(ModelChangeEvent.Type.MODEL_UPDATED);
            assertThat(event.version()).isEqualTo(1);
            assertThat(event.changes()).extracting(ElementChange::type).containsOnly(ChangeType.ADDED).hasSize(2);
        });
    }

    @Test
    void onDocumentChanged_burstOfChanges_convertsOnceAfterQuietPeriod() {
        sync.onDocumentOpened(URI, model("A"));
        events.clear();

        sync.onDocumentChanged(URI, model("A", "B"));
        scheduler.advance(40);
        sync.onDocumentChanged(URI, model("A", "B", "C"));
        scheduler.advance(40);
        sync.onDocumentChanged(URI, model("A", "B", "C", "D"));

        assertThat(sync.state(URI)).isEqualTo(SyncState.TRACKED_UNSYNCED);
        assertThat(events).isEmpty();

        scheduler.advance(100);

        assertThat(converted).hasSize(2);
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.version()).isEqualTo(4);
            assertThat(event.content().nodes()).hasSize(4);
            assertThat(event.changes()).hasSize(3);
        });
        assertThat(sync.state(URI)).isEqualTo(SyncState.TRACKED_SYNCED);
    }

    @Test
    void sync_documentChangedDuringConversion_discardsStaleResult() {
        sync.onDocumentOpened(URI, model("A"));
        events.clear();
        AstNode newer = model("A", "B", "C");
        converter = (uri, root) -> {
            converter = this::convert;
            sync.onDocumentChanged(uri, newer);
            return convert(uri, root);
        };

        sync.onDocumentChanged(URI, model("A", "B"));
        scheduler.advance(100);

        assertThat(events).isEmpty();
        assertThat(sync.state(URI)).isEqualTo(SyncState.TRACKED_UNSYNCED);

        scheduler.advance(100);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.version()).isEqualTo(3);
            assertThat(event.content().nodes()).hasSize(3);
        });
    }

    @Test
    void onDocumentClosed_publishesRemovalAndCancelsTimer() {
        sync.onDocumentOpened(URI, model("A"));
        sync.onDocumentChanged(URI, model("A", "B"));

        sync.onDocumentClosed(URI);
        scheduler.advance(100);

        assertThat(events).last().satisfies(event -> {
            assertThat(event.isRemoval()).isTrue();
            assertThat(event.content()).isNull();
            assertThat(event.version()).isEqualTo(2);
        });
        assertThat(converted).hasSize(1);
        assertThat(sync.state(URI)).isEqualTo(SyncState.UNTRACKED);
        assertThat(sync.isTracked(URI)).isFalse();
    }

    @Test
    void onDocumentClosed_untrackedDocument_isIgnored() {
        sync.onDocumentClosed(URI);

        assertThat(events).isEmpty();
    }

    @Test
    void sync_converterThrows_reportsFailureAndStaysUnsynced() {
        converter = (uri, root) -> {
            throw new IllegalStateException("broken grammar");
        };

        sync.onDocumentOpened(URI, model("A"));

        assertThat(events).isEmpty();
        assertThat(failures).singleElement()
            .satisfies(error -> assertThat(error).hasMessage("broken grammar"));
        assertThat(sync.state(URI)).isEqualTo(SyncState.TRACKED_UNSYNCED);
    }

    @Test
    void syncNow_reconvertsEvenWhenSynced() {
        sync.onDocumentOpened(URI, model("A"));

        assertThat(sync.syncNow(URI)).isTrue();

        assertThat(converted).hasSize(2);
        assertThat(events).hasSize(2);
        assertThat(events.get(1).changes()).isEmpty();
        assertThat(sync.syncNow("file:///other.ecml")).isFalse();
    }

    @Test
    void onDocumentChanged_untrackedDocument_startsTracking() {
        sync.onDocumentChanged(URI, model("A"));

        assertThat(sync.isTracked(URI)).isTrue();
        assertThat(sync.version(URI)).isEqualTo(1);
        assertThat(events).hasSize(1);
    }

    @Test
    void close_stopsTrackingWithoutEvents() {
        sync.onDocumentOpened(URI, model("A"));
        sync.onDocumentChanged(URI, model("A", "B"));
        events.clear();

        sync.close();
        scheduler.advance(100);

        assertThat(events).isEmpty();
        assertThat(sync.state(URI)).isEqualTo(SyncState.UNTRACKED);
    }

    private DiagramSnapshot convert(String uri, AstNode root) {
        converted.add(root);
        List<DiagramNode> nodes = root.children().stream()
            .map(child -> new DiagramNode(child.name(), "node:entity", child.name(), Point.ORIGIN,
                new Dimension(100, 50), null, List.of(), List.of()))
            .toList();
        return new DiagramSnapshot(uri, converted.size(), nodes, List.of());
    }

    private static AstNode model(String... names) {
        AstNode.Builder builder = AstNode.builder("Model");
        for (String name : names) {
            builder.child("entities", AstNode.builder("Entity").name(name).build());
        }
        return builder.build();
    }
}
