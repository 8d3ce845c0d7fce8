package com.modelsync.core.sync;

import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.model.TextEdit;
import com.modelsync.core.model.TextPosition;
import com.modelsync.core.model.TextRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramToTextSync}.
 */
class DiagramToTextSyncTest {

    private static final String URI = "file:///models/shop.ecml";

    private final ManualDocumentScheduler scheduler = new ManualDocumentScheduler();
    private final RecordingApplier applier = new RecordingApplier();
    private final RecordingListener listener = new RecordingListener();

    private DiagramToTextSync sync;

    @BeforeEach
    void setUp() {
        sync = new DiagramToTextSync(applier, scheduler, 50, true);
        sync.addListener(listener);
    }

    @Test
    void submit_withinBatchWindow_appliesOnceWithAllEdits() {
        CompletableFuture<Boolean> first = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        CompletableFuture<Boolean> second = sync.submit(URI, "createEdge", List.of(insert(2, 0, "b")));
        CompletableFuture<Boolean> third = sync.submit(URI, "deleteElement", List.of(insert(4, 0, "c")));

        assertThat(applier.calls).isEmpty();
        assertThat(sync.hasPending(URI)).isTrue();

        scheduler.advance(50);

        assertThat(applier.calls).singleElement()
            .satisfies(edits -> assertThat(edits).extracting(TextEdit::newText).containsExactly("c", "b", "a"));
        assertThat(first).isCompletedWithValue(true);
        assertThat(second).isSameAs(first);
        assertThat(third).isSameAs(first);
        assertThat(listener.applied).singleElement()
            .satisfies(event -> assertThat(event.operationKinds()).containsExactly("createNode", "createEdge", "deleteElement"));
    }

    @Test
    void submit_restartsBatchWindow() {
        sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        scheduler.advance(30);
        sync.submit(URI, "createNode", List.of(insert(1, 0, "b")));
        scheduler.advance(30);

        assertThat(applier.calls).isEmpty();

        scheduler.advance(20);

        assertThat(applier.calls).hasSize(1);
        assertThat(scheduler.pendingTimers()).isZero();
    }

    @Test
    void submit_zeroWindow_appliesEachSubmission() {
        DiagramToTextSync immediate = new DiagramToTextSync(applier, scheduler, 0, true);

        CompletableFuture<Boolean> result = immediate.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        immediate.submit(URI, "createNode", List.of(insert(0, 0, "b")));

        assertThat(result).isCompletedWithValue(true);
        assertThat(applier.calls).hasSize(2);
    }

    @Test
    void submit_noEdits_completesWithoutApplying() {
        assertThat(sync.submit(URI, "changeBounds", List.of())).isCompletedWithValue(true);
        assertThat(sync.hasPending(URI)).isFalse();
    }

    @Test
    void submit_malformedRange_failsWithoutCallingApplier() {
        TextEdit inverted = new TextEdit(TextRange.of(2, 0, 1, 0), "x");

        CompletableFuture<Boolean> result = sync.submit(URI, "deleteElement", List.of(inverted));
        scheduler.advance(50);

        assertThat(result).isCompletedWithValue(false);
        assertThat(applier.calls).isEmpty();
        assertThat(listener.failed).singleElement()
            .satisfies(event -> assertThat(event.reason()).startsWith("Invalid edit range"));
    }

    @Test
    void submit_staleVersion_reportsConflictAndDropsEdits() {
        sync.setDocumentVersion(URI, 3);

        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")), 2);

        assertThat(result).isCompletedWithValue(false);
        assertThat(sync.hasPending(URI)).isFalse();
        assertThat(listener.conflicts).singleElement().satisfies(event -> {
            assertThat(event.expectedVersion()).isEqualTo(2);
            assertThat(event.actualVersion()).isEqualTo(3);
            assertThat(event.operationKind()).isEqualTo("createNode");
        });
    }

    @Test
    void submit_documentChangesInsideBatchWindow_reportsConflictAtFlush() {
        sync.setDocumentVersion(URI, 1);

        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(3, 0, "x")), 1);
        sync.setDocumentVersion(URI, 2);
        scheduler.advance(50);

        assertThat(applier.calls).isEmpty();
        assertThat(result).isCompletedWithValue(false);
        assertThat(sync.hasPending(URI)).isFalse();
        assertThat(listener.conflicts).singleElement().satisfies(event -> {
            assertThat(event.expectedVersion()).isEqualTo(1);
            assertThat(event.actualVersion()).isEqualTo(2);
        });
    }

    @Test
    void submit_zeroWindowAfterDocumentMoved_isDroppedWhenApplied() {
        DiagramToTextSync immediate = new DiagramToTextSync(applier, scheduler, 0, true);
        immediate.addListener(listener);
        immediate.setDocumentVersion(URI, 1);
        List<CompletableFuture<Boolean>> results = new ArrayList<>();

        scheduler.execute(URI, () -> {
            results.add(immediate.submit(URI, "createNode", List.of(insert(0, 0, "a")), 1));
            immediate.setDocumentVersion(URI, 2);
        });

        assertThat(applier.calls).isEmpty();
        assertThat(results).singleElement().satisfies(result -> assertThat(result).isCompletedWithValue(false));
        assertThat(listener.conflicts).hasSize(1);
    }

    @Test
    void submit_newerVersionWhileOlderBatchPending_dropsOlderBatch() {
        sync.setDocumentVersion(URI, 1);
        CompletableFuture<Boolean> older = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")), 1);
        sync.setDocumentVersion(URI, 2);

        CompletableFuture<Boolean> newer = sync.submit(URI, "createEdge", List.of(insert(1, 0, "b")), 2);
        scheduler.advance(50);

        assertThat(older).isCompletedWithValue(false);
        assertThat(newer).isCompletedWithValue(true);
        assertThat(applier.calls).singleElement()
            .satisfies(edits -> assertThat(edits).extracting(TextEdit::newText).containsExactly("b"));
        assertThat(listener.conflicts).singleElement()
            .satisfies(event -> assertThat(event.operationKind()).isEqualTo("createNode"));
    }

    @Test
    void checkVersionConflict_unknownOrMatchingVersion_isNoConflict() {
        assertThat(sync.checkVersionConflict(URI, "createNode", 7)).isFalse();
        sync.setDocumentVersion(URI, 7);
        assertThat(sync.checkVersionConflict(URI, "createNode", 7)).isFalse();
        assertThat(sync.getDocumentVersion(URI)).hasValue(7);
    }

    @Test
    void submit_applierRejects_reportsFailure() {
        applier.outcome = CompletableFuture.completedFuture(false);

        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        scheduler.advance(50);

        assertThat(result).isCompletedWithValue(false);
        assertThat(listener.failed).singleElement()
            .satisfies(event -> assertThat(event.reason()).isEqualTo("Document rejected the edits"));
    }

    @Test
    void submit_applierThrows_reportsFailure() {
        applier.outcome = CompletableFuture.failedFuture(new IllegalStateException("disk full"));

        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        scheduler.advance(50);

        assertThat(result).isCompletedWithValue(false);
        assertThat(listener.failed).singleElement()
            .satisfies(event -> assertThat(event.reason()).contains("disk full"));
    }

    @Test
    void listeners_failingListener_doesNotStopOthers() {
        sync.removeListener(listener);
        sync.addListener(new TextSyncListener() {
            @Override
            public void onEditsApplied(EditsApplied event) {
                throw new IllegalStateException("listener bug");
            }
        });
        sync.addListener(listener);

        sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));
        scheduler.advance(50);

        assertThat(listener.applied).hasSize(1);
    }

    @Test
    void flush_appliesPendingBatchImmediately() {
        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));

        assertThat(sync.flush(URI)).isSameAs(result);

        assertThat(result).isCompletedWithValue(true);
        assertThat(scheduler.pendingTimers()).isZero();
        assertThat(sync.flush(URI)).isCompletedWithValue(true);
    }

    @Test
    void clearPending_completesBatchWithFalse() {
        CompletableFuture<Boolean> result = sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));

        sync.clearPending(URI);
        scheduler.advance(50);

        assertThat(result).isCompletedWithValue(false);
        assertThat(applier.calls).isEmpty();
    }

    @Test
    void forget_dropsPendingEditsAndVersion() {
        sync.setDocumentVersion(URI, 4);
        sync.submit(URI, "createNode", List.of(insert(0, 0, "a")));

        sync.forget(URI);

        assertThat(sync.hasPending(URI)).isFalse();
        assertThat(sync.getDocumentVersion(URI)).isEmpty();
    }

    @Test
    void mergeEdits_touchingRanges_areCombined() {
        TextEdit replace = new TextEdit(TextRange.of(0, 0, 0, 5), "X");
        TextEdit append = insert(0, 5, "Y");
        TextEdit separate = insert(3, 0, "Z");

        List<TextEdit> merged = DiagramToTextSync.mergeEdits(List.of(replace, separate, append));

        assertThat(merged).containsExactly(separate, new TextEdit(TextRange.of(0, 0, 0, 5), "XY"));
    }

    @Test
    void mergeEdits_samePosition_keepsReverseSubmissionOrder() {
        List<TextEdit> merged = DiagramToTextSync.mergeEdits(List.of(insert(1, 0, "a"), insert(1, 0, "b")));

        assertThat(merged).containsExactly(insert(1, 0, "ba"));
    }

    @Test
    void submit_againstDocumentStore_updatesText() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        store.put(new SourceDocument(URI, "entity A {\n}\n", 1));
        DiagramToTextSync storeSync = new DiagramToTextSync(store, scheduler, 50, true);

        storeSync.submit(URI, "createNode", List.of(insert(2, 0, "entity B {\n}\n")));
        storeSync.submit(URI, "createEdge", List.of(insert(1, 0, "    target A\n")));
        scheduler.advance(50);

        assertThat(store.get(URI)).hasValueSatisfying(document -> {
            assertThat(document.text()).isEqualTo("entity A {\n    target A\n}\nentity B {\n}\n");
            assertThat(document.version()).isEqualTo(2);
        });
    }

    private static TextEdit insert(int line, int character, String text) {
        return TextEdit.insert(new TextPosition(line, character), text);
    }

    private static final class RecordingApplier implements TextEditApplier {
        private final List<List<TextEdit>> calls = new ArrayList<>();
        private CompletableFuture<Boolean> outcome = CompletableFuture.completedFuture(true);

        @Override
        public CompletableFuture<Boolean> applyEdits(String uri, List<TextEdit> edits) {
            calls.add(edits);
            return outcome;
        }
    }

    private static final class RecordingListener implements TextSyncListener {
        private final List<EditsApplied> applied = new ArrayList<>();
        private final List<EditsFailed> failed = new ArrayList<>();
        private final List<VersionConflict> conflicts = new ArrayList<>();

        @Override
        public void onEditsApplied(EditsApplied event) {
            applied.add(event);
        }

        @Override
        public void onEditsFailed(EditsFailed event) {
            failed.add(event);
        }

        @Override
        public void onVersionConflict(VersionConflict event) {
            conflicts.add(event);
        }
    }
}
