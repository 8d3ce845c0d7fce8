package com.modelsync.core.sync;

import com.modelsync.core.model.SourceDocument;
import com.modelsync.core.model.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds document texts in memory and applies edits to them.
 *
 * <p>Used when no editor owns the documents, for example from the command line and in tests.
 * Every successful application increments the document version.
 */
public class InMemoryDocumentStore implements TextEditApplier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, SourceDocument> documents = new ConcurrentHashMap<>();

    public void put(SourceDocument document) {
        documents.put(document.uri(), document);
    }

    public Optional<SourceDocument> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public void remove(String uri) {
        documents.remove(uri);
    }

    @Override
    public CompletableFuture<Boolean> applyEdits(String uri, List<TextEdit> edits) {
        SourceDocument document = documents.get(uri);
        if (document == null) {
            log.warn("Cannot apply edits to unknown document: {}", uri);
            return CompletableFuture.completedFuture(false);
        }

        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparing((TextEdit edit) -> edit.range().start()).reversed());

        StringBuilder text = new StringBuilder(document.text());
        for (TextEdit edit : ordered) {
            int start = document.offsetAt(edit.range().start());
            int end = document.offsetAt(edit.range().end());
            text.replace(start, end, edit.newText());
        }

        SourceDocument updated = document.withText(text.toString());
        documents.put(uri, updated);
        log.debug("Applied {} edits to {} (version {})", ordered.size(), uri, updated.version());
        return CompletableFuture.completedFuture(true);
    }
}
