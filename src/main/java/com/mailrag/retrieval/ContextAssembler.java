package com.mailrag.retrieval;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailrag.ingest.EmbeddingService;
import com.mailrag.store.DimensionMismatchException;
import com.mailrag.store.StorageBackend;

public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final EmbeddingService embeddingService;
    private final StorageBackend backend;
    private final int topK;
    private final String itemLabel;
    private final Clock clock;

    public ContextAssembler(EmbeddingService embeddingService, StorageBackend backend, int topK, String itemLabel, Clock clock) {
        if (embeddingService.dimension() != backend.dimension()) {
            throw new DimensionMismatchException("Query embedding service", backend.dimension(), embeddingService.dimension());
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        this.embeddingService = embeddingService;
        this.backend = backend;
        this.topK = topK;
        this.itemLabel = itemLabel == null || itemLabel.isBlank() ? "Email" : itemLabel;
        this.clock = clock;
    }

    public RetrievedContext assemble(String query) {
        return assemble(query, topK);
    }

    public RetrievedContext assemble(String query, int k) {
        float[] embedding;
        try {
            embedding = embeddingService.embed(query == null ? "" : query);
        } catch (RuntimeException e) {
            log.warn("retrieve.embed.failed reason={}", e.getMessage());
            return fallback(query, StorageBackend.SEARCH_ERROR);
        }
        if (embedding == null) {
            log.warn("retrieve.embed.failed reason=no vector returned");
            return fallback(query, StorageBackend.SEARCH_ERROR);
        }
        if (embedding.length != backend.dimension()) {
            throw new DimensionMismatchException("Query embedding", backend.dimension(), embedding.length);
        }

        List<String> items;
        try {
            items = backend.search(embedding, Math.max(1, k));
        } catch (RuntimeException e) {
            log.warn("retrieve.search.failed backend={} reason={}", backend.kind(), e.getMessage(), e);
            return fallback(query, StorageBackend.SEARCH_ERROR);
        }
        if (items == null || items.isEmpty()) {
            return fallback(query, StorageBackend.NO_RESULTS);
        }
        boolean sentinel = items.size() == 1 && isSentinel(items.get(0));
        log.debug("retrieve.done backend={} k={} items={} sentinel={}", backend.kind(), k, items.size(), sentinel);
        return new RetrievedContext(query, items, render(items), sentinel);
    }

    String render(List<String> items) {
        StringBuilder builder = new StringBuilder();
        builder.append("Today's Datetime is ").append(ZonedDateTime.now(clock)).append("\n\n");
        for (int i = 0; i < items.size(); i++) {
            builder.append(itemLabel)
                    .append('(')
                    .append(i + 1)
                    .append("):\n\n")
                    .append(items.get(i))
                    .append("\n\n");
        }
        return builder.toString();
    }

    private RetrievedContext fallback(String query, String sentinel) {
        List<String> items = List.of(sentinel);
        return new RetrievedContext(query, items, render(items), true);
    }

    private static boolean isSentinel(String item) {
        return StorageBackend.NO_RESULTS.equals(item) || StorageBackend.SEARCH_ERROR.equals(item);
    }
}
