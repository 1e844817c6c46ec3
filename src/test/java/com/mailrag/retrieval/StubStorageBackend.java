package com.mailrag.retrieval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.mailrag.store.BackendKind;
import com.mailrag.store.StorageBackend;
import com.mailrag.store.StoreOutcome;
import com.mailrag.store.VectorRecord;

class StubStorageBackend implements StorageBackend {
    private final int dimension;
    private final List<float[]> queries = new ArrayList<>();
    private List<String> results = List.of(NO_RESULTS);
    private RuntimeException failure;

    StubStorageBackend(int dimension) {
        this.dimension = dimension;
    }

    StubStorageBackend returning(String... summaries) {
        this.results = List.of(summaries);
        return this;
    }

    StubStorageBackend failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    int searches() {
        return queries.size();
    }

    @Override
    public StoreOutcome store(VectorRecord record) {
        return StoreOutcome.failed("read-only stub");
    }

    @Override
    public boolean contains(String sourceId) {
        return false;
    }

    @Override
    public List<String> search(float[] queryEmbedding, int topK) {
        queries.add(queryEmbedding);
        if (failure != null) {
            throw failure;
        }
        return results.size() > topK ? results.subList(0, topK) : results;
    }

    @Override
    public int count() {
        return results.size();
    }

    @Override
    public Instant lastSyncTime() {
        return Instant.EPOCH;
    }

    @Override
    public void updateLastSyncTime(Instant timestamp) {
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.RELATIONAL;
    }

    @Override
    public void close() {
    }
}
