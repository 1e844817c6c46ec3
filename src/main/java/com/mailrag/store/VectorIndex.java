package com.mailrag.store;

import java.io.IOException;
import java.util.List;
import java.util.OptionalLong;

public interface VectorIndex {
    int dimension();

    /**
     * Appends a vector and returns its position (0-based, equal to the index size before the add).
     *
     * @throws IllegalArgumentException if {@code sourceId} is already indexed
     * @throws DimensionMismatchException if the vector length differs from {@link #dimension()}
     */
    long add(String sourceId, float[] embedding);

    OptionalLong positionOf(String sourceId);

    List<IndexHit> search(float[] queryEmbedding, int topK);

    int size();

    void save() throws IOException;
}
