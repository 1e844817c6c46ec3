package com.mailrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

class RelationalStorageBackendTest extends StorageBackendContractTest {

    @Override
    StorageBackend openBackend(Path dir) {
        return open(dir, DIMENSION, 100);
    }

    private static RelationalStorageBackend open(Path dir, int dimension, int searchWindow) {
        return RelationalStorageBackend.open(DataSources.sqliteUrl(dir.resolve("emails.db")), null, null, 1, dimension, searchWindow);
    }

    @Test
    void shouldOnlyRankTheMostRecentWindow() {
        backend.close();
        try (RelationalStorageBackend windowed = open(tempDir, DIMENSION, 2)) {
            windowed.store(record("oldest", unit(0)));
            windowed.store(record("middle", unit(1)));
            windowed.store(record("newest", unit(2)));

            assertEquals(3, windowed.count());
            assertEquals(List.of("summary middle", "summary newest"), windowed.search(unit(0), 3));
        }
        backend = openBackend(tempDir);
    }

    @Test
    void shouldAssignIncreasingInsertionSequence() {
        backend.store(record("A", unit(0)));
        backend.store(record("B", unit(1)));

        RelationalStorageBackend relational = (RelationalStorageBackend) backend;
        assertEquals(0L, relational.find("A").orElseThrow().insertionSequence());
        assertEquals(1L, relational.find("B").orElseThrow().insertionSequence());
        assertTrue(relational.find("C").isEmpty());
    }

    @Test
    void shouldRoundTripStoredEmbedding() {
        float[] embedding = { 0.5f, -1.25f, 0f, 3f, 1e-3f, -0f, 7f, 2f };
        backend.store(record("A", embedding));

        VectorRecord stored = ((RelationalStorageBackend) backend).find("A").orElseThrow();
        assertEquals(embedding.length, stored.embedding().length);
        for (int i = 0; i < embedding.length; i++) {
            assertEquals(embedding[i], stored.embedding()[i]);
        }
    }

    @Test
    void shouldRejectReopeningWithDifferentDimension() {
        backend.store(record("A", unit(0)));
        backend.close();

        assertThrows(DimensionMismatchException.class, () -> open(tempDir, DIMENSION * 2, 100));
        backend = openBackend(tempDir);
    }

    @Test
    void shouldRejectNonPositiveSearchWindow() {
        assertThrows(IllegalArgumentException.class,
                () -> new RelationalStorageBackend(null, DIMENSION, 0, () -> { }));
    }
}
