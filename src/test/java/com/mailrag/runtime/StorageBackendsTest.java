package com.mailrag.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mailrag.store.BackendKind;
import com.mailrag.store.DimensionMismatchException;
import com.mailrag.store.StorageBackend;

class StorageBackendsTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPickIndexedBackendLocally() {
        assertEquals(BackendKind.INDEXED, StorageBackends.selectKind(new AppConfig.StorageConfig(), Map.of()));
        assertEquals(BackendKind.INDEXED, StorageBackends.selectKind(new AppConfig.StorageConfig(), Map.of("PRODUCTION", "false")));
    }

    @Test
    void shouldPickRelationalBackendWhenDeployed() {
        AppConfig.StorageConfig auto = new AppConfig.StorageConfig();

        assertEquals(BackendKind.RELATIONAL, StorageBackends.selectKind(auto, Map.of("DATABASE_URL", "postgres://u:p@db/mail")));
        assertEquals(BackendKind.RELATIONAL, StorageBackends.selectKind(auto, Map.of("DYNO", "web.1")));
        assertEquals(BackendKind.RELATIONAL, StorageBackends.selectKind(auto, Map.of("PRODUCTION", "TRUE")));
    }

    @Test
    void shouldHonourExplicitBackendOverEnvironment() {
        AppConfig.StorageConfig config = new AppConfig.StorageConfig();
        config.setBackend("indexed");

        assertEquals(BackendKind.INDEXED, StorageBackends.selectKind(config, Map.of("DATABASE_URL", "postgres://db/mail")));
        config.setBackend("bogus");
        assertThrows(IllegalArgumentException.class, () -> StorageBackends.selectKind(config, Map.of()));
    }

    @Test
    void shouldPreferDatabaseUrlAndRewritePostgresScheme() {
        AppConfig.StorageConfig config = new AppConfig.StorageConfig();
        config.setJdbcUrl("jdbc:sqlite:/tmp/ignored.db");

        assertEquals("jdbc:postgresql://u:p@db:5432/mail",
                StorageBackends.relationalUrl(config, Map.of("DATABASE_URL", "postgres://u:p@db:5432/mail")));
        assertEquals("jdbc:sqlite:/tmp/ignored.db", StorageBackends.relationalUrl(config, Map.of()));
    }

    @Test
    void shouldOpenRelationalBackendOnEmbeddedDatabaseByDefault() {
        AppConfig config = new AppConfig();
        config.getStorage().setBackend("relational");
        config.getStorage().setDataDir(tempDir.toString());

        try (StorageBackend backend = StorageBackends.open(config, Map.of())) {
            assertEquals(BackendKind.RELATIONAL, backend.kind());
            assertEquals(0, backend.count());
        }
        assertTrue(Files.exists(tempDir.resolve("emails.db")));
    }

    @Test
    void shouldRefuseEmbeddingDimensionThatDiffersFromStore() {
        AppConfig config = new AppConfig();
        config.getStorage().setDataDir(tempDir.toString());
        config.getStorage().setDimension(8);
        config.getEmbedding().setDimension(16);

        DimensionMismatchException error = assertThrows(DimensionMismatchException.class, () -> StorageBackends.open(config, Map.of()));
        assertEquals(8, error.expected());
        assertEquals(16, error.actual());
    }
}
