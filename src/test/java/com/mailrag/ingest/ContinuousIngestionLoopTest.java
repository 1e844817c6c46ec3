package com.mailrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mailrag.runtime.AppConfig;
import com.mailrag.store.DataSources;
import com.mailrag.store.RelationalStorageBackend;
import com.mailrag.store.StorageBackend;

class ContinuousIngestionLoopTest {
    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");

    @TempDir
    Path tempDir;

    private StorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = RelationalStorageBackend.open(DataSources.sqliteUrl(tempDir.resolve("emails.db")), null, null, 1, 8, 100);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private IngestionPipeline pipeline(MailSource source) {
        return new IngestionPipeline(source, backend, new HashingEmbeddingService(8), document -> document.subject(),
                RelevanceFilters.acceptAll(), new AppConfig.IngestionConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AppConfig.ContinuousModeConfig cycles(long maxCycles) {
        AppConfig.ContinuousModeConfig config = new AppConfig.ContinuousModeConfig();
        config.setIngestIntervalMs(0);
        config.setMaxCycles(maxCycles);
        return config;
    }

    @Test
    void shouldRunBoundedCyclesAndOnlyStoreNewMessagesOnce() throws Exception {
        InMemoryMailSource source = new InMemoryMailSource().withCandidates(
                new Document("A", "alice@example.com", "", "hello", Instant.parse("2026-10-03T10:00:00Z"), "hi"));
        ContinuousIngestionLoop loop = new ContinuousIngestionLoop(pipeline(source), cycles(3));

        ContinuousIngestionLoop.LoopSummary summary = loop.runLoop();

        assertEquals(3, summary.cycles());
        assertEquals(3, summary.successfulCycles());
        assertEquals(1, summary.lastReport().duplicates());
        assertEquals(1, backend.count());
    }

    @Test
    void shouldKeepGoingAfterFailedCycles() throws Exception {
        ContinuousIngestionLoop loop = new ContinuousIngestionLoop(pipeline(new InMemoryMailSource().failingList()), cycles(2));

        ContinuousIngestionLoop.LoopSummary summary = loop.runLoop();

        assertEquals(2, summary.cycles());
        assertEquals(2, summary.failedCycles());
        assertNull(summary.lastReport());
        assertEquals(Instant.EPOCH, backend.lastSyncTime());
    }

    @Test
    void shouldNotStartCycleOnceStopWasRequested() throws Exception {
        ContinuousIngestionLoop loop = new ContinuousIngestionLoop(pipeline(new InMemoryMailSource()), cycles(0));
        loop.requestStop();

        assertEquals(0, loop.runLoop().cycles());
    }

    @Test
    void shouldRejectNegativeSettings() {
        AppConfig.ContinuousModeConfig config = cycles(1);
        config.setIngestIntervalMs(-1);

        assertThrows(IllegalArgumentException.class, () -> new ContinuousIngestionLoop(pipeline(new InMemoryMailSource()), config));
    }
}
