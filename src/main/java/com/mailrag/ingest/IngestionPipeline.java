package com.mailrag.ingest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mailrag.runtime.AppConfig;
import com.mailrag.store.DimensionMismatchException;
import com.mailrag.store.StorageBackend;
import com.mailrag.store.StoreOutcome;
import com.mailrag.store.VectorMath;
import com.mailrag.store.VectorRecord;

/**
 * One ingestion pass: fetch candidates, filter them by window and relevance, summarize and embed, store, and
 * finally advance the checkpoint.
 *
 * <p>Failures of a single message (fetching its body, filtering, embedding, storing) are recorded in the report and the
 * run moves on. Only a failure to list candidates aborts the run, leaving the checkpoint as it was. Runs
 * are serialized per pipeline instance and can be stopped between messages.
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    static final String AFTER_PLACEHOLDER = "{after}";

    private final MailSource mailSource;
    private final StorageBackend backend;
    private final EmbeddingService embeddingService;
    private final Summarizer summarizer;
    private final Predicate<Document> relevance;
    private final FetchWindowPolicy windowPolicy;
    private final AppConfig.IngestionConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public IngestionPipeline(
            MailSource mailSource,
            StorageBackend backend,
            EmbeddingService embeddingService,
            Summarizer summarizer,
            Predicate<Document> relevance,
            AppConfig.IngestionConfig config,
            Clock clock) {
        if (embeddingService.dimension() != backend.dimension()) {
            throw new DimensionMismatchException("Embedding service " + embeddingService.version(),
                    backend.dimension(), embeddingService.dimension());
        }
        if (config.getMaxRecordsPerRun() <= 0) {
            throw new IllegalArgumentException("ingestion.maxRecordsPerRun must be > 0");
        }
        this.mailSource = mailSource;
        this.backend = backend;
        this.embeddingService = embeddingService;
        this.summarizer = summarizer;
        this.relevance = relevance;
        this.windowPolicy = new FetchWindowPolicy(config.getWindowMode(), config.getTrailingDays());
        this.config = config;
        this.clock = clock;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    public IngestionReport run() throws FetchException {
        if (!running.compareAndSet(false, true)) {
            throw new IngestionInProgressException();
        }
        stopRequested.set(false);
        try {
            return doRun();
        } finally {
            running.set(false);
        }
    }

    private IngestionReport doRun() throws FetchException {
        Instant startedAt = clock.instant();
        Instant checkpointBefore = backend.lastSyncTime();
        TimeWindow window = windowPolicy.windowAt(startedAt);

        Candidates fetched = fetchCandidates(window);
        log.info("ingest.start backend={} window={}..{} query='{}' candidates={} lastSync={}",
                backend.kind(), window.start(), window.end(), fetched.query(), fetched.documents().size(), checkpointBefore);

        int stored = 0;
        int duplicates = 0;
        int outsideWindow = 0;
        int irrelevant = 0;
        boolean limitReached = false;
        boolean cancelled = false;
        List<RecordFailure> failures = new ArrayList<>();

        for (Document candidate : fetched.documents()) {
            if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                break;
            }
            if (stored >= config.getMaxRecordsPerRun()) {
                limitReached = true;
                break;
            }
            if (candidate == null) {
                continue;
            }

            Document document;
            try {
                document = candidate.hasBody() ? candidate : mailSource.fetch(candidate.sourceId());
            } catch (FetchException | RuntimeException e) {
                failures.add(fail(candidate.sourceId(), RecordFailure.Stage.FETCH, e.getMessage()));
                continue;
            }
            if (document == null) {
                failures.add(fail(candidate.sourceId(), RecordFailure.Stage.FETCH, "message not found"));
                continue;
            }

            if (!window.contains(document.sentAt())) {
                outsideWindow++;
                continue;
            }
            boolean relevant;
            try {
                relevant = relevance.test(document);
            } catch (RuntimeException e) {
                failures.add(fail(document.sourceId(), RecordFailure.Stage.FILTER, e.getMessage()));
                continue;
            }
            if (!relevant) {
                irrelevant++;
                continue;
            }
            if (backend.contains(document.sourceId())) {
                duplicates++;
                continue;
            }

            String summary = summarize(document);
            float[] embedding;
            try {
                embedding = embed(summary);
            } catch (RuntimeException e) {
                failures.add(fail(document.sourceId(), RecordFailure.Stage.TRANSFORM, e.getMessage()));
                continue;
            }

            StoreOutcome outcome = backend.store(VectorRecord.pending(
                    document.sourceId(),
                    document.sender(),
                    document.subject(),
                    document.sentAt(),
                    document.body(),
                    summary,
                    embedding));
            switch (outcome.status()) {
                case INSERTED -> {
                    stored++;
                    log.info("ingest.record.stored n={} sourceId={} sentAt={} subject='{}'",
                            stored, document.sourceId(), document.sentAt(), document.subject());
                }
                case ALREADY_EXISTS -> duplicates++;
                case FAILED -> failures.add(fail(document.sourceId(), RecordFailure.Stage.STORE, outcome.reason()));
            }
        }

        Instant checkpointAfter = checkpointBefore;
        if (cancelled) {
            log.warn("ingest.cancelled stored={} checkpoint unchanged", stored);
        } else {
            checkpointAfter = startedAt.isAfter(checkpointBefore) ? startedAt : checkpointBefore;
            backend.updateLastSyncTime(checkpointAfter);
        }

        IngestionReport report = new IngestionReport(
                window,
                fetched.query(),
                fetched.documents().size(),
                stored,
                duplicates,
                outsideWindow,
                irrelevant,
                failures,
                limitReached,
                cancelled,
                checkpointBefore,
                checkpointAfter);
        log.info("ingest.done stored={} duplicates={} outsideWindow={} irrelevant={} failed={} limitReached={} total={}",
                stored, duplicates, outsideWindow, irrelevant, report.failed(), limitReached, backend.count());
        return report;
    }

    private Candidates fetchCandidates(TimeWindow window) throws FetchException {
        List<String> templates = config.getQueries().isEmpty() ? List.of("") : config.getQueries();
        String lastQuery = "";
        for (String template : templates) {
            String query = template == null ? "" : template.replace(AFTER_PLACEHOLDER, window.startDate());
            lastQuery = query;
            List<Document> documents = mailSource.listCandidates(window, query);
            if (documents != null && !documents.isEmpty()) {
                return new Candidates(query, documents);
            }
            log.info("ingest.fetch.empty query='{}'", query);
        }
        return new Candidates(lastQuery, List.of());
    }

    private String summarize(Document document) {
        try {
            String summary = summarizer.summarize(document);
            if (summary != null && !summary.isBlank()) {
                return summary;
            }
            log.warn("ingest.summary.empty sourceId={} using fallback", document.sourceId());
        } catch (RuntimeException e) {
            log.warn("ingest.summary.failed sourceId={} reason={} using fallback", document.sourceId(), e.getMessage());
        }
        return FallbackSummaries.format(document, config.getSummaryBodyLimit());
    }

    private float[] embed(String text) {
        float[] embedding = embeddingService.embed(text);
        if (embedding == null) {
            throw new EmbeddingException("embedding service returned no vector");
        }
        if (embedding.length != backend.dimension()) {
            throw new DimensionMismatchException("Embedding", backend.dimension(), embedding.length);
        }
        if (!VectorMath.isFinite(embedding)) {
            throw new EmbeddingException("embedding contains non-finite values");
        }
        return embedding;
    }

    private static RecordFailure fail(String sourceId, RecordFailure.Stage stage, String reason) {
        log.warn("ingest.record.failed sourceId={} stage={} reason={}", sourceId, stage, reason);
        return new RecordFailure(sourceId, stage, reason == null ? "unknown" : reason);
    }

    private record Candidates(String query, List<Document> documents) {
    }
}
