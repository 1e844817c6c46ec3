package com.mailrag.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariDataSource;

public class RelationalStorageBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(RelationalStorageBackend.class);
    static final String CHECKPOINT_KEY = "last_email_check";

    private final MetadataStore metadata;
    private final int dimension;
    // only the most recent rows are scanned by search
    private final int searchWindow;
    private final AutoCloseable dataSource;
    private final Object writeLock = new Object();

    public RelationalStorageBackend(MetadataStore metadata, int dimension, int searchWindow, AutoCloseable dataSource) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        if (searchWindow <= 0) {
            throw new IllegalArgumentException("searchWindow must be > 0");
        }
        this.metadata = metadata;
        this.dimension = dimension;
        this.searchWindow = searchWindow;
        this.dataSource = dataSource;
    }

    public static RelationalStorageBackend open(String jdbcUrl, String username, String password, int poolSize, int dimension, int searchWindow) {
        HikariDataSource dataSource = DataSources.create(jdbcUrl, username, password, poolSize);
        MetadataStore metadata = new MetadataStore(dataSource, SqlDialect.fromJdbcUrl(jdbcUrl));
        try {
            metadata.createSchema();
            List<VectorRecord> sample = metadata.recent(1);
            if (!sample.isEmpty() && sample.get(0).embedding().length != dimension) {
                throw new DimensionMismatchException("Stored embeddings", dimension, sample.get(0).embedding().length);
            }
        } catch (SQLException e) {
            dataSource.close();
            throw new StorageException("Unable to initialize relational store " + jdbcUrl, e);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        return new RelationalStorageBackend(metadata, dimension, searchWindow, dataSource);
    }

    @Override
    public StoreOutcome store(VectorRecord record) {
        if (record.embedding().length != dimension) {
            return StoreOutcome.failed("dimension mismatch: expected " + dimension + " got " + record.embedding().length);
        }
        synchronized (writeLock) {
            try (Connection conn = metadata.connection()) {
                boolean autoCommit = conn.getAutoCommit();
                conn.setAutoCommit(false);
                try {
                    if (metadata.exists(conn, record.sourceId())) {
                        conn.rollback();
                        return StoreOutcome.alreadyExists();
                    }
                    metadata.insert(conn, record, metadata.nextSequence(conn));
                    conn.commit();
                    return StoreOutcome.inserted();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                } finally {
                    conn.setAutoCommit(autoCommit);
                }
            } catch (SQLException e) {
                log.warn("store.failed backend=relational sourceId={} reason={}", record.sourceId(), e.getMessage());
                return StoreOutcome.failed(e.getMessage());
            }
        }
    }

    @Override
    public boolean contains(String sourceId) {
        try (Connection conn = metadata.connection()) {
            return metadata.exists(conn, sourceId);
        } catch (SQLException e) {
            log.warn("contains.failed backend=relational sourceId={} reason={}", sourceId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> search(float[] queryEmbedding, int topK) {
        try {
            if (topK <= 0) {
                return List.of(NO_RESULTS);
            }
            List<VectorRecord> window = metadata.recent(searchWindow);
            List<VectorMath.Scored<String>> scored = new ArrayList<>(window.size());
            for (VectorRecord record : window) {
                scored.add(new VectorMath.Scored<>(
                        record.summary(),
                        VectorMath.squaredL2(queryEmbedding, record.embedding()),
                        record.insertionSequence()));
            }
            List<String> summaries = VectorMath.nearest(scored, topK).stream()
                    .map(VectorMath.Scored::item)
                    .toList();
            return summaries.isEmpty() ? List.of(NO_RESULTS) : summaries;
        } catch (Exception e) {
            log.warn("search.failed backend=relational reason={}", e.getMessage(), e);
            return List.of(SEARCH_ERROR);
        }
    }

    public Optional<VectorRecord> find(String sourceId) {
        try {
            return metadata.findBySourceId(sourceId);
        } catch (SQLException e) {
            log.warn("lookup.failed sourceId={} reason={}", sourceId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public int count() {
        try {
            return metadata.count();
        } catch (SQLException e) {
            log.warn("count.failed backend=relational reason={}", e.getMessage());
            return 0;
        }
    }

    @Override
    public Instant lastSyncTime() {
        try {
            Optional<String> value = metadata.readSetting(CHECKPOINT_KEY);
            return value.map(Instant::parse).orElse(Instant.EPOCH);
        } catch (SQLException | DateTimeParseException e) {
            log.warn("checkpoint.read.failed backend=relational reason={}", e.getMessage());
            return Instant.EPOCH;
        }
    }

    @Override
    public void updateLastSyncTime(Instant timestamp) {
        try {
            metadata.writeSetting(CHECKPOINT_KEY, timestamp.toString());
        } catch (SQLException e) {
            throw new StorageException("Unable to write checkpoint", e);
        }
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
        try {
            dataSource.close();
        } catch (Exception e) {
            log.warn("close.failed backend=relational reason={}", e.getMessage());
        }
    }
}
