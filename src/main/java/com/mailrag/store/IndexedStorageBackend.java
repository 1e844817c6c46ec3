package com.mailrag.store;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Flat-file vector index paired with a relational metadata table.
 *
 * <p>A store writes the index first (and flushes it), then the metadata row, whose
 * {@code insertion_sequence} is the index position of the vector. If the index flush or the metadata insert
 * fails the vector stays in memory as an orphan: searches skip it because no row carries its {@code sourceId},
 * and a later store of the same {@code sourceId} reuses the orphan position and flushes the index again before
 * the row is written.
 */
public class IndexedStorageBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(IndexedStorageBackend.class);

    private final VectorIndex index;
    private final MetadataStore metadata;
    private final CheckpointFile checkpointFile;
    private final AutoCloseable dataSource;
    private final Object writeLock = new Object();

    public IndexedStorageBackend(VectorIndex index, MetadataStore metadata, CheckpointFile checkpointFile, AutoCloseable dataSource) {
        this.index = index;
        this.metadata = metadata;
        this.checkpointFile = checkpointFile;
        this.dataSource = dataSource;
    }

    public static IndexedStorageBackend open(Path indexFile, Path metadataDb, Path checkpointPath, int dimension) {
        FlatFileVectorIndex index;
        try {
            index = FlatFileVectorIndex.load(indexFile, dimension);
        } catch (IOException e) {
            throw new StorageException("Unable to load vector index " + indexFile, e);
        }
        HikariDataSource dataSource = DataSources.create(DataSources.sqliteUrl(metadataDb), null, null, 1);
        MetadataStore metadata = new MetadataStore(dataSource, SqlDialect.SQLITE);
        try {
            metadata.createSchema();
        } catch (SQLException e) {
            dataSource.close();
            throw new StorageException("Unable to initialize metadata store " + metadataDb, e);
        }
        IndexedStorageBackend backend = new IndexedStorageBackend(index, metadata, new CheckpointFile(checkpointPath), dataSource);
        backend.reportCoupling();
        return backend;
    }

    @Override
    public StoreOutcome store(VectorRecord record) {
        if (record.embedding().length != index.dimension()) {
            return StoreOutcome.failed("dimension mismatch: expected " + index.dimension() + " got " + record.embedding().length);
        }
        synchronized (writeLock) {
            try (Connection conn = metadata.connection()) {
                if (metadata.exists(conn, record.sourceId())) {
                    return StoreOutcome.alreadyExists();
                }

                long position;
                try {
                    OptionalLong orphan = index.positionOf(record.sourceId());
                    if (orphan.isPresent()) {
                        position = orphan.getAsLong();
                        log.warn("store.orphan.reuse sourceId={} position={}", record.sourceId(), position);
                    } else {
                        position = index.add(record.sourceId(), record.embedding());
                    }
                    // an orphan may never have reached disk if the earlier save failed
                    index.save();
                } catch (IOException | RuntimeException e) {
                    log.warn("store.index.failed sourceId={} reason={}", record.sourceId(), e.getMessage());
                    return StoreOutcome.failed("vector index write failed: " + e.getMessage());
                }

                try {
                    metadata.insert(conn, record, position);
                } catch (SQLException e) {
                    log.warn("store.metadata.failed sourceId={} orphanPosition={} reason={}", record.sourceId(), position, e.getMessage());
                    return StoreOutcome.failed("metadata insert failed after indexing at position " + position + ": " + e.getMessage());
                }
                return StoreOutcome.inserted();
            } catch (SQLException e) {
                log.warn("store.failed sourceId={} reason={}", record.sourceId(), e.getMessage());
                return StoreOutcome.failed(e.getMessage());
            }
        }
    }

    @Override
    public boolean contains(String sourceId) {
        try (Connection conn = metadata.connection()) {
            return metadata.exists(conn, sourceId);
        } catch (SQLException e) {
            log.warn("contains.failed backend=indexed sourceId={} reason={}", sourceId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> search(float[] queryEmbedding, int topK) {
        try {
            if (topK <= 0 || index.size() == 0) {
                return List.of(NO_RESULTS);
            }
            int phantoms = Math.max(0, index.size() - metadata.count());
            List<IndexHit> hits = index.search(queryEmbedding, topK + phantoms);
            List<String> summaries = new ArrayList<>();
            try (Connection conn = metadata.connection()) {
                for (IndexHit hit : hits) {
                    if (summaries.size() >= topK) {
                        break;
                    }
                    Optional<String> summary = metadata.findSummary(conn, hit.sourceId());
                    if (summary.isEmpty()) {
                        log.debug("search.phantom sourceId={} position={}", hit.sourceId(), hit.position());
                        continue;
                    }
                    summaries.add(summary.get());
                }
            }
            return summaries.isEmpty() ? List.of(NO_RESULTS) : summaries;
        } catch (Exception e) {
            log.warn("search.failed backend=indexed reason={}", e.getMessage(), e);
            return List.of(SEARCH_ERROR);
        }
    }

    /** Metadata row whose {@code insertion_sequence} equals the given index position. */
    public Optional<VectorRecord> recordAt(long position) {
        try {
            return metadata.findBySequence(position);
        } catch (SQLException e) {
            log.warn("lookup.failed position={} reason={}", position, e.getMessage());
            return Optional.empty();
        }
    }

    public List<IndexHit> nearest(float[] queryEmbedding, int topK) {
        return index.search(queryEmbedding, topK);
    }

    @Override
    public int count() {
        try {
            return metadata.count();
        } catch (SQLException e) {
            log.warn("count.failed backend=indexed reason={}", e.getMessage());
            return 0;
        }
    }

    @Override
    public Instant lastSyncTime() {
        try {
            return checkpointFile.load();
        } catch (IOException e) {
            log.warn("checkpoint.read.failed path={} reason={}", checkpointFile.path(), e.getMessage());
            return Instant.EPOCH;
        }
    }

    @Override
    public void updateLastSyncTime(Instant timestamp) {
        try {
            checkpointFile.save(timestamp);
        } catch (IOException e) {
            throw new StorageException("Unable to write checkpoint " + checkpointFile.path(), e);
        }
    }

    @Override
    public int dimension() {
        return index.dimension();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.INDEXED;
    }

    @Override
    public void close() {
        try {
            dataSource.close();
        } catch (Exception e) {
            log.warn("close.failed backend=indexed reason={}", e.getMessage());
        }
    }

    private void reportCoupling() {
        int rows = count();
        int vectors = index.size();
        if (vectors > rows) {
            log.warn("Vector index holds {} vectors but metadata has {} rows; {} orphan vector(s) will be skipped in search",
                    vectors, rows, vectors - rows);
        } else if (rows > vectors) {
            log.warn("Metadata has {} rows but vector index holds only {} vectors; the index file may have been replaced",
                    rows, vectors);
        }
    }
}
