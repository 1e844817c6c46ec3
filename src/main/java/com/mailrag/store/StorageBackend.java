package com.mailrag.store;

import java.time.Instant;
import java.util.List;

/**
 * Persistence seam shared by ingestion and retrieval. Both implementations dedupe on {@code sourceId},
 * rank by ascending squared L2 distance (ties broken by insertion order) and never hand an empty result to
 * the caller.
 *
 * <p>Single writer: only the ingestion pipeline calls {@link #store}. Searches running concurrently with a
 * store may or may not see the record being written.
 */
public interface StorageBackend extends AutoCloseable {

    /** Returned as the only element of a search result when nothing can be returned. */
    String NO_RESULTS = "No relevant emails found.";

    /** Returned as the only element of a search result when the query itself failed. */
    String SEARCH_ERROR = "No relevant emails found due to an error in the search process.";

    StoreOutcome store(VectorRecord record);

    /** Whether a record with this id is already stored; {@code false} when the store cannot be read. */
    boolean contains(String sourceId);

    /**
     * Returns at most {@code topK} summaries, closest first. Never empty and never throws: an empty store
     * yields {@link #NO_RESULTS}, an internal failure {@link #SEARCH_ERROR}.
     */
    List<String> search(float[] queryEmbedding, int topK);

    /** Total stored records, or 0 when the store cannot be read. */
    int count();

    /** Last successful sync time, or {@link Instant#EPOCH} when none was recorded. */
    Instant lastSyncTime();

    void updateLastSyncTime(Instant timestamp);

    int dimension();

    BackendKind kind();

    @Override
    void close();
}
