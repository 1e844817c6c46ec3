package com.mailrag.ingest;

import java.time.Instant;
import java.util.List;

public record IngestionReport(
        TimeWindow window,
        String query,
        int candidates,
        int stored,
        int duplicates,
        int outsideWindow,
        int irrelevant,
        List<RecordFailure> failures,
        boolean limitReached,
        boolean cancelled,
        Instant checkpointBefore,
        Instant checkpointAfter) {

    public IngestionReport {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }
}
