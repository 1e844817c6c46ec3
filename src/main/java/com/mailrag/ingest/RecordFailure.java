package com.mailrag.ingest;

public record RecordFailure(String sourceId, Stage stage, String reason) {
    public enum Stage {
        FETCH,
        FILTER,
        TRANSFORM,
        STORE
    }
}
