package com.mailrag.ingest;

public class IngestionInProgressException extends IllegalStateException {
    public IngestionInProgressException() {
        super("An ingestion run is already in progress");
    }
}
