package com.mailrag.ingest;

public class SummarizationException extends RuntimeException {
    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
