package com.mailrag.ingest;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }
}
