package com.mailrag.ingest;

@FunctionalInterface
public interface Summarizer {
    String summarize(Document document);
}
