package com.mailrag.store;

import java.time.Instant;
import java.util.Objects;

public record VectorRecord(
        String sourceId,
        String sender,
        String subject,
        Instant sentAt,
        String bodyText,
        String summary,
        float[] embedding,
        long insertionSequence) {

    public VectorRecord {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(embedding, "embedding");
        sender = sender == null ? "" : sender;
        subject = subject == null ? "" : subject;
        bodyText = bodyText == null ? "" : bodyText;
    }

    public static VectorRecord pending(
            String sourceId,
            String sender,
            String subject,
            Instant sentAt,
            String bodyText,
            String summary,
            float[] embedding) {
        return new VectorRecord(sourceId, sender, subject, sentAt, bodyText, summary, embedding, -1L);
    }
}
