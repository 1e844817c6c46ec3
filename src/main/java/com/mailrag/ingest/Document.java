package com.mailrag.ingest;

import java.time.Instant;
import java.util.Objects;

public record Document(String sourceId, String sender, String cc, String subject, Instant sentAt, String body) {
    public Document {
        Objects.requireNonNull(sourceId, "sourceId");
        sender = sender == null ? "" : sender;
        cc = cc == null ? "" : cc;
        subject = subject == null ? "" : subject;
    }

    public boolean hasBody() {
        return body != null;
    }
}
