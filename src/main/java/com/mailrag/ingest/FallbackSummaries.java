package com.mailrag.ingest;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class FallbackSummaries {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private FallbackSummaries() {
    }

    public static String format(Document document, int bodyLimit) {
        String context;
        if (document.body() == null || document.body().isBlank()) {
            context = "No body content available";
        } else {
            String body = document.body();
            context = body.length() > bodyLimit ? body.substring(0, bodyLimit) : body;
        }
        return "<Email Start>\n"
                + "Date and Time: " + (document.sentAt() == null ? "unknown" : DATE.format(document.sentAt())) + "\n"
                + "Sender: " + document.sender() + "\n"
                + "CC: " + document.cc() + "\n"
                + "Subject: " + document.subject() + "\n"
                + "Email Context: " + context + "...\n"
                + "<Email End>";
    }
}
