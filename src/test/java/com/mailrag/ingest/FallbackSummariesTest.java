package com.mailrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class FallbackSummariesTest {

    @Test
    void shouldEchoHeadersAndTruncateBody() {
        Document document = new Document("m1", "alice@example.com", "bob@example.com", "Invoice",
                Instant.parse("2026-10-10T07:30:00Z"), "0123456789");

        assertEquals("""
                <Email Start>
                Date and Time: 2026-10-10T07:30:00Z
                Sender: alice@example.com
                CC: bob@example.com
                Subject: Invoice
                Email Context: 01234...
                <Email End>""", FallbackSummaries.format(document, 5));
    }

    @Test
    void shouldSayWhenBodyIsMissing() {
        Document document = new Document("m1", "alice@example.com", null, "Invoice", null, " ");

        String summary = FallbackSummaries.format(document, 500);

        assertTrue(summary.contains("Date and Time: unknown\n"));
        assertTrue(summary.contains("Email Context: No body content available...\n"));
    }
}
