package com.mailrag.ingest;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

import org.junit.jupiter.api.Test;

class RelevanceFiltersTest {

    private static Document document(String sender, String subject) {
        return new Document("id", sender, "", subject, Instant.EPOCH, "body");
    }

    @Test
    void shouldMatchSenderOrSubjectIgnoringCase() {
        Predicate<Document> filter = RelevanceFilters.senderOrSubjectContainsAny(List.of("Pavan"));

        assertTrue(filter.test(document("PAVAN <p@example.com>", "hi")));
        assertTrue(filter.test(document("x@example.com", "notes from pavan")));
        assertFalse(filter.test(document("x@example.com", "unrelated")));
    }

    @Test
    void shouldAcceptEverythingWithoutTerms() {
        assertTrue(RelevanceFilters.senderOrSubjectContainsAny(List.of()).test(document("a", "b")));
        assertTrue(RelevanceFilters.senderOrSubjectContainsAny(null).test(document("a", "b")));
    }
}
