package com.mailrag.ingest;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

public final class RelevanceFilters {
    private RelevanceFilters() {
    }

    public static Predicate<Document> acceptAll() {
        return document -> true;
    }

    public static Predicate<Document> senderOrSubjectContainsAny(List<String> terms) {
        List<String> normalized = terms == null
                ? List.of()
                : terms.stream()
                        .filter(term -> term != null && !term.isBlank())
                        .map(term -> term.trim().toLowerCase(Locale.ROOT))
                        .toList();
        if (normalized.isEmpty()) {
            return acceptAll();
        }
        return document -> {
            String sender = document.sender().toLowerCase(Locale.ROOT);
            String subject = document.subject().toLowerCase(Locale.ROOT);
            return normalized.stream().anyMatch(term -> sender.contains(term) || subject.contains(term));
        };
    }
}
