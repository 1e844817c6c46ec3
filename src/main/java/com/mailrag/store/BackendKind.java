package com.mailrag.store;

import java.util.Locale;

public enum BackendKind {
    INDEXED,
    RELATIONAL;

    public static BackendKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Backend name must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "indexed", "index", "file", "files" -> INDEXED;
            case "relational", "database", "db", "sql" -> RELATIONAL;
            default -> throw new IllegalArgumentException("Unknown storage backend: " + value);
        };
    }
}
