package com.mailrag.retrieval;

import java.util.List;

public record RetrievedContext(String query, List<String> items, String block, boolean fallback) {
    public RetrievedContext {
        items = List.copyOf(items);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("retrieved context must hold at least one item");
        }
    }
}
