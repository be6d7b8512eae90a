package com.zzf.workspace.core.rag.search;

import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;

import java.util.Locale;

public enum SearchMode {
    BM25,
    VECTOR,
    HYBRID;

    public static SearchMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return HYBRID;
        }
        try {
            return SearchMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException("mode must be one of bm25, vector, hybrid: " + raw);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
