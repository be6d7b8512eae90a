package com.zzf.workspace.core.rag.search;

import lombok.Value;

import java.util.Arrays;
import java.util.Locale;

/**
 * Picks the first line containing the query (case-insensitive, line 0 if none) and
 * returns it with two lines of context on each side.
 */
public final class SnippetExtractor {
    private static final int CONTEXT_LINES = 2;
    private static final String TRUNCATION_MARK = "\n...";

    @Value
    public static class Snippet {
        String text;
        int startLine;
        int endLine;
    }

    private SnippetExtractor() {
    }

    public static Snippet extract(String content, String query, int maxLength) {
        String[] lines = (content == null ? "" : content).split("\r?\n", -1);
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        int best = 0;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].toLowerCase(Locale.ROOT).contains(q)) {
                best = i;
                break;
            }
        }
        int start = Math.max(0, best - CONTEXT_LINES);
        int end = Math.min(lines.length - 1, best + CONTEXT_LINES);
        String combined = String.join("\n", Arrays.asList(lines).subList(start, end + 1));
        int max = Math.max(1, maxLength);
        String text = combined.length() > max ? combined.substring(0, max) + TRUNCATION_MARK : combined;
        return new Snippet(text, start + 1, end + 1);
    }
}
