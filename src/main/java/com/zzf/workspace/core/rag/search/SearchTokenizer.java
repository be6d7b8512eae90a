package com.zzf.workspace.core.rag.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lowercases, splits on runs of anything but ASCII letters and digits, drops tokens
 * shorter than two characters.
 */
public final class SearchTokenizer {
    private static final int MIN_TOKEN_LENGTH = 2;

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<String>();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')) {
                sb.append(ch);
            } else {
                flush(sb, out);
            }
        }
        flush(sb, out);
        return out;
    }

    private static void flush(StringBuilder sb, List<String> out) {
        if (sb.length() >= MIN_TOKEN_LENGTH) {
            out.add(sb.toString());
        }
        sb.setLength(0);
    }
}
