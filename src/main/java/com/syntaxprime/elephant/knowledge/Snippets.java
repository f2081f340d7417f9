package com.syntaxprime.elephant.knowledge;

import java.util.Locale;

/**
 * Short excerpts around the first query hit, used where the index offers no highlighter.
 */
final class Snippets {
    static final int SNIPPET_LENGTH = 300;
    private static final int LEAD = 100;

    private Snippets() {
    }

    static String around(String content, String query) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        int hit = firstHit(content.toLowerCase(Locale.ROOT), query);
        int start = hit < 0 ? 0 : Math.max(0, hit - LEAD);
        int end = Math.min(content.length(), start + SNIPPET_LENGTH);
        String snippet = content.substring(start, end).strip();
        if (start > 0) {
            snippet = "..." + snippet;
        }
        if (end < content.length()) {
            snippet = snippet + "...";
        }
        return snippet;
    }

    private static int firstHit(String lowerContent, String query) {
        if (query == null || query.isBlank()) {
            return -1;
        }
        String lowerQuery = query.toLowerCase(Locale.ROOT).strip();
        int phrase = lowerContent.indexOf(lowerQuery);
        if (phrase >= 0) {
            return phrase;
        }
        int best = -1;
        for (String term : lowerQuery.split("\\s+")) {
            if (term.length() < 3) {
                continue;
            }
            int idx = lowerContent.indexOf(term);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }
}
