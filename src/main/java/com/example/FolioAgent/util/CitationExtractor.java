package com.example.FolioAgent.util;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads chunk citations out of generated text.
 */
public final class CitationExtractor {

    private CitationExtractor() {
    }

    /**
     * Pattern for inline citations: [docId=42], [docId: 42], 【docId=42】
     */
    private static final Pattern DOC_ID = Pattern.compile(
            "[\\[【]\\s*docId\\s*[=:：]\\s*(\\d+)\\s*[\\]】]",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Cited chunk ids in order of first appearance.
     */
    public static Set<Long> citedIds(String text) {
        Set<Long> ids = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return ids;
        }
        Matcher matcher = DOC_ID.matcher(text);
        while (matcher.find()) {
            try {
                ids.add(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException ignored) {
                // Longer than a long can hold: cannot be one of ours
            }
        }
        return ids;
    }
}
