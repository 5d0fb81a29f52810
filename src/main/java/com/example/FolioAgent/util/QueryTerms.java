package com.example.FolioAgent.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a natural-language question into lexical search terms.
 */
public final class QueryTerms {

    private QueryTerms() {
    }

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "but", "by", "can", "could", "did", "do",
            "does", "for", "from", "had", "has", "have", "how", "i", "in", "is", "it", "its", "me",
            "my", "of", "on", "or", "so", "tell", "that", "the", "their", "them", "there", "these",
            "they", "this", "to", "was", "we", "were", "what", "when", "where", "which", "who",
            "why", "will", "with", "would", "you", "your", "yours", "about", "any", "some", "please"
    );

    /**
     * Lowercased alphanumeric tokens of length >= 2, stop words removed, first occurrence order.
     */
    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> terms = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= 2 && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return new ArrayList<>(terms);
    }
}
