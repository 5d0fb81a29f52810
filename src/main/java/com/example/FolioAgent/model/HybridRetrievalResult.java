package com.example.FolioAgent.model;

import java.util.List;
import java.util.Set;

/**
 * Ranked, deduplicated output of one hybrid retrieval.
 *
 * @param results         ordered best first, at most k entries
 * @param degraded        true when at least one search method was unavailable
 * @param degradedMethods the methods that failed
 */
public record HybridRetrievalResult(
        List<RetrievalResult> results,
        boolean degraded,
        Set<SearchMethod> degradedMethods
) {
    public HybridRetrievalResult {
        results = List.copyOf(results);
        degradedMethods = Set.copyOf(degradedMethods);
    }

    public static HybridRetrievalResult empty() {
        return new HybridRetrievalResult(List.of(), false, Set.of());
    }

    public static HybridRetrievalResult unavailable() {
        return new HybridRetrievalResult(List.of(), true, Set.of(SearchMethod.SEMANTIC, SearchMethod.LEXICAL));
    }
}
