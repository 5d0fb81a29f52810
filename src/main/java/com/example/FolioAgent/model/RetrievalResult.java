package com.example.FolioAgent.model;

import java.util.Set;

/**
 * One fused hit from hybrid retrieval.
 *
 * @param document     the chunk
 * @param score        the better of the per-method scores
 * @param method       the method that produced {@code score}
 * @param matchedBy    every method that returned this chunk
 * @param boostedScore score used for ranking, boosted when both methods matched
 */
public record RetrievalResult(
        KbDocument document,
        double score,
        SearchMethod method,
        Set<SearchMethod> matchedBy,
        double boostedScore
) {
    public RetrievalResult {
        matchedBy = Set.copyOf(matchedBy);
    }

    public Long id() {
        return document.getId();
    }

    public SourceCategory category() {
        return document.category();
    }

    public boolean matchedByBoth() {
        return matchedBy.size() > 1;
    }
}
