package com.example.FolioAgent.model;

import java.util.Set;

/**
 * Retrieval parameters derived from an intent.
 *
 * @param k              maximum number of chunks to fetch
 * @param allowedSources categories to search; empty means the whole corpus
 */
public record RetrievalPlan(int k, Set<SourceCategory> allowedSources) {

    public RetrievalPlan {
        allowedSources = Set.copyOf(allowedSources);
    }

    public boolean unrestricted() {
        return allowedSources.isEmpty();
    }
}
