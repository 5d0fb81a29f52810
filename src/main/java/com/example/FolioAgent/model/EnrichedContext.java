package com.example.FolioAgent.model;

import java.util.List;
import java.util.Set;

/**
 * Context block handed to a responder, together with how it was retrieved.
 *
 * @param text            rendered chunks, ready to be placed in a prompt
 * @param sources         the chunks actually rendered into {@code text}, in retrieval order
 * @param plan            the retrieval plan that produced it
 * @param retrieved       number of chunks the retriever returned before the size budget applied
 * @param widenLevel      how many times the plan was widened
 * @param degradedMethods search methods that were unavailable for this retrieval
 */
public record EnrichedContext(
        String text,
        List<RetrievalResult> sources,
        RetrievalPlan plan,
        int retrieved,
        int widenLevel,
        Set<SearchMethod> degradedMethods
) {
    public EnrichedContext {
        sources = List.copyOf(sources);
        degradedMethods = degradedMethods == null ? Set.of() : Set.copyOf(degradedMethods);
    }

    public EnrichedContext(String text, List<RetrievalResult> sources, RetrievalPlan plan, int retrieved) {
        this(text, sources, plan, retrieved, 0, Set.of());
    }

    public static EnrichedContext empty(RetrievalPlan plan) {
        return new EnrichedContext("", List.of(), plan, 0);
    }

    public EnrichedContext withRetrieval(int widenLevel, Set<SearchMethod> degradedMethods) {
        return new EnrichedContext(text, sources, plan, retrieved, widenLevel, degradedMethods);
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public boolean degraded() {
        return !degradedMethods.isEmpty();
    }
}
