package com.example.FolioAgent.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieval-only request used by the debug endpoint.
 *
 * @param question query text
 * @param topK     optional k, defaults when null or non-positive
 * @param sources  optional doc types to restrict to, e.g. ["education", "resume"]
 */
public record RagQueryRequest(
        String question,
        Integer topK,
        List<String> sources
) {
    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public Set<SourceCategory> resolveSources() {
        if (sources == null || sources.isEmpty()) {
            return Set.of();
        }
        Set<SourceCategory> resolved = EnumSet.noneOf(SourceCategory.class);
        for (String source : sources) {
            SourceCategory category = SourceCategory.fromDocType(source);
            if (category != SourceCategory.OTHER) {
                resolved.add(category);
            }
        }
        return resolved;
    }
}
