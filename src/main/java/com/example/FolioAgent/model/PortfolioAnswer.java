package com.example.FolioAgent.model;

import java.util.List;
import java.util.Map;

/**
 * Final answer of one request. Always well formed, whatever happened on the way.
 */
public record PortfolioAnswer(
        String response,
        List<SourceRef> sources,
        Intent intent,
        Map<String, Object> metadata
) {
    public PortfolioAnswer {
        sources = List.copyOf(sources);
        metadata = Map.copyOf(metadata);
    }
}
