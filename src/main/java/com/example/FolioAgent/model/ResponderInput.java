package com.example.FolioAgent.model;

/**
 * Everything a responder may look at.
 *
 * @param intent   resolved intent
 * @param query    the user's question
 * @param context  enriched context; the only legitimate source of citations
 * @param tool     tool output for this request, may be null
 * @param strategy generation strategy to use
 * @param model    model hint from the request
 */
public record ResponderInput(
        Intent intent,
        String query,
        EnrichedContext context,
        ToolInvocation tool,
        ResponseStrategy strategy,
        String model
) {
}
