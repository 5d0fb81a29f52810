package com.example.FolioAgent.model;

/**
 * A single "thinking" step event for streaming the pipeline progress to the client.
 *
 * type      - event kind, e.g. "start", "intent", "retrieval", "validation", "answer_final"
 * message   - human-readable description of what this step means
 * timestamp - milliseconds since the request started; never decreases within a request
 * payload   - arbitrary payload for UI, e.g.:
 *             - Map for intent / validation details
 *             - List<Map<...>> for retrieval summaries
 *             - PortfolioAnswer for the final answer
 */
public record ThinkingEvent(
        String type,
        String message,
        long timestamp,
        Object payload
) {
}
