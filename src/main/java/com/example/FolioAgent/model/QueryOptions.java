package com.example.FolioAgent.model;

/**
 * Per-request switches.
 *
 * @param stream      record progress events for the client
 * @param forceIntent skip classification and use this intent, may be null
 * @param sessionId   caller's session id, used only for the query log
 * @param model       model hint (e.g. "deepseek", "openai")
 */
public record QueryOptions(
        boolean stream,
        Intent forceIntent,
        String sessionId,
        String model
) {
    public static QueryOptions defaults() {
        return new QueryOptions(false, null, null, null);
    }

    public QueryOptions withStream(boolean stream) {
        return new QueryOptions(stream, forceIntent, sessionId, model);
    }
}
