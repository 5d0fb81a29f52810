package com.example.FolioAgent.model;

import java.util.Locale;

/**
 * Progress event kinds streamed to the client. The wire name doubles as the SSE event name.
 */
public enum EventType {
    START,
    INTENT,
    RETRIEVAL,
    DEGRADED,
    TOOL,
    DRAFT,
    VALIDATION,
    RETRY,
    ANSWER_FINAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
