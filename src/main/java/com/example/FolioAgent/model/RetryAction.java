package com.example.FolioAgent.model;

/**
 * Where the orchestrator loops back to when validation asks for a retry.
 */
public enum RetryAction {
    /** Fetch a wider context, then respond again. */
    RE_ENRICH,
    /** Keep the context, respond again with the alternate strategy. */
    ALTERNATE_STRATEGY
}
