package com.example.FolioAgent.model;

import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Request payload for asking the portfolio agent a question.
 *
 * @param question    user question
 * @param sessionId   chat session id, only used to tag the query log
 * @param model       optional model name hint (e.g. "deepseek", "openai")
 * @param forceIntent optional intent override (e.g. "EDUCATION", "case study")
 */
public record PortfolioQueryRequest(
        String question,
        String sessionId,
        String model,
        String forceIntent
) {
    private static final Set<String> models = Set.of("deepseek", "openai");
    public static final String DEFAULT_MODEL = "deepseek";

    public String resolveModel() {
        if (model == null || model.isBlank()) {
            return DEFAULT_MODEL;
        }
        String normalized = model.trim().toLowerCase(Locale.ROOT);
        return models.contains(normalized) ? normalized : DEFAULT_MODEL;
    }

    /**
     * The caller's session id, or a fresh "temp-" id when none was sent.
     */
    public String resolveSessionId() {
        return sessionId == null || sessionId.isBlank() ? "temp-" + UUID.randomUUID() : sessionId;
    }

    /**
     * Resolve the forced intent for this request.
     * Null/blank/unknown labels mean "let the classifier decide".
     */
    public Intent resolveForceIntent() {
        return Intent.parse(forceIntent).orElse(null);
    }

    public QueryOptions toOptions(boolean stream) {
        return new QueryOptions(stream, resolveForceIntent(), resolveSessionId(), resolveModel());
    }
}
