package com.example.FolioAgent.model;

/**
 * Responder output before validation.
 *
 * @param text          generated answer, empty when generation failed
 * @param strategy      strategy used to produce it
 * @param failureReason set when the responder could not produce text
 */
public record DraftResponse(
        String text,
        ResponseStrategy strategy,
        String failureReason
) {
    public static DraftResponse of(String text, ResponseStrategy strategy) {
        return new DraftResponse(text == null ? "" : text.trim(), strategy, null);
    }

    public static DraftResponse failed(String reason, ResponseStrategy strategy) {
        return new DraftResponse("", strategy, reason == null ? "generation failed" : reason);
    }

    public boolean generationFailed() {
        return failureReason != null;
    }
}
