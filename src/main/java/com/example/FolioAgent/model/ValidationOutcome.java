package com.example.FolioAgent.model;

/**
 * Verdict of the guardrail gate on one draft.
 *
 * @param state  PASSED, RETRY or FAILED_SAFE
 * @param check  the check that decided the verdict (length, quality, safety, or "all")
 * @param reason human-readable reason, null when passed
 * @param action where to loop back to, only set for RETRY
 */
public record ValidationOutcome(
        ValidationState state,
        String check,
        String reason,
        RetryAction action
) {
    public static ValidationOutcome passed() {
        return new ValidationOutcome(ValidationState.PASSED, "all", null, null);
    }

    public static ValidationOutcome retry(String check, String reason, RetryAction action) {
        return new ValidationOutcome(ValidationState.RETRY, check, reason, action);
    }

    public static ValidationOutcome failedSafe(String check, String reason) {
        return new ValidationOutcome(ValidationState.FAILED_SAFE, check, reason, null);
    }
}
