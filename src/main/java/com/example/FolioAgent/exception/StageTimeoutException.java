package com.example.FolioAgent.exception;

import java.time.Duration;

/**
 * A pipeline stage did not finish within its budget.
 */
public class StageTimeoutException extends RuntimeException {

    private final String stage;

    public StageTimeoutException(String stage, Duration timeout) {
        super("Stage '" + stage + "' timed out after " + timeout.toMillis() + " ms");
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
