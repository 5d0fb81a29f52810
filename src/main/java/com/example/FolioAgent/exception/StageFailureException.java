package com.example.FolioAgent.exception;

/**
 * Checked failure raised inside a stage, rethrown unchecked.
 */
public class StageFailureException extends RuntimeException {

    public StageFailureException(String stage, Throwable cause) {
        super("Stage '" + stage + "' failed: " + cause.getMessage(), cause);
    }
}
