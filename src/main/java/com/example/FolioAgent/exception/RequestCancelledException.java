package com.example.FolioAgent.exception;

/**
 * The caller went away; the state machine stops at the next stage boundary.
 */
public class RequestCancelledException extends RuntimeException {

    private final String stage;

    public RequestCancelledException(String stage) {
        super("Request cancelled at stage '" + stage + "'");
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
