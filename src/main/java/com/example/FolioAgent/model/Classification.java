package com.example.FolioAgent.model;

/**
 * Classifier verdict.
 *
 * @param intent never null
 * @param source how it was decided: "rules", "model", "default" or "forced"
 * @param note   degradation cause when the default was used because of an error, else null
 */
public record Classification(Intent intent, String source, String note) {

    public static Classification of(Intent intent, String source) {
        return new Classification(intent, source, null);
    }

    public boolean degraded() {
        return note != null;
    }
}
