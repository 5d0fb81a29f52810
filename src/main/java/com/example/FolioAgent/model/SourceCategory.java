package com.example.FolioAgent.model;

import java.util.Locale;

/**
 * Category of a knowledge-base chunk, stored as {@code kb_documents.doc_type}.
 */
public enum SourceCategory {
    EDUCATION("education"),
    EXPERIENCE("experience"),
    PROJECTS("projects"),
    CASE_STUDY("case-study"),
    RESUME("resume"),
    SKILLS("skills"),
    ABOUT("about"),
    /** Any doc_type we do not recognise. Never matches a non-empty filter. */
    OTHER("other");

    private final String docType;

    SourceCategory(String docType) {
        this.docType = docType;
    }

    public String docType() {
        return docType;
    }

    public static SourceCategory fromDocType(String docType) {
        if (docType == null) {
            return OTHER;
        }
        String normalized = docType.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SourceCategory category : values()) {
            if (category.docType.equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}
