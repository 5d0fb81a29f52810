package com.example.FolioAgent.model;

import java.util.Locale;
import java.util.Optional;

/**
 * What kind of portfolio information a question is after.
 * GENERAL is the catch-all used when nothing more specific applies.
 */
public enum Intent {
    EDUCATION("degrees, schools, coursework, GPA"),
    EXPERIENCE("jobs, internships, roles, employers"),
    PERSONAL_PROJECT("side projects, apps, repositories"),
    SKILLS("languages, frameworks, tools, strengths"),
    CASE_STUDY("in-depth write-ups of a specific piece of work"),
    PROJECT_TOUR("a guided walk through the portfolio site"),
    GENERAL("anything else about the portfolio owner");

    private final String description;

    Intent(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Lenient label parsing: accepts "case study", "Personal-Project", "SKILLS." etc.
     */
    public static Optional<Intent> parse(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim()
                .replaceAll("[^A-Za-z_ -]", "")
                .trim()
                .replace(' ', '_')
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Optional.of(Intent.valueOf(normalized));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
