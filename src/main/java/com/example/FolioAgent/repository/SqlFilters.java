package com.example.FolioAgent.repository;

import com.example.FolioAgent.model.SourceCategory;

import java.util.Set;

final class SqlFilters {

    private SqlFilters() {
    }

    /**
     * doc_type values for an {@code = ANY(?)} filter, sorted so the statement text is stable.
     */
    static String[] docTypes(Set<SourceCategory> filter) {
        if (filter == null || filter.isEmpty()) {
            return new String[0];
        }
        return filter.stream()
                .filter(c -> c != SourceCategory.OTHER)
                .map(SourceCategory::docType)
                .sorted()
                .toArray(String[]::new);
    }
}
