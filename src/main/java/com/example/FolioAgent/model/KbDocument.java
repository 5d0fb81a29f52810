package com.example.FolioAgent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chunk of portfolio content as stored in {@code kb_documents}.
 * Written by the ingestion job, read-only here.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KbDocument {
    private Long id;
    private String docType;
    private String content;
    private JsonNode metadata;
    @JsonIgnore
    private String embedding;

    public KbDocument(Long id, String docType, String content) {
        this(id, docType, content, null, null);
    }

    @JsonIgnore
    public SourceCategory category() {
        return SourceCategory.fromDocType(docType);
    }
}
