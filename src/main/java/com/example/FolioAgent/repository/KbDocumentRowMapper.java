package com.example.FolioAgent.repository;

import com.example.FolioAgent.model.KbDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps the common {@code kb_documents} columns. The embedding column is never selected.
 */
class KbDocumentRowMapper {

    private static final Logger log = LoggerFactory.getLogger(KbDocumentRowMapper.class);

    private final ObjectMapper objectMapper;

    KbDocumentRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    KbDocument map(ResultSet rs) throws SQLException {
        KbDocument doc = new KbDocument();
        doc.setId(rs.getLong("id"));
        doc.setDocType(rs.getString("doc_type"));
        doc.setContent(rs.getString("content"));

        String metadataJson = rs.getString("metadata");
        if (metadataJson != null) {
            try {
                doc.setMetadata(objectMapper.readTree(metadataJson));
            } catch (JsonProcessingException e) {
                // Unreadable metadata should not hide the chunk itself
                log.debug("Ignoring malformed metadata on kb_documents.id={}", doc.getId());
                doc.setMetadata(null);
            }
        }
        return doc;
    }
}
