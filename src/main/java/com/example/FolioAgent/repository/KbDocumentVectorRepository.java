package com.example.FolioAgent.repository;

import com.example.FolioAgent.model.KbDocument;
import com.example.FolioAgent.model.SourceCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.util.List;
import java.util.Set;

/**
 * Semantic index over {@code kb_documents.embedding}.
 */
@Repository
public class KbDocumentVectorRepository {

    private final JdbcTemplate jdbcTemplate;
    private final KbDocumentRowMapper rowMapper;

    public KbDocumentVectorRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = new KbDocumentRowMapper(objectMapper);
    }

    /**
     * k nearest chunks by pgvector cosine distance ({@code <=>}, 0 = identical, 2 = opposite).
     *
     * @param filter categories to search, empty for the whole corpus
     */
    public List<Neighbor> nearest(float[] embedding, int k, Set<SourceCategory> filter) {
        PGvector queryVector = new PGvector(embedding);
        String[] docTypes = SqlFilters.docTypes(filter);

        StringBuilder sql = new StringBuilder("""
                SELECT id,
                       doc_type,
                       content,
                       metadata,
                       embedding <=> ? AS distance
                FROM kb_documents
                WHERE embedding IS NOT NULL
                """);
        if (docTypes.length > 0) {
            sql.append("  AND doc_type = ANY(?)\n");
        }
        sql.append("ORDER BY distance ASC, id ASC\nLIMIT ?");

        return jdbcTemplate.query(sql.toString(), ps -> {
            int idx = 1;
            ps.setObject(idx++, queryVector);
            if (docTypes.length > 0) {
                Array array = ps.getConnection().createArrayOf("text", docTypes);
                ps.setArray(idx++, array);
            }
            ps.setInt(idx, k);
        }, (rs, rowNum) -> new Neighbor(rowMapper.map(rs), rs.getDouble("distance")));
    }

    public record Neighbor(KbDocument document, double distance) { }
}
