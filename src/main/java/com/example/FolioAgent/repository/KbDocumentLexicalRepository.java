package com.example.FolioAgent.repository;

import com.example.FolioAgent.model.ScoredDocument;
import com.example.FolioAgent.model.SourceCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lexical index: PostgreSQL full-text search over {@code kb_documents.content}.
 */
@Repository
public class KbDocumentLexicalRepository {

    private static final String TS_CONFIG = "english";

    private final JdbcTemplate jdbcTemplate;
    private final KbDocumentRowMapper rowMapper;

    public KbDocumentLexicalRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = new KbDocumentRowMapper(objectMapper);
    }

    /**
     * Top k chunks matching any of the terms, ranked by {@code ts_rank_cd}.
     * Normalization flag 32 maps the rank into [0, 1) as rank / (rank + 1).
     *
     * @param terms  search terms; anything but [a-z0-9] is stripped
     * @param filter categories to search, empty for the whole corpus
     */
    public List<ScoredDocument> search(List<String> terms, Set<SourceCategory> filter, int k) {
        String tsQuery = terms.stream()
                .map(t -> t.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", ""))
                .filter(t -> !t.isEmpty())
                .distinct()
                .collect(Collectors.joining(" | "));
        if (tsQuery.isEmpty() || k <= 0) {
            return List.of();
        }
        String[] docTypes = SqlFilters.docTypes(filter);

        StringBuilder sql = new StringBuilder("""
                SELECT id,
                       doc_type,
                       content,
                       metadata,
                       ts_rank_cd(to_tsvector('%1$s', content), to_tsquery('%1$s', ?), 32) AS score
                FROM kb_documents
                WHERE to_tsvector('%1$s', content) @@ to_tsquery('%1$s', ?)
                """.formatted(TS_CONFIG));
        if (docTypes.length > 0) {
            sql.append("  AND doc_type = ANY(?)\n");
        }
        sql.append("ORDER BY score DESC, id ASC\nLIMIT ?");

        return jdbcTemplate.query(sql.toString(), ps -> {
            int idx = 1;
            ps.setString(idx++, tsQuery);
            ps.setString(idx++, tsQuery);
            if (docTypes.length > 0) {
                Array array = ps.getConnection().createArrayOf("text", docTypes);
                ps.setArray(idx++, array);
            }
            ps.setInt(idx, k);
        }, (rs, rowNum) -> new ScoredDocument(rowMapper.map(rs), rs.getDouble("score")));
    }
}
