package com.example.FolioAgent.model;

/**
 * Raw hit from a single index. For the semantic index the score is cosine similarity,
 * for the lexical index it is the normalized full-text rank; both lie in [0, 1].
 */
public record ScoredDocument(
        KbDocument document,
        double score
) {
}
