package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.model.HybridRetrievalResult;
import com.example.FolioAgent.model.KbDocument;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.ScoredDocument;
import com.example.FolioAgent.model.SearchMethod;
import com.example.FolioAgent.model.SourceCategory;
import com.example.FolioAgent.repository.KbDocumentLexicalRepository;
import com.example.FolioAgent.repository.KbDocumentVectorRepository;
import com.example.FolioAgent.util.QueryTerms;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid retrieval over the portfolio knowledge base:
 * - Semantic search: embed the question, k nearest chunks by cosine distance,
 *   similarity = 1 - distance, weak matches dropped
 * - Lexical search: full-text rank over the same corpus subset
 * - Both run concurrently and are fused by chunk id into one ranked list
 *
 * When one method is unavailable the other one carries the result and the
 * result is flagged as degraded. This service never calls a chat model.
 */
@Service
@RequiredArgsConstructor
public class HybridRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final EmbeddingModel embeddingModel;
    private final KbDocumentVectorRepository vectorRepository;
    private final KbDocumentLexicalRepository lexicalRepository;
    private final AgentProperties properties;

    /**
     * @param query          user question
     * @param k              maximum number of results
     * @param allowedSources categories to keep; null or empty means all
     * @return at most k results, deduplicated, best first
     */
    public HybridRetrievalResult retrieve(String query, int k, Set<SourceCategory> allowedSources) {
        if (query == null || query.isBlank() || k <= 0) {
            return HybridRetrievalResult.empty();
        }
        Set<SourceCategory> filter = searchableFilter(allowedSources);
        if (filter == null) {
            log.debug("Hybrid retrieval: filter {} names no searchable category", allowedSources);
            return HybridRetrievalResult.empty();
        }

        // Both lookups are blocking IO; run them side by side and join before merging
        Mono<MethodHits> semanticMono = Mono.fromCallable(() -> semanticSearch(query, k, filter))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    log.warn("Hybrid retrieval: semantic search unavailable, falling back to lexical only: {}",
                            ex.toString());
                    return Mono.just(MethodHits.failed(SearchMethod.SEMANTIC));
                });

        Mono<MethodHits> lexicalMono = Mono.fromCallable(() -> lexicalSearch(query, k, filter))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    log.warn("Hybrid retrieval: lexical search unavailable, falling back to semantic only: {}",
                            ex.toString());
                    return Mono.just(MethodHits.failed(SearchMethod.LEXICAL));
                });

        Tuple2<MethodHits, MethodHits> joined = Mono.zip(semanticMono, lexicalMono).block();
        if (joined == null) {
            return HybridRetrievalResult.unavailable();
        }
        MethodHits semantic = joined.getT1();
        MethodHits lexical = joined.getT2();

        Set<SearchMethod> degradedMethods = EnumSet.noneOf(SearchMethod.class);
        if (semantic.failed()) {
            degradedMethods.add(SearchMethod.SEMANTIC);
        }
        if (lexical.failed()) {
            degradedMethods.add(SearchMethod.LEXICAL);
        }

        List<RetrievalResult> merged = merge(semantic.hits(), lexical.hits(), k);

        log.debug("Hybrid retrieval: semantic={} lexical={} merged={} k={} filter={} degraded={}",
                semantic.hits().size(), lexical.hits().size(), merged.size(), k, filter, degradedMethods);

        return new HybridRetrievalResult(merged, !degradedMethods.isEmpty(), degradedMethods);
    }

    private MethodHits semanticSearch(String query, int k, Set<SourceCategory> filter) {
        float[] queryEmbedding = embeddingModel.embed(query);
        double threshold = properties.getRetrieval().getSimilarityThreshold();

        List<ScoredDocument> hits = vectorRepository.nearest(queryEmbedding, k, filter).stream()
                .map(n -> new ScoredDocument(n.document(), 1.0 - n.distance()))
                .filter(sd -> sd.score() >= threshold)
                .filter(sd -> allowed(sd.document(), filter))
                .toList();
        return MethodHits.of(SearchMethod.SEMANTIC, hits);
    }

    private MethodHits lexicalSearch(String query, int k, Set<SourceCategory> filter) {
        List<String> terms = QueryTerms.extract(query);
        if (terms.isEmpty()) {
            return MethodHits.of(SearchMethod.LEXICAL, List.of());
        }
        List<ScoredDocument> hits = lexicalRepository.search(terms, filter, k).stream()
                .filter(sd -> allowed(sd.document(), filter))
                .toList();
        return MethodHits.of(SearchMethod.LEXICAL, hits);
    }

    /**
     * Union by chunk id. A chunk found by both methods keeps the higher score and gets the
     * configured boost; ordering is boosted score desc, source priority, id asc.
     */
    List<RetrievalResult> merge(List<ScoredDocument> semanticHits, List<ScoredDocument> lexicalHits, int k) {
        Map<Long, Candidate> byId = new HashMap<>();
        for (ScoredDocument hit : semanticHits) {
            byId.computeIfAbsent(hit.document().getId(), id -> new Candidate(hit.document()))
                    .offer(SearchMethod.SEMANTIC, hit.score());
        }
        for (ScoredDocument hit : lexicalHits) {
            byId.computeIfAbsent(hit.document().getId(), id -> new Candidate(hit.document()))
                    .offer(SearchMethod.LEXICAL, hit.score());
        }

        double boost = properties.getRetrieval().getBothMethodsBoost();
        List<RetrievalResult> results = new ArrayList<>(byId.size());
        for (Candidate c : byId.values()) {
            double boosted = c.matchedBy.size() > 1 ? c.bestScore + boost : c.bestScore;
            results.add(new RetrievalResult(c.document, c.bestScore, c.bestMethod, c.matchedBy, boosted));
        }

        results.sort(ranking());
        return results.size() > k ? List.copyOf(results.subList(0, k)) : List.copyOf(results);
    }

    private Comparator<RetrievalResult> ranking() {
        List<SourceCategory> priority = properties.getRetrieval().getSourcePriority();
        return Comparator.comparingDouble(RetrievalResult::boostedScore).reversed()
                .thenComparingInt(r -> priorityOf(priority, r.category()))
                .thenComparing(RetrievalResult::id, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private static int priorityOf(List<SourceCategory> priority, SourceCategory category) {
        int idx = priority.indexOf(category);
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    /**
     * OTHER never matches a filter, so it is removed; a filter left empty by that has nothing to
     * search and yields null. An absent or empty filter means all categories.
     */
    static Set<SourceCategory> searchableFilter(Set<SourceCategory> allowedSources) {
        if (allowedSources == null || allowedSources.isEmpty()) {
            return Set.of();
        }
        Set<SourceCategory> searchable = EnumSet.copyOf(allowedSources);
        searchable.remove(SourceCategory.OTHER);
        return searchable.isEmpty() ? null : Set.copyOf(searchable);
    }

    private static boolean allowed(KbDocument doc, Set<SourceCategory> filter) {
        return filter.isEmpty() || filter.contains(doc.category());
    }

    private static final class Candidate {
        private final KbDocument document;
        private final Set<SearchMethod> matchedBy = EnumSet.noneOf(SearchMethod.class);
        private double bestScore = Double.NEGATIVE_INFINITY;
        private SearchMethod bestMethod;

        private Candidate(KbDocument document) {
            this.document = document;
        }

        // Strictly greater: on a tie the method seen first (semantic) keeps the win
        private void offer(SearchMethod method, double score) {
            matchedBy.add(method);
            if (score > bestScore) {
                bestScore = score;
                bestMethod = method;
            }
        }
    }

    private record MethodHits(SearchMethod method, List<ScoredDocument> hits, boolean failed) {
        static MethodHits of(SearchMethod method, List<ScoredDocument> hits) {
            return new MethodHits(method, hits, false);
        }

        static MethodHits failed(SearchMethod method) {
            return new MethodHits(method, List.of(), true);
        }
    }
}
