package com.example.FolioAgent.controller;

import com.example.FolioAgent.model.HybridRetrievalResult;
import com.example.FolioAgent.model.RagQueryRequest;
import com.example.FolioAgent.service.HybridRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Set;

/**
 * Retrieval-only endpoints for inspecting what the knowledge base returns for a question.
 */
@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagRetrievalController {

    static final int DEFAULT_TOP_K = 8;

    private final HybridRetrievalService hybridRetrievalService;

    /**
     * Simple mode: question only, default k, all sources.
     * <pre>GET /api/rag/retrieve?q=xxx</pre>
     */
    @GetMapping("/retrieve")
    public HybridRetrievalResult retrieveByQueryParam(@RequestParam("q") String question) {
        requireQuestion(question);
        return hybridRetrievalService.retrieve(question, DEFAULT_TOP_K, Set.of());
    }

    /**
     * Advanced mode: caller controls k and the source filter.
     * <pre>
     * POST /api/rag/retrieve
     * {
     *   "question": "xxx",
     *   "topK": 8,
     *   "sources": ["education", "resume"]
     * }
     * </pre>
     */
    @PostMapping("/retrieve")
    public HybridRetrievalResult retrieveByBody(@RequestBody RagQueryRequest request) {
        requireQuestion(request.question());
        return hybridRetrievalService.retrieve(
                request.question(),
                request.resolveTopK(DEFAULT_TOP_K),
                request.resolveSources()
        );
    }

    private static void requireQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question must not be blank");
        }
    }
}
