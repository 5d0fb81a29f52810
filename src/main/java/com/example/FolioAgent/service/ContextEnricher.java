package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.model.EnrichedContext;
import com.example.FolioAgent.model.EventType;
import com.example.FolioAgent.model.HybridRetrievalResult;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.KbDocument;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.RetrievalPlan;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.SearchMethod;
import com.example.FolioAgent.model.SourceCategory;
import com.example.FolioAgent.model.SourceRef;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns an intent and a question into the context block a responder works from.
 */
@Service
@RequiredArgsConstructor
public class ContextEnricher {

    private static final Logger log = LoggerFactory.getLogger(ContextEnricher.class);

    private static final String BLOCK_SEPARATOR = "\n\n";

    public static final String DEGRADED_KEY = "degraded";
    public static final String DEGRADED_METHODS_KEY = "degradedMethods";
    public static final String RETRIEVAL_KEY = "retrieval";

    private final HybridRetrievalService retrievalService;
    private final EventEmitter eventEmitter;
    private final AgentProperties properties;

    /**
     * Retrieval parameters as a pure function of the intent. Every widen level doubles k,
     * up to the configured maximum.
     */
    public RetrievalPlan planFor(Intent intent, int widenLevel) {
        RetrievalPlan base = switch (intent) {
            case EDUCATION -> new RetrievalPlan(12, Set.of(SourceCategory.EDUCATION));
            case EXPERIENCE -> new RetrievalPlan(10, Set.of(SourceCategory.EXPERIENCE, SourceCategory.RESUME));
            case PERSONAL_PROJECT -> new RetrievalPlan(20, Set.of(SourceCategory.PROJECTS, SourceCategory.CASE_STUDY));
            case SKILLS -> new RetrievalPlan(10, Set.of(
                    SourceCategory.SKILLS, SourceCategory.RESUME, SourceCategory.EXPERIENCE, SourceCategory.PROJECTS));
            case CASE_STUDY -> new RetrievalPlan(16, Set.of(SourceCategory.CASE_STUDY, SourceCategory.PROJECTS));
            case PROJECT_TOUR -> new RetrievalPlan(16, Set.of(
                    SourceCategory.PROJECTS, SourceCategory.CASE_STUDY, SourceCategory.ABOUT));
            case GENERAL -> new RetrievalPlan(8, Set.of());
        };
        if (widenLevel <= 0) {
            return base;
        }
        int maxK = Math.max(base.k(), properties.getRetrieval().getMaxK());
        long widened = (long) base.k() << Math.min(widenLevel, 16);
        return new RetrievalPlan((int) Math.min(maxK, widened), base.allowedSources());
    }

    public EnrichedContext enrich(Intent intent, String query) {
        return enrich(intent, query, 0);
    }

    /**
     * Calls the hybrid retriever once and renders the hits into a size-bounded block.
     * Lowest-ranked chunks are the first to be left out when the budget runs out.
     * Touches no request state; the caller records the outcome with {@link #record}.
     */
    public EnrichedContext enrich(Intent intent, String query, int widenLevel) {
        RetrievalPlan plan = planFor(intent, widenLevel);
        HybridRetrievalResult retrieval = retrievalService.retrieve(query, plan.k(), plan.allowedSources());

        Set<SearchMethod> unavailable = retrieval.degraded() && retrieval.degradedMethods().isEmpty()
                ? EnumSet.allOf(SearchMethod.class)
                : retrieval.degradedMethods();
        EnrichedContext context = assemble(retrieval.results(), plan).withRetrieval(widenLevel, unavailable);

        log.debug("Context enrichment: intent={} k={} retrieved={} inContext={} chars={}",
                intent, plan.k(), context.retrieved(), context.sources().size(), context.text().length());
        return context;
    }

    /**
     * Copies the retrieval summary and any degradation of a context the responder will
     * actually use into the request metadata, and emits the matching events.
     */
    public void record(RequestState state, EnrichedContext context) {
        if (context.degraded()) {
            state.putMetadata(DEGRADED_KEY, true);
            state.putMetadata(DEGRADED_METHODS_KEY, context.degradedMethods().stream().map(Enum::name).sorted().toList());
            eventEmitter.emit(state, EventType.DEGRADED,
                    "Some search methods were unavailable; answering from what was found.",
                    Map.of("stage", "retrieve", "unavailable", context.degradedMethods()));
        }

        RetrievalPlan plan = context.plan();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("k", plan.k());
        summary.put("allowedSources", plan.allowedSources().stream().map(SourceCategory::docType).sorted().toList());
        summary.put("chunksRetrieved", context.retrieved());
        summary.put("chunksInContext", context.sources().size());
        summary.put("widenLevel", context.widenLevel());
        state.putMetadata(RETRIEVAL_KEY, summary);

        eventEmitter.emit(state, EventType.RETRIEVAL,
                "Searched the portfolio knowledge base for related content.",
                context.sources().stream().map(SourceRef::from).toList());
    }

    EnrichedContext assemble(List<RetrievalResult> results, RetrievalPlan plan) {
        if (results.isEmpty()) {
            return EnrichedContext.empty(plan);
        }
        int maxChars = properties.getContext().getMaxChars();
        StringBuilder sb = new StringBuilder();
        List<RetrievalResult> included = new ArrayList<>();

        for (RetrievalResult result : results) {
            String block = renderBlock(result);
            int needed = (sb.length() == 0 ? 0 : BLOCK_SEPARATOR.length()) + block.length();
            if (sb.length() + needed > maxChars) {
                if (included.isEmpty()) {
                    // A single oversize top chunk is clipped rather than dropped
                    sb.append(block, 0, Math.max(0, maxChars));
                    included.add(result);
                }
                break;
            }
            if (sb.length() > 0) {
                sb.append(BLOCK_SEPARATOR);
            }
            sb.append(block);
            included.add(result);
        }
        return new EnrichedContext(sb.toString(), included, plan, results.size());
    }

    /**
     * Example format:
     *   【docId=..., type=..., score=0.873】
     *   document content...
     */
    private String renderBlock(RetrievalResult result) {
        KbDocument doc = result.document();
        return "【docId=" + doc.getId()
                + ", type=" + doc.getDocType()
                + ", score=" + String.format(Locale.US, "%.3f", result.score())
                + "】\n"
                + (doc.getContent() == null ? "" : doc.getContent());
    }
}
