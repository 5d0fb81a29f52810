package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.exception.RequestCancelledException;
import com.example.FolioAgent.exception.StageTimeoutException;
import com.example.FolioAgent.model.Classification;
import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.EnrichedContext;
import com.example.FolioAgent.model.EventType;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.PortfolioAnswer;
import com.example.FolioAgent.model.QueryOptions;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.ResponderInput;
import com.example.FolioAgent.model.ResponseStrategy;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.RetryAction;
import com.example.FolioAgent.model.SourceRef;
import com.example.FolioAgent.model.ThinkingEvent;
import com.example.FolioAgent.model.ToolInvocation;
import com.example.FolioAgent.model.ValidationOutcome;
import com.example.FolioAgent.model.ValidationState;
import com.example.FolioAgent.service.responder.ResponderRouter;
import com.example.FolioAgent.util.CitationExtractor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one query through classify, enrich, dispatch, respond and validate.
 * <p>
 * The only back-edge is validation RETRY, bounded by the request's retry cap:
 * RE_ENRICH widens retrieval by one level and responds again, ALTERNATE_STRATEGY
 * responds again over the same context with the alternate strategy.
 * {@link #handleQuery} always returns a well-formed answer.
 */
@Service
@RequiredArgsConstructor
public class PortfolioQueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioQueryOrchestrator.class);

    static final String STAGE_CLASSIFY = "classify";
    static final String STAGE_RETRIEVE = "retrieve";
    static final String STAGE_RESPOND = "respond";
    static final String REASON_CANCELLED = "cancelled";
    static final String EVENT_METRIC = "pipeline_event";

    private final IntentClassifier intentClassifier;
    private final ContextEnricher contextEnricher;
    private final ToolDispatcher toolDispatcher;
    private final ResponderRouter responderRouter;
    private final ResponseValidator responseValidator;
    private final EventEmitter eventEmitter;
    private final StageExecutor stageExecutor;
    private final MetricsRecorder metricsRecorder;
    private final QueryLogService queryLogService;
    private final AgentProperties properties;

    public PortfolioAnswer handleQuery(String userQuery, QueryOptions options) {
        return run(newState(userQuery, options));
    }

    /**
     * Streaming variant: events are pushed as they are appended and the stream ends with
     * {@code answer_final}. Cancelling the subscription cancels the request.
     */
    public Flux<ThinkingEvent> streamQuery(String userQuery, QueryOptions options) {
        return Flux.defer(() -> {
            RequestState state = newState(userQuery, options.withStream(true));
            Sinks.Many<ThinkingEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
            state.events().onAppend(sink::tryEmitNext);

            Disposable execution = Mono.fromCallable(() -> run(state))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(
                            answer -> sink.tryEmitComplete(),
                            sink::tryEmitError
                    );

            return sink.asFlux().doOnCancel(() -> {
                log.debug("Stream subscriber went away, cancelling request");
                state.cancel();
                execution.dispose();
            });
        });
    }

    RequestState newState(String userQuery, QueryOptions options) {
        return new RequestState(userQuery, options, properties.getValidation().getMaxRetries());
    }

    PortfolioAnswer run(RequestState state) {
        eventEmitter.emit(state, EventType.START, "Request received. Initializing thinking pipeline.",
                Map.of("query", state.userQuery()));

        ValidationOutcome outcome;
        try {
            outcome = advance(state);
        } catch (RequestCancelledException ex) {
            log.info("Request cancelled during {} stage", ex.getStage());
            outcome = ValidationOutcome.failedSafe(REASON_CANCELLED, REASON_CANCELLED);
        } catch (RuntimeException ex) {
            log.error("Query pipeline failed unexpectedly", ex);
            outcome = ValidationOutcome.failedSafe("internal", "internal error: " + ex.getClass().getSimpleName());
        }
        return finish(state, outcome);
    }

    private ValidationOutcome advance(RequestState state) {
        Intent intent = resolveIntent(state);
        state.assignIntent(intent);
        eventEmitter.emit(state, EventType.INTENT, "Classified the question as " + intent + ".",
                state.metadata("classification"));

        Optional<String> toolId = toolDispatcher.select(intent, state.userQuery());
        ResponseStrategy strategy = ResponseStrategy.PRIMARY;
        ToolInvocation tool = null;
        boolean toolAttempted = false;
        boolean needContext = true;
        int widenLevel = 0;

        while (true) {
            if (needContext) {
                state.setContext(enrich(state, intent, widenLevel));
                needContext = false;
            }
            if (!toolAttempted && toolId.isPresent()) {
                toolAttempted = true;
                tool = toolDispatcher.dispatch(toolId.get(), state).orElse(null);
            }

            DraftResponse draft = respond(state, new ResponderInput(
                    intent, state.userQuery(), state.context(), tool, strategy, state.options().model()));
            state.setDraftResponse(draft);
            eventEmitter.emit(state, EventType.DRAFT, "Drafted an answer.", draftSummary(draft));

            ValidationOutcome outcome = responseValidator.validate(draft, state);
            eventEmitter.emit(state, EventType.VALIDATION, "Checked the draft: " + outcome.state() + ".",
                    validationSummary(outcome));
            if (outcome.state() != ValidationState.RETRY) {
                return outcome;
            }
            if (state.isCancelled()) {
                throw new RequestCancelledException("validate");
            }

            int attempt = state.incrementRetry();
            if (outcome.action() == RetryAction.RE_ENRICH) {
                widenLevel++;
                needContext = true;
            } else {
                strategy = ResponseStrategy.ALTERNATE;
            }
            log.debug("Retry {} after {} check: {}", attempt, outcome.check(), outcome.reason());
            eventEmitter.emit(state, EventType.RETRY, "Retrying: " + outcome.reason(),
                    Map.of("attempt", attempt, "action", outcome.action().name(), "check", outcome.check()));
        }
    }

    private Intent resolveIntent(RequestState state) {
        Intent forced = state.options().forceIntent();
        if (forced != null) {
            state.putMetadata("classification", classificationSummary(Classification.of(forced, "forced")));
            return forced;
        }

        Classification classification;
        try {
            classification = stageExecutor.run(state, STAGE_CLASSIFY, properties.getTimeouts().getClassify(),
                    () -> intentClassifier.classify(state.userQuery(), state.options().model()));
        } catch (StageTimeoutException ex) {
            log.warn("Intent classification timed out: {}", ex.getMessage());
            classification = new Classification(properties.getClassifier().getDefaultIntent(), "default",
                    "classifier timed out");
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Intent classification failed: {}", ex.toString());
            classification = new Classification(properties.getClassifier().getDefaultIntent(), "default",
                    "classifier failed: " + ex.getClass().getSimpleName());
        }

        if (classification.degraded()) {
            eventEmitter.emit(state, EventType.DEGRADED, "Classifier unavailable; using the default intent.",
                    Map.of("stage", STAGE_CLASSIFY, "cause", classification.note()));
        }
        state.putMetadata("classification", classificationSummary(classification));
        return classification.intent();
    }

    private EnrichedContext enrich(RequestState state, Intent intent, int widenLevel) {
        String query = state.userQuery();
        EnrichedContext context;
        try {
            context = stageExecutor.run(state, STAGE_RETRIEVE, properties.getTimeouts().getRetrieve(),
                    () -> contextEnricher.enrich(intent, query, widenLevel));
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Context enrichment failed for intent {}: {}", intent, ex.toString());
            state.putMetadata(ContextEnricher.DEGRADED_KEY, true);
            eventEmitter.emit(state, EventType.DEGRADED, "Knowledge base unavailable; answering without context.",
                    Map.of("stage", STAGE_RETRIEVE, "cause", ex.toString()));
            return EnrichedContext.empty(contextEnricher.planFor(intent, widenLevel));
        }
        // Only a stage that returned in time may write into the request
        contextEnricher.record(state, context);
        return context;
    }

    private DraftResponse respond(RequestState state, ResponderInput input) {
        try {
            return stageExecutor.run(state, STAGE_RESPOND, properties.getTimeouts().getRespond(),
                    () -> responderRouter.route(input.intent()).respond(input));
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Responder for {} failed: {}", input.intent(), ex.toString());
            return DraftResponse.failed(ex.getMessage(), input.strategy());
        }
    }

    private PortfolioAnswer finish(RequestState state, ValidationOutcome outcome) {
        if (state.intent() == null) {
            state.assignIntent(properties.getClassifier().getDefaultIntent());
        }

        String response;
        List<RetrievalResult> sources;
        if (outcome.state() == ValidationState.PASSED) {
            response = state.draftResponse().text();
            sources = citedSources(response, state.context());
        } else {
            response = properties.getValidation().getFallbackResponse();
            sources = List.of();
        }
        state.setSources(sources);

        long latencyMs = state.elapsedMillis();
        state.putMetadata("validation", validationSummary(outcome));
        state.putMetadata("retryCount", state.retryCount());
        state.putMetadata("latencyMs", latencyMs);
        state.putMetadata("model", state.options().model());
        state.putMetadata("sessionId", state.options().sessionId());

        PortfolioAnswer answer = new PortfolioAnswer(
                response,
                sources.stream().map(SourceRef::from).toList(),
                state.intent(),
                state.metadataSnapshot()
        );
        eventEmitter.emit(state, EventType.ANSWER_FINAL, "Finalized answer.", answer);

        for (ThinkingEvent event : state.events().snapshot()) {
            metricsRecorder.recordEvent(EVENT_METRIC, Map.of("type", event.type()));
        }
        metricsRecorder.recordEvent("query_completed", Map.of(
                "intent", state.intent().name(),
                "state", outcome.state().name(),
                "degraded", String.valueOf(Boolean.TRUE.equals(state.metadata(ContextEnricher.DEGRADED_KEY)))));
        metricsRecorder.recordLatency("total", latencyMs);
        queryLogService.recordQuery(state, answer, outcome.state(), latencyMs);

        log.info("Answered query intent={} state={} retries={} chunks={} latencyMs={}",
                state.intent(), outcome.state(), state.retryCount(),
                state.context() == null ? 0 : state.context().sources().size(), latencyMs);
        return answer;
    }

    /**
     * The context chunks the answer cites, in context order; all of them when it cites none.
     */
    static List<RetrievalResult> citedSources(String text, EnrichedContext context) {
        if (context == null) {
            return List.of();
        }
        Set<Long> cited = CitationExtractor.citedIds(text);
        if (cited.isEmpty()) {
            return context.sources();
        }
        List<RetrievalResult> matched = context.sources().stream()
                .filter(source -> cited.contains(source.id()))
                .toList();
        return matched.isEmpty() ? context.sources() : matched;
    }

    private static Map<String, Object> classificationSummary(Classification classification) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("intent", classification.intent().name());
        summary.put("source", classification.source());
        if (classification.note() != null) {
            summary.put("note", classification.note());
        }
        return summary;
    }

    private static Map<String, Object> draftSummary(DraftResponse draft) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("strategy", draft.strategy().name());
        summary.put("length", draft.text().length());
        if (draft.generationFailed()) {
            summary.put("failure", draft.failureReason());
        }
        return summary;
    }

    private static Map<String, Object> validationSummary(ValidationOutcome outcome) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("state", outcome.state().name());
        summary.put("check", outcome.check());
        if (outcome.reason() != null) {
            summary.put("reason", outcome.reason());
        }
        return summary;
    }
}
