package com.example.FolioAgent.service;

import com.example.FolioAgent.model.PortfolioAnswer;
import com.example.FolioAgent.model.QueryLog;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.ValidationState;
import com.example.FolioAgent.repository.QueryLogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Persists one row per answered query. Writes happen off the request thread and
 * a failed write is only logged.
 */
@Service
@RequiredArgsConstructor
public class QueryLogService {

    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

    private final QueryLogRepository queryLogRepository;

    public void recordQuery(RequestState state,
                            PortfolioAnswer answer,
                            ValidationState validationState,
                            long latencyMs) {
        QueryLog queryLog = toEntity(state, answer, validationState, latencyMs);
        Mono.fromRunnable(() -> queryLogRepository.save(queryLog))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        ex -> log.warn("Failed to persist query log for session {}: {}",
                                queryLog.getSessionId(), ex.toString())
                );
    }

    QueryLog toEntity(RequestState state,
                      PortfolioAnswer answer,
                      ValidationState validationState,
                      long latencyMs) {
        QueryLog queryLog = new QueryLog();
        queryLog.setSessionId(state.options().sessionId());
        queryLog.setModel(state.options().model());
        queryLog.setQuery(state.userQuery());
        queryLog.setIntent(answer.intent());
        queryLog.setAnswer(answer.response());
        queryLog.setLatencyMs(latencyMs);
        queryLog.setChunksRetrieved(state.context() == null ? 0 : state.context().retrieved());
        queryLog.setValidationState(validationState);
        queryLog.setDegraded(Boolean.TRUE.equals(state.metadata(ContextEnricher.DEGRADED_KEY)));
        return queryLog;
    }
}
