package com.example.FolioAgent.service;

import com.example.FolioAgent.model.EnrichedContext;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.PortfolioAnswer;
import com.example.FolioAgent.model.QueryLog;
import com.example.FolioAgent.model.QueryOptions;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.RetrievalPlan;
import com.example.FolioAgent.model.ValidationState;
import com.example.FolioAgent.repository.QueryLogRepository;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryLogServiceTest {

    private final QueryLogRepository repository = mock(QueryLogRepository.class);
    private final QueryLogService service = new QueryLogService(repository);

    private static RequestState state() {
        RequestState state = new RequestState("Where did Yuqi intern?",
                new QueryOptions(false, null, "session-9", "openai"), 2);
        state.setContext(new EnrichedContext("", List.of(), new RetrievalPlan(10, Set.of()), 4));
        state.putMetadata("degraded", true);
        return state;
    }

    @Test
    void rowCapturesTheOutcome() {
        PortfolioAnswer answer = new PortfolioAnswer("Yuqi interned at Acme.", List.of(), Intent.EXPERIENCE, Map.of());

        QueryLog row = service.toEntity(state(), answer, ValidationState.PASSED, 812);

        assertThat(row.getSessionId()).isEqualTo("session-9");
        assertThat(row.getModel()).isEqualTo("openai");
        assertThat(row.getIntent()).isEqualTo(Intent.EXPERIENCE);
        assertThat(row.getChunksRetrieved()).isEqualTo(4);
        assertThat(row.getLatencyMs()).isEqualTo(812);
        assertThat(row.isDegraded()).isTrue();
    }

    @Test
    void persistenceFailureDoesNotReachTheCaller() {
        when(repository.save(any())).thenThrow(new IllegalStateException("db down"));
        PortfolioAnswer answer = new PortfolioAnswer("x", List.of(), Intent.GENERAL, Map.of());

        service.recordQuery(state(), answer, ValidationState.FAILED_SAFE, 5);

        verify(repository, timeout(2_000)).save(any());
    }
}
