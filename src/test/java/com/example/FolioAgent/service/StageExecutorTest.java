package com.example.FolioAgent.service;

import com.example.FolioAgent.exception.RequestCancelledException;
import com.example.FolioAgent.exception.StageFailureException;
import com.example.FolioAgent.exception.StageTimeoutException;
import com.example.FolioAgent.model.QueryOptions;
import com.example.FolioAgent.model.RequestState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageExecutorTest {

    private SimpleMeterRegistry registry;
    private StageExecutor executor;
    private RequestState state;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        executor = new StageExecutor(new MetricsRecorder(registry));
        state = new RequestState("q", QueryOptions.defaults(), 2);
    }

    @Test
    void returnsTheStageResultAndRecordsLatency() {
        assertThat(executor.run(state, "retrieve", Duration.ofSeconds(1), () -> 42)).isEqualTo(42);
        assertThat(registry.find("folio.agent.stage.latency").tag("stage", "retrieve").timer()).isNotNull();
    }

    @Test
    void slowStageTimesOut() {
        assertThatThrownBy(() -> executor.run(state, "respond", Duration.ofMillis(50), () -> {
            Thread.sleep(1_000);
            return "late";
        }))
                .isInstanceOf(StageTimeoutException.class)
                .hasMessageContaining("respond");
    }

    @Test
    void runtimeFailuresPassThroughAndCheckedOnesAreWrapped() {
        assertThatThrownBy(() -> executor.run(state, "dispatch", Duration.ofSeconds(1), () -> {
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> executor.run(state, "dispatch", Duration.ofSeconds(1), () -> {
            throw new IOException("socket closed");
        })).isInstanceOf(StageFailureException.class);
    }

    @Test
    void cancelledRequestDoesNotStartTheStage() {
        state.cancel();

        assertThatThrownBy(() -> executor.run(state, "classify", Duration.ofSeconds(1), () -> "never"))
                .isInstanceOf(RequestCancelledException.class);
    }

    @Test
    void cancellingReleasesTheWaitingCaller() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                executor.run(state, "dispatch", Duration.ofSeconds(30), () -> {
                    started.countDown();
                    Thread.sleep(30_000);
                    return "done";
                });
                return null;
            } catch (RuntimeException ex) {
                return ex;
            }
        });

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        state.cancel();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(RequestCancelledException.class);
    }
}
