package com.example.FolioAgent.service;

import com.example.FolioAgent.exception.RequestCancelledException;
import com.example.FolioAgent.exception.StageFailureException;
import com.example.FolioAgent.exception.StageTimeoutException;
import com.example.FolioAgent.model.RequestState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs one pipeline stage on boundedElastic with a timeout, wired to the request's
 * cancellation handle so a disconnect releases whatever the stage is waiting on.
 */
@Component
@RequiredArgsConstructor
public class StageExecutor {

    private final MetricsRecorder metricsRecorder;

    /**
     * @throws RequestCancelledException when the request is or becomes cancelled
     * @throws StageTimeoutException     when the stage exceeds {@code timeout}
     */
    public <T> T run(RequestState state, String stage, Duration timeout, Callable<T> work) {
        if (state.isCancelled()) {
            throw new RequestCancelledException(stage);
        }
        long started = System.nanoTime();
        CompletableFuture<T> future = Mono.fromCallable(work)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .toFuture();
        state.bindInFlight(future);
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new RequestCancelledException(stage);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.cancel();
            throw new RequestCancelledException(stage);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (state.isCancelled()) {
                throw new RequestCancelledException(stage);
            }
            if (cause instanceof TimeoutException) {
                throw new StageTimeoutException(stage, timeout);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new StageFailureException(stage, cause);
        } finally {
            state.clearInFlight(future);
            metricsRecorder.recordLatency(stage, (System.nanoTime() - started) / 1_000_000);
        }
    }
}
