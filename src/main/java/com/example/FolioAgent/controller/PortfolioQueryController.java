package com.example.FolioAgent.controller;

import com.example.FolioAgent.model.PortfolioAnswer;
import com.example.FolioAgent.model.PortfolioQueryRequest;
import com.example.FolioAgent.model.ThinkingEvent;
import com.example.FolioAgent.service.PortfolioQueryOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioQueryController {

    private final PortfolioQueryOrchestrator orchestrator;

    @PostMapping("/query")
    public PortfolioAnswer query(@RequestBody PortfolioQueryRequest request) {
        requireQuestion(request);
        return orchestrator.handleQuery(request.question(), request.toOptions(false));
    }

    @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamQuery(@RequestBody PortfolioQueryRequest request) {
        requireQuestion(request);
        // 0L means no timeout; every stage has its own budget
        SseEmitter emitter = new SseEmitter(0L);

        // Events: start / intent / retrieval / degraded / tool / draft / validation / retry / answer_final
        Flux<ThinkingEvent> stream = orchestrator.streamQuery(request.question(), request.toOptions(true));

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // Use the event type as SSE event name so the frontend can handle each step separately
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.type())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Disposing the subscription cancels the request when the client goes away
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    private static void requireQuestion(PortfolioQueryRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question must not be blank");
        }
    }
}
