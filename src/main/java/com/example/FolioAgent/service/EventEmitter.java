package com.example.FolioAgent.service;

import com.example.FolioAgent.model.EventType;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.ThinkingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Appends progress events to the request's event log when the caller asked for streaming.
 * Safe to call from any component: it never throws and never changes the caller's result.
 */
@Component
public class EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

    public Optional<ThinkingEvent> emit(RequestState state, EventType type, String message, Object payload) {
        if (state == null || !state.streaming()) {
            return Optional.empty();
        }
        try {
            return Optional.of(state.events().append(type.wireName(), message, payload));
        } catch (RuntimeException ex) {
            log.warn("Failed to emit {} event: {}", type.wireName(), ex.toString());
            return Optional.empty();
        }
    }
}
