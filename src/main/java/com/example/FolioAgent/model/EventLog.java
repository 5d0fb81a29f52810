package com.example.FolioAgent.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Append-only, per-request event sequence.
 * <p>
 * Each append publishes a new immutable snapshot through a volatile field, so a reader on
 * another thread always sees a complete prefix of the sequence. Timestamps are clamped so
 * they never go backwards even if appends arrive from different threads.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final LongSupplier clock;
    private final Object appendLock = new Object();

    private volatile List<ThinkingEvent> snapshot = List.of();
    private volatile Consumer<ThinkingEvent> listener;
    private long lastTimestamp;

    /**
     * @param clock request-relative milliseconds
     */
    public EventLog(LongSupplier clock) {
        this.clock = clock;
    }

    public ThinkingEvent append(String type, String message, Object payload) {
        synchronized (appendLock) {
            long ts = Math.max(lastTimestamp, clock.getAsLong());
            lastTimestamp = ts;
            ThinkingEvent event = new ThinkingEvent(type, message, ts, payload);

            List<ThinkingEvent> next = new ArrayList<>(snapshot.size() + 1);
            next.addAll(snapshot);
            next.add(event);
            snapshot = Collections.unmodifiableList(next);

            Consumer<ThinkingEvent> current = listener;
            if (current != null) {
                try {
                    current.accept(event);
                } catch (RuntimeException ex) {
                    log.warn("Event listener failed on type={}: {}", type, ex.toString());
                }
            }
            return event;
        }
    }

    /**
     * Consistent read of everything appended so far.
     */
    public List<ThinkingEvent> snapshot() {
        return snapshot;
    }

    public int size() {
        return snapshot.size();
    }

    /**
     * Live listener invoked under the append lock, in append order.
     */
    public void onAppend(Consumer<ThinkingEvent> listener) {
        this.listener = listener;
    }
}
