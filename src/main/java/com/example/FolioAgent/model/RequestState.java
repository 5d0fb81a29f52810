package com.example.FolioAgent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of one query, created at request entry and dropped once the answer is built.
 * <p>
 * Only the orchestrator assigns {@link #assignIntent(Intent) intent} and bumps
 * {@link #incrementRetry() retryCount}; other components receive the state for the duration
 * of a single call and must not keep it.
 */
public class RequestState {

    public static final String EVENTS_KEY = "events";

    private final String userQuery;
    private final QueryOptions options;
    private final int maxRetries;
    private final long startNanos = System.nanoTime();
    private final EventLog events = new EventLog(this::elapsedMillis);
    private final Map<String, Object> metadata = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<ToolInvocation> toolInvocations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();

    private volatile Intent intent;
    private volatile EnrichedContext context;
    private volatile DraftResponse draftResponse;
    private volatile List<RetrievalResult> sources = List.of();
    private volatile int retryCount;

    public RequestState(String userQuery, QueryOptions options, int maxRetries) {
        this.userQuery = userQuery == null ? "" : userQuery;
        this.options = options == null ? QueryOptions.defaults() : options;
        this.maxRetries = maxRetries;
    }

    public String userQuery() {
        return userQuery;
    }

    public QueryOptions options() {
        return options;
    }

    public boolean streaming() {
        return options.stream();
    }

    public Intent intent() {
        return intent;
    }

    /**
     * Write-once.
     *
     * @throws IllegalStateException when an intent was already assigned
     */
    public synchronized void assignIntent(Intent intent) {
        Objects.requireNonNull(intent, "intent");
        if (this.intent != null) {
            throw new IllegalStateException("Intent already assigned: " + this.intent);
        }
        this.intent = intent;
    }

    public EnrichedContext context() {
        return context;
    }

    public void setContext(EnrichedContext context) {
        this.context = context;
    }

    public DraftResponse draftResponse() {
        return draftResponse;
    }

    public void setDraftResponse(DraftResponse draftResponse) {
        this.draftResponse = draftResponse;
    }

    public List<RetrievalResult> sources() {
        return sources;
    }

    /**
     * Sources must come from the current context.
     *
     * @throws IllegalArgumentException when a source is not part of the current context
     */
    public void setSources(List<RetrievalResult> sources) {
        List<RetrievalResult> inContext = context == null ? List.of() : context.sources();
        for (RetrievalResult source : sources) {
            if (!inContext.contains(source)) {
                throw new IllegalArgumentException("Source " + source.id() + " is not part of the context");
            }
        }
        this.sources = List.copyOf(sources);
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean retriesLeft() {
        return retryCount < maxRetries;
    }

    /**
     * @throws IllegalStateException when the cap is already reached
     */
    public synchronized int incrementRetry() {
        if (retryCount >= maxRetries) {
            throw new IllegalStateException("Retry cap " + maxRetries + " reached");
        }
        return ++retryCount;
    }

    public EventLog events() {
        return events;
    }

    /**
     * A null value removes the key.
     */
    public void putMetadata(String key, Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    public Object metadata(String key) {
        return metadata.get(key);
    }

    /**
     * Copy of the metadata with the current event snapshot under {@value #EVENTS_KEY}.
     */
    public Map<String, Object> metadataSnapshot() {
        Map<String, Object> copy;
        synchronized (metadata) {
            copy = new LinkedHashMap<>(metadata);
        }
        copy.put(EVENTS_KEY, events.snapshot());
        return copy;
    }

    public List<ToolInvocation> toolInvocations() {
        return List.copyOf(toolInvocations);
    }

    public void addToolInvocation(ToolInvocation invocation) {
        toolInvocations.add(invocation);
    }

    public long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Stop the request: flags it and cancels whatever stage is in flight.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            Future<?> running = inFlight.getAndSet(null);
            if (running != null) {
                running.cancel(true);
            }
        }
    }

    /**
     * Track the stage currently running so {@link #cancel()} can release it.
     */
    public void bindInFlight(Future<?> future) {
        inFlight.set(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void clearInFlight(Future<?> future) {
        inFlight.compareAndSet(future, null);
    }
}
