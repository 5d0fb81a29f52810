package com.example.FolioAgent.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Fire-and-forget bridge to Micrometer. Never throws: a metrics problem must not fail a request.
 * Tags are kept low-cardinality (event/stage names and small enums only).
 */
@Component
public class MetricsRecorder {

    private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);

    static final String EVENT_COUNTER = "folio.agent.events";
    static final String STAGE_TIMER = "folio.agent.stage.latency";

    private final MeterRegistry registry; // may be null when no registry is configured

    @Autowired
    public MetricsRecorder(ObjectProvider<MeterRegistry> registryProvider) {
        this(registryProvider.getIfAvailable());
    }

    public MetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEvent(String name, Map<String, String> attributes) {
        if (registry == null) {
            return;
        }
        try {
            Tags tags = Tags.of("name", safeTag(name));
            if (attributes != null) {
                for (Map.Entry<String, String> e : attributes.entrySet()) {
                    tags = tags.and(safeTag(e.getKey()), safeTag(e.getValue()));
                }
            }
            Counter.builder(EVENT_COUNTER).tags(tags).register(registry).increment();
        } catch (RuntimeException ex) {
            log.debug("Dropping metric event {}: {}", name, ex.toString());
        }
    }

    public void recordLatency(String stage, long millis) {
        if (registry == null) {
            return;
        }
        try {
            Timer.builder(STAGE_TIMER)
                    .tag("stage", safeTag(stage))
                    .register(registry)
                    .record(Duration.ofMillis(Math.max(0, millis)));
        } catch (RuntimeException ex) {
            log.debug("Dropping latency for stage {}: {}", stage, ex.toString());
        }
    }

    private static String safeTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return "none";
        }
        String s = raw.trim();
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
