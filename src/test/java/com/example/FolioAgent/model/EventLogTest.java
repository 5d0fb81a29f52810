package com.example.FolioAgent.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventLogTest {

    @Test
    void timestampsNeverGoBackwards() {
        long[] ticks = {5, 9, 7, 12, 3};
        AtomicLong index = new AtomicLong();
        EventLog log = new EventLog(() -> ticks[(int) index.getAndIncrement()]);

        for (int i = 0; i < ticks.length; i++) {
            log.append("step", "step " + i, null);
        }

        assertThat(log.snapshot()).extracting(ThinkingEvent::timestamp).containsExactly(5L, 9L, 9L, 12L, 12L);
    }

    @Test
    void snapshotIsAStableImmutablePrefix() {
        EventLog log = new EventLog(() -> 0L);
        log.append("start", "a", null);
        List<ThinkingEvent> before = log.snapshot();

        log.append("intent", "b", null);

        assertThat(before).hasSize(1);
        assertThat(log.snapshot()).hasSize(2).startsWith(before.get(0));
        assertThatThrownBy(() -> before.add(before.get(0))).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void listenerSeesEventsInOrderAndItsFailuresAreContained() {
        EventLog log = new EventLog(() -> 0L);
        List<String> seen = new ArrayList<>();
        log.onAppend(event -> {
            seen.add(event.type());
            if (event.type().equals("tool")) {
                throw new IllegalStateException("client gone");
            }
        });

        log.append("start", "a", null);
        log.append("tool", "b", null);
        log.append("answer_final", "c", null);

        assertThat(seen).containsExactly("start", "tool", "answer_final");
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    void concurrentAppendsAreAllKeptWithOrderedTimestamps() throws Exception {
        AtomicLong clock = new AtomicLong();
        EventLog log = new EventLog(clock::incrementAndGet);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 250; i++) {
                        log.append("tick", "t", null);
                    }
                    return null;
                });
            }
            go.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(log.snapshot()).hasSize(1000);
        assertThat(log.snapshot()).extracting(ThinkingEvent::timestamp).isSorted();
    }
}
