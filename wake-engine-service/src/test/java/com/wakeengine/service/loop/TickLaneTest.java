package com.wakeengine.service.loop;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TickLaneTest {

    @Test
    @DisplayName("concurrent submissions run one at a time, each gets its own outcome")
    void serializesTicks() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger sequence = new AtomicInteger();

        TickLane lane = new TickLane(() -> Mono.fromCallable(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                return sequence.incrementAndGet();
            })
            .delayElement(Duration.ofMillis(20))
            .map(n -> {
                running.decrementAndGet();
                return TickOutcome.skipped("alarm-1", "tick-" + n, 0, LocalTime.of(7, 0), "test");
            }));
        try {
            List<TickOutcome> outcomes = Flux.range(0, 5)
                .flatMap(i -> lane.submit())
                .collectList()
                .block(Duration.ofSeconds(5));

            assertEquals(5, outcomes.size());
            assertEquals(1, maxRunning.get());
            assertEquals(5, outcomes.stream().map(TickOutcome::tickId).distinct().count());
        } finally {
            lane.dispose();
        }
    }

    @Test
    @DisplayName("a failing tick does not stop the lane")
    void survivesFailure() {
        AtomicInteger calls = new AtomicInteger();
        TickLane lane = new TickLane(() -> calls.incrementAndGet() == 1
            ? Mono.error(new IllegalStateException("boom"))
            : Mono.just(TickOutcome.disabled("alarm-1", "tick-2", LocalTime.of(7, 0))));
        try {
            assertThrows(IllegalStateException.class, () -> lane.submit().block(Duration.ofSeconds(5)));
            assertEquals(TickState.DISABLED, lane.submit().block(Duration.ofSeconds(5)).state());
        } finally {
            lane.dispose();
        }
    }

    @Test
    @DisplayName("submit after dispose → IllegalStateException")
    void closed() {
        TickLane lane = new TickLane(Mono::empty);
        lane.dispose();

        assertTrue(lane.isDisposed());
        assertThrows(IllegalStateException.class, () -> lane.submit().block());
    }
}
