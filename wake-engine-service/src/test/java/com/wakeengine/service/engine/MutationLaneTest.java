package com.wakeengine.service.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MutationLaneTest {

    @Test
    @DisplayName("concurrent sections run one at a time, in submission order")
    void serializesSections() {
        MutationLane lane = new MutationLane();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        try {
            List<Integer> results = Flux.range(0, 5)
                .flatMapSequential(i -> lane.submit(() -> Mono.fromCallable(() -> {
                        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                        return i;
                    })
                    .delayElement(Duration.ofMillis(20))
                    .doOnNext(n -> running.decrementAndGet())))
                .collectList()
                .block(Duration.ofSeconds(5));

            assertEquals(List.of(0, 1, 2, 3, 4), results);
            assertEquals(1, maxRunning.get());
        } finally {
            lane.dispose();
        }
    }

    @Test
    @DisplayName("section reads state when it starts, not when it is queued")
    void deferredUntilTurn() {
        MutationLane lane = new MutationLane();
        AtomicInteger value = new AtomicInteger();
        try {
            Mono<Void> slow = lane.submit(() -> Mono.delay(Duration.ofMillis(50))
                .doOnNext(tick -> value.set(7))
                .then());
            Mono<Integer> read = lane.submit(() -> Mono.just(value.get()));

            assertEquals(7, read.block(Duration.ofSeconds(5)));
            slow.block(Duration.ofSeconds(5));
        } finally {
            lane.dispose();
        }
    }

    @Test
    @DisplayName("empty and failing sections complete their caller and the lane keeps running")
    void emptyAndFailure() {
        MutationLane lane = new MutationLane();
        try {
            assertNull(lane.submit(Mono::empty).block(Duration.ofSeconds(5)));
            assertThrows(IllegalStateException.class, () -> lane.submit(() -> {
                throw new IllegalStateException("write rejected");
            }).block(Duration.ofSeconds(5)));
            assertEquals("next", lane.submit(() -> Mono.just("next")).block(Duration.ofSeconds(5)));
        } finally {
            lane.dispose();
        }
    }

    @Test
    @DisplayName("submit after dispose → IllegalStateException")
    void closed() {
        MutationLane lane = new MutationLane();
        lane.dispose();

        assertTrue(lane.isDisposed());
        assertThrows(IllegalStateException.class, () -> lane.submit(Mono::empty).block());
    }
}
