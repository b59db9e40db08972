package com.wakeengine.service.engine;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.function.Supplier;

/**
 * Runs the write-then-commit sections of one alarm one after another.
 *
 * <p>Every change to an alarm's persisted state (the apply phase of a tick, a learning
 * step, a real-time toggle, a condition upsert) is submitted here, so each one reads
 * the live state, writes it to storage and commits it in memory without another
 * change landing in between.
 */
public final class MutationLane implements Disposable {

    private final Sinks.Many<Mono<Void>> jobs = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable drain;

    public MutationLane() {
        this.drain = jobs.asFlux()
            .concatMap(job -> job)
            .subscribe();
    }

    /**
     * Queues one section.
     *
     * @return the section's result once it has run; errors with
     *         {@link IllegalStateException} when the lane was closed
     */
    public <T> Mono<T> submit(Supplier<Mono<T>> section) {
        Sinks.One<T> reply = Sinks.one();
        Mono<Void> job = Mono.defer(section)
            .doOnSuccess(value -> {
                if (value == null) reply.tryEmitEmpty();
                else reply.tryEmitValue(value);
            })
            .doOnError(reply::tryEmitError)
            .onErrorResume(e -> Mono.empty())
            .then();
        Sinks.EmitResult result;
        synchronized (jobs) {
            result = jobs.tryEmitNext(job);
        }
        if (result.isFailure()) {
            return Mono.error(new IllegalStateException("Mutation lane closed. emitResult=" + result));
        }
        return reply.asMono();
    }

    @Override
    public void dispose() {
        synchronized (jobs) {
            jobs.tryEmitComplete();
        }
        drain.dispose();
    }

    @Override
    public boolean isDisposed() {
        return drain.isDisposed();
    }
}
