package com.wakeengine.service.loop;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.function.Supplier;

/**
 * Single-owner lane that runs the ticks of one alarm strictly one after another.
 *
 * <p>Tick requests are queued on a unicast sink drained with {@code concatMap}, so a
 * tick never starts before the previous one for the same alarm has finished, whether
 * it came from the scheduler or from {@code tickNow}. Each request carries its own
 * reply sink that completes with that tick's outcome.
 */
public final class TickLane implements Disposable {

    private final Sinks.Many<Sinks.One<TickOutcome>> requests = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable drain;

    public TickLane(Supplier<Mono<TickOutcome>> tick) {
        this.drain = requests.asFlux()
            .concatMap(reply -> Mono.defer(tick)
                .doOnSuccess(reply::tryEmitValue)
                .doOnError(reply::tryEmitError)
                .onErrorResume(e -> Mono.empty()))
            .subscribe();
    }

    /**
     * Queues one tick.
     *
     * @return the outcome of that tick once it has run; errors with
     *         {@link IllegalStateException} when the lane was closed
     */
    public Mono<TickOutcome> submit() {
        Sinks.One<TickOutcome> reply = Sinks.one();
        Sinks.EmitResult result;
        synchronized (requests) {
            result = requests.tryEmitNext(reply);
        }
        if (result.isFailure()) {
            return Mono.error(new IllegalStateException("Tick lane closed. emitResult=" + result));
        }
        return reply.asMono();
    }

    @Override
    public void dispose() {
        synchronized (requests) {
            requests.tryEmitComplete();
        }
        drain.dispose();
    }

    @Override
    public boolean isDisposed() {
        return drain.isDisposed();
    }
}
