package com.wakeengine.service.loop;

import com.wakeengine.service.config.EngineTiming;
import com.wakeengine.service.engine.AlarmState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic trigger of the adaptation loop, one independent cycle per adaptive alarm:
 * <pre>
 *   delay(cadence) → submit tick on the alarm's lane → log outcome → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the
 * next one; {@code Mono.delay()} holds no thread while waiting. A failing tick never
 * stops the cycle. {@link #stop(String)} disposes the pending delay and retires the
 * cycle so that a callback already in flight does not schedule again.
 */
@Component
public class AdaptationScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdaptationScheduler.class);

    private final Duration cadence;
    private final Map<String, Cycle> cycles = new ConcurrentHashMap<>();

    public AdaptationScheduler(EngineTiming timing) {
        this.cadence = timing.tickCadence();
    }

    /** Starts (or restarts) the cycle for this alarm. */
    public void start(AlarmState state) {
        Cycle cycle = new Cycle();
        Cycle previous = cycles.put(state.alarmId(), cycle);
        if (previous != null) previous.cancel();
        log.info("ADAPTATION_SCHEDULED alarmId={} cadenceSeconds={}", state.alarmId(), cadence.toSeconds());
        scheduleNextCycle(state, cycle);
    }

    public void stop(String alarmId) {
        Cycle cycle = cycles.remove(alarmId);
        if (cycle != null) {
            cycle.cancel();
            log.info("ADAPTATION_UNSCHEDULED alarmId={}", alarmId);
        }
    }

    public boolean isScheduled(String alarmId) {
        return cycles.containsKey(alarmId);
    }

    @PreDestroy
    public void stopAll() {
        cycles.keySet().forEach(this::stop);
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextCycle(AlarmState state, Cycle cycle) {
        Disposable pending = Mono.delay(cadence)
            .then(Mono.defer(state::submitTick))
            .subscribe(
                outcome -> {
                    log.info("ADAPTATION_CYCLE alarmId={} tickId={} state={} adjustment={} newTime={}",
                             outcome.alarmId(), outcome.tickId(), outcome.state(),
                             outcome.adjustment(), outcome.newTime());
                    rescheduleIfCurrent(state, cycle);
                },
                err -> {
                    log.error("Adaptation cycle failed, rescheduling. alarmId={}", state.alarmId(), err);
                    rescheduleIfCurrent(state, cycle);
                });
        cycle.track(pending);
    }

    private void rescheduleIfCurrent(AlarmState state, Cycle cycle) {
        if (cycles.get(state.alarmId()) == cycle && state.isAdaptive()) {
            scheduleNextCycle(state, cycle);
        }
    }

    /** Identity token for one started cycle plus its pending delay. */
    private static final class Cycle {

        private volatile Disposable pending;
        private volatile boolean cancelled;

        void track(Disposable next) {
            pending = next;
            if (cancelled) next.dispose();
        }

        void cancel() {
            cancelled = true;
            Disposable current = pending;
            if (current != null) current.dispose();
        }
    }
}
