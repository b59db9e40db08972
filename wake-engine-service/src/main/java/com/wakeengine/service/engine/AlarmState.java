package com.wakeengine.service.engine;

import com.wakeengine.common.condition.ConditionCatalog;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.service.loop.TickLane;
import com.wakeengine.service.loop.TickOutcome;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Live, in-memory state of one alarm: the alarm itself, its condition catalog,
 * the adaptation and feedback logs, the lane its ticks run on and the lane its
 * persisted changes run on.
 *
 * <p>The catalog guards itself; the alarm and both logs are guarded by this object.
 * Changes that are written to storage go through {@link #mutate}, one at a time.
 * {@code adaptive} follows {@code settings.realTimeAdaptation} but is switched off
 * before the new settings are written, so a tick that is already running sees the
 * switch-off before it commits anything.
 */
public final class AlarmState {

    private final String alarmId;
    private final ConditionCatalog catalog;
    private final List<AdaptationRecord> adaptations;
    private final List<WakeUpFeedback> feedback;
    private final AtomicBoolean adaptive;
    private final TickLane lane;
    private final MutationLane mutations;
    private Alarm alarm;

    public AlarmState(Alarm alarm,
                      ConditionCatalog catalog,
                      Collection<AdaptationRecord> adaptations,
                      Collection<WakeUpFeedback> feedback,
                      Function<AlarmState, Mono<TickOutcome>> tick) {
        this.alarmId     = alarm.id();
        this.alarm       = alarm;
        this.catalog     = catalog;
        this.adaptations = new ArrayList<>(adaptations);
        this.feedback    = new ArrayList<>(feedback);
        this.adaptive    = new AtomicBoolean(alarm.settings().realTimeAdaptation());
        this.lane        = new TickLane(() -> tick.apply(this));
        this.mutations   = new MutationLane();
    }

    public String alarmId() {
        return alarmId;
    }

    public ConditionCatalog catalog() {
        return catalog;
    }

    public synchronized Alarm alarm() {
        return alarm;
    }

    public synchronized Alarm updateAlarm(UnaryOperator<Alarm> change) {
        alarm = change.apply(alarm);
        return alarm;
    }

    public boolean isAdaptive() {
        return adaptive.get();
    }

    void setAdaptive(boolean value) {
        adaptive.set(value);
    }

    /** Returns the records in log order. */
    public synchronized List<AdaptationRecord> adaptations() {
        return List.copyOf(adaptations);
    }

    public synchronized void appendAdaptation(AdaptationRecord record) {
        adaptations.add(record);
    }

    /** Replaces records by id, keeping their position in the log. */
    public synchronized void replaceAdaptations(Collection<AdaptationRecord> updated) {
        if (updated.isEmpty()) return;
        Map<String, AdaptationRecord> byId = new HashMap<>();
        for (AdaptationRecord r : updated) byId.put(r.id(), r);
        adaptations.replaceAll(r -> byId.getOrDefault(r.id(), r));
    }

    public synchronized List<WakeUpFeedback> feedback() {
        return List.copyOf(feedback);
    }

    public synchronized void appendFeedback(WakeUpFeedback entry) {
        feedback.add(entry);
    }

    /** Queues a tick behind any tick already running for this alarm. */
    public Mono<TickOutcome> submitTick() {
        return lane.submit();
    }

    /**
     * Queues a write-then-commit section behind any other one running for this alarm.
     * The section reads live state when it starts, not when it is queued.
     */
    public <T> Mono<T> mutate(Supplier<Mono<T>> section) {
        return mutations.submit(section);
    }

    void close() {
        lane.dispose();
        mutations.dispose();
    }
}
