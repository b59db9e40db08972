package com.wakeengine.service.engine;

import com.wakeengine.common.condition.ConditionCatalog;
import com.wakeengine.common.condition.ConditionPresets;
import com.wakeengine.common.condition.ConditionValidator;
import com.wakeengine.common.exception.CollaboratorTimeoutException;
import com.wakeengine.common.exception.ValidationException;
import com.wakeengine.common.learning.FeedbackLearner;
import com.wakeengine.common.learning.FeedbackLearner.LearningOutcome;
import com.wakeengine.common.metrics.ConditionSetupAdvisor;
import com.wakeengine.common.metrics.ConditionSetupReport;
import com.wakeengine.common.metrics.MetricsAggregator;
import com.wakeengine.common.metrics.SmartAlarmMetrics;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.AdaptationSettings;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.AlarmConfig;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.OptimalTimeSlot;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.common.sleep.SleepPatternAdjuster;
import com.wakeengine.common.spi.SleepStagePredictor;
import com.wakeengine.common.spi.WakeStorage;
import com.wakeengine.service.config.EngineTiming;
import com.wakeengine.service.loop.AdaptationLoop;
import com.wakeengine.service.loop.AdaptationScheduler;
import com.wakeengine.service.loop.TickOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point of the engine. Owns alarm creation, manual ticks, feedback learning,
 * metrics and the condition catalog of every alarm.
 *
 * <p>Live state is held in the {@link AlarmRegistry}; every mutation is written to
 * {@link WakeStorage} first and committed in memory after the write succeeded, one
 * change at a time per alarm.
 */
@Service
public class AdaptiveWakeEngine {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveWakeEngine.class);

    public static final int MAX_WAKE_WINDOW = 180;

    private final AlarmRegistry registry;
    private final AdaptationLoop loop;
    private final AdaptationScheduler scheduler;
    private final WakeStorage storage;
    private final SleepStagePredictor sleepPredictor;
    private final Clock clock;
    private final Duration collaboratorTimeout;

    public AdaptiveWakeEngine(AlarmRegistry registry,
                              AdaptationLoop loop,
                              AdaptationScheduler scheduler,
                              WakeStorage storage,
                              SleepStagePredictor sleepPredictor,
                              Clock clock,
                              EngineTiming timing) {
        this.registry            = registry;
        this.loop                = loop;
        this.scheduler           = scheduler;
        this.storage             = storage;
        this.sleepPredictor      = sleepPredictor;
        this.clock               = clock;
        this.collaboratorTimeout = timing.collaboratorTimeout();
    }

    // ── alarms ────────────────────────────────────────────────────────────────

    /**
     * Creates, persists and registers an adaptive alarm. The target starts at the
     * baseline; the periodic loop starts when real-time adaptation is on.
     *
     * @throws ValidationException (as an error signal) when the config is invalid
     */
    public Mono<Alarm> createEnhancedAlarm(AlarmConfig config) {
        return Mono.fromCallable(() -> buildAlarm(config))
            .flatMap(created -> {
                Alarm alarm = created.alarm();
                List<ConditionDefinition> conditions = created.catalog().list(false);
                return storage.saveAlarm(alarm)
                    .thenMany(Flux.fromIterable(conditions)
                        .concatMap(def -> storage.saveCondition(alarm.id(), def)))
                    .then(Mono.fromCallable(() -> {
                        AlarmState state = register(alarm, created.catalog(), List.of(), List.of());
                        log.info("ALARM_CREATED alarmId={} baseline={} wakeWindow={} conditions={} realTime={}",
                                 alarm.id(), alarm.baselineTime(), alarm.wakeWindow(),
                                 conditions.size(), state.isAdaptive());
                        return alarm;
                    }));
            });
    }

    public Mono<Alarm> getAlarm(String alarmId) {
        return Mono.fromCallable(() -> registry.get(alarmId).alarm());
    }

    public Flux<Alarm> listAlarms() {
        return Flux.fromIterable(registry.all()).map(AlarmState::alarm);
    }

    /**
     * Switches the periodic loop on or off. Switching off takes effect at once: the
     * adaptive flag is cleared and the loop disposed before the new settings are
     * written, so a tick already running is cancelled. The settings are committed in
     * memory once they are stored; a failed write puts the loop back as it was.
     */
    public Mono<Alarm> setRealTimeAdaptation(String alarmId, boolean enabled) {
        return Mono.fromCallable(() -> registry.get(alarmId))
            .flatMap(state -> {
                if (!enabled) {
                    state.setAdaptive(false);
                    scheduler.stop(alarmId);
                }
                return state.mutate(() -> {
                        Alarm current = state.alarm();
                        Alarm updated = current.withSettings(current.settings().withRealTimeAdaptation(enabled), now());
                        return storage.saveAlarm(updated).then(Mono.fromCallable(() -> {
                            state.updateAlarm(a -> updated);
                            if (enabled) {
                                state.setAdaptive(true);
                                if (updated.enabled()) scheduler.start(state);
                            }
                            log.info("REAL_TIME_ADAPTATION_TOGGLED alarmId={} enabled={}", alarmId, enabled);
                            return updated;
                        }));
                    })
                    .doOnError(e -> {
                        if (!enabled) resumeFromSettings(state);
                    });
            });
    }

    private void resumeFromSettings(AlarmState state) {
        Alarm alarm = state.alarm();
        boolean adaptive = alarm.settings().realTimeAdaptation();
        log.warn("REAL_TIME_ADAPTATION_TOGGLE_FAILED alarmId={} restoredAdaptive={}", alarm.id(), adaptive);
        state.setAdaptive(adaptive);
        if (adaptive && alarm.enabled()) scheduler.start(state);
    }

    // ── adaptation ────────────────────────────────────────────────────────────

    /** Runs one adaptation tick now, queued behind any tick already running for the alarm. */
    public Mono<TickOutcome> tickNow(String alarmId) {
        return Mono.fromCallable(() -> registry.get(alarmId))
            .flatMap(AlarmState::submitTick);
    }

    /**
     * Ranks candidate wake times around the baseline. Without a sleep pattern or stage
     * predictions every slot is scored as light sleep.
     */
    public Mono<List<OptimalTimeSlot>> calculateOptimalTimeSlots(String alarmId) {
        return Mono.fromCallable(() -> registry.get(alarmId))
            .flatMap(state -> {
                Alarm alarm = state.alarm();
                return bounded(() -> sleepPredictor.currentPattern(alarm))
                    .flatMap(pattern -> bounded(() -> sleepPredictor.predict(alarm, pattern)))
                    .defaultIfEmpty(List.of())
                    .onErrorResume(e -> {
                        log.warn("Stage prediction unavailable, ranking without stages. alarmId={} reason={}",
                                 alarmId, e.getMessage());
                        return Mono.just(List.of());
                    })
                    .map(predictions -> SleepPatternAdjuster.calculateOptimalTimeSlots(
                        alarm.baselineTime(), alarm.wakeWindow(), predictions, state.feedback()));
            });
    }

    // ── learning ──────────────────────────────────────────────────────────────

    /**
     * Updates the effectiveness of every condition that fired on the feedback's day,
     * backfills that day's adaptation records and stores the feedback. The learning
     * step is computed from the live state, written to storage, and only then
     * committed in memory, so a failed write leaves the alarm as it was and can be
     * retried. Storage failures are surfaced to the caller.
     */
    public Mono<LearningOutcome> recordWakeUpFeedback(String alarmId, WakeUpFeedback feedback) {
        return Mono.fromCallable(() -> {
                AlarmState state = registry.get(alarmId);
                FeedbackLearner.validate(feedback);
                return state;
            })
            .flatMap(state -> state.mutate(() -> learn(state, feedback)));
    }

    private Mono<LearningOutcome> learn(AlarmState state, WakeUpFeedback feedback) {
        String alarmId = state.alarmId();
        LearningOutcome outcome = FeedbackLearner.apply(feedback, state.catalog().list(false),
            state.adaptations(), state.alarm().settings().learningFactor());

        return Flux.fromIterable(outcome.updatedConditions())
            .concatMap(def -> storage.saveCondition(alarmId, def))
            .thenMany(Flux.fromIterable(outcome.updatedRecords())
                .concatMap(r -> storage.updateAdaptationEffectiveness(r.id(), outcome.effectiveness())))
            .then(Mono.defer(() -> storage.appendFeedback(alarmId, feedback)))
            .then(Mono.fromCallable(() -> {
                Map<String, ConditionDefinition> learned = outcome.updatedConditions().stream()
                    .collect(Collectors.toMap(ConditionDefinition::id, def -> def));
                state.catalog().transformAll(current -> current.stream()
                    .map(def -> learned.getOrDefault(def.id(), def))
                    .toList());
                state.replaceAdaptations(outcome.updatedRecords());
                state.appendFeedback(feedback);
                log.info("FEEDBACK_RECORDED alarmId={} date={} effectiveness={} conditionsUpdated={} recordsBackfilled={}",
                         alarmId, feedback.date(), outcome.effectiveness(),
                         outcome.updatedConditions().size(), outcome.updatedRecords().size());
                return outcome;
            }));
    }

    // ── metrics ───────────────────────────────────────────────────────────────

    public Mono<SmartAlarmMetrics> getMetrics(String alarmId) {
        return Mono.fromCallable(() -> {
            AlarmState state = registry.get(alarmId);
            return MetricsAggregator.aggregate(state.alarm(), state.catalog().list(false),
                state.adaptations(), state.feedback(), now());
        });
    }

    public Mono<ConditionSetupReport> getConditionSetupReport(String alarmId) {
        return Mono.fromCallable(() -> {
            AlarmState state = registry.get(alarmId);
            return ConditionSetupAdvisor.review(alarmId, state.catalog().list(false), state.alarm().settings());
        });
    }

    // ── conditions ────────────────────────────────────────────────────────────

    public Mono<List<ConditionDefinition>> listConditions(String alarmId) {
        return Mono.fromCallable(() -> registry.get(alarmId).catalog().listByPriority());
    }

    /**
     * Validates and persists the definition, then makes it live.
     *
     * @throws ValidationException (as an error signal) when the definition is invalid
     */
    public Mono<ConditionDefinition> upsertCondition(String alarmId, ConditionDefinition definition) {
        return Mono.fromCallable(() -> {
                AlarmState state = registry.get(alarmId);
                ConditionValidator.validate(definition);
                return state;
            })
            .flatMap(state -> state.mutate(() -> storage.saveCondition(alarmId, definition)
                .then(Mono.fromCallable(() -> {
                    ConditionDefinition saved = state.catalog().upsert(definition);
                    log.info("CONDITION_UPSERTED alarmId={} conditionId={} type={} enabled={}",
                             alarmId, saved.id(), saved.type().key(), saved.enabled());
                    return saved;
                }))));
    }

    // ── restore ───────────────────────────────────────────────────────────────

    /** Rebuilds the live state of every stored alarm and restarts their loops. */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        restore().subscribe(
            count -> log.info("ALARMS_RESTORED count={}", count),
            err   -> log.error("Alarm restore failed", err));
    }

    public Mono<Long> restore() {
        return storage.findAllAlarms()
            .concatMap(alarm -> Mono.zip(
                    storage.findConditions(alarm.id()).collectList(),
                    storage.findAdaptations(alarm.id()).collectList(),
                    storage.findFeedback(alarm.id()).collectList())
                .map(t -> register(alarm, new ConditionCatalog(t.getT1()), t.getT2(), t.getT3())))
            .count();
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private record CreatedAlarm(Alarm alarm, ConditionCatalog catalog) {}

    private CreatedAlarm buildAlarm(AlarmConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) throw new ValidationException("alarm config is required");
        if (config.baselineTime() == null) errors.add("baselineTime is required");
        int wakeWindow = config.wakeWindow() == null ? AlarmConfig.DEFAULT_WAKE_WINDOW : config.wakeWindow();
        if (wakeWindow < 0 || wakeWindow > MAX_WAKE_WINDOW) {
            errors.add("wakeWindow must be within [0, " + MAX_WAKE_WINDOW + "], was " + wakeWindow);
        }
        AdaptationSettings defaults = AdaptationSettings.defaults();
        double weight = config.sleepPatternWeight() == null ? defaults.sleepPatternWeight() : config.sleepPatternWeight();
        double learningFactor = config.learningFactor() == null ? defaults.learningFactor() : config.learningFactor();
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            errors.add("sleepPatternWeight must be within [0, 1], was " + weight);
        }
        if (Double.isNaN(learningFactor) || learningFactor < 0.0 || learningFactor > 1.0) {
            errors.add("learningFactor must be within [0, 1], was " + learningFactor);
        }
        if (!errors.isEmpty()) throw new ValidationException(errors);

        List<ConditionDefinition> conditions = config.conditions() != null
            ? config.conditions()
            : ConditionPresets.forProfile(config.profile());
        ConditionCatalog catalog = new ConditionCatalog(conditions);

        AdaptationSettings settings = new AdaptationSettings(
            config.realTimeAdaptation() == null ? defaults.realTimeAdaptation() : config.realTimeAdaptation(),
            config.dynamicWakeWindow() == null ? defaults.dynamicWakeWindow() : config.dynamicWakeWindow(),
            weight, learningFactor);
        LocalDateTime now = now();
        Alarm alarm = new Alarm(
            UUID.randomUUID().toString(),
            config.label() == null ? "Smart alarm" : config.label(),
            config.baselineTime(), config.baselineTime(), wakeWindow,
            config.enabled() == null || config.enabled(),
            settings, now, now);
        return new CreatedAlarm(alarm, catalog);
    }

    private AlarmState register(Alarm alarm, ConditionCatalog catalog,
                                List<AdaptationRecord> adaptations,
                                List<WakeUpFeedback> feedback) {
        AlarmState state = new AlarmState(alarm, catalog, adaptations, feedback, loop::tick);
        registry.register(state);
        if (state.isAdaptive() && alarm.enabled()) {
            scheduler.start(state);
        }
        return state;
    }

    private <T> Mono<T> bounded(Supplier<Mono<T>> call) {
        return Mono.defer(call)
            .timeout(collaboratorTimeout)
            .onErrorMap(TimeoutException.class,
                e -> new CollaboratorTimeoutException("sleep-predictor", collaboratorTimeout, e));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
