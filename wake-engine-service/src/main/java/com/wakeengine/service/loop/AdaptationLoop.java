package com.wakeengine.service.loop;

import com.wakeengine.common.adaptation.AdaptationBlender;
import com.wakeengine.common.adaptation.BlendResult;
import com.wakeengine.common.condition.ConditionEvaluation;
import com.wakeengine.common.condition.ConditionEvaluator;
import com.wakeengine.common.exception.CollaboratorTimeoutException;
import com.wakeengine.common.exception.CollaboratorUnavailableException;
import com.wakeengine.common.exception.WakeEngineException;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionReading;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.WakeRecommendation;
import com.wakeengine.common.sleep.SleepPatternAdjuster;
import com.wakeengine.common.spi.ConditionReadingSource;
import com.wakeengine.common.spi.ErrorReporter;
import com.wakeengine.common.spi.ScheduleNotifier;
import com.wakeengine.common.spi.SleepStagePredictor;
import com.wakeengine.common.spi.WakeStorage;
import com.wakeengine.common.time.TimeOfDay;
import com.wakeengine.service.config.EngineTiming;
import com.wakeengine.service.engine.AlarmState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * One evaluate → blend → (apply | skip) cycle for a single alarm.
 *
 * <pre>
 *   readings ─┐
 *   pattern  ─┼─→ evaluator + adjuster → blender → significant? ─no→ SKIPPED
 *   recommend ┘                                      │yes
 *                                                    ▼
 *                         clamp to ±wakeWindow around baseline → persist → commit → notify → APPLIED
 * </pre>
 *
 * <p>Every collaborator call is bounded by {@link EngineTiming#collaboratorTimeout()}.
 * Any collaborator error ends the tick as {@code FAILED}: it is reported to the
 * {@link ErrorReporter} and the alarm keeps its previous target. Storage is written
 * before in-memory state, adaptation record first and alarm last, so a failed write
 * never leaves the live alarm ahead of what was persisted.
 *
 * <p>Ticks must be run through the alarm's {@link TickLane}; this class does not
 * serialize callers itself. The apply phase is queued on the alarm's mutation lane
 * with the other writes to that alarm.
 */
@Component
public class AdaptationLoop {

    private static final Logger log = LoggerFactory.getLogger(AdaptationLoop.class);

    private final WakeStorage storage;
    private final SleepStagePredictor sleepPredictor;
    private final ConditionReadingSource readingSource;
    private final ScheduleNotifier notifier;
    private final ErrorReporter errorReporter;
    private final Clock clock;
    private final Duration collaboratorTimeout;

    public AdaptationLoop(WakeStorage storage,
                          SleepStagePredictor sleepPredictor,
                          ConditionReadingSource readingSource,
                          ScheduleNotifier notifier,
                          ErrorReporter errorReporter,
                          Clock clock,
                          EngineTiming timing) {
        this.storage             = storage;
        this.sleepPredictor      = sleepPredictor;
        this.readingSource       = readingSource;
        this.notifier            = notifier;
        this.errorReporter       = errorReporter;
        this.clock               = clock;
        this.collaboratorTimeout = timing.collaboratorTimeout();
    }

    public Mono<TickOutcome> tick(AlarmState state) {
        String tickId = UUID.randomUUID().toString();
        Alarm alarm = state.alarm();

        if (!state.isAdaptive() || !alarm.enabled()) {
            log.info("ADAPTATION_DISABLED alarmId={} tickId={}", alarm.id(), tickId);
            return Mono.just(TickOutcome.disabled(alarm.id(), tickId, alarm.targetTime()));
        }

        Mono<ConditionReading> readings = bounded("condition-source", readingSource::currentReadings)
            .defaultIfEmpty(ConditionReading.empty());
        Mono<Optional<SleepPattern>> pattern = bounded("sleep-predictor", () -> sleepPredictor.currentPattern(alarm))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
        Mono<Optional<WakeRecommendation>> recommendation = bounded("sleep-predictor", () -> sleepPredictor.recommend(alarm))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());

        return Mono.zip(readings, pattern, recommendation)
            .flatMap(inputs -> decide(state, alarm, tickId,
                inputs.getT1(), inputs.getT2().orElse(null), inputs.getT3().orElse(null)))
            .onErrorResume(e -> {
                log.warn("ADAPTATION_FAILED alarmId={} tickId={} reason={}", alarm.id(), tickId, e.getMessage());
                errorReporter.report(e, Map.of(
                    "alarmId", alarm.id(),
                    "tickId",  tickId,
                    "stage",   "adaptation-tick"));
                return Mono.just(TickOutcome.failed(alarm.id(), tickId, state.alarm().targetTime(),
                    String.valueOf(e.getMessage())));
            });
    }

    // ── decision ──────────────────────────────────────────────────────────────

    private Mono<TickOutcome> decide(AlarmState state, Alarm alarm, String tickId,
                                     ConditionReading reading, SleepPattern pattern,
                                     WakeRecommendation recommendation) {
        if (pattern == null) {
            log.info("ADAPTATION_SKIPPED alarmId={} tickId={} reason=no_sleep_pattern", alarm.id(), tickId);
            return Mono.just(TickOutcome.skipped(alarm.id(), tickId, 0, alarm.targetTime(), "no sleep pattern available"));
        }

        ConditionEvaluation evaluation = ConditionEvaluator.evaluate(state.catalog().list(true), reading);
        int sleepAdjustment = SleepPatternAdjuster.calculateSleepPatternAdjustment(
            alarm.baselineTime(), alarm.wakeWindow(), alarm.settings().dynamicWakeWindow(),
            recommendation, pattern, state.feedback());
        BlendResult blend = AdaptationBlender.blend(
            evaluation.totalConditionAdjustment(), sleepAdjustment, alarm.settings().sleepPatternWeight());

        log.info("ADAPTATION_EVALUATED alarmId={} tickId={} conditionAdjustment={} sleepAdjustment={} blended={} fired={} skipped={}",
                 alarm.id(), tickId, evaluation.totalConditionAdjustment(), sleepAdjustment,
                 blend.adjustment(), evaluation.firedIds(), evaluation.skipped());

        if (!blend.significant()) {
            log.info("ADAPTATION_SKIPPED alarmId={} tickId={} adjustment={} reason=below_threshold",
                     alarm.id(), tickId, blend.adjustment());
            return Mono.just(TickOutcome.skipped(alarm.id(), tickId, blend.adjustment(), alarm.targetTime(),
                "adjustment below " + AdaptationBlender.SIGNIFICANCE_THRESHOLD_MINUTES + " minutes"));
        }

        int applied = AdaptationBlender.clampToWindow(blend.adjustment(), alarm.wakeWindow());
        LocalTime newTime = TimeOfDay.shift(alarm.baselineTime(), applied);
        if (newTime.equals(alarm.targetTime())) {
            log.info("ADAPTATION_SKIPPED alarmId={} tickId={} adjustment={} reason=already_at_target",
                     alarm.id(), tickId, applied);
            return Mono.just(TickOutcome.skipped(alarm.id(), tickId, applied, alarm.targetTime(),
                "alarm already at " + newTime));
        }

        return state.mutate(() -> apply(state, tickId, applied, newTime, blend, evaluation, sleepAdjustment));
    }

    // ── apply ─────────────────────────────────────────────────────────────────

    /**
     * Runs on the alarm's mutation lane. The alarm and catalog written are the live
     * ones, so settings or scores changed while the tick was evaluating are kept.
     * Switching real-time adaptation off is checked before writing and again before
     * committing; a switch-off seen after the writes undoes them.
     */
    private Mono<TickOutcome> apply(AlarmState state, String tickId, int applied,
                                    LocalTime newTime, BlendResult blend,
                                    ConditionEvaluation evaluation, int sleepAdjustment) {
        Alarm alarm = state.alarm();
        if (!state.isAdaptive()) {
            return Mono.just(cancelled(alarm, tickId));
        }

        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        String reason = reasonText(sleepAdjustment, evaluation);

        AdaptationRecord record = new AdaptationRecord(
            UUID.randomUUID().toString(), alarm.id(), now, alarm.baselineTime(), newTime,
            reason, blend.dominantSource(), blend.confidence(), null);
        Alarm moved = alarm.withTargetTime(newTime, now);
        List<ConditionDefinition> fired = state.catalog().list(false).stream()
            .filter(def -> evaluation.firedIds().contains(def.id()))
            .toList();

        Mono<Void> persist = bounded("storage", () -> storage.appendAdaptation(record)).then()
            .then(saveConditions(alarm.id(), fired.stream().map(def -> def.withLastTriggered(now)).toList()))
            .then(bounded("storage", () -> storage.saveAlarm(moved)).then());

        return persist.then(Mono.defer(() -> {
            if (!state.isAdaptive()) {
                return revert(state, record, fired).thenReturn(cancelled(alarm, tickId));
            }
            state.updateAlarm(current -> current.withTargetTime(newTime, now));
            state.catalog().markTriggered(evaluation.firedIds(), now);
            state.appendAdaptation(record);

            log.info("ADAPTATION_APPLIED alarmId={} tickId={} adjustment={} newTime={} confidence={} source={}",
                     alarm.id(), tickId, applied, newTime, blend.confidence(), blend.dominantSource().key());
            try {
                notifier.onScheduleChanged(alarm.id(), newTime, blend.confidence(), reason);
            } catch (RuntimeException e) {
                log.warn("Schedule notification failed (non-critical). alarmId={} tickId={}", alarm.id(), tickId, e);
            }
            return Mono.just(TickOutcome.applied(alarm.id(), tickId, applied, newTime, blend.confidence(), reason));
        }));
    }

    /** Puts storage back to the live state after a tick was cancelled mid-write. */
    private Mono<Void> revert(AlarmState state, AdaptationRecord record, List<ConditionDefinition> fired) {
        log.info("ADAPTATION_REVERTED alarmId={} recordId={} conditions={}",
                 record.alarmId(), record.id(), fired.size());
        return bounded("storage", () -> storage.removeAdaptation(record.id()))
            .then(saveConditions(record.alarmId(), fired))
            .then(bounded("storage", () -> storage.saveAlarm(state.alarm())).then());
    }

    private Mono<Void> saveConditions(String alarmId, List<ConditionDefinition> definitions) {
        return Flux.fromIterable(definitions)
            .concatMap(def -> bounded("storage", () -> storage.saveCondition(alarmId, def)))
            .then();
    }

    private static TickOutcome cancelled(Alarm alarm, String tickId) {
        log.info("ADAPTATION_CANCELLED alarmId={} tickId={}", alarm.id(), tickId);
        return TickOutcome.disabled(alarm.id(), tickId, alarm.targetTime());
    }

    static String reasonText(int sleepAdjustment, ConditionEvaluation evaluation) {
        return String.format(Locale.ROOT, "sleep pattern: %+dmin; conditions: %s",
                             sleepAdjustment, evaluation.summary());
    }

    /**
     * Wraps one collaborator call: synchronous throws become error signals, the call is
     * bounded by the collaborator timeout, and foreign exceptions are mapped into the
     * engine's taxonomy.
     */
    private <T> Mono<T> bounded(String collaborator, Supplier<Mono<T>> call) {
        return Mono.defer(call)
            .timeout(collaboratorTimeout)
            .onErrorMap(TimeoutException.class,
                e -> new CollaboratorTimeoutException(collaborator, collaboratorTimeout, e))
            .onErrorMap(e -> !(e instanceof WakeEngineException),
                e -> new CollaboratorUnavailableException(collaborator, String.valueOf(e.getMessage()), e));
    }
}
