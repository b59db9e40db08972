package com.wakeengine.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakeengine.common.exception.CollaboratorUnavailableException;
import com.wakeengine.common.exception.WakeEngineException;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.common.spi.WakeStorage;
import com.wakeengine.service.model.AdaptationRecordEntity;
import com.wakeengine.service.model.ConditionDefinitionEntity;
import com.wakeengine.service.repository.AdaptationRecordRepository;
import com.wakeengine.service.repository.AlarmRepository;
import com.wakeengine.service.repository.ConditionDefinitionRepository;
import com.wakeengine.service.repository.WakeUpFeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * PostgreSQL-backed {@link WakeStorage} on Spring Data R2DBC.
 *
 * <p>Alarms, conditions and adaptation records carry engine-assigned ids and are
 * written through explicit upsert/insert queries; feedback rows use a database
 * sequence and plain {@code save()}.
 */
@Component
public class R2dbcWakeStorage implements WakeStorage {

    private static final Logger log = LoggerFactory.getLogger(R2dbcWakeStorage.class);

    private final AlarmRepository alarmRepository;
    private final ConditionDefinitionRepository conditionRepository;
    private final AdaptationRecordRepository adaptationRepository;
    private final WakeUpFeedbackRepository feedbackRepository;
    private final EntityMapper mapper;
    private final Clock clock;

    public R2dbcWakeStorage(AlarmRepository alarmRepository,
                            ConditionDefinitionRepository conditionRepository,
                            AdaptationRecordRepository adaptationRepository,
                            WakeUpFeedbackRepository feedbackRepository,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.alarmRepository      = alarmRepository;
        this.conditionRepository  = conditionRepository;
        this.adaptationRepository = adaptationRepository;
        this.feedbackRepository   = feedbackRepository;
        this.mapper               = new EntityMapper(objectMapper);
        this.clock                = clock;
    }

    @Override
    public Mono<Alarm> saveAlarm(Alarm alarm) {
        return Mono.fromCallable(() -> mapper.toEntity(alarm))
            .flatMap(e -> alarmRepository.upsertAlarm(e.getId(), e.getLabel(), e.getBaselineTime(),
                e.getTargetTime(), e.getWakeWindow(), e.isEnabled(),
                e.isRealTimeAdaptation(), e.isDynamicWakeWindow(),
                e.getSleepPatternWeight(), e.getLearningFactor(),
                e.getCreatedAt(), e.getUpdatedAt()))
            .doOnSuccess(v -> log.debug("Alarm saved. alarmId={} target={}", alarm.id(), alarm.targetTime()))
            .thenReturn(alarm)
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    @Override
    public Flux<Alarm> findAllAlarms() {
        return alarmRepository.findAllOrderByCreatedAt().map(mapper::toDomain);
    }

    @Override
    public Mono<ConditionDefinition> saveCondition(String alarmId, ConditionDefinition condition) {
        return Mono.fromCallable(() -> mapper.toEntity(alarmId, condition))
            .flatMap(this::upsert)
            .thenReturn(condition)
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    private Mono<Void> upsert(ConditionDefinitionEntity e) {
        return conditionRepository.upsertCondition(e.getAlarmId(), e.getConditionId(), e.getType(),
            e.isEnabled(), e.getPriority(), e.getTriggerOperator(), e.getTriggerValue(),
            e.getTriggerThreshold(), e.getAdjustmentMinutes(), e.getMaxAdjustment(), e.getReason(),
            e.getEffectivenessScore(), e.getLastTriggered());
    }

    @Override
    public Flux<ConditionDefinition> findConditions(String alarmId) {
        return conditionRepository.findByAlarmId(alarmId).map(mapper::toDomain);
    }

    @Override
    public Mono<AdaptationRecord> appendAdaptation(AdaptationRecord record) {
        AdaptationRecordEntity e = mapper.toEntity(record);
        return adaptationRepository.insertRecord(e.getId(), e.getAlarmId(), e.getRecordedAt(),
                e.getOriginalTime(), e.getAdjustedTime(), e.getReason(), e.getSource(),
                e.getConfidence(), e.getEffectiveness())
            .thenReturn(record)
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    @Override
    public Mono<Void> removeAdaptation(String recordId) {
        return adaptationRepository.deleteById(recordId)
            .doOnSuccess(v -> log.debug("Adaptation record removed. recordId={}", recordId))
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    @Override
    public Mono<Void> updateAdaptationEffectiveness(String recordId, double effectiveness) {
        return adaptationRepository.updateEffectiveness(recordId, effectiveness)
            .doOnNext(rows -> {
                if (rows == 0) {
                    log.debug("Adaptation record already scored. recordId={}", recordId);
                }
            })
            .then()
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    @Override
    public Flux<AdaptationRecord> findAdaptations(String alarmId) {
        return adaptationRepository.findByAlarmIdOrderByRecordedAt(alarmId).map(mapper::toDomain);
    }

    @Override
    public Mono<WakeUpFeedback> appendFeedback(String alarmId, WakeUpFeedback feedback) {
        LocalDateTime savedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        return feedbackRepository.save(mapper.toEntity(alarmId, feedback, savedAt))
            .thenReturn(feedback)
            .onErrorMap(R2dbcWakeStorage::isForeign, R2dbcWakeStorage::storageFailure);
    }

    @Override
    public Flux<WakeUpFeedback> findFeedback(String alarmId) {
        return feedbackRepository.findByAlarmId(alarmId).map(mapper::toDomain);
    }

    private static boolean isForeign(Throwable e) {
        return !(e instanceof WakeEngineException);
    }

    private static Throwable storageFailure(Throwable e) {
        return new CollaboratorUnavailableException("storage", String.valueOf(e.getMessage()), e);
    }
}
