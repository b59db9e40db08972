package com.wakeengine.common.spi;

import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.WakeUpFeedback;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for alarms and their condition catalogs, adaptation history and feedback.
 *
 * <p>Adaptation records and feedback are append-only; the only in-place change to
 * a record is filling in its effectiveness once, and a record is only removed by the
 * tick that appended it when that tick was cancelled before it committed. Reads
 * return entries in the order they were appended.
 */
public interface WakeStorage {

    Mono<Alarm> saveAlarm(Alarm alarm);

    Flux<Alarm> findAllAlarms();

    /** Inserts or replaces a condition by {@code (alarmId, condition.id)}. */
    Mono<ConditionDefinition> saveCondition(String alarmId, ConditionDefinition condition);

    Flux<ConditionDefinition> findConditions(String alarmId);

    Mono<AdaptationRecord> appendAdaptation(AdaptationRecord record);

    Mono<Void> removeAdaptation(String recordId);

    Mono<Void> updateAdaptationEffectiveness(String recordId, double effectiveness);

    Flux<AdaptationRecord> findAdaptations(String alarmId);

    Mono<WakeUpFeedback> appendFeedback(String alarmId, WakeUpFeedback feedback);

    Flux<WakeUpFeedback> findFeedback(String alarmId);
}
