package com.wakeengine.service.support;

import com.wakeengine.common.exception.CollaboratorUnavailableException;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.common.spi.WakeStorage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link WakeStorage} over plain maps. The {@code fail*Writes} switches make those
 * writes fail; {@link #adaptationWriteDelay}
 * holds every adaptation append open, so other operations can run while a tick is
 * writing.
 */
public class InMemoryWakeStorage implements WakeStorage {

    private final Map<String, Alarm> alarms = new LinkedHashMap<>();
    private final Map<String, Map<String, ConditionDefinition>> conditions = new LinkedHashMap<>();
    private final List<AdaptationRecord> adaptations = new ArrayList<>();
    private final Map<String, List<WakeUpFeedback>> feedback = new LinkedHashMap<>();

    public volatile boolean  failAlarmWrites;
    public volatile boolean  failAdaptationWrites;
    public volatile boolean  failConditionWrites;
    public volatile Duration adaptationWriteDelay = Duration.ZERO;

    @Override
    public synchronized Mono<Alarm> saveAlarm(Alarm alarm) {
        if (failAlarmWrites) {
            return Mono.error(new CollaboratorUnavailableException("storage", "write rejected"));
        }
        alarms.put(alarm.id(), alarm);
        return Mono.just(alarm);
    }

    @Override
    public synchronized Flux<Alarm> findAllAlarms() {
        return Flux.fromIterable(new ArrayList<>(alarms.values()));
    }

    @Override
    public synchronized Mono<ConditionDefinition> saveCondition(String alarmId, ConditionDefinition condition) {
        if (failConditionWrites) {
            return Mono.error(new CollaboratorUnavailableException("storage", "write rejected"));
        }
        conditions.computeIfAbsent(alarmId, k -> new LinkedHashMap<>()).put(condition.id(), condition);
        return Mono.just(condition);
    }

    @Override
    public synchronized Flux<ConditionDefinition> findConditions(String alarmId) {
        return Flux.fromIterable(new ArrayList<>(conditions.getOrDefault(alarmId, Map.of()).values()));
    }

    @Override
    public synchronized Mono<AdaptationRecord> appendAdaptation(AdaptationRecord record) {
        if (failAdaptationWrites) {
            return Mono.error(new CollaboratorUnavailableException("storage", "write rejected"));
        }
        if (adaptationWriteDelay.isZero()) {
            adaptations.add(record);
            return Mono.just(record);
        }
        return Mono.delay(adaptationWriteDelay)
            .then(Mono.fromCallable(() -> {
                synchronized (this) {
                    adaptations.add(record);
                }
                return record;
            }));
    }

    @Override
    public synchronized Mono<Void> removeAdaptation(String recordId) {
        adaptations.removeIf(r -> r.id().equals(recordId));
        return Mono.empty();
    }

    @Override
    public synchronized Mono<Void> updateAdaptationEffectiveness(String recordId, double effectiveness) {
        adaptations.replaceAll(r -> r.id().equals(recordId) && r.effectiveness() == null
            ? r.withEffectiveness(effectiveness)
            : r);
        return Mono.empty();
    }

    @Override
    public synchronized Flux<AdaptationRecord> findAdaptations(String alarmId) {
        return Flux.fromIterable(adaptations.stream().filter(r -> r.alarmId().equals(alarmId)).toList());
    }

    @Override
    public synchronized Mono<WakeUpFeedback> appendFeedback(String alarmId, WakeUpFeedback entry) {
        feedback.computeIfAbsent(alarmId, k -> new ArrayList<>()).add(entry);
        return Mono.just(entry);
    }

    @Override
    public synchronized Flux<WakeUpFeedback> findFeedback(String alarmId) {
        return Flux.fromIterable(new ArrayList<>(feedback.getOrDefault(alarmId, List.of())));
    }

    public synchronized Alarm storedAlarm(String alarmId) {
        return alarms.get(alarmId);
    }

    public synchronized ConditionDefinition storedCondition(String alarmId, String conditionId) {
        return conditions.getOrDefault(alarmId, Map.of()).get(conditionId);
    }

    public synchronized List<AdaptationRecord> storedAdaptations() {
        return List.copyOf(adaptations);
    }

    public synchronized List<WakeUpFeedback> storedFeedback(String alarmId) {
        return List.copyOf(feedback.getOrDefault(alarmId, List.of()));
    }
}
