package com.wakeengine.service.repository;

import com.wakeengine.service.model.AlarmEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.LocalTime;

@Repository
public interface AlarmRepository extends ReactiveCrudRepository<AlarmEntity, String> {

    @Query("SELECT * FROM alarms ORDER BY created_at ASC")
    Flux<AlarmEntity> findAllOrderByCreatedAt();

    /**
     * Inserts the alarm or overwrites every mutable column. {@code created_at}
     * keeps its first value.
     */
    @Modifying
    @Query("""
        INSERT INTO alarms
            (id, label, baseline_time, target_time, wake_window, enabled,
             real_time_adaptation, dynamic_wake_window, sleep_pattern_weight, learning_factor,
             created_at, updated_at)
        VALUES
            (:id, :label, :baselineTime, :targetTime, :wakeWindow, :enabled,
             :realTimeAdaptation, :dynamicWakeWindow, :sleepPatternWeight, :learningFactor,
             :createdAt, :updatedAt)
        ON CONFLICT (id) DO UPDATE SET
            label                = :label,
            baseline_time        = :baselineTime,
            target_time          = :targetTime,
            wake_window          = :wakeWindow,
            enabled              = :enabled,
            real_time_adaptation = :realTimeAdaptation,
            dynamic_wake_window  = :dynamicWakeWindow,
            sleep_pattern_weight = :sleepPatternWeight,
            learning_factor      = :learningFactor,
            updated_at           = :updatedAt
        """)
    Mono<Void> upsertAlarm(String id, String label, LocalTime baselineTime, LocalTime targetTime,
                           int wakeWindow, boolean enabled,
                           boolean realTimeAdaptation, boolean dynamicWakeWindow,
                           double sleepPatternWeight, double learningFactor,
                           LocalDateTime createdAt, LocalDateTime updatedAt);
}
