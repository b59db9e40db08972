package com.wakeengine.service.repository;

import com.wakeengine.service.model.ConditionDefinitionEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ConditionDefinitionRepository extends ReactiveCrudRepository<ConditionDefinitionEntity, Long> {

    /** Conditions of one alarm in the order they were first stored. */
    @Query("SELECT * FROM alarm_conditions WHERE alarm_id = :alarmId ORDER BY id ASC")
    Flux<ConditionDefinitionEntity> findByAlarmId(String alarmId);

    /**
     * Atomic UPSERT on {@code (alarm_id, condition_id)}. The row keeps its surrogate
     * id, so catalog order survives edits.
     */
    @Modifying
    @Query("""
        INSERT INTO alarm_conditions
            (alarm_id, condition_id, type, enabled, priority,
             trigger_operator, trigger_value, trigger_threshold,
             adjustment_minutes, max_adjustment, reason,
             effectiveness_score, last_triggered)
        VALUES
            (:alarmId, :conditionId, :type, :enabled, :priority,
             :triggerOperator, :triggerValue, :triggerThreshold,
             :adjustmentMinutes, :maxAdjustment, :reason,
             :effectivenessScore, :lastTriggered)
        ON CONFLICT (alarm_id, condition_id) DO UPDATE SET
            type                = :type,
            enabled             = :enabled,
            priority            = :priority,
            trigger_operator    = :triggerOperator,
            trigger_value       = :triggerValue,
            trigger_threshold   = :triggerThreshold,
            adjustment_minutes  = :adjustmentMinutes,
            max_adjustment      = :maxAdjustment,
            reason              = :reason,
            effectiveness_score = :effectivenessScore,
            last_triggered      = :lastTriggered
        """)
    Mono<Void> upsertCondition(String alarmId, String conditionId, String type, boolean enabled, int priority,
                               String triggerOperator, String triggerValue, Double triggerThreshold,
                               int adjustmentMinutes, int maxAdjustment, String reason,
                               double effectivenessScore, LocalDateTime lastTriggered);
}
