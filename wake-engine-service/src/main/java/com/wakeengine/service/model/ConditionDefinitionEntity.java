package com.wakeengine.service.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One condition of one alarm, unique on {@code (alarm_id, condition_id)}.
 *
 * triggerValue: JSON-serialised {@link com.wakeengine.common.model.ReadingValue}
 *                (number, text, text list or flag)
 */
@Data
@NoArgsConstructor
@Table("alarm_conditions")
public class ConditionDefinitionEntity {

    @Id
    private Long id;

    private String alarmId;
    private String conditionId;

    /** {@link com.wakeengine.common.model.ConditionType#key()} */
    private String type;
    private boolean enabled;
    private int priority;

    private String triggerOperator;
    private String triggerValue;
    private Double triggerThreshold;

    private int adjustmentMinutes;
    private int maxAdjustment;
    private String reason;

    private double effectivenessScore;
    private LocalDateTime lastTriggered;
}
