package com.wakeengine.service.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Persisted alarm. The id is assigned by the engine, so rows are written with
 * an upsert rather than {@code save()}.
 *
 * <p>{@link com.wakeengine.common.model.AdaptationSettings} is flattened into the
 * four {@code realTimeAdaptation .. learningFactor} columns.
 */
@Data
@NoArgsConstructor
@Table("alarms")
public class AlarmEntity {

    @Id
    private String id;

    private String label;

    private LocalTime baselineTime;
    private LocalTime targetTime;
    private int wakeWindow;
    private boolean enabled;

    private boolean realTimeAdaptation;
    private boolean dynamicWakeWindow;
    private double sleepPatternWeight;
    private double learningFactor;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
