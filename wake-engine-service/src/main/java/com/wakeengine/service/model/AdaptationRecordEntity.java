package com.wakeengine.service.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Append-only adaptation history. {@code effectiveness} stays null until
 * same-day wake-up feedback arrives.
 */
@Data
@NoArgsConstructor
@Table("adaptation_records")
public class AdaptationRecordEntity {

    @Id
    private String id;

    private String alarmId;
    private LocalDateTime recordedAt;
    private LocalTime originalTime;
    private LocalTime adjustedTime;
    private String reason;
    private String source;
    private double confidence;
    private Double effectiveness;
}
