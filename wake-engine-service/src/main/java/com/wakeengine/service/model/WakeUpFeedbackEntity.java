package com.wakeengine.service.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@NoArgsConstructor
@Table("wake_up_feedback")
public class WakeUpFeedbackEntity {

    @Id
    private Long id;

    private String alarmId;
    private LocalDate feedbackDate;
    private LocalTime originalTime;
    private LocalTime actualWakeTime;
    private String difficulty;
    private String feeling;
    private int sleepQuality;
    private int timeToFullyAwake;
    private boolean wouldPreferEarlier;
    private boolean wouldPreferLater;
    private String notes;
    private LocalDateTime savedAt;
}
