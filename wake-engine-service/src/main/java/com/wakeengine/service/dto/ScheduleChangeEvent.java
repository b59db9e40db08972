package com.wakeengine.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;

/**
 * Body posted to the notifier when an alarm's target time moves.
 */
public record ScheduleChangeEvent(
    @JsonProperty("alarmId")    String    alarmId,
    @JsonProperty("newTime")    LocalTime newTime,
    @JsonProperty("confidence") double    confidence,
    @JsonProperty("reason")     String    reason
) {}
