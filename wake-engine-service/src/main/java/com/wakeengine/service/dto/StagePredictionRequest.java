package com.wakeengine.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wakeengine.common.model.SleepPattern;

import java.time.LocalTime;

public record StagePredictionRequest(
    @JsonProperty("alarmId")      String       alarmId,
    @JsonProperty("baselineTime") LocalTime    baselineTime,
    @JsonProperty("wakeWindow")   int          wakeWindow,
    @JsonProperty("sleepPattern") SleepPattern sleepPattern
) {}
