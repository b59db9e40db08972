package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * One applied change of an alarm's target time.
 *
 * <p>{@code originalTime} is the alarm's baseline and {@code adjustedTime} the
 * new target, so their minutes-of-day difference is exactly the applied shift.
 * Records are append-only; {@code effectiveness} is the single field filled in
 * later, once, by wake-up feedback for the same day.
 */
public record AdaptationRecord(
    @JsonProperty("id")            String           id,
    @JsonProperty("alarmId")       String           alarmId,
    @JsonProperty("recordedAt")    LocalDateTime    recordedAt,
    @JsonProperty("originalTime")  LocalTime        originalTime,
    @JsonProperty("adjustedTime")  LocalTime        adjustedTime,
    @JsonProperty("reason")        String           reason,
    @JsonProperty("source")        AdaptationSource source,
    @JsonProperty("confidence")    double           confidence,
    @JsonProperty("effectiveness") Double           effectiveness
) {

    public AdaptationRecord withEffectiveness(double value) {
        return new AdaptationRecord(id, alarmId, recordedAt, originalTime, adjustedTime,
                                    reason, source, confidence, value);
    }
}
