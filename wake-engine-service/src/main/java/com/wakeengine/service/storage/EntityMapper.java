package com.wakeengine.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakeengine.common.exception.CollaboratorUnavailableException;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.AdaptationSettings;
import com.wakeengine.common.model.AdaptationSource;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionAdjustment;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionTrigger;
import com.wakeengine.common.model.ConditionType;
import com.wakeengine.common.model.PredicateOperator;
import com.wakeengine.common.model.ReadingValue;
import com.wakeengine.common.model.WakeDifficulty;
import com.wakeengine.common.model.WakeFeeling;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.service.model.AdaptationRecordEntity;
import com.wakeengine.service.model.AlarmEntity;
import com.wakeengine.service.model.ConditionDefinitionEntity;
import com.wakeengine.service.model.WakeUpFeedbackEntity;

import java.time.LocalDateTime;

/**
 * Converts between domain records and their R2DBC entities.
 *
 * Column mapping notes:
 *   AdaptationSettings   → four flat alarm columns
 *   ConditionTrigger     → trigger_operator / trigger_value (JSON) / trigger_threshold
 *   ConditionAdjustment  → adjustment_minutes / max_adjustment / reason
 *   enums                → their lowercase wire key
 */
public final class EntityMapper {

    private final ObjectMapper objectMapper;

    public EntityMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── alarm ─────────────────────────────────────────────────────────────────

    public AlarmEntity toEntity(Alarm alarm) {
        AlarmEntity entity = new AlarmEntity();
        entity.setId(alarm.id());
        entity.setLabel(alarm.label());
        entity.setBaselineTime(alarm.baselineTime());
        entity.setTargetTime(alarm.targetTime());
        entity.setWakeWindow(alarm.wakeWindow());
        entity.setEnabled(alarm.enabled());
        AdaptationSettings settings = alarm.settings();
        entity.setRealTimeAdaptation(settings.realTimeAdaptation());
        entity.setDynamicWakeWindow(settings.dynamicWakeWindow());
        entity.setSleepPatternWeight(settings.sleepPatternWeight());
        entity.setLearningFactor(settings.learningFactor());
        entity.setCreatedAt(alarm.createdAt());
        entity.setUpdatedAt(alarm.updatedAt());
        return entity;
    }

    public Alarm toDomain(AlarmEntity entity) {
        AdaptationSettings settings = new AdaptationSettings(
            entity.isRealTimeAdaptation(), entity.isDynamicWakeWindow(),
            entity.getSleepPatternWeight(), entity.getLearningFactor());
        return new Alarm(entity.getId(), entity.getLabel(), entity.getBaselineTime(), entity.getTargetTime(),
            entity.getWakeWindow(), entity.isEnabled(), settings, entity.getCreatedAt(), entity.getUpdatedAt());
    }

    // ── condition ─────────────────────────────────────────────────────────────

    public ConditionDefinitionEntity toEntity(String alarmId, ConditionDefinition def) {
        ConditionDefinitionEntity entity = new ConditionDefinitionEntity();
        entity.setAlarmId(alarmId);
        entity.setConditionId(def.id());
        entity.setType(def.type().key());
        entity.setEnabled(def.enabled());
        entity.setPriority(def.priority());
        ConditionTrigger trigger = def.trigger();
        entity.setTriggerOperator(trigger.operator().key());
        entity.setTriggerValue(writeJson(trigger.value()));
        entity.setTriggerThreshold(trigger.threshold());
        ConditionAdjustment adjustment = def.adjustment();
        entity.setAdjustmentMinutes(adjustment.minutes());
        entity.setMaxAdjustment(adjustment.maxAdjustment());
        entity.setReason(adjustment.reason());
        entity.setEffectivenessScore(def.effectivenessScore());
        entity.setLastTriggered(def.lastTriggered());
        return entity;
    }

    public ConditionDefinition toDomain(ConditionDefinitionEntity entity) {
        ReadingValue value = entity.getTriggerValue() == null
            ? null
            : readJson(entity.getTriggerValue());
        ConditionTrigger trigger = new ConditionTrigger(
            PredicateOperator.fromKey(entity.getTriggerOperator()), value, entity.getTriggerThreshold());
        ConditionAdjustment adjustment = new ConditionAdjustment(
            entity.getAdjustmentMinutes(), entity.getMaxAdjustment(), entity.getReason());
        return new ConditionDefinition(entity.getConditionId(), ConditionType.fromKey(entity.getType()),
            entity.isEnabled(), entity.getPriority(), trigger, adjustment,
            entity.getEffectivenessScore(), entity.getLastTriggered());
    }

    // ── adaptation record ─────────────────────────────────────────────────────

    public AdaptationRecordEntity toEntity(AdaptationRecord record) {
        AdaptationRecordEntity entity = new AdaptationRecordEntity();
        entity.setId(record.id());
        entity.setAlarmId(record.alarmId());
        entity.setRecordedAt(record.recordedAt());
        entity.setOriginalTime(record.originalTime());
        entity.setAdjustedTime(record.adjustedTime());
        entity.setReason(record.reason());
        entity.setSource(record.source().key());
        entity.setConfidence(record.confidence());
        entity.setEffectiveness(record.effectiveness());
        return entity;
    }

    public AdaptationRecord toDomain(AdaptationRecordEntity entity) {
        return new AdaptationRecord(entity.getId(), entity.getAlarmId(), entity.getRecordedAt(),
            entity.getOriginalTime(), entity.getAdjustedTime(), entity.getReason(),
            AdaptationSource.fromKey(entity.getSource()), entity.getConfidence(), entity.getEffectiveness());
    }

    // ── feedback ──────────────────────────────────────────────────────────────

    public WakeUpFeedbackEntity toEntity(String alarmId, WakeUpFeedback feedback, LocalDateTime savedAt) {
        WakeUpFeedbackEntity entity = new WakeUpFeedbackEntity();
        entity.setAlarmId(alarmId);
        entity.setFeedbackDate(feedback.date());
        entity.setOriginalTime(feedback.originalTime());
        entity.setActualWakeTime(feedback.actualWakeTime());
        entity.setDifficulty(feedback.difficulty().key());
        entity.setFeeling(feedback.feeling().key());
        entity.setSleepQuality(feedback.sleepQuality());
        entity.setTimeToFullyAwake(feedback.timeToFullyAwake());
        entity.setWouldPreferEarlier(feedback.wouldPreferEarlier());
        entity.setWouldPreferLater(feedback.wouldPreferLater());
        entity.setNotes(feedback.notes());
        entity.setSavedAt(savedAt);
        return entity;
    }

    public WakeUpFeedback toDomain(WakeUpFeedbackEntity entity) {
        return new WakeUpFeedback(entity.getFeedbackDate(), entity.getOriginalTime(), entity.getActualWakeTime(),
            WakeDifficulty.fromKey(entity.getDifficulty()), WakeFeeling.fromKey(entity.getFeeling()),
            entity.getSleepQuality(), entity.getTimeToFullyAwake(),
            entity.isWouldPreferEarlier(), entity.isWouldPreferLater(), entity.getNotes());
    }

    // ── json ──────────────────────────────────────────────────────────────────

    private String writeJson(ReadingValue value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CollaboratorUnavailableException("storage", "cannot serialise trigger value " + value, e);
        }
    }

    private ReadingValue readJson(String json) {
        try {
            return objectMapper.readValue(json, ReadingValue.class);
        } catch (JsonProcessingException e) {
            throw new CollaboratorUnavailableException("storage", "cannot read trigger value " + json, e);
        }
    }
}
