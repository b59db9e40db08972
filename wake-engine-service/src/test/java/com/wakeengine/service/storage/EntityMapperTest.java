package com.wakeengine.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wakeengine.common.condition.ConditionPresets;
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
import com.wakeengine.service.model.ConditionDefinitionEntity;
import com.wakeengine.service.model.WakeUpFeedbackEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityMapperTest {

    private static final LocalDateTime AT = LocalDateTime.of(2026, 3, 2, 5, 45, 12, 345_000_000);

    private final EntityMapper mapper = new EntityMapper(objectMapper());

    private static ObjectMapper objectMapper() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return om;
    }

    @Nested
    @DisplayName("condition definitions")
    class Conditions {

        @Test
        @DisplayName("preset with text trigger → entity → same definition")
        void textTrigger() {
            ConditionDefinition def = ConditionPresets.WEATHER_RAIN.withLastTriggered(AT);

            ConditionDefinitionEntity entity = mapper.toEntity("alarm-1", def);

            assertEquals("alarm-1", entity.getAlarmId());
            assertEquals("weather", entity.getType());
            assertEquals("contains", entity.getTriggerOperator());
            assertEquals("\"rain\"", entity.getTriggerValue());
            assertEquals(def, mapper.toDomain(entity));
        }

        @Test
        @DisplayName("numeric threshold keeps its number kind")
        void numericTrigger() {
            ConditionDefinition def = ConditionPresets.SLEEP_DEBT_HIGH;

            ConditionDefinition back = mapper.toDomain(mapper.toEntity("alarm-1", def));

            assertEquals(def, back);
            assertTrue(back.trigger().value().isNumber());
            assertEquals(60.0, back.trigger().threshold(), 1e-9);
        }

        @Test
        @DisplayName("tag-list trigger survives the JSON column")
        void listTrigger() {
            ConditionDefinition def = new ConditionDefinition("gym_days", ConditionType.CALENDAR, false, 2,
                new ConditionTrigger(PredicateOperator.EQUALS, ReadingValue.textList(List.of("gym", "early")), null),
                new ConditionAdjustment(-20, 30, "Gym before work"), 0.55, null);

            ConditionDefinition back = mapper.toDomain(mapper.toEntity("alarm-1", def));

            assertEquals(def, back);
            assertEquals(ReadingValue.Kind.TEXT_LIST, back.trigger().value().kind());
        }
    }

    @Test
    @DisplayName("adaptation record with and without effectiveness")
    void adaptationRecord() {
        AdaptationRecord open = new AdaptationRecord("rec-1", "alarm-1", AT, LocalTime.of(7, 0),
            LocalTime.of(6, 49), "sleep pattern: -12min; conditions: weather: -10.0min",
            AdaptationSource.SLEEP_PATTERN, 1.0, null);

        assertEquals(open, mapper.toDomain(mapper.toEntity(open)));
        assertEquals("sleep_pattern", mapper.toEntity(open).getSource());
        AdaptationRecord scored = open.withEffectiveness(0.4);
        assertEquals(scored, mapper.toDomain(mapper.toEntity(scored)));
    }

    @Test
    @DisplayName("alarm flattens and restores its settings")
    void alarm() {
        Alarm alarm = new Alarm("alarm-1", "Work", LocalTime.of(7, 0), LocalTime.of(6, 49), 30, true,
            new AdaptationSettings(false, true, 0.6, 0.2), AT, AT.plusMinutes(5));

        assertEquals(alarm, mapper.toDomain(mapper.toEntity(alarm)));
    }

    @Test
    @DisplayName("feedback keeps enum keys and optional notes")
    void feedback() {
        WakeUpFeedback fb = new WakeUpFeedback(LocalDate.of(2026, 3, 2), LocalTime.of(7, 0),
            LocalTime.of(7, 12), WakeDifficulty.HARD, WakeFeeling.TIRED, 5, 20, true, false, null);

        WakeUpFeedbackEntity entity = mapper.toEntity("alarm-1", fb, AT);

        assertEquals("hard", entity.getDifficulty());
        assertEquals(fb, mapper.toDomain(entity));
    }
}
