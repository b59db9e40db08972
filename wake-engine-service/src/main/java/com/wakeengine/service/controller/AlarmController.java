package com.wakeengine.service.controller;

import com.wakeengine.common.exception.ValidationException;
import com.wakeengine.common.learning.FeedbackLearner.LearningOutcome;
import com.wakeengine.common.metrics.ConditionSetupReport;
import com.wakeengine.common.metrics.SmartAlarmMetrics;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.AlarmConfig;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.OptimalTimeSlot;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.service.dto.RealTimeToggleRequest;
import com.wakeengine.service.engine.AdaptiveWakeEngine;
import com.wakeengine.service.loop.TickOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alarms")
public class AlarmController {

    private final AdaptiveWakeEngine engine;

    public AlarmController(AdaptiveWakeEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public Mono<ResponseEntity<Alarm>> create(@RequestBody AlarmConfig config) {
        return engine.createEnhancedAlarm(config)
            .map(alarm -> ResponseEntity.status(HttpStatus.CREATED).body(alarm));
    }

    @GetMapping
    public Mono<ResponseEntity<List<Alarm>>> list() {
        return engine.listAlarms().collectList().map(ResponseEntity::ok);
    }

    @GetMapping("/{alarmId}")
    public Mono<ResponseEntity<Alarm>> get(@PathVariable String alarmId) {
        return engine.getAlarm(alarmId).map(ResponseEntity::ok);
    }

    /** Runs one adaptation tick immediately. */
    @PostMapping("/{alarmId}/tick")
    public Mono<ResponseEntity<TickOutcome>> tick(@PathVariable String alarmId) {
        return engine.tickNow(alarmId).map(ResponseEntity::ok);
    }

    @GetMapping("/{alarmId}/optimal-slots")
    public Mono<ResponseEntity<List<OptimalTimeSlot>>> optimalSlots(@PathVariable String alarmId) {
        return engine.calculateOptimalTimeSlots(alarmId).map(ResponseEntity::ok);
    }

    @PostMapping("/{alarmId}/feedback")
    public Mono<ResponseEntity<LearningOutcome>> feedback(@PathVariable String alarmId,
                                                          @RequestBody WakeUpFeedback feedback) {
        return engine.recordWakeUpFeedback(alarmId, feedback).map(ResponseEntity::ok);
    }

    @GetMapping("/{alarmId}/metrics")
    public Mono<ResponseEntity<SmartAlarmMetrics>> metrics(@PathVariable String alarmId) {
        return engine.getMetrics(alarmId).map(ResponseEntity::ok);
    }

    @PutMapping("/{alarmId}/real-time-adaptation")
    public Mono<ResponseEntity<Alarm>> realTimeAdaptation(@PathVariable String alarmId,
                                                          @RequestBody RealTimeToggleRequest request) {
        return engine.setRealTimeAdaptation(alarmId, request.enabled()).map(ResponseEntity::ok);
    }

    @GetMapping("/{alarmId}/conditions")
    public Mono<ResponseEntity<List<ConditionDefinition>>> conditions(@PathVariable String alarmId) {
        return engine.listConditions(alarmId).map(ResponseEntity::ok);
    }

    @PutMapping("/{alarmId}/conditions/{conditionId}")
    public Mono<ResponseEntity<ConditionDefinition>> upsertCondition(@PathVariable String alarmId,
                                                                     @PathVariable String conditionId,
                                                                     @RequestBody ConditionDefinition definition) {
        if (definition == null || !conditionId.equals(definition.id())) {
            return Mono.error(new ValidationException(
                "condition id in path (" + conditionId + ") does not match body"));
        }
        return engine.upsertCondition(alarmId, definition).map(ResponseEntity::ok);
    }

    @GetMapping("/{alarmId}/condition-setup")
    public Mono<ResponseEntity<ConditionSetupReport>> conditionSetup(@PathVariable String alarmId) {
        return engine.getConditionSetupReport(alarmId).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
