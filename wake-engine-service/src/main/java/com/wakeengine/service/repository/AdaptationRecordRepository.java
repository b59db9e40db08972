package com.wakeengine.service.repository;

import com.wakeengine.service.model.AdaptationRecordEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.LocalTime;

@Repository
public interface AdaptationRecordRepository extends ReactiveCrudRepository<AdaptationRecordEntity, String> {

    @Query("SELECT * FROM adaptation_records WHERE alarm_id = :alarmId ORDER BY recorded_at ASC")
    Flux<AdaptationRecordEntity> findByAlarmIdOrderByRecordedAt(String alarmId);

    @Modifying
    @Query("""
        INSERT INTO adaptation_records
            (id, alarm_id, recorded_at, original_time, adjusted_time,
             reason, source, confidence, effectiveness)
        VALUES
            (:id, :alarmId, :recordedAt, :originalTime, :adjustedTime,
             :reason, :source, :confidence, :effectiveness)
        """)
    Mono<Void> insertRecord(String id, String alarmId, LocalDateTime recordedAt,
                            LocalTime originalTime, LocalTime adjustedTime,
                            String reason, String source, double confidence, Double effectiveness);

    /** Fills in effectiveness once; an already-scored record is left alone. */
    @Modifying
    @Query("""
        UPDATE adaptation_records
        SET effectiveness = :effectiveness
        WHERE id = :id
          AND effectiveness IS NULL
        """)
    Mono<Integer> updateEffectiveness(String id, double effectiveness);
}
