package com.wakeengine.service.repository;

import com.wakeengine.service.model.WakeUpFeedbackEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface WakeUpFeedbackRepository extends ReactiveCrudRepository<WakeUpFeedbackEntity, Long> {

    @Query("SELECT * FROM wake_up_feedback WHERE alarm_id = :alarmId ORDER BY id ASC")
    Flux<WakeUpFeedbackEntity> findByAlarmId(String alarmId);
}
