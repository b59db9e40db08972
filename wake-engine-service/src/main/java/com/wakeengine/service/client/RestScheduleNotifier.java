package com.wakeengine.service.client;

import com.wakeengine.common.spi.ScheduleNotifier;
import com.wakeengine.service.dto.ScheduleChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalTime;

/**
 * REST-based implementation of {@link ScheduleNotifier}.
 *
 * <p>Posts a {@link ScheduleChangeEvent} to the notifier service (fire-and-forget).
 * No reactor thread is ever blocked and a failed delivery is only logged.
 */
@Component
public class RestScheduleNotifier implements ScheduleNotifier {

    private static final Logger log = LoggerFactory.getLogger(RestScheduleNotifier.class);

    private final WebClient notifierClient;

    public RestScheduleNotifier(WebClient notifierClient) {
        this.notifierClient = notifierClient;
    }

    @Override
    public void onScheduleChanged(String alarmId, LocalTime newTime, double confidence, String reason) {
        notifierClient.post()
            .uri("/api/v1/notify/schedule-change")
            .bodyValue(new ScheduleChangeEvent(alarmId, newTime, confidence, reason))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Schedule change published. alarmId={} newTime={} status={}",
                                alarmId, newTime, r.getStatusCode()),
                err -> log.warn("Schedule change publish failed (non-critical). alarmId={}", alarmId, err)
            );
    }
}
