package com.wakeengine.service.engine;

import com.wakeengine.common.exception.NotFoundException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the live state of every known alarm. All engine operations resolve alarms here.
 */
@Component
public class AlarmRegistry {

    private final Map<String, AlarmState> alarms = new ConcurrentHashMap<>();

    public void register(AlarmState state) {
        AlarmState previous = alarms.put(state.alarmId(), state);
        if (previous != null && previous != state) {
            previous.close();
        }
    }

    /**
     * @throws NotFoundException when the alarm is unknown
     */
    public AlarmState get(String alarmId) {
        AlarmState state = alarms.get(alarmId);
        if (state == null) throw NotFoundException.alarm(alarmId);
        return state;
    }

    public Collection<AlarmState> all() {
        return List.copyOf(alarms.values());
    }
}
