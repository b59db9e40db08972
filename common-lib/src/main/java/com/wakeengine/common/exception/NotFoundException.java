package com.wakeengine.common.exception;

public class NotFoundException extends WakeEngineException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id   = id;
    }

    public static NotFoundException alarm(String alarmId) {
        return new NotFoundException("alarm", alarmId);
    }

    public static NotFoundException condition(String conditionId) {
        return new NotFoundException("condition", conditionId);
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
