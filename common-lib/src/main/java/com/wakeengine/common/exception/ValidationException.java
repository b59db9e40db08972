package com.wakeengine.common.exception;

import java.util.List;

/**
 * A condition definition, alarm config or feedback entry broke an invariant.
 * Surfaces synchronously to the caller.
 */
public class ValidationException extends WakeEngineException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
