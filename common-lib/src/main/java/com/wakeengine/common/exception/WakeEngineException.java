package com.wakeengine.common.exception;

/**
 * Root of the engine's exception taxonomy. All subtypes are unchecked.
 */
public class WakeEngineException extends RuntimeException {

    public WakeEngineException(String message) {
        super(message);
    }

    public WakeEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
