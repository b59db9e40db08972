package com.wakeengine.common.exception;

import java.time.Duration;

/**
 * An external collaborator did not answer within its timeout.
 */
public class CollaboratorTimeoutException extends CollaboratorUnavailableException {

    private final Duration timeout;

    public CollaboratorTimeoutException(String collaborator, Duration timeout, Throwable cause) {
        super(collaborator, "no response within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
