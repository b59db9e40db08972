package com.wakeengine.common.exception;

/**
 * An external collaborator (sleep predictor, reading source, storage) failed or
 * returned unusable data.
 */
public class CollaboratorUnavailableException extends WakeEngineException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super("[" + collaborator + "] " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super("[" + collaborator + "] " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
