package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when no artifact is delivered before the artifact timeout elapses.
 */
public final class ArtifactTimeoutException extends SessionPoolException {

    public ArtifactTimeoutException(String message) {
        super(ErrorType.ARTIFACT_TIMEOUT, message);
    }

    public ArtifactTimeoutException(String message, Throwable cause) {
        super(ErrorType.ARTIFACT_TIMEOUT, message, cause);
    }
}
