package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when work is submitted to a session manager that is not started or already shut down.
 */
public final class QueueNotRunningException extends SessionPoolException {

    public QueueNotRunningException() {
        super(ErrorType.QUEUE_NOT_RUNNING, "Session manager is not running");
    }
}
