package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Base class for failures raised by the pool, its workers and the job flow.
 * Each subclass maps onto one {@link ErrorType} recorded on the failed request.
 */
public class SessionPoolException extends RuntimeException {

    private final ErrorType errorType;

    public SessionPoolException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SessionPoolException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
