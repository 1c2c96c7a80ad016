package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when the working indicator never appears after submission, even after page reloads.
 */
public final class SessionStuckException extends SessionPoolException {

    public SessionStuckException(String message) {
        super(ErrorType.SESSION_STUCK, message);
    }

    public SessionStuckException(String message, Throwable cause) {
        super(ErrorType.SESSION_STUCK, message, cause);
    }
}
