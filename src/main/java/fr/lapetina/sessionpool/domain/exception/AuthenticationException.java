package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when the identity flow fails after all attempts, or a worker is found unauthenticated.
 */
public final class AuthenticationException extends SessionPoolException {

    public AuthenticationException(String message) {
        super(ErrorType.AUTHENTICATION_ERROR, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(ErrorType.AUTHENTICATION_ERROR, message, cause);
    }
}
