package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when a control could not be found or activated within its retry budget.
 */
public final class ElementNotFoundException extends SessionPoolException {

    public ElementNotFoundException(String message) {
        super(ErrorType.ELEMENT_NOT_FOUND, message);
    }

    public ElementNotFoundException(String message, Throwable cause) {
        super(ErrorType.ELEMENT_NOT_FOUND, message, cause);
    }
}
