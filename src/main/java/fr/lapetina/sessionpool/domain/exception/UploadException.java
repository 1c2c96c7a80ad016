package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when an artifact cannot be saved locally or handed to the uploader.
 */
public final class UploadException extends SessionPoolException {

    public UploadException(String message) {
        super(ErrorType.UPLOAD_ERROR, message);
    }

    public UploadException(String message, Throwable cause) {
        super(ErrorType.UPLOAD_ERROR, message, cause);
    }
}
