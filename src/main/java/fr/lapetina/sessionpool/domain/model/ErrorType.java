package fr.lapetina.sessionpool.domain.model;

/**
 * Error taxonomy for generation requests and pool operations.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Pool is at its hard worker cap */
    POOL_EXHAUSTED,

    /** Identity flow failed after all attempts, or a worker lost its session */
    AUTHENTICATION_ERROR,

    /** Target surface never showed the working indicator, even after reloads */
    SESSION_STUCK,

    /** A control could not be found or activated after its retries */
    ELEMENT_NOT_FOUND,

    /** The artifact was not delivered within the artifact timeout */
    ARTIFACT_TIMEOUT,

    /** Saving or uploading the artifact failed */
    UPLOAD_ERROR,

    /** The session manager is not started or already shut down */
    QUEUE_NOT_RUNNING,

    /** Request was cancelled by a caller or by worker removal */
    CANCELLED,

    /** Internal system error */
    INTERNAL_ERROR
}
