package fr.lapetina.sessionpool.domain.model;

/**
 * Lifecycle status of a generation request.
 *
 * PENDING -> PROCESSING -> COMPLETED | FAILED
 * PENDING | PROCESSING -> CANCELLED
 */
public enum RequestStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
