package fr.lapetina.sessionpool.domain.model;

/**
 * Status of a worker session.
 *
 * IDLE: authenticated, no job in flight
 * BUSY: running a job, or holding queued work to be picked on the next tick
 * ERROR: lost its authenticated session, waiting to be reclaimed
 * OFFLINE: being probed for reclamation or already torn down
 */
public enum WorkerStatus {
    IDLE,
    BUSY,
    ERROR,
    OFFLINE;

    /**
     * Whether new work may be assigned to a worker in this status.
     */
    public boolean isAssignable() {
        return this == IDLE || this == BUSY;
    }
}
