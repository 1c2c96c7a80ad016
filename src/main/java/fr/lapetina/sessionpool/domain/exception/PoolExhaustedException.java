package fr.lapetina.sessionpool.domain.exception;

import fr.lapetina.sessionpool.domain.model.ErrorType;

/**
 * Thrown when a worker is requested while the pool is at its hard cap.
 * Raised before any authentication is attempted.
 */
public final class PoolExhaustedException extends SessionPoolException {

    private final int maxWorkers;

    public PoolExhaustedException(int maxWorkers) {
        super(ErrorType.POOL_EXHAUSTED, "Pool exhausted: maximum of " + maxWorkers + " workers reached");
        this.maxWorkers = maxWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }
}
