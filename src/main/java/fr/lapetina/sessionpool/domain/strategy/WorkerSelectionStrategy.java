package fr.lapetina.sessionpool.domain.strategy;

import fr.lapetina.sessionpool.domain.model.WorkerSession;

import java.util.Collection;
import java.util.Optional;

/**
 * Strategy for choosing which worker receives a newly submitted request.
 *
 * Called while the pool lock is held, so implementations read worker state
 * directly and must not block.
 */
public interface WorkerSelectionStrategy {

    /**
     * Returns the name of this strategy for logging.
     */
    String getName();

    /**
     * Selects a worker for new work.
     *
     * @param workers all registered workers, in registration order
     * @return selected worker, or empty if none can take work
     */
    Optional<WorkerSession> select(Collection<WorkerSession> workers);
}
