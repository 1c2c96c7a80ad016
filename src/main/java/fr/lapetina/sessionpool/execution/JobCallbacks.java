package fr.lapetina.sessionpool.execution;

import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.WorkerSession;

/**
 * Worker bookkeeping the executor reports to.
 */
public interface JobCallbacks {

    /**
     * Called exactly once per executed job, whatever its outcome. Settles the worker's
     * statistics and state, then publishes the outcome on the request.
     *
     * @return false if the request had already left PROCESSING and keeps its state
     */
    boolean completeJob(WorkerSession worker, GenerationRequest request, JobOutcome outcome);

    /**
     * Called when the worker's session can no longer be trusted.
     */
    void markError(WorkerSession worker);
}
