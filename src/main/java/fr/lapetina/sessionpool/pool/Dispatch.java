package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.WorkerSession;

/**
 * A job that was moved to PROCESSING on a worker and is ready to run.
 */
public record Dispatch(WorkerSession worker, GenerationRequest request) {
}
