package fr.lapetina.sessionpool.domain.strategy;

import fr.lapetina.sessionpool.domain.model.WorkerSession;

import java.util.Collection;
import java.util.Optional;

/**
 * Least-loaded worker selection.
 *
 * Picks the IDLE or BUSY worker with the smallest queued plus in-flight count.
 * Ties go to the earliest registered worker.
 */
public final class LeastLoadedStrategy implements WorkerSelectionStrategy {

    @Override
    public String getName() {
        return "least-loaded";
    }

    @Override
    public Optional<WorkerSession> select(Collection<WorkerSession> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }

        WorkerSession selected = null;
        int minLoad = Integer.MAX_VALUE;

        for (WorkerSession worker : workers) {
            if (!worker.getStatus().isAssignable()) {
                continue;
            }
            int load = worker.load();
            // Strict comparison keeps the first worker on ties
            if (load < minLoad) {
                minLoad = load;
                selected = worker;
            }
        }

        return Optional.ofNullable(selected);
    }
}
