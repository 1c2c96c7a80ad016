package fr.lapetina.sessionpool.domain.model;

import java.util.List;

/**
 * Consistent view of the pool taken under its lock.
 */
public record PoolSnapshot(
        int totalWorkers,
        int availableWorkers,
        int busyWorkers,
        int maxWorkers,
        int globalQueueSize,
        List<WorkerSnapshot> workers,
        AggregateStats stats
) {
    public PoolSnapshot {
        workers = workers != null ? List.copyOf(workers) : List.of();
        if (stats == null) {
            stats = AggregateStats.empty();
        }
    }
}
