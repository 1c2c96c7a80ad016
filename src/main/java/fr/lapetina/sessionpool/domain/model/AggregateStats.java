package fr.lapetina.sessionpool.domain.model;

import java.time.Duration;

/**
 * Pool-wide counters, recomputed from the workers on each scheduler tick.
 *
 * @param totalRequests          requests ever accepted by the pool
 * @param completedRequests      sum of worker processed counts
 * @param failedRequests         sum of worker failed counts
 * @param averageProcessingSeconds per-worker averages weighted by processed count
 * @param uptime                 time since the pool started
 */
public record AggregateStats(
        long totalRequests,
        long completedRequests,
        long failedRequests,
        double averageProcessingSeconds,
        Duration uptime
) {
    public static AggregateStats empty() {
        return new AggregateStats(0, 0, 0, 0.0, Duration.ZERO);
    }
}
