package fr.lapetina.sessionpool.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of one worker, safe to hand out of the pool lock.
 */
public record WorkerSnapshot(
        String id,
        WorkerStatus status,
        int queueSize,
        String currentRequestId,
        long totalProcessed,
        long totalFailed,
        double averageProcessingSeconds,
        Instant createdAt,
        Instant lastActivity
) {
}
