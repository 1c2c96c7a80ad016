package fr.lapetina.sessionpool.pool;

import java.time.Duration;

/**
 * Where a newly added request was queued.
 *
 * @param requestId        id of the request
 * @param placement        local worker queue or global overflow queue
 * @param assignedWorkerId worker holding the request, null when queued globally
 * @param queuePosition    1-based position in the queue holding it
 * @param estimatedWait    average processing time times the position
 */
public record SubmitReceipt(
        String requestId,
        Placement placement,
        String assignedWorkerId,
        int queuePosition,
        Duration estimatedWait
) {
    public enum Placement {
        QUEUED,
        QUEUED_GLOBAL
    }
}
