package fr.lapetina.sessionpool.pool;

import java.time.Duration;

/**
 * Placement of a request in a worker's local queue.
 *
 * @param workerId      worker holding the request
 * @param queuePosition 1-based position in that worker's local queue
 * @param estimatedWait worker average processing time times the position
 */
public record Assignment(String workerId, int queuePosition, Duration estimatedWait) {
}
