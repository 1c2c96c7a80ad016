package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admission of requests into worker queues or the global overflow queue, plus the request index.
 *
 * A request lives in exactly one of: the global queue, one worker's local queue,
 * one worker's current slot, or nowhere once terminal.
 */
public final class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final SessionPool pool;
    private final GlobalQueue globalQueue;
    private final Map<String, GenerationRequest> requests = new ConcurrentHashMap<>();

    public JobQueue(SessionPool pool) {
        this.pool = pool;
        this.globalQueue = pool.getGlobalQueue();
    }

    /**
     * Indexes the request and queues it on the least-loaded worker, or globally when no worker can take it.
     */
    public SubmitReceipt addRequest(GenerationRequest request) {
        register(request);
        SubmitReceipt receipt = pool.withLock(() -> pool.assignToLeastLoaded(request)
                .map(assignment -> new SubmitReceipt(
                        request.getId(),
                        SubmitReceipt.Placement.QUEUED,
                        assignment.workerId(),
                        assignment.queuePosition(),
                        assignment.estimatedWait()))
                .orElseGet(() -> {
                    int position = globalQueue.append(request);
                    double averageSeconds = pool.getStats().averageProcessingSeconds();
                    return new SubmitReceipt(
                            request.getId(),
                            SubmitReceipt.Placement.QUEUED_GLOBAL,
                            null,
                            position,
                            Duration.ofMillis(Math.round(averageSeconds * 1000 * position)));
                }));
        log.info("Request queued: requestId={}, placement={}, workerId={}, position={}",
                request.getId(), receipt.placement(), receipt.assignedWorkerId(), receipt.queuePosition());
        return receipt;
    }

    /**
     * Indexes a request without queueing it, for direct execution.
     */
    public void register(GenerationRequest request) {
        if (requests.putIfAbsent(request.getId(), request) != null) {
            throw new IllegalArgumentException("Duplicate request id: " + request.getId());
        }
        pool.recordSubmission();
    }

    public Optional<GenerationRequest> get(String requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    /**
     * Cancels a request. A queued request is removed from its queue; a processing one is
     * marked cancelled and its execution finishes on its own.
     *
     * @return false if the request is unknown or already terminal
     */
    public boolean cancel(String requestId) {
        GenerationRequest request = requests.get(requestId);
        if (request == null) {
            return false;
        }
        boolean cancelled = pool.withLock(() -> {
            if (request.getStatus() == RequestStatus.PENDING) {
                removeFromQueues(request);
            }
            return request.cancel(null, pool.now());
        });
        if (cancelled) {
            log.info("Request cancelled: requestId={}", requestId);
        }
        return cancelled;
    }

    // Caller holds the pool lock
    private void removeFromQueues(GenerationRequest request) {
        String workerId = request.getAssignedWorkerId();
        if (workerId != null) {
            Optional<WorkerSession> worker = pool.getWorker(workerId);
            if (worker.isPresent() && worker.get().localQueue().remove(request)) {
                int position = 1;
                for (GenerationRequest queued : worker.get().localQueue()) {
                    queued.updateQueuePosition(position++);
                }
                return;
            }
        }
        globalQueue.remove(request);
    }

    public int size() {
        return requests.size();
    }
}
