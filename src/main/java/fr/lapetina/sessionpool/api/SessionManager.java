package fr.lapetina.sessionpool.api;

import fr.lapetina.sessionpool.api.dto.PoolStatusResponse;
import fr.lapetina.sessionpool.api.dto.RequestStatusResponse;
import fr.lapetina.sessionpool.api.dto.SubmitRequest;
import fr.lapetina.sessionpool.api.dto.SubmitResponse;
import fr.lapetina.sessionpool.domain.exception.PoolExhaustedException;
import fr.lapetina.sessionpool.domain.exception.QueueNotRunningException;
import fr.lapetina.sessionpool.domain.exception.SessionPoolException;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import fr.lapetina.sessionpool.execution.JobExecutor;
import fr.lapetina.sessionpool.infrastructure.pacing.Pacer;
import fr.lapetina.sessionpool.pool.GrowthPolicy;
import fr.lapetina.sessionpool.pool.JobQueue;
import fr.lapetina.sessionpool.pool.Scheduler;
import fr.lapetina.sessionpool.pool.SessionPool;
import fr.lapetina.sessionpool.pool.SubmitReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for callers: submits generation requests, reports their status and the pool's,
 * and cancels them.
 *
 * Submissions are rejected with {@link QueueNotRunningException} until {@link #start()} and
 * after {@link #shutdown()}.
 */
public final class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final SessionPool pool;
    private final JobQueue jobQueue;
    private final Scheduler scheduler;
    private final JobExecutor jobExecutor;
    private final GrowthPolicy growthPolicy;
    private final Pacer pacer;
    private final int initialWorkers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SessionManager(
            SessionPool pool,
            JobQueue jobQueue,
            Scheduler scheduler,
            JobExecutor jobExecutor,
            GrowthPolicy growthPolicy,
            Pacer pacer,
            int initialWorkers
    ) {
        this.pool = pool;
        this.jobQueue = jobQueue;
        this.scheduler = scheduler;
        this.jobExecutor = jobExecutor;
        this.growthPolicy = growthPolicy;
        this.pacer = pacer;
        this.initialWorkers = initialWorkers;
    }

    /**
     * Creates the initial workers and starts the scheduler. Worker creation failures are
     * logged and the scheduler grows the pool again when work arrives.
     */
    public void start() throws InterruptedException {
        if (stopped.get()) {
            throw new QueueNotRunningException();
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting session manager: initialWorkers={}, maxWorkers={}, softMaxWorkers={}",
                initialWorkers, pool.getMaxWorkers(), growthPolicy.getSoftMaxWorkers());
        try {
            for (int i = 0; i < initialWorkers; i++) {
                try {
                    pool.createWorker();
                } catch (SessionPoolException e) {
                    log.warn("Initial worker creation failed: index={}, errorType={}, error={}",
                            i, e.getErrorType(), e.getMessage());
                }
            }
        } finally {
            // Running implies scheduling, even when warm-up was cut short
            scheduler.start();
        }
        log.info("Session manager started: workers={}", pool.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Queues a request on the least-loaded worker, or globally when none can take it.
     * A worker is started first when every worker is occupied and growth is permitted.
     */
    public SubmitResponse submit(SubmitRequest submitRequest) {
        return SubmitResponse.fromReceipt(submit(submitRequest.toGenerationRequest()));
    }

    public SubmitReceipt submit(GenerationRequest request) {
        checkRunning();
        ensureCapacity();
        return jobQueue.addRequest(request);
    }

    /**
     * Starts one worker if every worker is occupied and growth is permitted.
     * Failures are logged; queued work is picked up by later growth.
     *
     * @return true if a worker was created
     */
    public boolean ensureCapacity() {
        if (!pool.needsGrowth() || !growthPolicy.permitsGrowth()) {
            return false;
        }
        try {
            pool.createWorker();
            return true;
        } catch (PoolExhaustedException e) {
            log.debug("No capacity for another worker: maxWorkers={}", e.getMaxWorkers());
        } catch (SessionPoolException e) {
            log.warn("Worker creation on submit failed: errorType={}, error={}", e.getErrorType(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker creation on submit interrupted");
        }
        return false;
    }

    /**
     * Runs a request immediately on the calling thread, on an idle worker or a newly created one.
     *
     * @return the terminal status of the request
     * @throws PoolExhaustedException if no worker can be claimed or created
     */
    public RequestStatusResponse submitDirect(SubmitRequest submitRequest) throws InterruptedException {
        checkRunning();
        GenerationRequest request = submitRequest.toGenerationRequest();
        jobQueue.register(request);

        WorkerSession worker = pool.claimIdleWorker(request).orElse(null);
        if (worker == null) {
            worker = createWorkerFor(request);
        }
        if (worker.getCurrentRequest() == request) {
            log.info("Direct job claimed worker: requestId={}, workerId={}", request.getId(), worker.getId());
            jobExecutor.run(worker, request);
        }
        return RequestStatusResponse.fromSnapshot(request.snapshot());
    }

    private WorkerSession createWorkerFor(GenerationRequest request) throws InterruptedException {
        try {
            if (!growthPolicy.permitsGrowth()) {
                throw new PoolExhaustedException(pool.getMaxWorkers());
            }
            return pool.createWorker(request);
        } catch (RuntimeException e) {
            request.cancel("Direct submission failed: " + e.getMessage(), pool.now());
            throw e;
        } catch (InterruptedException e) {
            request.cancel("Direct submission interrupted", pool.now());
            throw e;
        }
    }

    /**
     * @return the request's status, or empty if no such request was ever submitted
     */
    public Optional<RequestStatusResponse> status(String requestId) {
        return jobQueue.get(requestId).map(request -> RequestStatusResponse.fromSnapshot(request.snapshot()));
    }

    public PoolStatusResponse poolStatus() {
        return PoolStatusResponse.from(running.get(), pool.snapshot());
    }

    /**
     * @return false if the request is unknown or already terminal
     */
    public boolean cancel(String requestId) {
        return jobQueue.cancel(requestId);
    }

    /**
     * Polls the request until it is terminal or the timeout elapses, at the pacing profile's
     * completion poll interval.
     *
     * @return the last observed status, or empty if the request is unknown
     */
    public Optional<RequestStatusResponse> awaitCompletion(String requestId, Duration timeout)
            throws InterruptedException {
        Optional<GenerationRequest> found = jobQueue.get(requestId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        GenerationRequest request = found.get();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!request.isTerminal() && System.nanoTime() < deadline) {
            long remainingMillis = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            Duration interval = pacer.completionPollInterval();
            pacer.sleep(interval.toMillis() < remainingMillis ? interval : Duration.ofMillis(remainingMillis));
        }
        return Optional.of(RequestStatusResponse.fromSnapshot(request.snapshot()));
    }

    /**
     * Stops scheduling, cancels every request still held and closes all sessions. Idempotent.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        log.info("Shutting down session manager");
        scheduler.close();
        pool.shutdown();
        log.info("Session manager shut down: requestsSeen={}", jobQueue.size());
    }

    private void checkRunning() {
        if (!running.get()) {
            throw new QueueNotRunningException();
        }
    }
}
