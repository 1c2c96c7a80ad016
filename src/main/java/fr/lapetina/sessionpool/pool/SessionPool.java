package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.domain.exception.AuthenticationException;
import fr.lapetina.sessionpool.domain.exception.PoolExhaustedException;
import fr.lapetina.sessionpool.domain.exception.QueueNotRunningException;
import fr.lapetina.sessionpool.domain.exception.SessionPoolException;
import fr.lapetina.sessionpool.domain.model.AggregateStats;
import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.PoolSnapshot;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import fr.lapetina.sessionpool.domain.model.WorkerSnapshot;
import fr.lapetina.sessionpool.domain.model.WorkerStatus;
import fr.lapetina.sessionpool.domain.strategy.LeastLoadedStrategy;
import fr.lapetina.sessionpool.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.sessionpool.driver.SessionDriver;
import fr.lapetina.sessionpool.driver.SessionDriverFactory;
import fr.lapetina.sessionpool.execution.JobCallbacks;
import fr.lapetina.sessionpool.execution.JobOutcome;
import fr.lapetina.sessionpool.infrastructure.auth.Authenticator;
import fr.lapetina.sessionpool.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded registry of authenticated worker sessions.
 *
 * Owns worker lifecycle (creation, error, reclamation, teardown), the available and
 * busy sets, and the aggregate statistics. All worker state changes happen under
 * {@code lock}; driver I/O never does. Lock order: this pool, then the global queue,
 * then a request's monitor.
 */
public final class SessionPool implements JobCallbacks {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final int maxWorkers;
    private final SessionDriverFactory driverFactory;
    private final Authenticator authenticator;
    private final WorkerSelectionStrategy strategy;
    private final GlobalQueue globalQueue;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final Instant startedAt;
    private final AtomicInteger workerSequence = new AtomicInteger(0);

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<String, WorkerSession> workers = new LinkedHashMap<>();
    private final Set<String> available = new LinkedHashSet<>();
    private final Set<String> busy = new LinkedHashSet<>();
    private int pendingCreations;
    private long totalRequests;
    private AggregateStats stats = AggregateStats.empty();
    private boolean closed;

    private SessionPool(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.driverFactory = Objects.requireNonNull(builder.driverFactory, "Driver factory is required");
        this.authenticator = Objects.requireNonNull(builder.authenticator, "Authenticator is required");
        this.strategy = builder.strategy != null ? builder.strategy : new LeastLoadedStrategy();
        this.globalQueue = builder.globalQueue != null ? builder.globalQueue : new GlobalQueue();
        this.metrics = Objects.requireNonNull(builder.metrics, "Metrics registry is required");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.startedAt = clock.instant();
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
    }

    /**
     * Runs the action while holding the pool lock.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public GlobalQueue getGlobalQueue() {
        return globalQueue;
    }

    public Authenticator getAuthenticator() {
        return authenticator;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Creates, authenticates and registers a new IDLE worker.
     *
     * @throws PoolExhaustedException if the hard cap is reached, before any driver is opened
     * @throws AuthenticationException if the session cannot be opened or the identity flow fails
     */
    public WorkerSession createWorker() throws InterruptedException {
        return createWorker(null);
    }

    /**
     * Creates a worker that is registered already running the given request.
     * Used by direct submission so no queued work can take the new worker first.
     * If the request stopped being pending meanwhile, the worker is registered IDLE.
     */
    public WorkerSession createWorker(GenerationRequest claimFor) throws InterruptedException {
        reserveSlot();

        String workerId = "worker-" + workerSequence.incrementAndGet();
        SessionDriver driver = null;
        try {
            driver = driverFactory.open();
            authenticator.authenticate(workerId, driver);
        } catch (SessionPoolException | InterruptedException e) {
            abandonCreation(workerId, driver, e);
            throw e;
        } catch (RuntimeException e) {
            // Browser launch or a raw driver failure during the identity flow
            abandonCreation(workerId, driver, e);
            throw new AuthenticationException("Session could not be established for " + workerId
                    + ": " + e.getMessage(), e);
        }

        WorkerSession worker = new WorkerSession(workerId, driver, clock.instant());
        boolean registered;
        lock.lock();
        try {
            pendingCreations--;
            registered = !closed;
            if (registered) {
                workers.put(workerId, worker);
                if (claimFor != null && claimFor.markProcessing(workerId, clock.instant())) {
                    worker.setCurrentRequest(claimFor);
                    setStatus(worker, WorkerStatus.BUSY);
                } else {
                    setStatus(worker, WorkerStatus.IDLE);
                }
                log.info("Worker created: workerId={}, totalWorkers={}, maxWorkers={}",
                        workerId, workers.size(), maxWorkers);
            }
        } finally {
            lock.unlock();
        }
        if (!registered) {
            // Pool shut down while the worker was authenticating
            closeQuietly(workerId, driver);
            authenticator.forget(workerId);
            throw new QueueNotRunningException();
        }
        metrics.incrementWorkersCreated();
        return worker;
    }

    private void abandonCreation(String workerId, SessionDriver driver, Exception cause) {
        releaseSlot();
        closeQuietly(workerId, driver);
        authenticator.forget(workerId);
        log.warn("Worker creation failed: workerId={}, error={}", workerId, cause.getMessage());
    }

    private void reserveSlot() {
        lock.lock();
        try {
            if (closed) {
                throw new QueueNotRunningException();
            }
            if (workers.size() + pendingCreations >= maxWorkers) {
                throw new PoolExhaustedException(maxWorkers);
            }
            pendingCreations++;
        } finally {
            lock.unlock();
        }
    }

    private void releaseSlot() {
        lock.lock();
        try {
            pendingCreations--;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tears a worker down: its queued requests go to the tail of the global queue,
     * its in-flight request is cancelled, and its driver is closed.
     *
     * @return false if no such worker is registered
     */
    public boolean removeWorker(String workerId) {
        WorkerSession worker;
        lock.lock();
        try {
            worker = workers.remove(workerId);
            if (worker == null) {
                return false;
            }
            available.remove(workerId);
            busy.remove(workerId);
            worker.setStatus(WorkerStatus.OFFLINE);

            List<GenerationRequest> requeued = worker.drainQueue();
            requeued.forEach(GenerationRequest::clearAssignment);
            globalQueue.appendAll(requeued);

            GenerationRequest current = worker.getCurrentRequest();
            if (current != null) {
                current.cancel("Worker " + workerId + " was removed", clock.instant());
                worker.setCurrentRequest(null);
            }
            log.info("Worker removed: workerId={}, requeued={}, cancelledCurrent={}, totalWorkers={}",
                    workerId, requeued.size(), current != null, workers.size());
        } finally {
            lock.unlock();
        }

        closeQuietly(workerId, worker.getDriver());
        authenticator.forget(workerId);
        metrics.incrementWorkersRemoved();
        return true;
    }

    /**
     * Least-loaded assignable worker, ties going to the earliest registered.
     */
    public Optional<WorkerSession> findLeastLoaded() {
        lock.lock();
        try {
            return strategy.select(workers.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the request to the least-loaded worker's local queue.
     *
     * @return the placement, or empty if no worker can take work
     */
    public Optional<Assignment> assignToLeastLoaded(GenerationRequest request) {
        lock.lock();
        try {
            return findLeastLoaded().map(worker -> enqueueLocal(worker, request));
        } finally {
            lock.unlock();
        }
    }

    private Assignment enqueueLocal(WorkerSession worker, GenerationRequest request) {
        worker.localQueue().addLast(request);
        int position = worker.queueSize();
        request.assign(worker.getId(), position);
        if (worker.getStatus() == WorkerStatus.IDLE) {
            // Picked on the next tick
            setStatus(worker, WorkerStatus.BUSY);
        }
        log.debug("Request assigned: requestId={}, workerId={}, position={}",
                request.getId(), worker.getId(), position);
        return new Assignment(worker.getId(), position, worker.estimatedWait());
    }

    /**
     * Moves global-queue requests into worker queues, head first, while an assignable worker exists.
     * Requests that are no longer pending are dropped from the queue.
     *
     * @return number of requests still waiting in the global queue
     */
    public int drainGlobalQueue() {
        lock.lock();
        try {
            return globalQueue.drain(request -> {
                if (request.getStatus() != RequestStatus.PENDING) {
                    return true;
                }
                Optional<WorkerSession> worker = findLeastLoaded();
                if (worker.isEmpty()) {
                    return false;
                }
                enqueueLocal(worker.get(), request);
                return true;
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * For every assignable worker with queued work and nothing in flight, pops the head of its
     * queue and moves it to PROCESSING. Cancelled heads are discarded.
     *
     * @return jobs ready to run
     */
    public List<Dispatch> pickNextJobs() {
        List<Dispatch> dispatches = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (WorkerSession worker : workers.values()) {
                if (!worker.getStatus().isAssignable() || worker.getCurrentRequest() != null) {
                    continue;
                }
                GenerationRequest next = null;
                while (!worker.localQueue().isEmpty()) {
                    GenerationRequest head = worker.localQueue().pollFirst();
                    if (head.markProcessing(worker.getId(), now)) {
                        next = head;
                        break;
                    }
                }
                if (next != null) {
                    worker.setCurrentRequest(next);
                    worker.touch(now);
                    setStatus(worker, WorkerStatus.BUSY);
                    renumberLocal(worker);
                    dispatches.add(new Dispatch(worker, next));
                } else if (worker.getStatus() == WorkerStatus.BUSY) {
                    setStatus(worker, WorkerStatus.IDLE);
                }
            }
        } finally {
            lock.unlock();
        }
        return dispatches;
    }

    private void renumberLocal(WorkerSession worker) {
        int position = 1;
        for (GenerationRequest queued : worker.localQueue()) {
            queued.updateQueuePosition(position++);
        }
    }

    /**
     * Claims an IDLE worker with nothing queued and moves the request to PROCESSING on it.
     */
    public Optional<WorkerSession> claimIdleWorker(GenerationRequest request) {
        lock.lock();
        try {
            for (WorkerSession worker : workers.values()) {
                if (worker.getStatus() == WorkerStatus.IDLE && worker.load() == 0) {
                    if (!request.markProcessing(worker.getId(), clock.instant())) {
                        return Optional.empty();
                    }
                    worker.setCurrentRequest(request);
                    worker.touch(clock.instant());
                    setStatus(worker, WorkerStatus.BUSY);
                    return Optional.of(worker);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completion callback for a finished job. Always invoked once per dispatched job.
     * Metrics and worker statistics are settled before the outcome is published on the
     * request, all under the pool lock, so a caller that observes a terminal request also
     * observes the freed worker. A request cancelled meanwhile keeps CANCELLED.
     */
    @Override
    public boolean completeJob(WorkerSession worker, GenerationRequest request, JobOutcome outcome) {
        lock.lock();
        try {
            Instant now = clock.instant();
            boolean applies = request.getStatus() == RequestStatus.PROCESSING;
            RequestStatus finalStatus = applies ? outcome.status() : request.getStatus();
            ErrorType errorType = applies ? outcome.errorType() : request.getErrorType();
            Duration elapsed = request.processingTime(now);

            recordOutcome(finalStatus, errorType, elapsed);
            if (workers.get(worker.getId()) == worker) {
                release(worker, request, finalStatus, elapsed, now);
            } else {
                log.debug("Completion for unregistered worker: workerId={}, requestId={}",
                        worker.getId(), request.getId());
            }

            if (applies) {
                outcome.applyTo(request, now);
            } else {
                request.stampCompleted(now);
            }
            return applies;
        } finally {
            lock.unlock();
        }
    }

    private void recordOutcome(RequestStatus status, ErrorType errorType, Duration elapsed) {
        metrics.incrementOutcome(status);
        if (status == RequestStatus.FAILED && errorType != null) {
            metrics.incrementErrorCount(errorType);
        }
        if (elapsed != null) {
            metrics.recordJobDuration(elapsed);
        }
    }

    // Caller holds the lock
    private void release(WorkerSession worker, GenerationRequest request, RequestStatus finalStatus,
                         Duration elapsed, Instant now) {
        if (worker.getCurrentRequest() == request) {
            worker.setCurrentRequest(null);
        }
        worker.touch(now);

        if (finalStatus == RequestStatus.COMPLETED) {
            worker.recordSuccess(elapsed != null ? elapsed : Duration.ZERO);
        } else {
            worker.recordFailure();
        }

        if (worker.getStatus() == WorkerStatus.ERROR) {
            log.info("Worker left in error state after job: workerId={}, requestId={}",
                    worker.getId(), request.getId());
        } else if (!worker.localQueue().isEmpty()) {
            setStatus(worker, WorkerStatus.BUSY);
        } else {
            setStatus(worker, WorkerStatus.IDLE);
        }
        log.debug("Job completed on worker: workerId={}, requestId={}, status={}, queued={}",
                worker.getId(), request.getId(), finalStatus, worker.queueSize());
    }

    /**
     * Takes a worker out of rotation after it lost its session. It is reclaimed by the next cleanup.
     */
    @Override
    public void markError(WorkerSession worker) {
        lock.lock();
        try {
            if (workers.get(worker.getId()) == worker) {
                setStatus(worker, WorkerStatus.ERROR);
                log.warn("Worker marked as error: workerId={}, queued={}", worker.getId(), worker.queueSize());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reclaims workers: IDLE ones inactive since before {@code idleThreshold} whose authentication
     * probe now fails, and every ERROR worker. Still-authenticated idle workers are kept.
     *
     * @return number of workers removed
     */
    public int cleanupIdle(Instant idleThreshold) {
        List<WorkerSession> candidates = new ArrayList<>();
        List<String> errored = new ArrayList<>();
        lock.lock();
        try {
            for (WorkerSession worker : workers.values()) {
                if (worker.getStatus() == WorkerStatus.ERROR) {
                    errored.add(worker.getId());
                } else if (worker.idleSince(idleThreshold) && worker.localQueue().isEmpty()) {
                    // Offline while probed so nothing is assigned to it meanwhile
                    setStatus(worker, WorkerStatus.OFFLINE);
                    candidates.add(worker);
                }
            }
        } finally {
            lock.unlock();
        }

        int removed = 0;
        for (String workerId : errored) {
            if (removeWorker(workerId)) {
                removed++;
            }
        }
        for (WorkerSession worker : candidates) {
            if (probeStillAuthenticated(worker)) {
                restoreIdle(worker);
            } else if (removeWorker(worker.getId())) {
                log.info("Idle worker reclaimed: workerId={}, lastActivity={}",
                        worker.getId(), worker.getLastActivity());
                removed++;
            }
        }
        return removed;
    }

    private boolean probeStillAuthenticated(WorkerSession worker) {
        try {
            return authenticator.isAuthenticated(worker.getId(), worker.getDriver());
        } catch (RuntimeException e) {
            log.warn("Idle worker probe failed: workerId={}, error={}", worker.getId(), e.getMessage());
            return false;
        }
    }

    private void restoreIdle(WorkerSession worker) {
        lock.lock();
        try {
            if (workers.get(worker.getId()) == worker && worker.getStatus() == WorkerStatus.OFFLINE) {
                setStatus(worker, WorkerStatus.IDLE);
                log.debug("Idle worker still authenticated, kept: workerId={}", worker.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a new worker would help: capacity remains and no assignable worker is free.
     */
    public boolean needsGrowth() {
        lock.lock();
        try {
            if (closed || workers.size() + pendingCreations >= maxWorkers) {
                return false;
            }
            for (WorkerSession worker : workers.values()) {
                if (worker.getStatus().isAssignable() && worker.load() == 0) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether another worker may be created, counting creations in progress.
     */
    public boolean hasCapacity() {
        lock.lock();
        try {
            return !closed && workers.size() + pendingCreations < maxWorkers;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return workers.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkerSession> getWorker(String workerId) {
        lock.lock();
        try {
            return Optional.ofNullable(workers.get(workerId));
        } finally {
            lock.unlock();
        }
    }

    public void recordSubmission() {
        lock.lock();
        try {
            totalRequests++;
        } finally {
            lock.unlock();
        }
        metrics.incrementSubmitted();
    }

    /**
     * Recomputes aggregate statistics from the registered workers.
     */
    public AggregateStats recomputeStats() {
        lock.lock();
        try {
            long completed = 0;
            long failed = 0;
            double weightedSeconds = 0.0;
            for (WorkerSession worker : workers.values()) {
                completed += worker.getTotalProcessed();
                failed += worker.getTotalFailed();
                weightedSeconds += worker.getAverageProcessingSeconds() * worker.getTotalProcessed();
            }
            // Keep the last known average once the workers that produced it are gone
            double average = completed > 0 ? weightedSeconds / completed : stats.averageProcessingSeconds();
            stats = new AggregateStats(
                    totalRequests, completed, failed, average, Duration.between(startedAt, clock.instant()));
            return stats;
        } finally {
            lock.unlock();
        }
    }

    public AggregateStats getStats() {
        lock.lock();
        try {
            return stats;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent view of workers, sets and the global queue.
     */
    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            List<WorkerSnapshot> workerSnapshots = workers.values().stream()
                    .map(WorkerSession::snapshot)
                    .toList();
            return new PoolSnapshot(
                    workers.size(),
                    available.size(),
                    busy.size(),
                    maxWorkers,
                    globalQueue.size(),
                    workerSnapshots,
                    stats
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels every non-terminal request the pool still references and closes every driver.
     * Idempotent.
     */
    public void shutdown() {
        List<WorkerSession> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            Instant now = clock.instant();
            toClose = new ArrayList<>(workers.values());
            for (WorkerSession worker : toClose) {
                worker.setStatus(WorkerStatus.OFFLINE);
                for (GenerationRequest queued : worker.drainQueue()) {
                    queued.cancel("Session pool shut down", now);
                }
                GenerationRequest current = worker.getCurrentRequest();
                if (current != null) {
                    current.cancel("Session pool shut down", now);
                    worker.setCurrentRequest(null);
                }
            }
            for (GenerationRequest waiting : globalQueue.clear()) {
                waiting.cancel("Session pool shut down", now);
            }
            workers.clear();
            available.clear();
            busy.clear();
        } finally {
            lock.unlock();
        }

        for (WorkerSession worker : toClose) {
            closeQuietly(worker.getId(), worker.getDriver());
            authenticator.forget(worker.getId());
        }
        log.info("Session pool shut down: closedWorkers={}", toClose.size());
    }

    // Caller holds lock
    private void setStatus(WorkerSession worker, WorkerStatus status) {
        worker.setStatus(status);
        String id = worker.getId();
        switch (status) {
            case IDLE -> {
                available.add(id);
                busy.remove(id);
            }
            case BUSY -> {
                busy.add(id);
                available.remove(id);
            }
            case ERROR, OFFLINE -> {
                available.remove(id);
                busy.remove(id);
            }
        }
    }

    private void closeQuietly(String workerId, SessionDriver driver) {
        if (driver == null) {
            return;
        }
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing driver: workerId={}", workerId, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxWorkers = 12;
        private SessionDriverFactory driverFactory;
        private Authenticator authenticator;
        private WorkerSelectionStrategy strategy;
        private GlobalQueue globalQueue;
        private MetricsRegistry metrics;
        private Clock clock;

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder driverFactory(SessionDriverFactory driverFactory) {
            this.driverFactory = driverFactory;
            return this;
        }

        public Builder authenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder strategy(WorkerSelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder globalQueue(GlobalQueue globalQueue) {
            this.globalQueue = globalQueue;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SessionPool build() {
            return new SessionPool(this);
        }
    }
}
