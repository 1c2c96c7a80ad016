package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.domain.exception.PoolExhaustedException;
import fr.lapetina.sessionpool.domain.exception.QueueNotRunningException;
import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.PoolSnapshot;
import fr.lapetina.sessionpool.execution.JobExecutor;
import fr.lapetina.sessionpool.execution.JobOutcome;
import fr.lapetina.sessionpool.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic tick driving the pool.
 *
 * Each tick drains the global queue, requests growth when work is waiting, dispatches the
 * next job of every free worker, periodically reclaims idle workers, and publishes statistics.
 * The tick itself never blocks on a session: growth, cleanup and jobs run on the worker executor.
 */
public final class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final SessionPool pool;
    private final JobExecutor jobExecutor;
    private final GrowthPolicy growthPolicy;
    private final MetricsRegistry metrics;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService ticker;
    private final Duration tickInterval;
    private final int cleanupEveryTicks;
    private volatile Duration idleTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean growthInFlight = new AtomicBoolean(false);
    private final AtomicBoolean cleanupInFlight = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong(0);

    public Scheduler(
            SessionPool pool,
            JobExecutor jobExecutor,
            GrowthPolicy growthPolicy,
            MetricsRegistry metrics,
            ExecutorService workerExecutor,
            Duration tickInterval,
            int cleanupEveryTicks,
            Duration idleTimeout
    ) {
        this.pool = pool;
        this.jobExecutor = jobExecutor;
        this.growthPolicy = growthPolicy;
        this.metrics = metrics;
        this.workerExecutor = workerExecutor;
        this.tickInterval = tickInterval;
        this.cleanupEveryTicks = Math.max(1, cleanupEveryTicks);
        this.idleTimeout = idleTimeout;
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            long period = tickInterval.toMillis();
            ticker.scheduleWithFixedDelay(this::tick, period, period, TimeUnit.MILLISECONDS);
            log.info("Scheduler started: tickInterval={}, cleanupEveryTicks={}, idleTimeout={}",
                    tickInterval, cleanupEveryTicks, idleTimeout);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void setIdleTimeout(Duration idleTimeout) {
        if (!idleTimeout.equals(this.idleTimeout)) {
            log.info("Idle timeout changed: previous={}, current={}", this.idleTimeout, idleTimeout);
            this.idleTimeout = idleTimeout;
        }
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Runs one scheduling pass. Exceptions are logged, never propagated.
     */
    void tick() {
        if (!running.get()) {
            return;
        }
        try {
            long tick = tickCount.incrementAndGet();

            int waiting = pool.drainGlobalQueue();
            if (waiting > 0) {
                requestGrowth();
            }

            dispatch(pool.pickNextJobs());

            if (tick % cleanupEveryTicks == 0) {
                requestCleanup();
            }

            pool.recomputeStats();
            PoolSnapshot snapshot = pool.snapshot();
            metrics.updatePool(snapshot.totalWorkers(), snapshot.availableWorkers(),
                    snapshot.busyWorkers(), snapshot.globalQueueSize());
        } catch (Exception e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private void dispatch(List<Dispatch> dispatches) {
        for (Dispatch dispatch : dispatches) {
            try {
                workerExecutor.execute(() -> jobExecutor.run(dispatch.worker(), dispatch.request()));
                log.debug("Job dispatched: requestId={}, workerId={}",
                        dispatch.request().getId(), dispatch.worker().getId());
            } catch (RejectedExecutionException e) {
                log.error("Job dispatch rejected: requestId={}, workerId={}",
                        dispatch.request().getId(), dispatch.worker().getId());
                pool.completeJob(dispatch.worker(), dispatch.request(),
                        JobOutcome.failure(ErrorType.INTERNAL_ERROR, "Job executor rejected the job"));
            }
        }
    }

    private void requestGrowth() {
        if (!growthPolicy.permitsGrowth() || !growthInFlight.compareAndSet(false, true)) {
            return;
        }
        try {
            workerExecutor.execute(() -> {
                try {
                    pool.createWorker();
                } catch (PoolExhaustedException | QueueNotRunningException e) {
                    log.debug("Pool growth skipped: reason={}", e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Pool growth interrupted");
                } catch (RuntimeException e) {
                    log.warn("Pool growth failed, retrying on a later tick: error={}", e.getMessage());
                } finally {
                    growthInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            growthInFlight.set(false);
            log.warn("Pool growth rejected by executor");
        }
    }

    private void requestCleanup() {
        if (!cleanupInFlight.compareAndSet(false, true)) {
            return;
        }
        try {
            workerExecutor.execute(() -> {
                try {
                    int removed = pool.cleanupIdle(pool.now().minus(idleTimeout));
                    if (removed > 0) {
                        log.info("Idle cleanup finished: removed={}, remaining={}", removed, pool.size());
                    }
                } catch (RuntimeException e) {
                    log.warn("Idle cleanup failed: error={}", e.getMessage(), e);
                } finally {
                    cleanupInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            cleanupInFlight.set(false);
            log.warn("Idle cleanup rejected by executor");
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            ticker.shutdown();
            try {
                if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                    ticker.shutdownNow();
                }
            } catch (InterruptedException e) {
                ticker.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Scheduler stopped: ticks={}", tickCount.get());
        } else {
            ticker.shutdownNow();
        }
    }
}
