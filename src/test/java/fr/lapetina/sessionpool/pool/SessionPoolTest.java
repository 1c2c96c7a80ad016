package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.TestClock;
import fr.lapetina.sessionpool.TestSessions;
import fr.lapetina.sessionpool.domain.exception.AuthenticationException;
import fr.lapetina.sessionpool.domain.exception.PoolExhaustedException;
import fr.lapetina.sessionpool.domain.exception.QueueNotRunningException;
import fr.lapetina.sessionpool.domain.model.AggregateStats;
import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.GenerationResult;
import fr.lapetina.sessionpool.domain.model.PoolSnapshot;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import fr.lapetina.sessionpool.domain.model.WorkerStatus;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.StubDriverFactory;
import fr.lapetina.sessionpool.driver.StubSessionDriver;
import fr.lapetina.sessionpool.execution.JobOutcome;
import fr.lapetina.sessionpool.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPoolTest {

    private TestClock clock;
    private StubDriverFactory drivers;
    private MetricsRegistry metrics;
    private SessionPool pool;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        drivers = new StubDriverFactory();
        metrics = new MetricsRegistry("test_pool");
        pool = newPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
        metrics.close();
    }

    private SessionPool newPool(int maxWorkers) {
        return SessionPool.builder()
                .maxWorkers(maxWorkers)
                .driverFactory(drivers)
                .authenticator(TestSessions.authenticator(clock))
                .metrics(metrics)
                .clock(clock)
                .build();
    }

    private GenerationRequest request(String id) {
        return GenerationRequest.builder().id(id).prompt("calm piano").createdAt(clock.instant()).build();
    }

    private static GenerationResult result(GenerationRequest request, String workerId) {
        return new GenerationResult(request.getId(), workerId, "file:/a.mp3", "k", 1, Map.of(), null, null);
    }

    @Nested
    @DisplayName("createWorker")
    class CreateWorkerTests {

        @Test
        @DisplayName("should authenticate and register an idle worker")
        void shouldRegisterIdleWorker() throws InterruptedException {
            WorkerSession worker = pool.createWorker();

            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
            assertThat(drivers.last().isAuthenticated()).isTrue();
            assertThat(pool.size()).isEqualTo(1);
            assertThat(pool.snapshot().availableWorkers()).isEqualTo(1);
            assertThat(metrics.getRegistry().get("test_pool_workers_created_total").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should refuse beyond the hard cap without opening a driver")
        void shouldEnforceHardCap() throws InterruptedException {
            pool.createWorker();
            pool.createWorker();

            assertThatThrownBy(() -> pool.createWorker()).isInstanceOf(PoolExhaustedException.class);
            assertThat(drivers.opened()).hasSize(2);
        }

        @Test
        @DisplayName("should close the driver when authentication fails")
        void shouldCloseDriverOnAuthFailure() {
            drivers.script(StubSessionDriver::rejectCredentials);

            assertThatThrownBy(() -> pool.createWorker()).isInstanceOf(AuthenticationException.class);
            assertThat(drivers.last().isClosed()).isTrue();
            assertThat(pool.size()).isZero();
            assertThat(pool.hasCapacity()).isTrue();
        }

        @Test
        @DisplayName("should classify a browser that fails to launch and release the slot")
        void shouldClassifyOpenFailure() {
            drivers.failOpen(new DriverException("browser launch failed"));

            assertThatThrownBy(() -> pool.createWorker())
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("browser launch failed")
                    .hasCauseInstanceOf(DriverException.class);
            assertThat(drivers.opened()).isEmpty();
            assertThat(pool.size()).isZero();
            assertThat(pool.hasCapacity()).isTrue();
        }

        @Test
        @DisplayName("should register the worker already running the claimed request")
        void shouldClaimRequest() throws InterruptedException {
            GenerationRequest request = request("r1");

            WorkerSession worker = pool.createWorker(request);

            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.BUSY);
            assertThat(worker.getCurrentRequest()).isSameAs(request);
            assertThat(request.getStatus()).isEqualTo(RequestStatus.PROCESSING);
        }

        @Test
        @DisplayName("should refuse once shut down")
        void shouldRefuseAfterShutdown() {
            pool.shutdown();

            assertThatThrownBy(() -> pool.createWorker()).isInstanceOf(QueueNotRunningException.class);
        }
    }

    @Nested
    @DisplayName("assignment and dispatch")
    class DispatchTests {

        @Test
        @DisplayName("should spread requests over the least-loaded workers")
        void shouldAssignLeastLoaded() throws InterruptedException {
            WorkerSession first = pool.createWorker();
            WorkerSession second = pool.createWorker();

            Assignment a = pool.assignToLeastLoaded(request("r1")).orElseThrow();
            Assignment b = pool.assignToLeastLoaded(request("r2")).orElseThrow();
            Assignment c = pool.assignToLeastLoaded(request("r3")).orElseThrow();

            assertThat(a.workerId()).isEqualTo(first.getId());
            assertThat(b.workerId()).isEqualTo(second.getId());
            assertThat(c.workerId()).isEqualTo(first.getId());
            assertThat(c.queuePosition()).isEqualTo(2);
            assertThat(first.getStatus()).isEqualTo(WorkerStatus.BUSY);
        }

        @Test
        @DisplayName("should have no placement without workers")
        void shouldReturnEmptyWithoutWorkers() {
            assertThat(pool.assignToLeastLoaded(request("r1"))).isEmpty();
        }

        @Test
        @DisplayName("should pick one job per free worker and renumber the rest")
        void shouldPickNextJobs() throws InterruptedException {
            WorkerSession worker = pool.createWorker();
            GenerationRequest r1 = request("r1");
            GenerationRequest r2 = request("r2");
            pool.assignToLeastLoaded(r1);
            pool.assignToLeastLoaded(r2);

            List<Dispatch> dispatches = pool.pickNextJobs();

            assertThat(dispatches).containsExactly(new Dispatch(worker, r1));
            assertThat(r1.getStatus()).isEqualTo(RequestStatus.PROCESSING);
            assertThat(r2.getQueuePosition()).isEqualTo(1);
            assertThat(pool.pickNextJobs()).isEmpty();
        }

        @Test
        @DisplayName("should discard cancelled heads")
        void shouldSkipCancelled() throws InterruptedException {
            pool.createWorker();
            GenerationRequest r1 = request("r1");
            GenerationRequest r2 = request("r2");
            pool.assignToLeastLoaded(r1);
            pool.assignToLeastLoaded(r2);
            r1.cancel(null, clock.instant());

            assertThat(pool.pickNextJobs()).extracting(Dispatch::request).containsExactly(r2);
        }

        @Test
        @DisplayName("should drain the global queue onto new workers")
        void shouldDrainGlobalQueue() throws InterruptedException {
            GenerationRequest r1 = request("r1");
            pool.getGlobalQueue().append(r1);
            assertThat(pool.drainGlobalQueue()).isEqualTo(1);

            WorkerSession worker = pool.createWorker();

            assertThat(pool.drainGlobalQueue()).isZero();
            assertThat(r1.getAssignedWorkerId()).isEqualTo(worker.getId());
        }

        @Test
        @DisplayName("should claim only an idle worker with nothing queued")
        void shouldClaimIdleWorker() throws InterruptedException {
            WorkerSession worker = pool.createWorker();
            pool.assignToLeastLoaded(request("r1"));

            assertThat(pool.claimIdleWorker(request("r2"))).isEmpty();

            pool.pickNextJobs();
            assertThat(pool.claimIdleWorker(request("r3"))).isEmpty();
            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.BUSY);
        }
    }

    @Nested
    @DisplayName("completeJob")
    class CompleteJobTests {

        @Test
        @DisplayName("should return the worker to idle and fold its processing time")
        void shouldRecordSuccess() throws InterruptedException {
            GenerationRequest request = request("r1");
            WorkerSession worker = pool.createWorker(request);
            clock.advance(Duration.ofSeconds(30));

            boolean applied = pool.completeJob(worker, request, JobOutcome.success(result(request, worker.getId())));

            assertThat(applied).isTrue();
            assertThat(request.getStatus()).isEqualTo(RequestStatus.COMPLETED);
            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
            assertThat(worker.getCurrentRequest()).isNull();
            assertThat(worker.getTotalProcessed()).isEqualTo(1);
            assertThat(worker.getAverageProcessingSeconds()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("should stay busy when work is queued")
        void shouldStayBusyWithQueuedWork() throws InterruptedException {
            GenerationRequest request = request("r1");
            WorkerSession worker = pool.createWorker(request);
            pool.assignToLeastLoaded(request("r2"));

            pool.completeJob(worker, request, JobOutcome.failure(ErrorType.SESSION_STUCK, "stuck"));

            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.BUSY);
            assertThat(worker.getTotalFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep an errored worker out of rotation")
        void shouldKeepErrorState() throws InterruptedException {
            GenerationRequest request = request("r1");
            WorkerSession worker = pool.createWorker(request);
            pool.markError(worker);

            pool.completeJob(worker, request, JobOutcome.failure(ErrorType.AUTHENTICATION_ERROR, "logged out"));

            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.ERROR);
            assertThat(pool.assignToLeastLoaded(request("r2"))).isEmpty();
        }

        @Test
        @DisplayName("should keep a cancellation that raced the job and count it as a failure")
        void shouldKeepCancellation() throws InterruptedException {
            GenerationRequest request = request("r1");
            WorkerSession worker = pool.createWorker(request);
            request.cancel(null, clock.instant());

            boolean applied = pool.completeJob(worker, request, JobOutcome.success(result(request, worker.getId())));

            assertThat(applied).isFalse();
            assertThat(request.getStatus()).isEqualTo(RequestStatus.CANCELLED);
            assertThat(request.getResult()).isNull();
            assertThat(worker.getTotalFailed()).isEqualTo(1);
            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
        }

        @Test
        @DisplayName("should count the outcome before the request turns terminal")
        void shouldRecordOutcomeMetrics() throws InterruptedException {
            GenerationRequest request = request("r1");
            WorkerSession worker = pool.createWorker(request);

            pool.completeJob(worker, request, JobOutcome.failure(ErrorType.ARTIFACT_TIMEOUT, "no artifact"));

            assertThat(request.getStatus()).isEqualTo(RequestStatus.FAILED);
            assertThat(request.getErrorType()).isEqualTo(ErrorType.ARTIFACT_TIMEOUT);
            assertThat(metrics.getRegistry().get("test_pool_errors_total")
                    .tag("type", "ARTIFACT_TIMEOUT").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("removal and cleanup")
    class CleanupTests {

        @Test
        @DisplayName("should requeue local work globally and cancel the in-flight job")
        void shouldRequeueOnRemoval() throws InterruptedException {
            GenerationRequest current = request("r1");
            WorkerSession worker = pool.createWorker(current);
            GenerationRequest queued = request("r2");
            pool.assignToLeastLoaded(queued);

            assertThat(pool.removeWorker(worker.getId())).isTrue();

            assertThat(current.getStatus()).isEqualTo(RequestStatus.CANCELLED);
            assertThat(queued.getStatus()).isEqualTo(RequestStatus.PENDING);
            assertThat(queued.getAssignedWorkerId()).isNull();
            assertThat(pool.getGlobalQueue().snapshot()).containsExactly(queued);
            assertThat(drivers.last().isClosed()).isTrue();
            assertThat(pool.removeWorker(worker.getId())).isFalse();
        }

        @Test
        @DisplayName("should reclaim idle workers that lost their session")
        void shouldReclaimLoggedOutIdleWorker() throws InterruptedException {
            WorkerSession worker = pool.createWorker();
            drivers.last().logOut();
            clock.advance(Duration.ofMinutes(10));

            int removed = pool.cleanupIdle(clock.instant().minus(Duration.ofMinutes(5)));

            assertThat(removed).isEqualTo(1);
            assertThat(pool.getWorker(worker.getId())).isEmpty();
        }

        @Test
        @DisplayName("should keep idle workers still authenticated")
        void shouldKeepAuthenticatedIdleWorker() throws InterruptedException {
            WorkerSession worker = pool.createWorker();
            clock.advance(Duration.ofMinutes(10));

            int removed = pool.cleanupIdle(clock.instant().minus(Duration.ofMinutes(5)));

            assertThat(removed).isZero();
            assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
            assertThat(pool.snapshot().availableWorkers()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reclaim errored workers regardless of activity")
        void shouldReclaimErroredWorker() throws InterruptedException {
            WorkerSession worker = pool.createWorker();
            pool.markError(worker);

            assertThat(pool.cleanupIdle(clock.instant().minus(Duration.ofMinutes(5)))).isEqualTo(1);
            assertThat(pool.size()).isZero();
        }

        @Test
        @DisplayName("should leave recently active workers alone")
        void shouldIgnoreRecentWorkers() throws InterruptedException {
            pool.createWorker();
            drivers.last().logOut();

            assertThat(pool.cleanupIdle(clock.instant().minus(Duration.ofMinutes(5)))).isZero();
        }
    }

    @Nested
    @DisplayName("growth signals")
    class GrowthTests {

        @Test
        @DisplayName("should need growth only when no free worker exists and capacity remains")
        void shouldReportGrowthNeed() throws InterruptedException {
            assertThat(pool.needsGrowth()).isTrue();

            pool.createWorker();
            assertThat(pool.needsGrowth()).isFalse();

            pool.assignToLeastLoaded(request("r1"));
            assertThat(pool.needsGrowth()).isTrue();

            pool.createWorker();
            pool.assignToLeastLoaded(request("r2"));
            assertThat(pool.needsGrowth()).isFalse();
            assertThat(pool.hasCapacity()).isFalse();
        }
    }

    @Nested
    @DisplayName("statistics and shutdown")
    class StatsTests {

        @Test
        @DisplayName("should aggregate worker counters")
        void shouldAggregate() throws InterruptedException {
            GenerationRequest ok = request("r1");
            pool.recordSubmission();
            WorkerSession worker = pool.createWorker(ok);
            clock.advance(Duration.ofSeconds(10));
            pool.completeJob(worker, ok, JobOutcome.success(result(ok, worker.getId())));

            AggregateStats stats = pool.recomputeStats();

            assertThat(stats.totalRequests()).isEqualTo(1);
            assertThat(stats.completedRequests()).isEqualTo(1);
            assertThat(stats.failedRequests()).isZero();
            assertThat(stats.averageProcessingSeconds()).isEqualTo(10.0);
            assertThat(stats.uptime()).isEqualTo(Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("should cancel everything it holds and close every driver")
        void shouldShutdown() throws InterruptedException {
            GenerationRequest running = request("r1");
            pool.createWorker(running);
            GenerationRequest queued = request("r2");
            pool.assignToLeastLoaded(queued);
            GenerationRequest waiting = request("r3");
            pool.getGlobalQueue().append(waiting);

            pool.shutdown();
            pool.shutdown();

            assertThat(List.of(running, queued, waiting))
                    .extracting(GenerationRequest::getStatus)
                    .containsOnly(RequestStatus.CANCELLED);
            assertThat(drivers.opened()).allMatch(StubSessionDriver::isClosed);
            PoolSnapshot snapshot = pool.snapshot();
            assertThat(snapshot.totalWorkers()).isZero();
            assertThat(snapshot.globalQueueSize()).isZero();
        }
    }
}
