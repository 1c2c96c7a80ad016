package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.DirectExecutorService;
import fr.lapetina.sessionpool.TestClock;
import fr.lapetina.sessionpool.TestSessions;
import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import fr.lapetina.sessionpool.domain.model.WorkerStatus;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.StubDriverFactory;
import fr.lapetina.sessionpool.execution.JobExecutor;
import fr.lapetina.sessionpool.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.sessionpool.infrastructure.storage.RecordingRecorder;
import fr.lapetina.sessionpool.infrastructure.storage.RecordingUploader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerTest {

    @TempDir
    Path downloads;

    private TestClock clock;
    private StubDriverFactory drivers;
    private MetricsRegistry metrics;
    private RecordingUploader uploader;
    private DirectExecutorService executor;
    private SessionPool pool;
    private JobQueue jobQueue;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        drivers = new StubDriverFactory();
        metrics = new MetricsRegistry("test_pool");
        uploader = new RecordingUploader();
        executor = new DirectExecutorService();
        pool = SessionPool.builder()
                .maxWorkers(2)
                .driverFactory(drivers)
                .authenticator(TestSessions.authenticator(clock))
                .metrics(metrics)
                .clock(clock)
                .build();
        jobQueue = new JobQueue(pool);
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
        pool.shutdown();
        metrics.close();
    }

    private Scheduler startScheduler(GrowthPolicy growthPolicy, int cleanupEveryTicks) {
        JobExecutor jobExecutor = JobExecutor.builder()
                .surface(TestSessions.SURFACE)
                .authenticator(pool.getAuthenticator())
                .pacer(TestSessions.pacer())
                .uploader(uploader)
                .recorder(new RecordingRecorder())
                .callbacks(pool)
                .downloadPath(downloads)
                .clock(clock)
                .stuckDetection(3, Duration.ofMillis(1), 1, Duration.ofMillis(10))
                .build();
        // Ticks are driven by the test
        scheduler = new Scheduler(pool, jobExecutor, growthPolicy, metrics, executor,
                Duration.ofHours(1), cleanupEveryTicks, Duration.ofMinutes(5));
        scheduler.start();
        return scheduler;
    }

    private GenerationRequest request(String id) {
        return GenerationRequest.builder().id(id).prompt("synthwave").createdAt(clock.instant()).build();
    }

    @Test
    @DisplayName("should dispatch queued work and run it to completion")
    void shouldDispatchQueuedWork() throws InterruptedException {
        WorkerSession worker = pool.createWorker();
        GenerationRequest request = request("r1");
        jobQueue.addRequest(request);
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);

        scheduler.tick();

        assertThat(request.getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(request.getResult().workerId()).isEqualTo(worker.getId());
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
        assertThat(uploader.keys()).containsExactly("music/generated/r1/track.mp3");
    }

    @Test
    @DisplayName("should start one job per worker and finish the rest as workers free up")
    void shouldRunBurstOnTwoWorkers() throws InterruptedException {
        WorkerSession first = pool.createWorker();
        WorkerSession second = pool.createWorker();
        List<GenerationRequest> requests = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            GenerationRequest request = request("r" + i);
            requests.add(request);
            jobQueue.addRequest(request);
        }
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);
        executor.hold();

        scheduler.tick();

        assertThat(executor.heldCount()).isEqualTo(2);
        assertThat(requests).filteredOn(r -> r.getStatus() == RequestStatus.PROCESSING).hasSize(2);
        assertThat(requests).filteredOn(r -> r.getStatus() == RequestStatus.PENDING).hasSize(3);

        for (int round = 0; round < 5 && executor.heldCount() > 0; round++) {
            executor.runHeld();
            scheduler.tick();
        }

        assertThat(requests).extracting(GenerationRequest::getStatus).containsOnly(RequestStatus.COMPLETED);
        assertThat(first.getTotalProcessed() + second.getTotalProcessed()).isEqualTo(5);
    }

    @Test
    @DisplayName("should fail only the job whose session throws")
    void shouldIsolateFailingSession() throws InterruptedException {
        pool.createWorker();
        pool.createWorker();
        drivers.opened().get(0).failActivation("submit", new DriverException("Target closed"));
        GenerationRequest failing = request("r1");
        GenerationRequest healthy = request("r2");
        jobQueue.addRequest(failing);
        jobQueue.addRequest(healthy);
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);
        executor.hold();

        scheduler.tick();
        executor.runHeld();

        assertThat(failing.getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(failing.getErrorType()).isEqualTo(ErrorType.ELEMENT_NOT_FOUND);
        assertThat(healthy.getStatus()).isEqualTo(RequestStatus.COMPLETED);
    }

    @Test
    @DisplayName("should grow the pool while requests wait globally")
    void shouldGrowForWaitingWork() {
        GenerationRequest request = request("r1");
        jobQueue.addRequest(request);
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);

        scheduler.tick();
        assertThat(pool.size()).isEqualTo(1);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);

        scheduler.tick();
        assertThat(request.getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(pool.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not grow when the policy refuses")
    void shouldRespectGrowthPolicy() {
        jobQueue.addRequest(request("r1"));
        startScheduler(new GrowthPolicy(pool, 0, workers -> false), 1000);

        scheduler.tick();

        assertThat(pool.size()).isZero();
        assertThat(pool.getGlobalQueue().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reclaim idle workers that lost their session")
    void shouldCleanUpIdleWorkers() throws InterruptedException {
        pool.createWorker();
        drivers.last().logOut();
        clock.advance(Duration.ofMinutes(10));
        startScheduler(new GrowthPolicy(pool, 2, null), 1);

        scheduler.tick();

        assertThat(pool.size()).isZero();
        assertThat(drivers.last().isClosed()).isTrue();
    }

    @Test
    @DisplayName("should fail a job the executor rejects and free its worker")
    void shouldFailRejectedJob() throws InterruptedException {
        WorkerSession worker = pool.createWorker();
        GenerationRequest request = request("r1");
        jobQueue.addRequest(request);
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);
        executor.shutdown();

        scheduler.tick();

        assertThat(request.getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.IDLE);
    }

    @Test
    @DisplayName("should publish pool gauges each tick")
    void shouldPublishGauges() throws InterruptedException {
        pool.createWorker();
        jobQueue.register(request("r0"));
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);

        scheduler.tick();

        assertThat(metrics.getRegistry().get("test_pool_workers").gauge().value()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_pool_workers_available").gauge().value()).isEqualTo(1.0);
        assertThat(pool.getStats().totalRequests()).isEqualTo(1);
    }

    @Test
    @DisplayName("should do nothing once closed")
    void shouldStopWhenClosed() throws InterruptedException {
        pool.createWorker();
        GenerationRequest request = request("r1");
        jobQueue.addRequest(request);
        startScheduler(new GrowthPolicy(pool, 2, null), 1000);
        scheduler.close();

        scheduler.tick();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);
    }
}
