package fr.lapetina.sessionpool.execution;

import fr.lapetina.sessionpool.domain.exception.ArtifactTimeoutException;
import fr.lapetina.sessionpool.domain.exception.AuthenticationException;
import fr.lapetina.sessionpool.domain.exception.ElementNotFoundException;
import fr.lapetina.sessionpool.domain.exception.SessionPoolException;
import fr.lapetina.sessionpool.domain.exception.SessionStuckException;
import fr.lapetina.sessionpool.domain.exception.UploadException;
import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.GenerationResult;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import fr.lapetina.sessionpool.domain.model.WorkerSession;
import fr.lapetina.sessionpool.driver.Artifact;
import fr.lapetina.sessionpool.driver.Control;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.SessionDriver;
import fr.lapetina.sessionpool.driver.Surface;
import fr.lapetina.sessionpool.infrastructure.auth.Authenticator;
import fr.lapetina.sessionpool.infrastructure.pacing.Pacer;
import fr.lapetina.sessionpool.infrastructure.pacing.PauseKind;
import fr.lapetina.sessionpool.infrastructure.retry.RecoveringRetry;
import fr.lapetina.sessionpool.infrastructure.storage.DestinationKeys;
import fr.lapetina.sessionpool.infrastructure.storage.PersistenceRecorder;
import fr.lapetina.sessionpool.infrastructure.storage.UploadResult;
import fr.lapetina.sessionpool.infrastructure.storage.Uploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one generation job on one worker's session, from prompt entry to artifact hand-off.
 *
 * Every failure ends up on the request as FAILED with its {@link ErrorType}, and the
 * completion callback is always invoked. A request cancelled while running is noticed
 * between steps and abandoned.
 */
public final class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_WORKER_ID = "workerId";

    private final Surface surface;
    private final Authenticator authenticator;
    private final Pacer pacer;
    private final Uploader uploader;
    private final PersistenceRecorder recorder;
    private final JobCallbacks callbacks;
    private final Path downloadPath;
    private final Clock clock;

    private final Duration pageLoadTimeout;
    private final Duration elementTimeout;
    private final Duration artifactTimeout;

    private final int stuckProbeAttempts;
    private final Duration stuckProbeInterval;
    private final int stuckReloadCycles;
    private final Duration stuckReloadProbeTimeout;

    private final int primaryAttempts;
    private final Duration primaryTimeout;
    private final int secondaryAttempts;
    private final Duration secondaryTimeout;

    private JobExecutor(Builder builder) {
        this.surface = Objects.requireNonNull(builder.surface, "Surface is required");
        this.authenticator = Objects.requireNonNull(builder.authenticator, "Authenticator is required");
        this.pacer = Objects.requireNonNull(builder.pacer, "Pacer is required");
        this.uploader = Objects.requireNonNull(builder.uploader, "Uploader is required");
        this.recorder = Objects.requireNonNull(builder.recorder, "Persistence recorder is required");
        this.callbacks = Objects.requireNonNull(builder.callbacks, "Job callbacks are required");
        this.downloadPath = Objects.requireNonNull(builder.downloadPath, "Download path is required");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.pageLoadTimeout = builder.pageLoadTimeout;
        this.elementTimeout = builder.elementTimeout;
        this.artifactTimeout = builder.artifactTimeout;
        this.stuckProbeAttempts = builder.stuckProbeAttempts;
        this.stuckProbeInterval = builder.stuckProbeInterval;
        this.stuckReloadCycles = builder.stuckReloadCycles;
        this.stuckReloadProbeTimeout = builder.stuckReloadProbeTimeout;
        this.primaryAttempts = builder.primaryAttempts;
        this.primaryTimeout = builder.primaryTimeout;
        this.secondaryAttempts = builder.secondaryAttempts;
        this.secondaryTimeout = builder.secondaryTimeout;
    }

    /**
     * Executes a request already moved to PROCESSING on the worker.
     */
    public void run(WorkerSession worker, GenerationRequest request) {
        MDC.put(MDC_REQUEST_ID, request.getId());
        MDC.put(MDC_WORKER_ID, worker.getId());
        JobOutcome outcome = null;
        try {
            if (request.getStatus() != RequestStatus.PROCESSING) {
                log.debug("Job skipped, request not processing: status={}", request.getStatus());
                outcome = JobOutcome.failure(ErrorType.CANCELLED, "Request no longer processing");
                return;
            }
            log.info("Job started: title={}", request.getTitle());
            outcome = JobOutcome.success(execute(worker, request));
        } catch (SessionPoolException e) {
            outcome = JobOutcome.failure(e.getErrorType(), e.getMessage());
        } catch (DriverException e) {
            // A control interaction the surface rejected outright
            outcome = JobOutcome.failure(ErrorType.ELEMENT_NOT_FOUND, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = JobOutcome.failure(ErrorType.INTERNAL_ERROR, "Interrupted");
        } catch (Exception e) {
            log.error("Job failed unexpectedly", e);
            outcome = JobOutcome.failure(ErrorType.INTERNAL_ERROR, e.getMessage());
        } finally {
            try {
                report(worker, request, outcome != null
                        ? outcome : JobOutcome.failure(ErrorType.INTERNAL_ERROR, "Job aborted"));
            } finally {
                MDC.remove(MDC_REQUEST_ID);
                MDC.remove(MDC_WORKER_ID);
            }
        }
    }

    private void report(WorkerSession worker, GenerationRequest request, JobOutcome outcome) {
        if (!callbacks.completeJob(worker, request, outcome)) {
            log.info("Job abandoned: status={}", request.getStatus());
        } else if (outcome.succeeded()) {
            log.info("Job completed: artifactUrl={}, recordId={}",
                    outcome.result().artifactUrl(), outcome.result().recordId());
        } else {
            log.error("Job failed: errorType={}, error={}", outcome.errorType(), outcome.error());
        }
    }

    private GenerationResult execute(WorkerSession worker, GenerationRequest request) throws InterruptedException {
        SessionDriver driver = worker.getDriver();

        ensureAuthenticated(worker);
        recordContext(worker, request);
        ensureActive(request);

        driver.navigate(surface.taskUrl(), pageLoadTimeout);
        pacer.pause(PauseKind.NAVIGATION);
        enterPrompt(driver, request.composeInput());
        ensureActive(request);

        if (!driver.findAndActivate(surface.submitControl(), elementTimeout)) {
            throw new ElementNotFoundException("Control not found: " + surface.submitControl());
        }
        pacer.pause(PauseKind.CLICK);

        awaitWorkingIndicator(driver);
        ensureActive(request);

        exportArtifact(driver);
        Artifact artifact = driver.awaitArtifact(artifactTimeout)
                .orElseThrow(() -> new ArtifactTimeoutException(
                        "No artifact delivered within " + artifactTimeout.toSeconds() + "s"));
        ensureActive(request);

        return handOff(worker, request, artifact);
    }

    private void ensureAuthenticated(WorkerSession worker) throws InterruptedException {
        SessionDriver driver = worker.getDriver();
        if (authenticator.isAuthenticated(worker.getId(), driver)) {
            return;
        }
        log.warn("Worker session lost, re-authenticating");
        try {
            authenticator.authenticate(worker.getId(), driver);
        } catch (AuthenticationException e) {
            callbacks.markError(worker);
            throw e;
        }
    }

    private void recordContext(WorkerSession worker, GenerationRequest request) {
        Map<String, Object> context = worker.getGenerationContext();
        context.clear();
        context.put("requestId", request.getId());
        context.put("title", request.getTitle());
        context.put("instrumental", request.isInstrumental());
        context.put("startedAt", clock.instant());
    }

    private void enterPrompt(SessionDriver driver, String input) throws InterruptedException {
        Control prompt = surface.promptInput();
        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "fill " + prompt,
                primaryAttempts,
                attempt -> {
                    if (!driver.probe(prompt, primaryTimeout)) {
                        return false;
                    }
                    driver.fill(prompt, "");
                    driver.fill(prompt, input);
                    return true;
                },
                failed -> reloadPage(driver));
        if (!outcome.succeeded()) {
            throw new ElementNotFoundException(
                    "Control not usable: " + prompt + ", " + outcome.describeFailure(), outcome.lastFailure());
        }
        pacer.pause(PauseKind.CLICK);
    }

    /**
     * Polls for the working indicator, then re-probes after each reload cycle.
     */
    private void awaitWorkingIndicator(SessionDriver driver) throws InterruptedException {
        Control working = surface.workingIndicator();
        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "detect " + working,
                1 + stuckReloadCycles,
                attempt -> attempt == 1 ? pollWorking(driver, working)
                        : driver.probe(working, stuckReloadProbeTimeout),
                failed -> reloadPage(driver));
        if (!outcome.succeeded()) {
            throw new SessionStuckException(
                    "Working indicator never appeared, " + outcome.describeFailure(), outcome.lastFailure());
        }
    }

    private boolean pollWorking(SessionDriver driver, Control working) throws InterruptedException {
        for (int i = 0; i < stuckProbeAttempts; i++) {
            if (driver.probe(working, Duration.ZERO)) {
                return true;
            }
            pacer.sleep(stuckProbeInterval);
        }
        return false;
    }

    /**
     * Opens the secondary menu, picks export, then the format. A control that fails is
     * retried after a reload that re-opens the menus leading to it.
     */
    private void exportArtifact(SessionDriver driver) throws InterruptedException {
        activateWithRetry(driver, surface.moreOptions(), primaryAttempts, primaryTimeout, List.of());
        activateWithRetry(driver, surface.exportMenuItem(), secondaryAttempts, secondaryTimeout,
                List.of(surface.moreOptions()));
        activateWithRetry(driver, surface.formatOption(), secondaryAttempts, secondaryTimeout,
                List.of(surface.moreOptions(), surface.exportMenuItem()));
    }

    private void activateWithRetry(
            SessionDriver driver,
            Control control,
            int attempts,
            Duration timeout,
            List<Control> leadingControls
    ) throws InterruptedException {
        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "activate " + control,
                attempts,
                attempt -> driver.findAndActivate(control, timeout),
                failed -> {
                    reloadPage(driver);
                    for (Control leading : leadingControls) {
                        driver.findAndActivate(leading, timeout);
                        pacer.pause(PauseKind.CLICK);
                    }
                });
        if (!outcome.succeeded()) {
            throw new ElementNotFoundException(
                    "Control not found: " + control + ", " + outcome.describeFailure(), outcome.lastFailure());
        }
        pacer.pause(PauseKind.CLICK);
    }

    private void reloadPage(SessionDriver driver) throws InterruptedException {
        driver.reload(pageLoadTimeout);
        pacer.pause(PauseKind.NAVIGATION);
    }

    private GenerationResult handOff(WorkerSession worker, GenerationRequest request, Artifact artifact) {
        String generationId = request.getId();
        String filename = artifact.suggestedFilename();
        Path localPath = downloadPath.resolve(generationId).resolve(filename);
        try {
            artifact.saveAs(localPath);
        } catch (DriverException e) {
            throw new UploadException("Failed to save artifact: " + e.getMessage(), e);
        }
        log.debug("Artifact saved: path={}", localPath);

        String key = DestinationKeys.forArtifact(
                request.getUserId(), request.getProjectId(), generationId, filename);
        UploadResult upload;
        try {
            upload = uploader.upload(localPath, key);
        } catch (UploadException e) {
            log.error("Upload failed, local copy kept: path={}, key={}", localPath, key);
            throw e;
        } catch (RuntimeException e) {
            log.error("Upload failed, local copy kept: path={}, key={}", localPath, key);
            throw new UploadException("Upload failed: " + e.getMessage(), e);
        }
        deleteLocalCopy(localPath);

        GenerationResult result = new GenerationResult(
                generationId, worker.getId(), upload.url(), upload.key(), upload.size(),
                upload.metadata(), null, clock.instant());
        return record(request, upload, result);
    }

    private void deleteLocalCopy(Path localPath) {
        try {
            Files.deleteIfExists(localPath);
        } catch (IOException e) {
            log.warn("Error deleting local artifact: path={}", localPath, e);
        }
    }

    private GenerationResult record(GenerationRequest request, UploadResult upload, GenerationResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generation_id", request.getId());
        metadata.put("title", request.getTitle());
        metadata.put("prompt", request.getPrompt());
        metadata.put("instrumental", request.isInstrumental());
        metadata.put("worker_id", result.workerId());
        if (request.getLyrics() != null) {
            metadata.put("lyrics", request.getLyrics());
        }
        if (request.getProjectId() != null) {
            metadata.put("project_id", request.getProjectId());
        }
        if (request.getUserId() != null) {
            metadata.put("user_id", request.getUserId());
        }
        try {
            return result.withRecordId(recorder.createRecord(upload, metadata));
        } catch (RuntimeException e) {
            log.warn("Persistence record failed, result kept: key={}, error={}", upload.key(), e.getMessage());
            return result;
        }
    }

    private static void ensureActive(GenerationRequest request) {
        if (request.getStatus() != RequestStatus.PROCESSING) {
            throw new SessionPoolException(ErrorType.CANCELLED, "Request no longer processing");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Surface surface;
        private Authenticator authenticator;
        private Pacer pacer;
        private Uploader uploader;
        private PersistenceRecorder recorder;
        private JobCallbacks callbacks;
        private Path downloadPath = Path.of("downloads");
        private Clock clock;
        private Duration pageLoadTimeout = Duration.ofSeconds(30);
        private Duration elementTimeout = Duration.ofSeconds(15);
        private Duration artifactTimeout = Duration.ofSeconds(120);
        private int stuckProbeAttempts = 30;
        private Duration stuckProbeInterval = Duration.ofSeconds(1);
        private int stuckReloadCycles = 2;
        private Duration stuckReloadProbeTimeout = Duration.ofSeconds(5);
        private int primaryAttempts = 3;
        private Duration primaryTimeout = Duration.ofSeconds(30);
        private int secondaryAttempts = 2;
        private Duration secondaryTimeout = Duration.ofSeconds(10);

        public Builder surface(Surface surface) {
            this.surface = surface;
            return this;
        }

        public Builder authenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        public Builder pacer(Pacer pacer) {
            this.pacer = pacer;
            return this;
        }

        public Builder uploader(Uploader uploader) {
            this.uploader = uploader;
            return this;
        }

        public Builder recorder(PersistenceRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder callbacks(JobCallbacks callbacks) {
            this.callbacks = callbacks;
            return this;
        }

        public Builder downloadPath(Path downloadPath) {
            this.downloadPath = downloadPath;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder timeouts(Duration pageLoad, Duration element, Duration artifact) {
            this.pageLoadTimeout = pageLoad;
            this.elementTimeout = element;
            this.artifactTimeout = artifact;
            return this;
        }

        public Builder stuckDetection(int probeAttempts, Duration probeInterval, int reloadCycles,
                                      Duration reloadProbeTimeout) {
            this.stuckProbeAttempts = probeAttempts;
            this.stuckProbeInterval = probeInterval;
            this.stuckReloadCycles = reloadCycles;
            this.stuckReloadProbeTimeout = reloadProbeTimeout;
            return this;
        }

        public Builder interaction(int primaryAttempts, Duration primaryTimeout,
                                   int secondaryAttempts, Duration secondaryTimeout) {
            this.primaryAttempts = primaryAttempts;
            this.primaryTimeout = primaryTimeout;
            this.secondaryAttempts = secondaryAttempts;
            this.secondaryTimeout = secondaryTimeout;
            return this;
        }

        public JobExecutor build() {
            return new JobExecutor(this);
        }
    }
}
