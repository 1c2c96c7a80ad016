package fr.lapetina.sessionpool;

import fr.lapetina.sessionpool.api.SessionManager;
import fr.lapetina.sessionpool.domain.strategy.LeastLoadedStrategy;
import fr.lapetina.sessionpool.driver.SessionDriverFactory;
import fr.lapetina.sessionpool.driver.Surface;
import fr.lapetina.sessionpool.driver.playwright.PlaywrightDriverFactory;
import fr.lapetina.sessionpool.execution.JobExecutor;
import fr.lapetina.sessionpool.infrastructure.auth.AuthenticationStatusCache;
import fr.lapetina.sessionpool.infrastructure.auth.Authenticator;
import fr.lapetina.sessionpool.infrastructure.config.ConfigLoader;
import fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig;
import fr.lapetina.sessionpool.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.sessionpool.infrastructure.pacing.Pacer;
import fr.lapetina.sessionpool.infrastructure.pacing.PacingProfile;
import fr.lapetina.sessionpool.infrastructure.pacing.Sleeper;
import fr.lapetina.sessionpool.infrastructure.storage.FileSystemUploader;
import fr.lapetina.sessionpool.infrastructure.storage.LoggingPersistenceRecorder;
import fr.lapetina.sessionpool.infrastructure.storage.PersistenceRecorder;
import fr.lapetina.sessionpool.infrastructure.storage.Uploader;
import fr.lapetina.sessionpool.pool.AdmissionSignal;
import fr.lapetina.sessionpool.pool.GrowthPolicy;
import fr.lapetina.sessionpool.pool.JobQueue;
import fr.lapetina.sessionpool.pool.Scheduler;
import fr.lapetina.sessionpool.pool.SessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for creating a fully-wired session manager from configuration.
 * This is the primary entry point for obtaining a configured {@link SessionManager}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SessionManagerFactory factory = SessionManagerFactory.create("config.yaml").start()) {
 *     SessionManager manager = factory.getSessionManager();
 *     // submit requests...
 * }
 * }</pre>
 */
public class SessionManagerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionManagerFactory.class);

    private final ConfigLoader configLoader;
    private final SessionPoolConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Pacer pacer;
    private final Authenticator authenticator;
    private final SessionPool pool;
    private final ExecutorService workerExecutor;
    private final Scheduler scheduler;
    private final SessionManager sessionManager;

    protected SessionManagerFactory(String configPath, Overrides overrides) {
        log.info("Initializing SessionManagerFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        PacingProfile profile = PacingProfile.fromNameOrDefault(config.getPacing().getProfile(), PacingProfile.BALANCED);
        this.pacer = overrides.sleeper != null ? new Pacer(profile, overrides.sleeper) : new Pacer(profile);
        log.info("Using pacing profile: {}", profile);

        Surface surface = Surface.fromConfig(config.getSurface());
        SessionPoolConfig.TimeoutsConfig timeouts = config.getTimeouts();

        this.authenticator = Authenticator.builder()
                .surface(surface)
                .credentials(config.getAuth().getIdentity(), config.getAuth().getSecret())
                .pacer(pacer)
                .statusCache(new AuthenticationStatusCache(Duration.ofMillis(config.getAuth().getStatusCacheTtlMs())))
                .maxAttempts(config.getAuth().getMaxAttempts())
                .pageLoadTimeout(Duration.ofMillis(timeouts.getPageLoadMs()))
                .elementTimeout(Duration.ofMillis(timeouts.getElementWaitMs()))
                .probeTimeout(Duration.ofMillis(timeouts.getAuthProbeMs()))
                .build();

        // Driver factory (allow override for testing)
        SessionDriverFactory driverFactory = overrides.driverFactory != null
                ? overrides.driverFactory
                : new PlaywrightDriverFactory(config.getBrowser());

        this.pool = SessionPool.builder()
                .maxWorkers(config.getPool().getMaxConcurrentWorkers())
                .driverFactory(driverFactory)
                .authenticator(authenticator)
                .strategy(new LeastLoadedStrategy())
                .build();

        JobExecutor jobExecutor = createJobExecutor(surface, overrides);

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.workerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "session-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        GrowthPolicy growthPolicy = new GrowthPolicy(
                pool,
                config.getPool().getSoftMaxWorkers(),
                overrides.admissionSignal
        );

        this.scheduler = new Scheduler(
                pool,
                jobExecutor,
                growthPolicy,
                metricsRegistry,
                workerExecutor,
                Duration.ofMillis(config.getScheduler().getTickIntervalMs()),
                config.getScheduler().getCleanupEveryTicks(),
                Duration.ofMillis(config.getPool().getIdleTimeoutMs())
        );

        this.sessionManager = new SessionManager(
                pool,
                new JobQueue(pool),
                scheduler,
                jobExecutor,
                growthPolicy,
                pacer,
                config.getPool().getInitialWorkers()
        );

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("SessionManagerFactory initialized: maxWorkers={}", pool.getMaxWorkers());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SessionManagerFactory create(String configPath) {
        return new SessionManagerFactory(configPath, new Overrides());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static SessionManagerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the session manager and watches the configuration file.
     */
    public SessionManagerFactory start() throws InterruptedException {
        sessionManager.start();
        configLoader.startWatching();
        log.info("Session manager factory started");
        return this;
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    public SessionPool getPool() {
        return pool;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public Pacer getPacer() {
        return pacer;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public SessionPoolConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private JobExecutor createJobExecutor(Surface surface, Overrides overrides) {
        SessionPoolConfig.TimeoutsConfig timeouts = config.getTimeouts();
        SessionPoolConfig.StuckDetectionConfig stuck = config.getStuckDetection();
        SessionPoolConfig.InteractionConfig interaction = config.getInteraction();

        Uploader uploader = overrides.uploader != null
                ? overrides.uploader
                : new FileSystemUploader(Path.of(config.getStorage().getUploadRoot()));
        PersistenceRecorder recorder = overrides.recorder != null
                ? overrides.recorder
                : new LoggingPersistenceRecorder();

        return JobExecutor.builder()
                .surface(surface)
                .authenticator(authenticator)
                .pacer(pacer)
                .uploader(uploader)
                .recorder(recorder)
                .callbacks(pool)
                .downloadPath(Path.of(config.getStorage().getDownloadPath()))
                .timeouts(
                        Duration.ofMillis(timeouts.getPageLoadMs()),
                        Duration.ofMillis(timeouts.getElementWaitMs()),
                        Duration.ofMillis(timeouts.getArtifactMs()))
                .stuckDetection(
                        stuck.getProbeAttempts(),
                        Duration.ofMillis(stuck.getProbeIntervalMs()),
                        stuck.getReloadCycles(),
                        Duration.ofMillis(stuck.getReloadProbeTimeoutMs()))
                .interaction(
                        interaction.getPrimaryAttempts(),
                        Duration.ofMillis(interaction.getPrimaryTimeoutMs()),
                        interaction.getSecondaryAttempts(),
                        Duration.ofMillis(interaction.getSecondaryTimeoutMs()))
                .build();
    }

    private void onConfigChanged(SessionPoolConfig oldConfig, SessionPoolConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        PacingProfile profile = PacingProfile.fromNameOrDefault(newConfig.getPacing().getProfile(), pacer.getProfile());
        pacer.setProfile(profile);

        scheduler.setIdleTimeout(Duration.ofMillis(newConfig.getPool().getIdleTimeoutMs()));

        if (oldConfig != null
                && oldConfig.getPool().getMaxConcurrentWorkers() != newConfig.getPool().getMaxConcurrentWorkers()) {
            log.warn("Worker cap changes require a restart: current={}, configured={}",
                    pool.getMaxWorkers(), newConfig.getPool().getMaxConcurrentWorkers());
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down SessionManagerFactory...");

        try {
            sessionManager.shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down session manager", e);
        }

        try {
            workerExecutor.shutdown();
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("SessionManagerFactory shut down");
    }

    /**
     * Components replacing the configured ones, mainly for tests.
     */
    protected static class Overrides {
        private SessionDriverFactory driverFactory;
        private Sleeper sleeper;
        private Uploader uploader;
        private PersistenceRecorder recorder;
        private AdmissionSignal admissionSignal;

        public Overrides() {
        }

        public Overrides driverFactory(SessionDriverFactory driverFactory) {
            this.driverFactory = driverFactory;
            return this;
        }

        public Overrides sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Overrides uploader(Uploader uploader) {
            this.uploader = uploader;
            return this;
        }

        public Overrides recorder(PersistenceRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Overrides admissionSignal(AdmissionSignal admissionSignal) {
            this.admissionSignal = admissionSignal;
            return this;
        }
    }
}
