package fr.lapetina.sessionpool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the session pool. Keeps the pool warm and logs its status periodically.
 */
public class SessionPoolApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionPoolApplication.class);

    private final SessionManagerFactory factory;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService statusReporter;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public SessionPoolApplication(String configPath) {
        this(SessionManagerFactory.create(configPath));
    }

    SessionPoolApplication(SessionManagerFactory factory) {
        log.info("Starting Session Pool...");
        this.factory = factory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.statusReporter = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "status-reporter");
            t.setDaemon(true);
            return t;
        });
        log.info("Session Pool initialized");
    }

    public void start() throws InterruptedException {
        factory.start();
        long intervalMs = factory.getConfig().getStatusLog().getIntervalMs();
        if (intervalMs > 0) {
            statusReporter.scheduleWithFixedDelay(this::logStatus, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Session Pool started: workers={}", factory.getPool().size());
    }

    /**
     * Serialized pool status, as written to the status log.
     */
    String statusJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(factory.getSessionManager().poolStatus());
    }

    private void logStatus() {
        try {
            log.info("Pool status: {}", statusJson());
        } catch (JsonProcessingException e) {
            log.warn("Error serializing pool status", e);
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public SessionManagerFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Session Pool...");

        statusReporter.shutdownNow();

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Session Pool shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            SessionPoolApplication app = new SessionPoolApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Session Pool", e);
            System.exit(1);
        }
    }
}
