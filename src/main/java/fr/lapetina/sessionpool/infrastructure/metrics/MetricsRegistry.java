package fr.lapetina.sessionpool.infrastructure.metrics;

import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.RequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Pool size gauges (workers, available, busy, global queue)
 * - Request outcome and error counters
 * - Job duration timer
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<RequestStatus, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();

    private final Counter submittedCounter;
    private final Counter workersCreatedCounter;
    private final Counter workersRemovedCounter;
    private final Timer jobTimer;

    // Pool gauges
    private final AtomicInteger totalWorkers = new AtomicInteger(0);
    private final AtomicInteger availableWorkers = new AtomicInteger(0);
    private final AtomicInteger busyWorkers = new AtomicInteger(0);
    private final AtomicInteger globalQueueSize = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_workers", totalWorkers, AtomicInteger::get)
                .description("Number of registered workers")
                .register(registry);

        Gauge.builder(prefix + "_workers_available", availableWorkers, AtomicInteger::get)
                .description("Number of idle workers")
                .register(registry);

        Gauge.builder(prefix + "_workers_busy", busyWorkers, AtomicInteger::get)
                .description("Number of busy workers")
                .register(registry);

        Gauge.builder(prefix + "_global_queue_size", globalQueueSize, AtomicInteger::get)
                .description("Requests waiting for any worker")
                .register(registry);

        this.submittedCounter = Counter.builder(prefix + "_requests_submitted_total")
                .description("Total number of accepted requests")
                .register(registry);

        this.workersCreatedCounter = Counter.builder(prefix + "_workers_created_total")
                .description("Total number of workers created")
                .register(registry);

        this.workersRemovedCounter = Counter.builder(prefix + "_workers_removed_total")
                .description("Total number of workers torn down")
                .register(registry);

        this.jobTimer = Timer.builder(prefix + "_job_duration")
                .description("Time from job start to completion")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("session_pool");
    }

    public void incrementSubmitted() {
        submittedCounter.increment();
    }

    public void incrementWorkersCreated() {
        workersCreatedCounter.increment();
    }

    public void incrementWorkersRemoved() {
        workersRemovedCounter.increment();
    }

    /**
     * Counts a request reaching a terminal status.
     */
    public void incrementOutcome(RequestStatus status) {
        outcomeCounters.computeIfAbsent(status, s ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of finished requests")
                        .tag("status", s.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, t ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("type", t.name())
                        .register(registry)
        ).increment();
    }

    public void recordJobDuration(Duration duration) {
        jobTimer.record(duration);
    }

    /**
     * Publishes pool gauges.
     */
    public void updatePool(int workers, int available, int busy, int globalQueue) {
        totalWorkers.set(workers);
        availableWorkers.set(available);
        busyWorkers.set(busy);
        globalQueueSize.set(globalQueue);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
