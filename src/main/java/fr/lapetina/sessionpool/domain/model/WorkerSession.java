package fr.lapetina.sessionpool.domain.model;

import fr.lapetina.sessionpool.driver.SessionDriver;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One long-lived, authenticated browser session that executes jobs serially.
 *
 * Identity, driver and creation time are fixed. Status, local queue, current
 * request and counters are mutated only while the owning pool holds its lock;
 * this class does no locking of its own for those fields.
 */
public final class WorkerSession {

    private final String id;
    private final SessionDriver driver;
    private final Instant createdAt;
    private final Map<String, Object> generationContext = new ConcurrentHashMap<>();

    // Mutable state - guarded by the pool lock
    private final Deque<GenerationRequest> localQueue = new ArrayDeque<>();
    private volatile WorkerStatus status = WorkerStatus.IDLE;
    private volatile GenerationRequest currentRequest;
    private volatile Instant lastActivity;
    private volatile long totalProcessed;
    private volatile long totalFailed;
    private volatile double averageProcessingSeconds;

    public WorkerSession(String id, SessionDriver driver, Instant createdAt) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.driver = Objects.requireNonNull(driver, "Driver is required");
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.lastActivity = this.createdAt;
    }

    public String getId() {
        return id;
    }

    public SessionDriver getDriver() {
        return driver;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public void setStatus(WorkerStatus status) {
        this.status = status;
    }

    public GenerationRequest getCurrentRequest() {
        return currentRequest;
    }

    public void setCurrentRequest(GenerationRequest currentRequest) {
        this.currentRequest = currentRequest;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public long getTotalProcessed() {
        return totalProcessed;
    }

    public long getTotalFailed() {
        return totalFailed;
    }

    public double getAverageProcessingSeconds() {
        return averageProcessingSeconds;
    }

    /**
     * Per-job scratch data (request id, prompt, title, start time). Reset at the start of each job.
     */
    public Map<String, Object> getGenerationContext() {
        return generationContext;
    }

    public Deque<GenerationRequest> localQueue() {
        return localQueue;
    }

    public int queueSize() {
        return localQueue.size();
    }

    /**
     * Queued plus in-flight jobs.
     */
    public int load() {
        return localQueue.size() + (currentRequest != null ? 1 : 0);
    }

    /**
     * Estimated wait before a newly appended job would start.
     */
    public Duration estimatedWait() {
        return Duration.ofMillis(Math.round(averageProcessingSeconds * 1000 * localQueue.size()));
    }

    /**
     * Folds a successful job's processing time into the running average.
     */
    public void recordSuccess(Duration elapsed) {
        totalProcessed++;
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        averageProcessingSeconds =
                (averageProcessingSeconds * (totalProcessed - 1) + seconds) / totalProcessed;
    }

    public void recordFailure() {
        totalFailed++;
    }

    public boolean idleSince(Instant threshold) {
        return status == WorkerStatus.IDLE && currentRequest == null && lastActivity.isBefore(threshold);
    }

    /**
     * Removes and returns every queued request, leaving the local queue empty.
     */
    public List<GenerationRequest> drainQueue() {
        List<GenerationRequest> drained = new ArrayList<>(localQueue);
        localQueue.clear();
        return drained;
    }

    public WorkerSnapshot snapshot() {
        GenerationRequest current = currentRequest;
        return new WorkerSnapshot(
                id,
                status,
                localQueue.size(),
                current != null ? current.getId() : null,
                totalProcessed,
                totalFailed,
                averageProcessingSeconds,
                createdAt,
                lastActivity
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerSession that = (WorkerSession) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerSession{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", queue=" + localQueue.size() +
                ", processed=" + totalProcessed +
                ", failed=" + totalFailed +
                '}';
    }
}
