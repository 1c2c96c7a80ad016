package fr.lapetina.sessionpool.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.sessionpool.domain.model.AggregateStats;
import fr.lapetina.sessionpool.domain.model.PoolSnapshot;
import fr.lapetina.sessionpool.domain.model.WorkerSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Pool-wide status with per-worker and aggregate statistics.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolStatusResponse {

    @JsonProperty("is_running")
    private boolean running;

    @JsonProperty("total_workers")
    private int totalWorkers;

    @JsonProperty("available_workers")
    private int availableWorkers;

    @JsonProperty("busy_workers")
    private int busyWorkers;

    @JsonProperty("max_workers")
    private int maxWorkers;

    @JsonProperty("global_queue_size")
    private int globalQueueSize;

    private List<WorkerStats> workers;

    private Stats stats;

    // Getters and setters
    public boolean isRunning() { return running; }
    public void setRunning(boolean running) { this.running = running; }

    public int getTotalWorkers() { return totalWorkers; }
    public void setTotalWorkers(int totalWorkers) { this.totalWorkers = totalWorkers; }

    public int getAvailableWorkers() { return availableWorkers; }
    public void setAvailableWorkers(int availableWorkers) { this.availableWorkers = availableWorkers; }

    public int getBusyWorkers() { return busyWorkers; }
    public void setBusyWorkers(int busyWorkers) { this.busyWorkers = busyWorkers; }

    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

    public int getGlobalQueueSize() { return globalQueueSize; }
    public void setGlobalQueueSize(int globalQueueSize) { this.globalQueueSize = globalQueueSize; }

    public List<WorkerStats> getWorkers() { return workers; }
    public void setWorkers(List<WorkerStats> workers) { this.workers = workers; }

    public Stats getStats() { return stats; }
    public void setStats(Stats stats) { this.stats = stats; }

    public static PoolStatusResponse from(boolean running, PoolSnapshot snapshot) {
        PoolStatusResponse response = new PoolStatusResponse();
        response.setRunning(running);
        response.setTotalWorkers(snapshot.totalWorkers());
        response.setAvailableWorkers(snapshot.availableWorkers());
        response.setBusyWorkers(snapshot.busyWorkers());
        response.setMaxWorkers(snapshot.maxWorkers());
        response.setGlobalQueueSize(snapshot.globalQueueSize());
        response.setWorkers(snapshot.workers().stream().map(WorkerStats::from).toList());
        response.setStats(Stats.from(snapshot.stats()));
        return response;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WorkerStats {

        @JsonProperty("worker_id")
        private String workerId;

        private String status;

        @JsonProperty("queue_size")
        private int queueSize;

        @JsonProperty("current_request_id")
        private String currentRequestId;

        @JsonProperty("total_processed")
        private long totalProcessed;

        @JsonProperty("total_failed")
        private long totalFailed;

        @JsonProperty("average_processing_seconds")
        private double averageProcessingSeconds;

        @JsonProperty("created_at")
        private Instant createdAt;

        @JsonProperty("last_activity")
        private Instant lastActivity;

        public String getWorkerId() { return workerId; }
        public void setWorkerId(String workerId) { this.workerId = workerId; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }

        public String getCurrentRequestId() { return currentRequestId; }
        public void setCurrentRequestId(String currentRequestId) { this.currentRequestId = currentRequestId; }

        public long getTotalProcessed() { return totalProcessed; }
        public void setTotalProcessed(long totalProcessed) { this.totalProcessed = totalProcessed; }

        public long getTotalFailed() { return totalFailed; }
        public void setTotalFailed(long totalFailed) { this.totalFailed = totalFailed; }

        public double getAverageProcessingSeconds() { return averageProcessingSeconds; }
        public void setAverageProcessingSeconds(double averageProcessingSeconds) { this.averageProcessingSeconds = averageProcessingSeconds; }

        public Instant getCreatedAt() { return createdAt; }
        public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

        public Instant getLastActivity() { return lastActivity; }
        public void setLastActivity(Instant lastActivity) { this.lastActivity = lastActivity; }

        static WorkerStats from(WorkerSnapshot worker) {
            WorkerStats stats = new WorkerStats();
            stats.setWorkerId(worker.id());
            stats.setStatus(worker.status().name().toLowerCase());
            stats.setQueueSize(worker.queueSize());
            stats.setCurrentRequestId(worker.currentRequestId());
            stats.setTotalProcessed(worker.totalProcessed());
            stats.setTotalFailed(worker.totalFailed());
            stats.setAverageProcessingSeconds(worker.averageProcessingSeconds());
            stats.setCreatedAt(worker.createdAt());
            stats.setLastActivity(worker.lastActivity());
            return stats;
        }
    }

    public static class Stats {

        @JsonProperty("total_requests")
        private long totalRequests;

        @JsonProperty("completed_requests")
        private long completedRequests;

        @JsonProperty("failed_requests")
        private long failedRequests;

        @JsonProperty("average_processing_seconds")
        private double averageProcessingSeconds;

        @JsonProperty("uptime_seconds")
        private long uptimeSeconds;

        public long getTotalRequests() { return totalRequests; }
        public void setTotalRequests(long totalRequests) { this.totalRequests = totalRequests; }

        public long getCompletedRequests() { return completedRequests; }
        public void setCompletedRequests(long completedRequests) { this.completedRequests = completedRequests; }

        public long getFailedRequests() { return failedRequests; }
        public void setFailedRequests(long failedRequests) { this.failedRequests = failedRequests; }

        public double getAverageProcessingSeconds() { return averageProcessingSeconds; }
        public void setAverageProcessingSeconds(double averageProcessingSeconds) { this.averageProcessingSeconds = averageProcessingSeconds; }

        public long getUptimeSeconds() { return uptimeSeconds; }
        public void setUptimeSeconds(long uptimeSeconds) { this.uptimeSeconds = uptimeSeconds; }

        static Stats from(AggregateStats aggregate) {
            Stats stats = new Stats();
            stats.setTotalRequests(aggregate.totalRequests());
            stats.setCompletedRequests(aggregate.completedRequests());
            stats.setFailedRequests(aggregate.failedRequests());
            stats.setAverageProcessingSeconds(aggregate.averageProcessingSeconds());
            stats.setUptimeSeconds(aggregate.uptime().toSeconds());
            return stats;
        }
    }
}
