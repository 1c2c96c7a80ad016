package fr.lapetina.sessionpool.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of submitted generation work, tracked through its status lifecycle.
 *
 * Identity and input fields are immutable. Lifecycle fields are guarded by the
 * request's own monitor; transitions are monotonic and return false when refused.
 */
public final class GenerationRequest {

    private final String id;
    private final String prompt;
    private final String title;
    private final String lyrics;
    private final boolean instrumental;
    private final String projectId;
    private final String userId;
    private final int priority;
    private final int maxRetries;
    private final Instant createdAt;

    // Mutable state - guarded by this
    private RequestStatus status = RequestStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String assignedWorkerId;
    private Integer queuePosition;
    private GenerationResult result;
    private String error;
    private ErrorType errorType;
    private int retryCount;

    private GenerationRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.prompt = Objects.requireNonNull(builder.prompt, "Prompt is required");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        this.title = builder.title != null ? builder.title : "Track " + id;
        this.lyrics = builder.lyrics;
        this.instrumental = builder.instrumental;
        this.projectId = builder.projectId;
        this.userId = builder.userId;
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getTitle() {
        return title;
    }

    public String getLyrics() {
        return lyrics;
    }

    public boolean isInstrumental() {
        return instrumental;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getUserId() {
        return userId;
    }

    public int getPriority() {
        return priority;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Text entered into the primary input: the prompt, with lyrics appended
     * when present and the request is not instrumental.
     */
    public String composeInput() {
        if (lyrics != null && !lyrics.isBlank() && !instrumental) {
            return prompt + "\n\nLyrics:\n" + lyrics;
        }
        return prompt;
    }

    public synchronized RequestStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized String getAssignedWorkerId() {
        return assignedWorkerId;
    }

    public synchronized Integer getQueuePosition() {
        return queuePosition;
    }

    public synchronized GenerationResult getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized ErrorType getErrorType() {
        return errorType;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    /**
     * Records where the request is queued. Position is 1-based and advisory.
     */
    public synchronized void assign(String workerId, int position) {
        this.assignedWorkerId = workerId;
        this.queuePosition = position;
    }

    /**
     * Updates the advisory queue position while the request waits.
     */
    public synchronized void updateQueuePosition(int position) {
        if (status == RequestStatus.PENDING) {
            this.queuePosition = position;
        }
    }

    /**
     * Detaches the request from a worker, e.g. when it is moved back to the global queue.
     */
    public synchronized void clearAssignment() {
        this.assignedWorkerId = null;
        this.queuePosition = null;
    }

    /**
     * PENDING -> PROCESSING.
     */
    public synchronized boolean markProcessing(String workerId, Instant now) {
        if (status != RequestStatus.PENDING) {
            return false;
        }
        status = RequestStatus.PROCESSING;
        assignedWorkerId = workerId;
        startedAt = now;
        queuePosition = null;
        return true;
    }

    /**
     * PROCESSING -> COMPLETED.
     */
    public synchronized boolean complete(GenerationResult generationResult, Instant now) {
        if (status != RequestStatus.PROCESSING) {
            return false;
        }
        status = RequestStatus.COMPLETED;
        result = generationResult;
        completedAt = now;
        return true;
    }

    /**
     * PROCESSING -> FAILED.
     */
    public synchronized boolean fail(ErrorType type, String message, Instant now) {
        if (status != RequestStatus.PROCESSING) {
            return false;
        }
        status = RequestStatus.FAILED;
        errorType = type != null ? type : ErrorType.INTERNAL_ERROR;
        error = message;
        completedAt = now;
        return true;
    }

    /**
     * PENDING | PROCESSING -> CANCELLED.
     *
     * @param reason optional error text; null for a plain caller cancellation
     */
    public synchronized boolean cancel(String reason, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = RequestStatus.CANCELLED;
        queuePosition = null;
        if (reason != null) {
            error = reason;
            errorType = ErrorType.CANCELLED;
        }
        completedAt = now;
        return true;
    }

    /**
     * Stamps completion time if no transition has done so yet.
     */
    public synchronized void stampCompleted(Instant now) {
        if (completedAt == null) {
            completedAt = now;
        }
    }

    /**
     * Time spent processing, or null if the request never started.
     */
    public synchronized Duration processingTime(Instant now) {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end);
    }

    /**
     * Consistent view of the lifecycle fields.
     */
    public synchronized Snapshot snapshot() {
        return new Snapshot(
                id, status, assignedWorkerId, queuePosition, createdAt, startedAt,
                completedAt, error, errorType, result, retryCount, maxRetries, priority
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenerationRequest that = (GenerationRequest) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public synchronized String toString() {
        return "GenerationRequest{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", worker=" + assignedWorkerId +
                ", position=" + queuePosition +
                '}';
    }

    /**
     * Point-in-time copy of a request's lifecycle state.
     */
    public record Snapshot(
            String id,
            RequestStatus status,
            String assignedWorkerId,
            Integer queuePosition,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt,
            String error,
            ErrorType errorType,
            GenerationResult result,
            int retryCount,
            int maxRetries,
            int priority
    ) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String prompt;
        private String title;
        private String lyrics;
        private boolean instrumental;
        private String projectId;
        private String userId;
        private int priority = 0;
        private int maxRetries = 3;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder lyrics(String lyrics) {
            this.lyrics = lyrics;
            return this;
        }

        public Builder instrumental(boolean instrumental) {
            this.instrumental = instrumental;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(this);
        }
    }
}
