package fr.lapetina.sessionpool.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.GenerationResult;
import fr.lapetina.sessionpool.domain.model.RequestStatus;

import java.time.Instant;

/**
 * Status of one request as reported to callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestStatusResponse {

    @JsonProperty("request_id")
    private String requestId;

    private String status;

    @JsonProperty("assigned_worker_id")
    private String assignedWorkerId;

    @JsonProperty("queue_position")
    private Integer queuePosition;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("retry_count")
    private int retryCount;

    private String error;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("artifact_url")
    private String artifactUrl;

    @JsonProperty("storage_key")
    private String storageKey;

    @JsonProperty("record_id")
    private String recordId;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getAssignedWorkerId() { return assignedWorkerId; }
    public void setAssignedWorkerId(String assignedWorkerId) { this.assignedWorkerId = assignedWorkerId; }

    public Integer getQueuePosition() { return queuePosition; }
    public void setQueuePosition(Integer queuePosition) { this.queuePosition = queuePosition; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public String getArtifactUrl() { return artifactUrl; }
    public void setArtifactUrl(String artifactUrl) { this.artifactUrl = artifactUrl; }

    public String getStorageKey() { return storageKey; }
    public void setStorageKey(String storageKey) { this.storageKey = storageKey; }

    public String getRecordId() { return recordId; }
    public void setRecordId(String recordId) { this.recordId = recordId; }

    /**
     * Creates from a request snapshot. The error is only reported on failed or cancelled requests.
     */
    public static RequestStatusResponse fromSnapshot(GenerationRequest.Snapshot snapshot) {
        RequestStatusResponse response = new RequestStatusResponse();
        response.setRequestId(snapshot.id());
        response.setStatus(snapshot.status().name().toLowerCase());
        response.setAssignedWorkerId(snapshot.assignedWorkerId());
        response.setQueuePosition(snapshot.queuePosition());
        response.setCreatedAt(snapshot.createdAt());
        response.setStartedAt(snapshot.startedAt());
        response.setCompletedAt(snapshot.completedAt());
        response.setRetryCount(snapshot.retryCount());

        if (snapshot.status() == RequestStatus.FAILED || snapshot.status() == RequestStatus.CANCELLED) {
            response.setError(snapshot.error());
            if (snapshot.errorType() != null) {
                response.setErrorType(snapshot.errorType().name());
            }
        }

        GenerationResult result = snapshot.result();
        if (result != null) {
            response.setArtifactUrl(result.artifactUrl());
            response.setStorageKey(result.storageKey());
            response.setRecordId(result.recordId());
        }
        return response;
    }
}
