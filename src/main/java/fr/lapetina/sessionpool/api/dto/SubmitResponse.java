package fr.lapetina.sessionpool.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.sessionpool.pool.SubmitReceipt;

/**
 * Answer to a queued submission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubmitResponse {

    @JsonProperty("request_id")
    private String requestId;

    private String status;

    @JsonProperty("assigned_worker_id")
    private String assignedWorkerId;

    @JsonProperty("queue_position")
    private Integer queuePosition;

    @JsonProperty("estimated_wait_seconds")
    private Double estimatedWaitSeconds;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getAssignedWorkerId() { return assignedWorkerId; }
    public void setAssignedWorkerId(String assignedWorkerId) { this.assignedWorkerId = assignedWorkerId; }

    public Integer getQueuePosition() { return queuePosition; }
    public void setQueuePosition(Integer queuePosition) { this.queuePosition = queuePosition; }

    public Double getEstimatedWaitSeconds() { return estimatedWaitSeconds; }
    public void setEstimatedWaitSeconds(Double estimatedWaitSeconds) { this.estimatedWaitSeconds = estimatedWaitSeconds; }

    /**
     * Creates from the queue's placement receipt.
     */
    public static SubmitResponse fromReceipt(SubmitReceipt receipt) {
        SubmitResponse response = new SubmitResponse();
        response.setRequestId(receipt.requestId());
        response.setStatus(receipt.placement().name().toLowerCase());
        response.setAssignedWorkerId(receipt.assignedWorkerId());
        response.setQueuePosition(receipt.queuePosition());
        if (receipt.estimatedWait() != null) {
            response.setEstimatedWaitSeconds(receipt.estimatedWait().toMillis() / 1000.0);
        }
        return response;
    }
}
