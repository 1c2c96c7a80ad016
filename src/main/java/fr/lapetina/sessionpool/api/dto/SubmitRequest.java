package fr.lapetina.sessionpool.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;

import java.util.UUID;

/**
 * Generation request as accepted from callers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmitRequest {

    @JsonProperty("request_id")
    private String requestId;

    private String prompt;
    private String title;
    private String lyrics;

    @JsonProperty("is_instrumental")
    private boolean instrumental;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("user_id")
    private String userId;

    private int priority;

    @JsonProperty("max_retries")
    private Integer maxRetries;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getLyrics() { return lyrics; }
    public void setLyrics(String lyrics) { this.lyrics = lyrics; }

    public boolean isInstrumental() { return instrumental; }
    public void setInstrumental(boolean instrumental) { this.instrumental = instrumental; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public Integer getMaxRetries() { return maxRetries; }
    public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

    /**
     * Converts to a domain request, generating an id when none was given.
     */
    public GenerationRequest toGenerationRequest() {
        GenerationRequest.Builder builder = GenerationRequest.builder()
                .id(requestId != null ? requestId : UUID.randomUUID().toString())
                .prompt(prompt)
                .title(title)
                .lyrics(lyrics)
                .instrumental(instrumental)
                .projectId(projectId)
                .userId(userId)
                .priority(priority);
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        return builder.build();
    }
}
