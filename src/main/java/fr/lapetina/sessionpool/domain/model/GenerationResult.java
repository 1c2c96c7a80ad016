package fr.lapetina.sessionpool.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a completed generation: where the artifact ended up and how it was catalogued.
 * Immutable and thread-safe.
 *
 * @param generationId identifier used for the artifact's storage path
 * @param workerId     worker that produced the artifact
 * @param artifactUrl  location returned by the uploader
 * @param storageKey   destination key the artifact was uploaded under
 * @param sizeBytes    uploaded size
 * @param metadata     uploader-provided metadata
 * @param recordId     catalog record id, or null when recording failed or was skipped
 * @param completedAt  time the artifact was handed off
 */
public record GenerationResult(
        String generationId,
        String workerId,
        String artifactUrl,
        String storageKey,
        long sizeBytes,
        Map<String, Object> metadata,
        String recordId,
        Instant completedAt
) {
    public GenerationResult {
        Objects.requireNonNull(generationId, "Generation ID is required");
        Objects.requireNonNull(artifactUrl, "Artifact URL is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    /**
     * Returns a copy carrying the catalog record id.
     */
    public GenerationResult withRecordId(String recordId) {
        return new GenerationResult(
                generationId, workerId, artifactUrl, storageKey, sizeBytes,
                metadata, recordId, completedAt
        );
    }
}
