package fr.lapetina.sessionpool.infrastructure.storage;

import java.util.Map;
import java.util.Objects;

/**
 * Where an uploaded artifact ended up.
 *
 * @param url      location the artifact can be fetched from
 * @param key      destination key it was stored under
 * @param size     stored size in bytes
 * @param metadata descriptive metadata (format, content type, file name)
 */
public record UploadResult(String url, String key, long size, Map<String, Object> metadata) {
    public UploadResult {
        Objects.requireNonNull(url, "URL is required");
        Objects.requireNonNull(key, "Key is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
