package fr.lapetina.sessionpool.infrastructure.storage;

import fr.lapetina.sessionpool.domain.exception.UploadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Uploader} that copies artifacts into a root directory, keyed by relative path.
 */
public final class FileSystemUploader implements Uploader {

    private static final Logger log = LoggerFactory.getLogger(FileSystemUploader.class);

    private final Path root;

    public FileSystemUploader(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public UploadResult upload(Path localPath, String destinationKey) {
        Path target = root.resolve(destinationKey).normalize();
        if (!target.startsWith(root)) {
            throw new UploadException("Destination key escapes the upload root: " + destinationKey);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.copy(localPath, target, StandardCopyOption.REPLACE_EXISTING);
            long size = Files.size(target);

            String filename = localPath.getFileName().toString();
            String format = DestinationKeys.extensionOf(filename);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("filename", filename);
            metadata.put("format", format);
            metadata.put("content_type", "audio/" + format);
            metadata.put("size_mb", Math.round(size / (1024.0 * 1024.0) * 100.0) / 100.0);

            log.info("Artifact uploaded: key={}, size={}", destinationKey, size);
            return new UploadResult(target.toUri().toString(), destinationKey, size, metadata);
        } catch (IOException e) {
            throw new UploadException("Upload failed: key=" + destinationKey + ", error=" + e.getMessage(), e);
        }
    }
}
