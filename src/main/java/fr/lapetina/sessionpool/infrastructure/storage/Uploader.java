package fr.lapetina.sessionpool.infrastructure.storage;

import java.nio.file.Path;

/**
 * Durable storage for generated artifacts.
 */
public interface Uploader {

    /**
     * Stores the local file under the destination key.
     *
     * @throws fr.lapetina.sessionpool.domain.exception.UploadException if the file could not be stored
     */
    UploadResult upload(Path localPath, String destinationKey);
}
