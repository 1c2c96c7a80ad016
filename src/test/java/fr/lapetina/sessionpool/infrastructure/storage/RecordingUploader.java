package fr.lapetina.sessionpool.infrastructure.storage;

import fr.lapetina.sessionpool.domain.exception.UploadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Uploader that remembers each key and the content it was given, optionally failing.
 */
public class RecordingUploader implements Uploader {

    private final List<String> keys = new CopyOnWriteArrayList<>();
    private final List<String> contents = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    public RecordingUploader failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public UploadResult upload(Path localPath, String destinationKey) {
        if (failure != null) {
            throw failure;
        }
        try {
            contents.add(Files.readString(localPath));
        } catch (IOException e) {
            throw new UploadException("Cannot read " + localPath, e);
        }
        keys.add(destinationKey);
        return new UploadResult("memory://" + destinationKey, destinationKey, 42,
                Map.of("format", DestinationKeys.extensionOf(destinationKey)));
    }

    public List<String> keys() {
        return List.copyOf(keys);
    }

    public List<String> contents() {
        return List.copyOf(contents);
    }
}
