package fr.lapetina.sessionpool.infrastructure.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;

/**
 * {@link PersistenceRecorder} that only logs the record it would create.
 */
public final class LoggingPersistenceRecorder implements PersistenceRecorder {

    private static final Logger log = LoggerFactory.getLogger(LoggingPersistenceRecorder.class);

    @Override
    public String createRecord(UploadResult artifact, Map<String, Object> metadata) {
        String recordId = UUID.randomUUID().toString();
        log.info("Artifact recorded: recordId={}, key={}, url={}, metadata={}",
                recordId, artifact.key(), artifact.url(), metadata);
        return recordId;
    }
}
