package fr.lapetina.sessionpool.infrastructure.storage;

import java.util.Map;

/**
 * Catalogs uploaded artifacts. Failures are reported by throwing and are never fatal to a job.
 */
public interface PersistenceRecorder {

    /**
     * Creates a catalog record for the artifact.
     *
     * @return the record id
     */
    String createRecord(UploadResult artifact, Map<String, Object> metadata);
}
