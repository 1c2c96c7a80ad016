package fr.lapetina.sessionpool.infrastructure.storage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Persistence recorder keeping the metadata of each record, optionally failing.
 */
public class RecordingRecorder implements PersistenceRecorder {

    private final List<Map<String, Object>> records = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    public RecordingRecorder failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public String createRecord(UploadResult artifact, Map<String, Object> metadata) {
        if (failure != null) {
            throw failure;
        }
        records.add(Map.copyOf(metadata));
        return "record-" + records.size();
    }

    public List<Map<String, Object>> records() {
        return List.copyOf(records);
    }
}
