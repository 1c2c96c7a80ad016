package fr.lapetina.sessionpool.infrastructure.storage;

/**
 * Storage key layout for generated artifacts.
 */
public final class DestinationKeys {

    static final String DEFAULT_EXTENSION = "wav";

    private DestinationKeys() {
        // Utility class
    }

    /**
     * Key for an artifact: scoped to the user's project when both ids are known,
     * otherwise grouped by generation id.
     */
    public static String forArtifact(String userId, String projectId, String generationId, String filename) {
        if (isPresent(userId) && isPresent(projectId)) {
            return "users/" + userId + "/projects/music-clip/" + projectId
                    + "/audio/" + generationId + "." + extensionOf(filename);
        }
        return "music/generated/" + generationId + "/" + filename;
    }

    /**
     * Lower-case extension without the dot, or the default when the name has none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return filename.substring(dot + 1).toLowerCase();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
