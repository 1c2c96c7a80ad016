package fr.lapetina.sessionpool.driver;

import java.nio.file.Path;

/**
 * Handle on an artifact delivered asynchronously by the target surface.
 */
public interface Artifact {

    /**
     * File name proposed by the surface, including its extension.
     */
    String suggestedFilename();

    /**
     * Writes the artifact to the given path, creating parent directories as needed.
     */
    void saveAs(Path target);
}
