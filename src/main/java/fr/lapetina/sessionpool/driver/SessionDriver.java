package fr.lapetina.sessionpool.driver;

import java.time.Duration;
import java.util.Optional;

/**
 * Capability for interacting with the target surface through one live session.
 *
 * A driver instance is owned by exactly one worker and is never called concurrently.
 * Failures other than "not present in time" are reported as {@link DriverException}.
 */
public interface SessionDriver extends AutoCloseable {

    /**
     * Navigates to the given location and waits for it to load.
     */
    void navigate(String url, Duration timeout);

    /**
     * Waits for the control to become visible and activates it.
     *
     * @return true if activated, false if the control did not appear within the timeout
     */
    boolean findAndActivate(Control control, Duration timeout);

    /**
     * Replaces the control's content with the given text.
     */
    void fill(Control control, String text);

    /**
     * Types text into the control after its current content, key by key.
     */
    void type(Control control, CharSequence text);

    /**
     * Checks whether the control becomes visible within the timeout. A zero timeout checks once.
     */
    boolean probe(Control control, Duration timeout);

    /**
     * Waits for the next artifact delivered by the surface.
     *
     * @return the artifact, or empty if none arrived within the timeout
     */
    Optional<Artifact> awaitArtifact(Duration timeout);

    /**
     * Reloads the current page.
     */
    void reload(Duration timeout);

    /**
     * Current location of the session.
     */
    String currentUrl();

    /**
     * Releases the session. Idempotent.
     */
    @Override
    void close();
}
