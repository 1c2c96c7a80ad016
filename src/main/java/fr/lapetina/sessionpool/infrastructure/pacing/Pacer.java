package fr.lapetina.sessionpool.infrastructure.pacing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Applies randomized pauses from the active {@link PacingProfile}.
 *
 * Shared by all workers. The profile can be swapped at runtime; pauses already
 * in progress finish with the old profile.
 */
public final class Pacer {

    private static final Logger log = LoggerFactory.getLogger(Pacer.class);

    private final Sleeper sleeper;
    private volatile PacingProfile profile;

    public Pacer(PacingProfile profile, Sleeper sleeper) {
        this.profile = profile;
        this.sleeper = sleeper;
    }

    public Pacer(PacingProfile profile) {
        this(profile, Sleeper.SYSTEM);
    }

    public PacingProfile getProfile() {
        return profile;
    }

    public void setProfile(PacingProfile newProfile) {
        PacingProfile previous = this.profile;
        this.profile = newProfile;
        if (previous != newProfile) {
            log.info("Pacing profile changed: previousProfile={}, newProfile={}", previous, newProfile);
        }
    }

    /**
     * Sleeps for a random duration drawn from the current profile's range for the given kind.
     */
    public void pause(PauseKind kind) throws InterruptedException {
        sleeper.sleep(nextDelay(kind));
    }

    /**
     * Sleeps for a fixed duration, e.g. between polls.
     */
    public void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            sleeper.sleep(duration);
        }
    }

    Duration nextDelay(PauseKind kind) {
        PacingProfile.DelayRange range = profile.rangeFor(kind);
        long millis = range.minMillis() == range.maxMillis()
                ? range.minMillis()
                : ThreadLocalRandom.current().nextLong(range.minMillis(), range.maxMillis() + 1);
        return Duration.ofMillis(millis);
    }

    public Duration completionPollInterval() {
        return profile.completionPollInterval();
    }
}
