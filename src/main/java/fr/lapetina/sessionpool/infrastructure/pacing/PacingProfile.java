package fr.lapetina.sessionpool.infrastructure.pacing;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Delay ranges applied between interactions with the target surface.
 *
 * Slower profiles look more like a human operator at the cost of throughput.
 */
public enum PacingProfile {
    STEALTH(
            new DelayRange(200, 800),
            new DelayRange(100, 300),
            new DelayRange(2_000, 5_000),
            Duration.ofMillis(1_000)
    ),
    BALANCED(
            new DelayRange(100, 300),
            new DelayRange(50, 150),
            new DelayRange(1_000, 3_000),
            Duration.ofMillis(500)
    ),
    AGGRESSIVE(
            new DelayRange(50, 200),
            new DelayRange(20, 100),
            new DelayRange(500, 2_000),
            Duration.ofMillis(200)
    );

    private final DelayRange click;
    private final DelayRange keystroke;
    private final DelayRange navigation;
    private final Duration completionPollInterval;

    PacingProfile(DelayRange click, DelayRange keystroke, DelayRange navigation, Duration completionPollInterval) {
        this.click = click;
        this.keystroke = keystroke;
        this.navigation = navigation;
        this.completionPollInterval = completionPollInterval;
    }

    public DelayRange rangeFor(PauseKind kind) {
        return switch (kind) {
            case CLICK -> click;
            case KEYSTROKE -> keystroke;
            case NAVIGATION -> navigation;
        };
    }

    /**
     * Interval at which callers poll for a request to finish.
     */
    public Duration completionPollInterval() {
        return completionPollInterval;
    }

    /**
     * Resolves a profile from its configuration name, case-insensitively.
     */
    public static Optional<PacingProfile> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Resolves a profile from its configuration name, with default fallback.
     */
    public static PacingProfile fromNameOrDefault(String name, PacingProfile defaultProfile) {
        return fromName(name).orElse(defaultProfile);
    }

    /**
     * Inclusive range of milliseconds a pause is drawn from.
     */
    public record DelayRange(long minMillis, long maxMillis) {
        public DelayRange {
            if (minMillis < 0 || maxMillis < minMillis) {
                throw new IllegalArgumentException("Invalid delay range: " + minMillis + ".." + maxMillis);
            }
        }
    }
}
