package fr.lapetina.sessionpool.infrastructure.pacing;

import java.time.Duration;

/**
 * Blocking wait used for pauses and polling, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
