package fr.lapetina.sessionpool.driver;

/**
 * Opens new, unauthenticated driver sessions for the pool.
 */
@FunctionalInterface
public interface SessionDriverFactory {

    SessionDriver open();
}
