package fr.lapetina.sessionpool.infrastructure.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an attempt up to a fixed number of times, invoking a recovery action between attempts.
 *
 * Used by the identity flow, stuck-session detection and control interactions. An attempt
 * fails by returning false or throwing; the last failure is kept in the {@link Outcome}.
 * Interruption is never retried.
 */
public final class RecoveringRetry {

    private static final Logger log = LoggerFactory.getLogger(RecoveringRetry.class);

    private RecoveringRetry() {
        // Utility class
    }

    /**
     * One attempt of the operation.
     */
    @FunctionalInterface
    public interface Attempt {
        /**
         * @param attempt 1-based attempt number
         * @return true on success
         */
        boolean run(int attempt) throws Exception;
    }

    /**
     * Action run after a failed attempt, before the next one.
     */
    @FunctionalInterface
    public interface Recovery {
        Recovery NONE = failedAttempt -> { };

        void recover(int failedAttempt) throws Exception;
    }

    /**
     * @param succeeded   whether an attempt succeeded
     * @param attempts    number of attempts made
     * @param lastFailure exception thrown by the last failed attempt, or null if it returned false
     */
    public record Outcome(boolean succeeded, int attempts, Exception lastFailure) {

        public String describeFailure() {
            if (lastFailure == null) {
                return "not satisfied after " + attempts + " attempt(s)";
            }
            return lastFailure.getMessage() + " after " + attempts + " attempt(s)";
        }
    }

    /**
     * Runs the attempt until it succeeds or {@code maxAttempts} is reached.
     *
     * @throws InterruptedException if the attempt or the recovery is interrupted
     */
    public static Outcome run(String operation, int maxAttempts, Attempt attempt, Recovery recovery)
            throws InterruptedException {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Exception lastFailure = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                if (attempt.run(i)) {
                    if (i > 1) {
                        log.info("Operation succeeded after retry: operation={}, attempt={}", operation, i);
                    }
                    return new Outcome(true, i, null);
                }
                lastFailure = null;
                log.warn("Attempt failed: operation={}, attempt={}/{}", operation, i, maxAttempts);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                log.warn("Attempt failed: operation={}, attempt={}/{}, error={}",
                        operation, i, maxAttempts, e.getMessage());
            }

            if (i < maxAttempts) {
                recover(operation, i, recovery);
            }
        }
        return new Outcome(false, maxAttempts, lastFailure);
    }

    private static void recover(String operation, int failedAttempt, Recovery recovery) throws InterruptedException {
        try {
            recovery.recover(failedAttempt);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Recovery failed: operation={}, afterAttempt={}, error={}",
                    operation, failedAttempt, e.getMessage());
        }
    }
}
