package fr.lapetina.sessionpool.infrastructure.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecoveringRetryTest {

    @Test
    @DisplayName("should stop at the first successful attempt")
    void shouldStopOnSuccess() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "op", 3, attempt -> calls.incrementAndGet() == 2, RecoveringRetry.Recovery.NONE);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("should recover between attempts but not after the last one")
    void shouldRecoverBetweenAttempts() throws InterruptedException {
        List<Integer> recoveries = new ArrayList<>();

        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "op", 3, attempt -> false, recoveries::add);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(recoveries).containsExactly(1, 2);
        assertThat(outcome.describeFailure()).contains("3 attempt(s)");
    }

    @Test
    @DisplayName("should keep the last exception thrown by an attempt")
    void shouldKeepLastFailure() throws InterruptedException {
        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "op", 2,
                attempt -> {
                    throw new IllegalStateException("attempt " + attempt);
                },
                RecoveringRetry.Recovery.NONE);

        assertThat(outcome.lastFailure()).hasMessage("attempt 2");
        assertThat(outcome.describeFailure()).startsWith("attempt 2");
    }

    @Test
    @DisplayName("should continue when the recovery itself fails")
    void shouldSurviveFailingRecovery() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "op", 2,
                attempt -> calls.incrementAndGet() == 2,
                failed -> {
                    throw new IllegalStateException("reload failed");
                });

        assertThat(outcome.succeeded()).isTrue();
    }

    @Test
    @DisplayName("should never retry an interruption")
    void shouldPropagateInterruption() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> RecoveringRetry.run(
                "op", 5,
                attempt -> {
                    calls.incrementAndGet();
                    throw new InterruptedException();
                },
                RecoveringRetry.Recovery.NONE))
                .isInstanceOf(InterruptedException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject a non-positive attempt limit")
    void shouldRejectZeroAttempts() {
        assertThatThrownBy(() -> RecoveringRetry.run("op", 0, attempt -> true, RecoveringRetry.Recovery.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
