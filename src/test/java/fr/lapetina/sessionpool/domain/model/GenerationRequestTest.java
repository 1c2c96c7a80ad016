package fr.lapetina.sessionpool.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationRequestTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static GenerationRequest request() {
        return GenerationRequest.builder().id("req-1").prompt("lofi beat").build();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("should apply defaults")
        void shouldApplyDefaults() {
            GenerationRequest request = request();

            assertThat(request.getTitle()).isEqualTo("Track req-1");
            assertThat(request.getPriority()).isZero();
            assertThat(request.getMaxRetries()).isEqualTo(3);
            assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);
            assertThat(request.getQueuePosition()).isNull();
        }

        @Test
        @DisplayName("should generate an id when none is given")
        void shouldGenerateId() {
            GenerationRequest request = GenerationRequest.builder().prompt("ambient").build();

            assertThat(request.getId()).isNotBlank();
        }

        @Test
        @DisplayName("should reject a blank prompt")
        void shouldRejectBlankPrompt() {
            assertThatThrownBy(() -> GenerationRequest.builder().prompt("  ").build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("composeInput")
    class ComposeInputTests {

        @Test
        @DisplayName("should append lyrics for vocal tracks")
        void shouldAppendLyrics() {
            GenerationRequest request = GenerationRequest.builder()
                    .prompt("pop ballad")
                    .lyrics("la la la")
                    .build();

            assertThat(request.composeInput()).isEqualTo("pop ballad\n\nLyrics:\nla la la");
        }

        @Test
        @DisplayName("should ignore lyrics for instrumental tracks")
        void shouldIgnoreLyricsWhenInstrumental() {
            GenerationRequest request = GenerationRequest.builder()
                    .prompt("pop ballad")
                    .lyrics("la la la")
                    .instrumental(true)
                    .build();

            assertThat(request.composeInput()).isEqualTo("pop ballad");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should move to processing and clear the queue position")
        void shouldMarkProcessing() {
            GenerationRequest request = request();
            request.assign("worker-1", 2);

            assertThat(request.markProcessing("worker-1", T0)).isTrue();

            assertThat(request.getStatus()).isEqualTo(RequestStatus.PROCESSING);
            assertThat(request.getStartedAt()).isEqualTo(T0);
            assertThat(request.getQueuePosition()).isNull();
            assertThat(request.getAssignedWorkerId()).isEqualTo("worker-1");
        }

        @Test
        @DisplayName("should only complete a processing request")
        void shouldOnlyCompleteWhenProcessing() {
            GenerationRequest request = request();
            GenerationResult result = new GenerationResult(
                    "req-1", "worker-1", "file:///a.mp3", "a.mp3", 10, null, null, T0);

            assertThat(request.complete(result, T0)).isFalse();

            request.markProcessing("worker-1", T0);
            assertThat(request.complete(result, T0.plusSeconds(30))).isTrue();
            assertThat(request.getResult()).isEqualTo(result);
            assertThat(request.processingTime(T0.plusSeconds(99))).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("should record the error type when failing")
        void shouldFail() {
            GenerationRequest request = request();
            request.markProcessing("worker-1", T0);

            assertThat(request.fail(null, "boom", T0)).isTrue();

            assertThat(request.getStatus()).isEqualTo(RequestStatus.FAILED);
            assertThat(request.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
            assertThat(request.getError()).isEqualTo("boom");
        }

        @Test
        @DisplayName("should cancel without error when no reason is given")
        void shouldCancelWithoutReason() {
            GenerationRequest request = request();

            assertThat(request.cancel(null, T0)).isTrue();

            assertThat(request.getStatus()).isEqualTo(RequestStatus.CANCELLED);
            assertThat(request.getError()).isNull();
            assertThat(request.getErrorType()).isNull();
        }

        @Test
        @DisplayName("should keep the reason when cancelled by the pool")
        void shouldCancelWithReason() {
            GenerationRequest request = request();
            request.markProcessing("worker-1", T0);

            request.cancel("Worker worker-1 was removed", T0);

            assertThat(request.getErrorType()).isEqualTo(ErrorType.CANCELLED);
            assertThat(request.getError()).contains("worker-1");
        }

        @Test
        @DisplayName("should never leave a terminal state")
        void shouldStayTerminal() {
            GenerationRequest request = request();
            request.cancel(null, T0);

            assertThat(request.markProcessing("worker-1", T0)).isFalse();
            assertThat(request.cancel("again", T0)).isFalse();
            assertThat(request.fail(ErrorType.SESSION_STUCK, "late", T0)).isFalse();
            assertThat(request.getStatus()).isEqualTo(RequestStatus.CANCELLED);
        }

        @Test
        @DisplayName("should not renumber once processing")
        void shouldIgnorePositionUpdatesOutsidePending() {
            GenerationRequest request = request();
            request.markProcessing("worker-1", T0);

            request.updateQueuePosition(4);

            assertThat(request.getQueuePosition()).isNull();
        }
    }
}
