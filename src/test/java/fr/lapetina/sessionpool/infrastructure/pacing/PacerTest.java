package fr.lapetina.sessionpool.infrastructure.pacing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PacerTest {

    @Nested
    @DisplayName("PacingProfile")
    class ProfileTests {

        @Test
        @DisplayName("should resolve names case-insensitively")
        void shouldResolveNames() {
            assertThat(PacingProfile.fromName("Stealth")).contains(PacingProfile.STEALTH);
            assertThat(PacingProfile.fromName(" aggressive ")).contains(PacingProfile.AGGRESSIVE);
            assertThat(PacingProfile.fromName("reckless")).isEmpty();
            assertThat(PacingProfile.fromName(null)).isEmpty();
        }

        @Test
        @DisplayName("should fall back to the default for unknown names")
        void shouldFallBack() {
            assertThat(PacingProfile.fromNameOrDefault("unknown", PacingProfile.BALANCED))
                    .isEqualTo(PacingProfile.BALANCED);
        }

        @Test
        @DisplayName("should poll faster as profiles get more aggressive")
        void shouldOrderPollIntervals() {
            assertThat(PacingProfile.STEALTH.completionPollInterval()).isEqualTo(Duration.ofSeconds(1));
            assertThat(PacingProfile.BALANCED.completionPollInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(PacingProfile.AGGRESSIVE.completionPollInterval()).isEqualTo(Duration.ofMillis(200));
        }
    }

    @Nested
    @DisplayName("Pacer")
    class PacerTests {

        @ParameterizedTest
        @EnumSource(PauseKind.class)
        @DisplayName("should draw delays within the profile range")
        void shouldDrawWithinRange(PauseKind kind) {
            Pacer pacer = new Pacer(PacingProfile.STEALTH, d -> { });
            PacingProfile.DelayRange range = PacingProfile.STEALTH.rangeFor(kind);

            for (int i = 0; i < 200; i++) {
                long millis = pacer.nextDelay(kind).toMillis();
                assertThat(millis).isBetween(range.minMillis(), range.maxMillis());
            }
        }

        @Test
        @DisplayName("should sleep through the sleeper")
        void shouldSleepThroughSleeper() throws InterruptedException {
            List<Duration> slept = new ArrayList<>();
            Pacer pacer = new Pacer(PacingProfile.AGGRESSIVE, slept::add);

            pacer.pause(PauseKind.CLICK);
            pacer.sleep(Duration.ofMillis(5));
            pacer.sleep(Duration.ZERO);

            assertThat(slept).hasSize(2);
            assertThat(slept.get(1)).isEqualTo(Duration.ofMillis(5));
        }

        @Test
        @DisplayName("should apply a new profile immediately")
        void shouldSwitchProfile() {
            Pacer pacer = new Pacer(PacingProfile.BALANCED, d -> { });

            pacer.setProfile(PacingProfile.STEALTH);

            assertThat(pacer.getProfile()).isEqualTo(PacingProfile.STEALTH);
            assertThat(pacer.completionPollInterval()).isEqualTo(Duration.ofSeconds(1));
            assertThat(pacer.nextDelay(PauseKind.NAVIGATION).toMillis()).isBetween(2_000L, 5_000L);
        }
    }
}
