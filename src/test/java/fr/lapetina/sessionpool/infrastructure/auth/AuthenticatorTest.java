package fr.lapetina.sessionpool.infrastructure.auth;

import fr.lapetina.sessionpool.TestClock;
import fr.lapetina.sessionpool.domain.exception.AuthenticationException;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.StubSessionDriver;
import fr.lapetina.sessionpool.driver.Surface;
import fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig;
import fr.lapetina.sessionpool.infrastructure.pacing.Pacer;
import fr.lapetina.sessionpool.infrastructure.pacing.PacingProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticatorTest {

    private static final Surface SURFACE = Surface.fromConfig(new SessionPoolConfig.SurfaceConfig());

    private TestClock clock;
    private StubSessionDriver driver;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        driver = new StubSessionDriver();
    }

    private Authenticator authenticator(String identity, String secret) {
        return Authenticator.builder()
                .surface(SURFACE)
                .credentials(identity, secret)
                .pacer(new Pacer(PacingProfile.AGGRESSIVE, d -> { }))
                .statusCache(new AuthenticationStatusCache(Duration.ofSeconds(60), clock))
                .maxAttempts(3)
                .build();
    }

    @Nested
    @DisplayName("authenticate")
    class AuthenticateTests {

        @Test
        @DisplayName("should type credentials key by key and verify the ready control")
        void shouldLogIn() throws InterruptedException {
            authenticator("user@example.com", "s3cret").authenticate("worker-1", driver);

            assertThat(driver.isAuthenticated()).isTrue();
            assertThat(driver.typedInto("identity")).isEqualTo("user@example.com");
            assertThat(driver.typedInto("secret")).isEqualTo("s3cret");
            assertThat(driver.calls()).contains("navigate:" + SURFACE.entryUrl(), "probe:ready");
        }

        @Test
        @DisplayName("should short-circuit an already authenticated session")
        void shouldSkipWhenAuthenticated() throws InterruptedException {
            driver.authenticated(true);

            authenticator("user@example.com", "s3cret").authenticate("worker-1", driver);

            assertThat(driver.calls()).doesNotContain("activate:login");
        }

        @Test
        @DisplayName("should re-enter the identity when the interstitial appears")
        void shouldHandleInterstitial() throws InterruptedException {
            driver.show("try-again");

            authenticator("user@example.com", "s3cret").authenticate("worker-1", driver);

            assertThat(driver.count("activate:try-again")).isEqualTo(1);
            assertThat(driver.isAuthenticated()).isTrue();
        }

        @Test
        @DisplayName("should tick the consent checkbox when present")
        void shouldTickConsent() throws InterruptedException {
            driver.show("consent");

            authenticator("user@example.com", "s3cret").authenticate("worker-1", driver);

            assertThat(driver.calls()).contains("activate:consent");
        }

        @Test
        @DisplayName("should fail after every attempt is rejected")
        void shouldFailAfterAllAttempts() {
            driver.rejectCredentials();

            assertThatThrownBy(() -> authenticator("user@example.com", "wrong").authenticate("worker-1", driver))
                    .isInstanceOf(AuthenticationException.class)
                    .hasMessageContaining("worker-1");
            assertThat(driver.count("activate:login")).isEqualTo(3);
        }

        @Test
        @DisplayName("should fail without a configured secret")
        void shouldFailWithoutSecret() {
            assertThatThrownBy(() -> authenticator("user@example.com", null).authenticate("worker-1", driver))
                    .isInstanceOf(AuthenticationException.class);
            assertThat(driver.isAuthenticated()).isFalse();
        }

        @Test
        @DisplayName("should succeed on a later attempt when the login control shows up late")
        void shouldRetryMissingControl() throws InterruptedException {
            driver.hide("identity");
            Authenticator authenticator = authenticator("user@example.com", "s3cret");

            assertThatThrownBy(() -> authenticator.authenticate("worker-1", driver))
                    .isInstanceOf(AuthenticationException.class);

            driver.show("identity");
            authenticator.authenticate("worker-1", driver);
            assertThat(driver.isAuthenticated()).isTrue();
        }
    }

    @Nested
    @DisplayName("isAuthenticated")
    class IsAuthenticatedTests {

        @Test
        @DisplayName("should cache the probe result for the TTL")
        void shouldCacheProbe() {
            Authenticator authenticator = authenticator("user@example.com", "s3cret");
            driver.authenticated(true);

            assertThat(authenticator.isAuthenticated("worker-1", driver)).isTrue();
            driver.logOut();
            assertThat(authenticator.isAuthenticated("worker-1", driver)).isTrue();

            clock.advance(Duration.ofSeconds(60));
            assertThat(authenticator.isAuthenticated("worker-1", driver)).isFalse();
        }

        @Test
        @DisplayName("should probe again once forgotten")
        void shouldProbeAfterForget() {
            Authenticator authenticator = authenticator("user@example.com", "s3cret");

            assertThat(authenticator.isAuthenticated("worker-1", driver)).isFalse();
            driver.authenticated(true);
            authenticator.forget("worker-1");

            assertThat(authenticator.isAuthenticated("worker-1", driver)).isTrue();
        }

        @Test
        @DisplayName("should only navigate when away from the task surface")
        void shouldNavigateOnlyWhenNeeded() {
            Authenticator authenticator = authenticator("user@example.com", "s3cret");
            driver.navigate(SURFACE.taskUrl(), Duration.ZERO);

            authenticator.isAuthenticated("worker-1", driver);

            assertThat(driver.count("navigate:" + SURFACE.taskUrl())).isEqualTo(1);
        }

        @Test
        @DisplayName("should report a driver failure as not authenticated")
        void shouldTreatDriverFailureAsLoggedOut() {
            driver.failNavigation(new DriverException("page crashed"));

            assertThat(authenticator("user@example.com", "s3cret").isAuthenticated("worker-1", driver)).isFalse();
        }
    }
}
