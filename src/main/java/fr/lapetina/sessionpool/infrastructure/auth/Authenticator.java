package fr.lapetina.sessionpool.infrastructure.auth;

import fr.lapetina.sessionpool.domain.exception.AuthenticationException;
import fr.lapetina.sessionpool.driver.Control;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.SessionDriver;
import fr.lapetina.sessionpool.driver.Surface;
import fr.lapetina.sessionpool.infrastructure.pacing.Pacer;
import fr.lapetina.sessionpool.infrastructure.pacing.PauseKind;
import fr.lapetina.sessionpool.infrastructure.retry.RecoveringRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Drives the identity flow on a session and checks whether a session is still authenticated.
 *
 * Flow per attempt: entry surface, login control, identity typed key by key, next,
 * optional "try again" interstitial, secret typed key by key, optional consent checkbox,
 * next, then a probe for the ready control on the task surface.
 */
public final class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final Surface surface;
    private final String identity;
    private final String secret;
    private final Pacer pacer;
    private final AuthenticationStatusCache statusCache;
    private final int maxAttempts;
    private final Duration pageLoadTimeout;
    private final Duration elementTimeout;
    private final Duration probeTimeout;

    private Authenticator(Builder builder) {
        this.surface = Objects.requireNonNull(builder.surface, "Surface is required");
        this.identity = builder.identity;
        this.secret = builder.secret;
        this.pacer = Objects.requireNonNull(builder.pacer, "Pacer is required");
        this.statusCache = Objects.requireNonNull(builder.statusCache, "Status cache is required");
        this.maxAttempts = builder.maxAttempts;
        this.pageLoadTimeout = builder.pageLoadTimeout;
        this.elementTimeout = builder.elementTimeout;
        this.probeTimeout = builder.probeTimeout;
    }

    /**
     * Authenticates the session unless it already is.
     *
     * @throws AuthenticationException when every attempt failed
     */
    public void authenticate(String workerId, SessionDriver driver) throws InterruptedException {
        if (isAuthenticated(workerId, driver)) {
            log.info("Session already authenticated: workerId={}", workerId);
            return;
        }

        RecoveringRetry.Outcome outcome = RecoveringRetry.run(
                "authenticate:" + workerId,
                maxAttempts,
                attempt -> attemptLogin(workerId, driver, attempt),
                failedAttempt -> statusCache.forget(workerId)
        );

        if (!outcome.succeeded()) {
            log.error("Authentication failed: workerId={}, attempts={}", workerId, outcome.attempts());
            throw new AuthenticationException(
                    "Authentication failed for worker " + workerId + ": " + outcome.describeFailure(),
                    outcome.lastFailure()
            );
        }
        log.info("Session authenticated: workerId={}, attempts={}", workerId, outcome.attempts());
    }

    /**
     * Checks whether the session shows the ready control on the task surface.
     * Results are cached per worker.
     */
    public boolean isAuthenticated(String workerId, SessionDriver driver) {
        var cached = statusCache.get(workerId);
        if (cached.isPresent()) {
            return cached.get();
        }
        boolean authenticated = probeReady(driver);
        statusCache.put(workerId, authenticated);
        return authenticated;
    }

    /**
     * Drops the cached status so the next check probes the session again.
     */
    public void forget(String workerId) {
        statusCache.forget(workerId);
    }

    private boolean probeReady(SessionDriver driver) {
        try {
            String current = driver.currentUrl();
            if (current == null || !current.startsWith(surface.taskUrl())) {
                driver.navigate(surface.taskUrl(), pageLoadTimeout);
            }
            return driver.probe(surface.readyControl(), probeTimeout);
        } catch (DriverException e) {
            log.debug("Authentication probe failed: error={}", e.getMessage());
            return false;
        }
    }

    private boolean attemptLogin(String workerId, SessionDriver driver, int attempt) throws InterruptedException {
        log.info("Logging in session: workerId={}, attempt={}/{}", workerId, attempt, maxAttempts);

        driver.navigate(surface.entryUrl(), pageLoadTimeout);
        pacer.pause(PauseKind.NAVIGATION);

        if (!driver.findAndActivate(surface.loginButton(), elementTimeout)) {
            log.warn("Login control not found, checking existing session: workerId={}", workerId);
            statusCache.forget(workerId);
            return isAuthenticated(workerId, driver);
        }
        pacer.pause(PauseKind.NAVIGATION);

        enterIdentity(driver);

        // The surface may bounce back to the identity step once
        if (driver.probe(surface.tryAgainLink(), elementTimeout)) {
            log.info("Identity interstitial shown, retrying identity step: workerId={}", workerId);
            driver.findAndActivate(surface.tryAgainLink(), elementTimeout);
            pacer.pause(PauseKind.NAVIGATION);
            enterIdentity(driver);
        }

        requireControl(driver, surface.secretInput());
        typeKeyByKey(driver, surface.secretInput(), secret);
        pacer.pause(PauseKind.CLICK);

        if (driver.findAndActivate(surface.consentCheckbox(), probeTimeout)) {
            pacer.pause(PauseKind.CLICK);
        }

        activate(driver, surface.nextButton());
        pacer.pause(PauseKind.NAVIGATION);

        statusCache.forget(workerId);
        return isAuthenticated(workerId, driver);
    }

    private void enterIdentity(SessionDriver driver) throws InterruptedException {
        requireControl(driver, surface.identityInput());
        typeKeyByKey(driver, surface.identityInput(), identity);
        pacer.pause(PauseKind.CLICK);
        activate(driver, surface.nextButton());
        pacer.pause(PauseKind.NAVIGATION);
    }

    private void typeKeyByKey(SessionDriver driver, Control control, String text) throws InterruptedException {
        if (text == null || text.isEmpty()) {
            throw new AuthenticationException("No credential configured for control " + control.name());
        }
        driver.fill(control, "");
        for (int i = 0; i < text.length(); i++) {
            driver.type(control, String.valueOf(text.charAt(i)));
            pacer.pause(PauseKind.KEYSTROKE);
        }
    }

    private void requireControl(SessionDriver driver, Control control) {
        if (!driver.probe(control, elementTimeout)) {
            throw new AuthenticationException("Control not found during login: " + control.name());
        }
    }

    private void activate(SessionDriver driver, Control control) {
        if (!driver.findAndActivate(control, elementTimeout)) {
            throw new AuthenticationException("Control not found during login: " + control.name());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Surface surface;
        private String identity;
        private String secret;
        private Pacer pacer;
        private AuthenticationStatusCache statusCache;
        private int maxAttempts = 3;
        private Duration pageLoadTimeout = Duration.ofSeconds(30);
        private Duration elementTimeout = Duration.ofSeconds(15);
        private Duration probeTimeout = Duration.ofSeconds(3);

        public Builder surface(Surface surface) {
            this.surface = surface;
            return this;
        }

        public Builder credentials(String identity, String secret) {
            this.identity = identity;
            this.secret = secret;
            return this;
        }

        public Builder pacer(Pacer pacer) {
            this.pacer = pacer;
            return this;
        }

        public Builder statusCache(AuthenticationStatusCache statusCache) {
            this.statusCache = statusCache;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder pageLoadTimeout(Duration pageLoadTimeout) {
            this.pageLoadTimeout = pageLoadTimeout;
            return this;
        }

        public Builder elementTimeout(Duration elementTimeout) {
            this.elementTimeout = elementTimeout;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Authenticator build() {
            return new Authenticator(this);
        }
    }
}
