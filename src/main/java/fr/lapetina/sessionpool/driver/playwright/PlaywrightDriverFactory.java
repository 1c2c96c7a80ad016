package fr.lapetina.sessionpool.driver.playwright;

import fr.lapetina.sessionpool.driver.SessionDriver;
import fr.lapetina.sessionpool.driver.SessionDriverFactory;
import fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig;

/**
 * Opens one {@link PlaywrightSessionDriver} per worker using the {@code browser} configuration section.
 */
public final class PlaywrightDriverFactory implements SessionDriverFactory {

    private final SessionPoolConfig.BrowserConfig browserConfig;

    public PlaywrightDriverFactory(SessionPoolConfig.BrowserConfig browserConfig) {
        this.browserConfig = browserConfig;
    }

    @Override
    public SessionDriver open() {
        return new PlaywrightSessionDriver(browserConfig);
    }
}
