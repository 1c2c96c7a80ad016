package fr.lapetina.sessionpool.driver.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Download;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import fr.lapetina.sessionpool.driver.Artifact;
import fr.lapetina.sessionpool.driver.Control;
import fr.lapetina.sessionpool.driver.DriverException;
import fr.lapetina.sessionpool.driver.SessionDriver;
import fr.lapetina.sessionpool.infrastructure.config.SessionPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SessionDriver} backed by a dedicated Chromium instance.
 *
 * Playwright objects are not thread-safe, so every driver owns its own
 * Playwright, browser, context and page. Downloads are captured by a page
 * listener and handed out by {@link #awaitArtifact(Duration)}.
 */
public final class PlaywrightSessionDriver implements SessionDriver {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightSessionDriver.class);

    private static final long EVENT_PUMP_INTERVAL_MS = 250;

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final BlockingQueue<Download> downloads = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PlaywrightSessionDriver(SessionPoolConfig.BrowserConfig cfg) {
        log.info("Launching browser session: headless={}, mobile={}", cfg.isHeadless(), cfg.isMobile());
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(cfg.isHeadless())
                            .setArgs(cfg.getArgs())
            );
            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
                    .setViewportSize(cfg.getViewportWidth(), cfg.getViewportHeight())
                    .setIsMobile(cfg.isMobile())
                    .setHasTouch(cfg.isMobile())
                    .setAcceptDownloads(true);
            if (cfg.getUserAgent() != null && !cfg.getUserAgent().isBlank()) {
                contextOptions.setUserAgent(cfg.getUserAgent());
            }
            if (cfg.getLocale() != null && !cfg.getLocale().isBlank()) {
                contextOptions.setLocale(cfg.getLocale());
            }
            this.context = browser.newContext(contextOptions);
            this.page = context.newPage();
            page.onDownload(downloads::offer);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new DriverException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    @Override
    public void navigate(String url, Duration timeout) {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setTimeout(timeout.toMillis())
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw new DriverException("Navigation failed: url=" + url + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public boolean findAndActivate(Control control, Duration timeout) {
        Locator locator = page.locator(control.selector()).first();
        if (!waitVisible(locator, timeout)) {
            return false;
        }
        try {
            locator.click(new Locator.ClickOptions().setTimeout(timeout.toMillis()));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throw new DriverException("Activation failed: control=" + control.name() + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public void fill(Control control, String text) {
        try {
            page.locator(control.selector()).first().fill(text);
        } catch (PlaywrightException e) {
            throw new DriverException("Fill failed: control=" + control.name() + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public void type(Control control, CharSequence text) {
        try {
            page.locator(control.selector()).first().pressSequentially(text.toString());
        } catch (PlaywrightException e) {
            throw new DriverException("Typing failed: control=" + control.name() + ", error=" + e.getMessage(), e);
        }
    }

    @Override
    public boolean probe(Control control, Duration timeout) {
        return waitVisible(page.locator(control.selector()).first(), timeout);
    }

    @Override
    public Optional<Artifact> awaitArtifact(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                Download download = downloads.poll();
                if (download != null) {
                    return Optional.of(new DownloadArtifact(download));
                }
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    return Optional.empty();
                }
                // Playwright dispatches page events only while one of its calls is in progress
                page.waitForTimeout(Math.min(EVENT_PUMP_INTERVAL_MS, remainingMs));
            }
        } catch (PlaywrightException e) {
            throw new DriverException("Waiting for artifact failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void reload(Duration timeout) {
        try {
            page.reload(new Page.ReloadOptions()
                    .setTimeout(timeout.toMillis())
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw new DriverException("Reload failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    private boolean waitVisible(Locator locator, Duration timeout) {
        try {
            if (timeout.isZero()) {
                // A zero timeout means "wait forever" to Playwright
                return locator.isVisible();
            }
            locator.waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(timeout.toMillis()));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throw new DriverException("Waiting for control failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            context.close();
        } catch (Exception e) {
            log.warn("Error closing browser context", e);
        }
        try {
            browser.close();
        } catch (Exception e) {
            log.warn("Error closing browser", e);
        }
        try {
            playwright.close();
        } catch (Exception e) {
            log.warn("Error closing playwright", e);
        }
        log.debug("Browser session closed");
    }

    private static final class DownloadArtifact implements Artifact {
        private final Download download;

        private DownloadArtifact(Download download) {
            this.download = download;
        }

        @Override
        public String suggestedFilename() {
            return download.suggestedFilename();
        }

        @Override
        public void saveAs(Path target) {
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                download.saveAs(target);
            } catch (IOException | PlaywrightException e) {
                throw new DriverException("Saving artifact failed: path=" + target + ", error=" + e.getMessage(), e);
            }
        }
    }
}
