package fr.lapetina.sessionpool.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the session pool.
 * Designed to be populated from YAML.
 */
public class SessionPoolConfig {

    private PoolConfig pool = new PoolConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private AuthConfig auth = new AuthConfig();
    private StuckDetectionConfig stuckDetection = new StuckDetectionConfig();
    private InteractionConfig interaction = new InteractionConfig();
    private PacingConfig pacing = new PacingConfig();
    private SurfaceConfig surface = new SurfaceConfig();
    private StorageConfig storage = new StorageConfig();
    private BrowserConfig browser = new BrowserConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private StatusLogConfig statusLog = new StatusLogConfig();

    // Getters and Setters
    public PoolConfig getPool() { return pool; }
    public void setPool(PoolConfig pool) { this.pool = pool; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public StuckDetectionConfig getStuckDetection() { return stuckDetection; }
    public void setStuckDetection(StuckDetectionConfig stuckDetection) { this.stuckDetection = stuckDetection; }

    public InteractionConfig getInteraction() { return interaction; }
    public void setInteraction(InteractionConfig interaction) { this.interaction = interaction; }

    public PacingConfig getPacing() { return pacing; }
    public void setPacing(PacingConfig pacing) { this.pacing = pacing; }

    public SurfaceConfig getSurface() { return surface; }
    public void setSurface(SurfaceConfig surface) { this.surface = surface; }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage; }

    public BrowserConfig getBrowser() { return browser; }
    public void setBrowser(BrowserConfig browser) { this.browser = browser; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public StatusLogConfig getStatusLog() { return statusLog; }
    public void setStatusLog(StatusLogConfig statusLog) { this.statusLog = statusLog; }

    /**
     * Worker pool sizing and reclamation.
     */
    public static class PoolConfig {
        private int maxConcurrentWorkers = 12;
        private int softMaxWorkers = 12;
        private int initialWorkers = 1;
        private long idleTimeoutMs = 1_800_000;

        public int getMaxConcurrentWorkers() { return maxConcurrentWorkers; }
        public void setMaxConcurrentWorkers(int maxConcurrentWorkers) { this.maxConcurrentWorkers = maxConcurrentWorkers; }

        public int getSoftMaxWorkers() { return softMaxWorkers; }
        public void setSoftMaxWorkers(int softMaxWorkers) { this.softMaxWorkers = softMaxWorkers; }

        public int getInitialWorkers() { return initialWorkers; }
        public void setInitialWorkers(int initialWorkers) { this.initialWorkers = initialWorkers; }

        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
    }

    /**
     * Scheduler tick configuration.
     */
    public static class SchedulerConfig {
        private long tickIntervalMs = 50;
        private int cleanupEveryTicks = 30;

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

        public int getCleanupEveryTicks() { return cleanupEveryTicks; }
        public void setCleanupEveryTicks(int cleanupEveryTicks) { this.cleanupEveryTicks = cleanupEveryTicks; }
    }

    /**
     * Driver timeout configuration.
     */
    public static class TimeoutsConfig {
        private long pageLoadMs = 30_000;
        private long elementWaitMs = 15_000;
        private long artifactMs = 120_000;
        private long authProbeMs = 3_000;

        public long getPageLoadMs() { return pageLoadMs; }
        public void setPageLoadMs(long pageLoadMs) { this.pageLoadMs = pageLoadMs; }

        public long getElementWaitMs() { return elementWaitMs; }
        public void setElementWaitMs(long elementWaitMs) { this.elementWaitMs = elementWaitMs; }

        public long getArtifactMs() { return artifactMs; }
        public void setArtifactMs(long artifactMs) { this.artifactMs = artifactMs; }

        public long getAuthProbeMs() { return authProbeMs; }
        public void setAuthProbeMs(long authProbeMs) { this.authProbeMs = authProbeMs; }
    }

    /**
     * Identity flow configuration. Credentials may be overridden from the environment.
     */
    public static class AuthConfig {
        private int maxAttempts = 3;
        private long statusCacheTtlMs = 60_000;
        private String identity;
        private String secret;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getStatusCacheTtlMs() { return statusCacheTtlMs; }
        public void setStatusCacheTtlMs(long statusCacheTtlMs) { this.statusCacheTtlMs = statusCacheTtlMs; }

        public String getIdentity() { return identity; }
        public void setIdentity(String identity) { this.identity = identity; }

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }

    /**
     * Stuck-session detection after submission.
     */
    public static class StuckDetectionConfig {
        private int probeAttempts = 30;
        private long probeIntervalMs = 1_000;
        private int reloadCycles = 2;
        private long reloadProbeTimeoutMs = 5_000;

        public int getProbeAttempts() { return probeAttempts; }
        public void setProbeAttempts(int probeAttempts) { this.probeAttempts = probeAttempts; }

        public long getProbeIntervalMs() { return probeIntervalMs; }
        public void setProbeIntervalMs(long probeIntervalMs) { this.probeIntervalMs = probeIntervalMs; }

        public int getReloadCycles() { return reloadCycles; }
        public void setReloadCycles(int reloadCycles) { this.reloadCycles = reloadCycles; }

        public long getReloadProbeTimeoutMs() { return reloadProbeTimeoutMs; }
        public void setReloadProbeTimeoutMs(long reloadProbeTimeoutMs) { this.reloadProbeTimeoutMs = reloadProbeTimeoutMs; }
    }

    /**
     * Retry budgets for control interactions.
     */
    public static class InteractionConfig {
        private int primaryAttempts = 3;
        private long primaryTimeoutMs = 30_000;
        private int secondaryAttempts = 2;
        private long secondaryTimeoutMs = 10_000;

        public int getPrimaryAttempts() { return primaryAttempts; }
        public void setPrimaryAttempts(int primaryAttempts) { this.primaryAttempts = primaryAttempts; }

        public long getPrimaryTimeoutMs() { return primaryTimeoutMs; }
        public void setPrimaryTimeoutMs(long primaryTimeoutMs) { this.primaryTimeoutMs = primaryTimeoutMs; }

        public int getSecondaryAttempts() { return secondaryAttempts; }
        public void setSecondaryAttempts(int secondaryAttempts) { this.secondaryAttempts = secondaryAttempts; }

        public long getSecondaryTimeoutMs() { return secondaryTimeoutMs; }
        public void setSecondaryTimeoutMs(long secondaryTimeoutMs) { this.secondaryTimeoutMs = secondaryTimeoutMs; }
    }

    /**
     * Interaction pacing: stealth, balanced or aggressive.
     */
    public static class PacingConfig {
        private String profile = "balanced";

        public String getProfile() { return profile; }
        public void setProfile(String profile) { this.profile = profile; }
    }

    /**
     * Target surface locations and control selectors.
     */
    public static class SurfaceConfig {
        private String entryUrl = "https://suno.com";
        private String taskUrl = "https://suno.com/create";
        private String loginButton = "button:has-text('Sign in')";
        private String identityInput = "input[type='email']";
        private String secretInput = "input[type='password']";
        private String nextButton = "button:has-text('Next')";
        private String tryAgainLink = "text=Try again";
        private String consentCheckbox = "input[type='checkbox']";
        private String readyControl = "textarea";
        private String promptInput = "textarea";
        private String submitControl = "button:has-text('Create')";
        private String workingIndicator = "[aria-label='Loading'], .animate-spin";
        private String moreOptions = "button[aria-label='More options']";
        private String exportMenuItem = "text=Download";
        private String formatOption = "text=MP3 Audio";

        public String getEntryUrl() { return entryUrl; }
        public void setEntryUrl(String entryUrl) { this.entryUrl = entryUrl; }

        public String getTaskUrl() { return taskUrl; }
        public void setTaskUrl(String taskUrl) { this.taskUrl = taskUrl; }

        public String getLoginButton() { return loginButton; }
        public void setLoginButton(String loginButton) { this.loginButton = loginButton; }

        public String getIdentityInput() { return identityInput; }
        public void setIdentityInput(String identityInput) { this.identityInput = identityInput; }

        public String getSecretInput() { return secretInput; }
        public void setSecretInput(String secretInput) { this.secretInput = secretInput; }

        public String getNextButton() { return nextButton; }
        public void setNextButton(String nextButton) { this.nextButton = nextButton; }

        public String getTryAgainLink() { return tryAgainLink; }
        public void setTryAgainLink(String tryAgainLink) { this.tryAgainLink = tryAgainLink; }

        public String getConsentCheckbox() { return consentCheckbox; }
        public void setConsentCheckbox(String consentCheckbox) { this.consentCheckbox = consentCheckbox; }

        public String getReadyControl() { return readyControl; }
        public void setReadyControl(String readyControl) { this.readyControl = readyControl; }

        public String getPromptInput() { return promptInput; }
        public void setPromptInput(String promptInput) { this.promptInput = promptInput; }

        public String getSubmitControl() { return submitControl; }
        public void setSubmitControl(String submitControl) { this.submitControl = submitControl; }

        public String getWorkingIndicator() { return workingIndicator; }
        public void setWorkingIndicator(String workingIndicator) { this.workingIndicator = workingIndicator; }

        public String getMoreOptions() { return moreOptions; }
        public void setMoreOptions(String moreOptions) { this.moreOptions = moreOptions; }

        public String getExportMenuItem() { return exportMenuItem; }
        public void setExportMenuItem(String exportMenuItem) { this.exportMenuItem = exportMenuItem; }

        public String getFormatOption() { return formatOption; }
        public void setFormatOption(String formatOption) { this.formatOption = formatOption; }
    }

    /**
     * Local download and upload locations.
     */
    public static class StorageConfig {
        private String downloadPath = "downloads";
        private String uploadRoot = "uploads";

        public String getDownloadPath() { return downloadPath; }
        public void setDownloadPath(String downloadPath) { this.downloadPath = downloadPath; }

        public String getUploadRoot() { return uploadRoot; }
        public void setUploadRoot(String uploadRoot) { this.uploadRoot = uploadRoot; }
    }

    /**
     * Browser launch and context options.
     */
    public static class BrowserConfig {
        private boolean headless = true;
        private List<String> args = new ArrayList<>(List.of(
                "--no-first-run",
                "--no-default-browser-check",
                "--disable-blink-features=AutomationControlled"
        ));
        private String userAgent;
        private String locale = "en-US";
        private int viewportWidth = 1280;
        private int viewportHeight = 720;
        private boolean mobile = false;

        public boolean isHeadless() { return headless; }
        public void setHeadless(boolean headless) { this.headless = headless; }

        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public String getLocale() { return locale; }
        public void setLocale(String locale) { this.locale = locale; }

        public int getViewportWidth() { return viewportWidth; }
        public void setViewportWidth(int viewportWidth) { this.viewportWidth = viewportWidth; }

        public int getViewportHeight() { return viewportHeight; }
        public void setViewportHeight(int viewportHeight) { this.viewportHeight = viewportHeight; }

        public boolean isMobile() { return mobile; }
        public void setMobile(boolean mobile) { this.mobile = mobile; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "session_pool";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Periodic pool status logging by the launcher.
     */
    public static class StatusLogConfig {
        private long intervalMs = 60_000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }
}
