package fr.lapetina.sessionpool.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Credential overrides from SESSION_POOL_IDENTITY and SESSION_POOL_SECRET
 * - Basic validation of pool sizing
 * - File watching for automatic reload and listener notification
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String IDENTITY_ENV = "SESSION_POOL_IDENTITY";
    public static final String SECRET_ENV = "SESSION_POOL_SECRET";

    private final AtomicReference<SessionPoolConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;
    private final UnaryOperator<String> environment;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath, UnaryOperator<String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        this.yaml = new Yaml(new Constructor(SessionPoolConfig.class, new LoaderOptions()));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SessionPoolConfig load() {
        SessionPoolConfig config = prepare(loadFromPath());
        SessionPoolConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private SessionPoolConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SessionPoolConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private SessionPoolConfig parse(InputStream is, String source) {
        try {
            SessionPoolConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new SessionPoolConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public SessionPoolConfig loadFromStream(InputStream inputStream) {
        SessionPoolConfig config = prepare(parse(inputStream, "stream"));
        SessionPoolConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private SessionPoolConfig prepare(SessionPoolConfig config) {
        applyEnvironment(config);
        validate(config);
        return config;
    }

    private void applyEnvironment(SessionPoolConfig config) {
        String identity = environment.apply(IDENTITY_ENV);
        if (identity != null && !identity.isBlank()) {
            config.getAuth().setIdentity(identity);
            log.debug("Identity overridden from environment: variable={}", IDENTITY_ENV);
        }
        String secret = environment.apply(SECRET_ENV);
        if (secret != null && !secret.isBlank()) {
            config.getAuth().setSecret(secret);
            log.debug("Secret overridden from environment: variable={}", SECRET_ENV);
        }
    }

    private void validate(SessionPoolConfig config) {
        SessionPoolConfig.PoolConfig pool = config.getPool();
        if (pool.getMaxConcurrentWorkers() < 1) {
            throw new ConfigurationException("pool.maxConcurrentWorkers must be at least 1");
        }
        if (pool.getInitialWorkers() < 0 || pool.getInitialWorkers() > pool.getMaxConcurrentWorkers()) {
            throw new ConfigurationException("pool.initialWorkers must be between 0 and pool.maxConcurrentWorkers");
        }
        if (pool.getSoftMaxWorkers() > pool.getMaxConcurrentWorkers()) {
            log.warn("pool.softMaxWorkers exceeds the hard cap, clamping: softMaxWorkers={}, maxConcurrentWorkers={}",
                    pool.getSoftMaxWorkers(), pool.getMaxConcurrentWorkers());
            pool.setSoftMaxWorkers(pool.getMaxConcurrentWorkers());
        }
        if (config.getScheduler().getTickIntervalMs() <= 0) {
            throw new ConfigurationException("scheduler.tickIntervalMs must be positive");
        }
        if (config.getAuth().getMaxAttempts() < 1) {
            throw new ConfigurationException("auth.maxAttempts must be at least 1");
        }
    }

    /**
     * Returns the current configuration.
     */
    public SessionPoolConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload, keeping the current configuration if the new one is invalid.
     */
    public SessionPoolConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(SessionPoolConfig oldConfig, SessionPoolConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
