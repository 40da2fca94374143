package fr.lapetina.agentnetwork.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link AgentNetworkConfig} from YAML and keeps it current.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Validation of the loaded tree
 * - Polling the file for modifications and reloading it
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final long POLL_INTERVAL_MS = 1000;

    private final AtomicReference<AgentNetworkConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private ScheduledExecutorService watcher;
    private volatile FileTime loadedModificationTime;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(AgentNetworkConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public AgentNetworkConfig load() {
        return install(validate(read()));
    }

    /**
     * Loads configuration from an input stream.
     */
    public AgentNetworkConfig loadFromStream(InputStream inputStream) {
        return install(validate(parse(inputStream, "stream")));
    }

    public AgentNetworkConfig getCurrentConfig() {
        return currentConfig.get();
    }

    private AgentNetworkConfig install(AgentNetworkConfig config) {
        AgentNetworkConfig previous = currentConfig.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config change listener failed: listener={}", listener.getClass().getSimpleName(), e);
            }
        }
        return config;
    }

    private AgentNetworkConfig read() {
        if (Files.isRegularFile(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                loadedModificationTime = Files.getLastModifiedTime(configPath);
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration from: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        log.info("Loading configuration from classpath: {}", resource);
        try (InputStream resourceStream = is) {
            return parse(resourceStream, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath configuration: " + resource, e);
        }
    }

    private AgentNetworkConfig parse(InputStream is, String source) {
        AgentNetworkConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration is empty, using defaults: source={}", source);
            return createDefault();
        }
        return config;
    }

    /**
     * Checks the values the network cannot run without.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public static AgentNetworkConfig validate(AgentNetworkConfig config) {
        AgentNetworkConfig.OrchestrationConfig orchestration = config.getOrchestration();
        require(orchestration.getMaxConcurrency() > 0, "orchestration.maxConcurrency must be positive");
        require(orchestration.getCallTimeoutMs() > 0, "orchestration.callTimeoutMs must be positive");
        require(orchestration.getTurnTimeoutMs() > 0, "orchestration.turnTimeoutMs must be positive");
        require(orchestration.getHistoryWindow() >= 0, "orchestration.historyWindow must not be negative");
        require(orchestration.getMaxMessageLength() > 0, "orchestration.maxMessageLength must be positive");

        Set<String> names = new HashSet<>();
        for (AgentNetworkConfig.EndpointConfig endpoint : config.getRateLimit().getEndpoints()) {
            require(endpoint.getName() != null && !endpoint.getName().isBlank(), "rateLimit endpoint name is required");
            require(names.add(endpoint.getName()), "Duplicate rateLimit endpoint: " + endpoint.getName());
            require(endpoint.getMaxTokens() > 0, "rateLimit.maxTokens must be positive: " + endpoint.getName());
            require(endpoint.getRefillRate() > 0, "rateLimit.refillRate must be positive: " + endpoint.getName());
            require(endpoint.getMaxRetries() >= 0, "rateLimit.maxRetries must not be negative: " + endpoint.getName());
        }

        AgentNetworkConfig.BackoffConfig backoff = config.getRateLimit().getBackoff();
        require(backoff.getBaseDelayMs() >= 0 && backoff.getMaxDelayMs() >= 0, "backoff delays must not be negative");
        require(backoff.getJitterMin() > 0 && backoff.getJitterMax() >= backoff.getJitterMin(),
                "backoff jitter range is invalid");

        require(config.getModels().getNormal() != null && config.getModels().getNormal().getName() != null,
                "models.normal.name is required");
        require(config.getModels().getThinking() != null && config.getModels().getThinking().getName() != null,
                "models.thinking.name is required");
        return config;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Polls the configuration file and reloads it when its modification time changes.
     * Does nothing for classpath configurations.
     */
    public synchronized void startWatching() {
        if (!Files.isRegularFile(configPath)) {
            log.warn("Config is not a file, hot reload disabled: {}", configPath);
            return;
        }
        if (watcher != null) {
            return;
        }

        watcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        watcher.scheduleWithFixedDelay(this::reloadIfModified, POLL_INTERVAL_MS, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
        log.info("Configuration hot-reload enabled: path={}, intervalMs={}", configPath, POLL_INTERVAL_MS);
    }

    private void reloadIfModified() {
        try {
            FileTime modified = Files.getLastModifiedTime(configPath);
            if (!modified.equals(loadedModificationTime)) {
                log.info("Configuration file changed, reloading: path={}", configPath);
                reload();
            }
        } catch (IOException e) {
            log.warn("Cannot check configuration file: path={}, error={}", configPath, e.getMessage());
        }
    }

    /**
     * Forces a configuration reload. A failed reload keeps the current configuration.
     */
    public AgentNetworkConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (watcher == null) {
            return;
        }
        watcher.shutdownNow();
        try {
            watcher.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        watcher = null;
    }

    /**
     * Creates a default configuration.
     */
    public static AgentNetworkConfig createDefault() {
        return new AgentNetworkConfig();
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
