package fr.lapetina.modeltraffic.infrastructure.config;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - File watching for automatic reload
 * - Listener notification on changes
 *
 * A configuration that fails validation is rejected as a whole.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<ControllerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ControllerConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ControllerConfig load() {
        return apply(loadFromPath());
    }

    private ControllerConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
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

    private ControllerConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private ControllerConfig parse(InputStream is, String source) {
        try {
            ControllerConfig config = yaml.load(is);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ControllerConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private ControllerConfig apply(ControllerConfig config) {
        validate(config);
        ControllerConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Checks the values that cannot be defaulted.
     *
     * @throws ConfigurationException on the first invalid value
     */
    static void validate(ControllerConfig config) {
        ControllerConfig.RoutingConfig routing = config.getRouting();
        if (RoutingStrategy.fromName(routing.getStrategy()).isEmpty()) {
            throw new ConfigurationException("Unknown routing strategy: " + routing.getStrategy());
        }
        try {
            routing.toParameters();
            config.getRollout().toSuccessCriteria().validate();
        } catch (IllegalArgumentException | ValidationException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config.getPipeline().getRingBufferSize() <= 0
                || Integer.bitCount(config.getPipeline().getRingBufferSize()) != 1) {
            throw new ConfigurationException("pipeline.ringBufferSize must be a power of 2");
        }
        String storeType = config.getStore().getType();
        if (!"memory".equals(storeType) && !"file".equals(storeType)) {
            throw new ConfigurationException("store.type must be 'memory' or 'file', got: " + storeType);
        }

        Set<String> endpointIds = new HashSet<>();
        for (ControllerConfig.ModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                throw new ConfigurationException("models[].name is required");
            }
            int total = 0;
            for (ControllerConfig.EndpointConfig endpoint : model.getEndpoints()) {
                if (endpoint.getId() == null || endpoint.getUrl() == null || endpoint.getVersion() == null) {
                    throw new ConfigurationException(
                            "Endpoint of model " + model.getName() + " needs id, version and url");
                }
                if (!endpointIds.add(endpoint.getId())) {
                    throw new ConfigurationException("Duplicate endpoint id: " + endpoint.getId());
                }
                total += endpoint.getWeight();
            }
            if (!model.getEndpoints().isEmpty() && total != 100) {
                throw new ConfigurationException(
                        "Weights of model " + model.getName() + " must sum to 100, got " + total);
            }
        }
    }

    /**
     * Returns the current configuration.
     */
    public ControllerConfig getCurrentConfig() {
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
                    // Editors fire several events per save
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
     * Forces a configuration reload. On failure the current configuration stays in effect.
     */
    public ControllerConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ControllerConfig oldConfig, ControllerConfig newConfig) {
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

    public static ControllerConfig createDefault() {
        return new ControllerConfig();
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
