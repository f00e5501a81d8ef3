package fr.lapetina.configgraph.infrastructure.config;

import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.model.SectionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.*;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Root configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system or classpath
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<SectionStore> currentStore = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final ImportResolver resolver;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath, ImportResolver resolver) {
        this.configPath = Paths.get(configPath);
        this.resolver = resolver;
    }

    public ConfigLoader(String configPath) {
        this(configPath, new ImportResolver());
    }

    /**
     * Resolves the root configuration file and its imports.
     *
     * @return The frozen section store
     * @throws ConfigurationException if the file can not be found
     * @throws fr.lapetina.configgraph.domain.exception.ImportResolutionException if an import fails
     */
    public SectionStore load() {
        SectionStore store = resolver.resolve(locate());
        SectionStore previous = currentStore.getAndSet(store);
        notifyListeners(previous, store);
        return store;
    }

    private Path locate() {
        // Try file system first
        if (Files.exists(configPath)) {
            try {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration file: " + configPath, e);
            }
            log.info("Loading configuration from file: {}", configPath);
            return configPath;
        }

        // Try classpath; imports are resolved relative to the file, so it must be a directory entry
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }
        URL url = getClass().getClassLoader().getResource(classpathResource);
        if (url != null) {
            if (!"file".equals(url.getProtocol())) {
                throw new ConfigurationException("Classpath configuration must be an exploded file, got: " + url);
            }
            try {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return Paths.get(url.toURI());
            } catch (URISyntaxException e) {
                throw new ConfigurationException("Invalid classpath location: " + url, e);
            }
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Returns the current store.
     */
    public SectionStore getCurrentStore() {
        return currentStore.get();
    }

    public ImportResolver getResolver() {
        return resolver;
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching(long intervalMs) {
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

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

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
                    // Debounce
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (IOException | ClosedWatchServiceException e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a reload, keeping the current store when the new one fails to
     * resolve.
     */
    public SectionStore reload() {
        try {
            return load();
        } catch (ConfigGraphException | ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentStore.get();
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

    private void notifyListeners(SectionStore oldStore, SectionStore newStore) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldStore, newStore);
            } catch (RuntimeException e) {
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
