package fr.lapetina.confkit.loader;

import fr.lapetina.confkit.domain.resolve.FieldResolver;
import fr.lapetina.confkit.domain.resolve.Resolution;
import fr.lapetina.confkit.domain.resolve.SoftWarning;
import fr.lapetina.confkit.domain.schema.ConfigSchema;
import fr.lapetina.confkit.exception.StructureException;
import fr.lapetina.confkit.infrastructure.format.ConfigFormat;
import fr.lapetina.confkit.infrastructure.metrics.LoaderMetrics;
import fr.lapetina.confkit.infrastructure.update.UpdateCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Typed configuration backed by a YAML or JSON file, with reload and hot-reload support.
 *
 * Supports:
 * - Building the configuration object from the file through a {@link ConfigSchema}
 * - Reconciling the file with a newer bundled default ({@link #updateConfig()})
 * - File watching for automatic reload
 * - Listener notification on changes
 *
 * Readers always see a complete object: a failed reload keeps the previous one. Reloads and
 * updates are serialised by an internal lock.
 *
 * Instances are created by {@link ConfigLoaderBuilder#load()}.
 *
 * @param <T> configuration record type
 */
public final class ConfigLoader<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    // Object and warnings swap together
    private final AtomicReference<Resolution<T>> current = new AtomicReference<>();
    private final List<ConfigChangeListener<? super T>> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final ConfigSchema<T> schema;
    private final ConfigFormat<?> format;
    private final Path configPath;
    private final String resourcePath;
    private final FieldResolver resolver;
    private final UpdateCoordinator<?> updateCoordinator;
    private final LoaderMetrics metrics;

    private volatile LoaderState state = LoaderState.UNBOOTSTRAPPED;

    private volatile WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    ConfigLoader(ConfigSchema<T> schema,
                 ConfigFormat<?> format,
                 Path configPath,
                 String resourcePath,
                 FieldResolver resolver,
                 UpdateCoordinator<?> updateCoordinator,
                 LoaderMetrics metrics) {
        this.schema = schema;
        this.format = format;
        this.configPath = configPath;
        this.resourcePath = resourcePath;
        this.resolver = resolver;
        this.updateCoordinator = updateCoordinator;
        this.metrics = metrics;
    }

    /**
     * Builds and publishes the first configuration object. Failures propagate.
     */
    T loadInitial() {
        lock.lock();
        try {
            Resolution<T> resolution = build(LoaderMetrics.Operation.LOAD);
            publish(resolution);
            return resolution.value();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current configuration.
     */
    public T get() {
        Resolution<T> resolution = current.get();
        return resolution != null ? resolution.value() : null;
    }

    /**
     * Returns the soft warnings raised while building the current configuration.
     */
    public List<SoftWarning> getWarnings() {
        Resolution<T> resolution = current.get();
        return resolution != null ? resolution.warnings() : List.of();
    }

    public LoaderState getState() {
        return state;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public ConfigSchema<T> getSchema() {
        return schema;
    }

    /**
     * Re-reads the file and replaces the current configuration.
     *
     * @return the new configuration
     * @throws fr.lapetina.confkit.exception.ConfigurationException if the file cannot be turned into
     *         a configuration object; the previous object stays current
     */
    public T reload() {
        lock.lock();
        LoaderState previousState = state;
        state = LoaderState.RELOADING;
        try {
            Resolution<T> resolution = build(LoaderMetrics.Operation.RELOAD);
            publish(resolution);
            return resolution.value();
        } catch (RuntimeException e) {
            log.error("Failed to reload configuration from {}, keeping current", configPath, e);
            state = previousState;
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reconciles the file with the bundled default if the file's version is older. The current
     * configuration object is not rebuilt; call {@link #reload()} afterwards.
     *
     * @return true if the file was rewritten
     */
    public boolean updateConfig() {
        lock.lock();
        LoaderState previousState = state;
        state = LoaderState.UPDATING;
        try {
            return updateCoordinator.reconcile(resourcePath, configPath);
        } finally {
            state = previousState;
            lock.unlock();
        }
    }

    private Resolution<T> build(LoaderMetrics.Operation operation) {
        long start = System.nanoTime();
        try {
            log.info("Loading configuration from file: {}", configPath);
            lastModified = Files.getLastModifiedTime(configPath).toMillis();
            byte[] content = Files.readAllBytes(configPath);

            Resolution<T> resolution = resolver.resolve(schema, format.readBag(content));
            for (SoftWarning warning : resolution.warnings()) {
                metrics.recordWarning(warning.kind());
            }

            metrics.recordLoad(operation, true);
            metrics.recordLoadDuration(Duration.ofNanos(System.nanoTime() - start));
            return resolution;
        } catch (IOException e) {
            metrics.recordLoad(operation, false);
            throw new StructureException("Failed to read configuration from: " + configPath, e);
        } catch (RuntimeException e) {
            metrics.recordLoad(operation, false);
            throw e;
        }
    }

    private void publish(Resolution<T> resolution) {
        Resolution<T> previous = current.getAndSet(resolution);
        state = LoaderState.LOADED;
        notifyListeners(previous != null ? previous.value() : null, resolution.value());
    }

    /**
     * Starts watching the configuration file for changes. Does nothing if already watching.
     */
    public synchronized void startWatching() {
        if (watchExecutor != null) {
            log.debug("Already watching {}", configPath);
            return;
        }
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
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
            closeWatchService();
        }
    }

    private void checkForChanges() {
        try {
            WatchService service = watchService;
            WatchKey key = service != null ? service.poll() : null;
            if (key == null) {
                return;
            }

            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                Path name = (Path) event.context();
                if (name != null && name.equals(configPath.getFileName())) {
                    changed = true;
                }
            }
            key.reset();

            // Debounce - check if file actually changed
            if (changed && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                log.info("Configuration file changed, reloading...");
                reload();
            }
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Adds a listener for configuration changes.
     */
    public void addListener(ConfigChangeListener<? super T> listener) {
        listeners.add(listener);
    }

    /**
     * Removes a configuration change listener.
     */
    public void removeListener(ConfigChangeListener<? super T> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(T oldConfig, T newConfig) {
        for (ConfigChangeListener<? super T> listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            watchExecutor = null;
        }
        closeWatchService();
    }

    private void closeWatchService() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
            watchService = null;
        }
    }
}
