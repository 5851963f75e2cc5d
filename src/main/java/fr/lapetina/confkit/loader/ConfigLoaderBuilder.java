package fr.lapetina.confkit.loader;

import fr.lapetina.confkit.domain.resolve.DefaultRegistry;
import fr.lapetina.confkit.domain.resolve.FieldResolver;
import fr.lapetina.confkit.domain.schema.ConfigSchema;
import fr.lapetina.confkit.exception.StructureException;
import fr.lapetina.confkit.infrastructure.format.ConfigFormat;
import fr.lapetina.confkit.infrastructure.format.ConfigFormats;
import fr.lapetina.confkit.infrastructure.io.AtomicFiles;
import fr.lapetina.confkit.infrastructure.io.ClasspathResourceReader;
import fr.lapetina.confkit.infrastructure.io.ResourceReader;
import fr.lapetina.confkit.infrastructure.metrics.LoaderMetrics;
import fr.lapetina.confkit.infrastructure.update.UpdateCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builder for {@link ConfigLoader}.
 *
 * <pre>{@code
 * ConfigLoader<AppConfig> loader = Confkit.loader(AppConfig.class)
 *         .fromResource("/defaults/app.yml")
 *         .toFile(Path.of("config/app.yml"))
 *         .autoUpdate(true)
 *         .load();
 * }</pre>
 *
 * @param <T> configuration record type
 */
public final class ConfigLoaderBuilder<T> {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoaderBuilder.class);

    private final Class<T> type;
    private final List<ConfigChangeListener<? super T>> listeners = new ArrayList<>();

    private ConfigSchema<T> schema;
    private String resourcePath;
    private Path targetFile;
    private ConfigFormat<?> format;
    private DefaultRegistry registry;
    private ResourceReader resourceReader;
    private MeterRegistry meterRegistry;
    private Boolean autoUpdate;

    public ConfigLoaderBuilder(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Uses an explicit schema instead of the annotation-derived one.
     */
    public ConfigLoaderBuilder<T> schema(ConfigSchema<T> schema) {
        if (schema.type() != type) {
            throw new IllegalArgumentException(
                    "Schema is for " + schema.type().getName() + ", loader is for " + type.getName());
        }
        this.schema = schema;
        return this;
    }

    /**
     * Classpath location of the bundled default document.
     */
    public ConfigLoaderBuilder<T> fromResource(String resourcePath) {
        this.resourcePath = resourcePath;
        return this;
    }

    /**
     * File the configuration is read from, created from the bundled default when missing.
     */
    public ConfigLoaderBuilder<T> toFile(Path targetFile) {
        this.targetFile = targetFile;
        return this;
    }

    public ConfigLoaderBuilder<T> format(ConfigFormat<?> format) {
        this.format = format;
        return this;
    }

    public ConfigLoaderBuilder<T> registry(DefaultRegistry registry) {
        this.registry = registry;
        return this;
    }

    public ConfigLoaderBuilder<T> resourceReader(ResourceReader resourceReader) {
        this.resourceReader = resourceReader;
        return this;
    }

    public ConfigLoaderBuilder<T> meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }

    /**
     * Reconciles an outdated file with the bundled default before the first load.
     */
    public ConfigLoaderBuilder<T> autoUpdate(boolean autoUpdate) {
        this.autoUpdate = autoUpdate;
        return this;
    }

    public ConfigLoaderBuilder<T> listener(ConfigChangeListener<? super T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Applies shared settings to every option not set explicitly on this builder.
     */
    public ConfigLoaderBuilder<T> withDefaults(LoaderSettings settings) {
        if (format == null) {
            format = settings.format();
        }
        if (registry == null) {
            registry = settings.registry();
        }
        if (meterRegistry == null) {
            meterRegistry = settings.meterRegistry();
        }
        if (autoUpdate == null) {
            autoUpdate = settings.autoUpdate();
        }
        return this;
    }

    /**
     * Creates the loader and builds the first configuration object.
     *
     * If the target file does not exist it is created from the bundled resource, byte for byte.
     * With auto-update enabled the file is then reconciled before loading.
     *
     * @throws NullPointerException if the resource path or the target file is not set
     * @throws fr.lapetina.confkit.exception.ConfigurationException if the first load fails
     */
    public ConfigLoader<T> load() {
        Objects.requireNonNull(resourcePath, "Resource path is not set");
        Objects.requireNonNull(targetFile, "Target file is not set");

        ConfigSchema<T> resolvedSchema = schema != null ? schema : ConfigSchema.of(type);
        ConfigFormat<?> resolvedFormat = format != null ? format : ConfigFormats.forPath(targetFile);
        ResourceReader reader = resourceReader != null ? resourceReader : defaultResourceReader();
        LoaderMetrics metrics = new LoaderMetrics(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
        FieldResolver resolver = new FieldResolver(registry != null ? registry : DefaultRegistry.standard());

        bootstrap(reader);

        ConfigLoader<T> loader = new ConfigLoader<>(
                resolvedSchema,
                resolvedFormat,
                targetFile,
                resourcePath,
                resolver,
                UpdateCoordinator.of(resolvedFormat, reader, metrics),
                metrics
        );
        listeners.forEach(loader::addListener);

        if (Boolean.TRUE.equals(autoUpdate)) {
            loader.updateConfig();
        }
        loader.loadInitial();

        log.info("Configuration {} loaded from {}", type.getSimpleName(), targetFile);
        return loader;
    }

    private void bootstrap(ResourceReader reader) {
        if (Files.exists(targetFile)) {
            return;
        }
        log.info("Config file not found, copying from resource: {}", resourcePath);
        byte[] content = reader.read(resourcePath);
        try {
            AtomicFiles.write(targetFile, content);
        } catch (IOException e) {
            throw new StructureException("Failed to create config file: " + targetFile, e);
        }
    }

    private ResourceReader defaultResourceReader() {
        ClassLoader classLoader = type.getClassLoader();
        return classLoader != null ? new ClasspathResourceReader(classLoader) : new ClasspathResourceReader();
    }
}
