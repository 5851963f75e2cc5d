package fr.lapetina.confkit.loader;

import fr.lapetina.confkit.domain.resolve.DefaultRegistry;
import fr.lapetina.confkit.infrastructure.format.ConfigFormat;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Defaults shared by several loaders. Null components leave the builder's own default in place.
 *
 * @param format        document format, or null to pick by file extension
 * @param autoUpdate    whether loaders reconcile their file with the bundled default before loading
 * @param registry      default-value parsers, or null for {@link DefaultRegistry#standard()}
 * @param meterRegistry meter registry, or null for an in-memory one
 */
public record LoaderSettings(
        ConfigFormat<?> format,
        boolean autoUpdate,
        DefaultRegistry registry,
        MeterRegistry meterRegistry
) {

    public static LoaderSettings defaults() {
        return new LoaderSettings(null, false, null, null);
    }

    public LoaderSettings withFormat(ConfigFormat<?> format) {
        return new LoaderSettings(format, autoUpdate, registry, meterRegistry);
    }

    public LoaderSettings withAutoUpdate(boolean autoUpdate) {
        return new LoaderSettings(format, autoUpdate, registry, meterRegistry);
    }

    public LoaderSettings withRegistry(DefaultRegistry registry) {
        return new LoaderSettings(format, autoUpdate, registry, meterRegistry);
    }

    public LoaderSettings withMeterRegistry(MeterRegistry meterRegistry) {
        return new LoaderSettings(format, autoUpdate, registry, meterRegistry);
    }
}
