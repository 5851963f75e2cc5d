package fr.lapetina.confkit;

import fr.lapetina.confkit.loader.ConfigLoaderBuilder;
import fr.lapetina.confkit.loader.LoaderSettings;

import java.util.Objects;

/**
 * Entry point for creating configuration loaders.
 *
 * <pre>{@code
 * ConfigLoader<AppConfig> loader = Confkit.loader(AppConfig.class)
 *         .fromResource("/defaults/app.yml")
 *         .toFile(Path.of("app.yml"))
 *         .load();
 *
 * Confkit shared = Confkit.withDefaults(LoaderSettings.defaults().withAutoUpdate(true));
 * ConfigLoader<DbConfig> db = shared.builder(DbConfig.class)
 *         .fromResource("/defaults/db.json")
 *         .toFile(Path.of("db.json"))
 *         .load();
 * }</pre>
 */
public final class Confkit {

    private final LoaderSettings settings;

    private Confkit(LoaderSettings settings) {
        this.settings = settings;
    }

    /**
     * Starts a loader builder for {@code type}.
     */
    public static <T> ConfigLoaderBuilder<T> loader(Class<T> type) {
        return new ConfigLoaderBuilder<>(type);
    }

    /**
     * Returns a factory whose builders start from {@code settings}.
     */
    public static Confkit withDefaults(LoaderSettings settings) {
        return new Confkit(Objects.requireNonNull(settings, "settings"));
    }

    /**
     * Starts a loader builder for {@code type} with this factory's settings applied.
     */
    public <T> ConfigLoaderBuilder<T> builder(Class<T> type) {
        return new ConfigLoaderBuilder<>(type).withDefaults(settings);
    }

    public LoaderSettings settings() {
        return settings;
    }
}
