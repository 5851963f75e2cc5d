package fr.lapetina.confkit.loader;

/**
 * Listener interface for configuration changes.
 *
 * @param <T> configuration type
 */
@FunctionalInterface
public interface ConfigChangeListener<T> {

    /**
     * Called when a configuration object has been built and published.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(T oldConfig, T newConfig);
}
