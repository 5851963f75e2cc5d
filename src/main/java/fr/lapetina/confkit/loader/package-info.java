/**
 * Configuration loading facade with reload, file update and hot-reload support.
 *
 * <p>This package ties the pieces together: a file in a known format, a record schema, the field
 * resolver, and the update coordinator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.confkit.loader.ConfigLoaderBuilder} - Fluent setup, bootstrap copy and first load</li>
 *   <li>{@link fr.lapetina.confkit.loader.ConfigLoader} - Current object, reload, update and file watching</li>
 *   <li>{@link fr.lapetina.confkit.loader.ConfigChangeListener} - Callback for configuration changes</li>
 *   <li>{@link fr.lapetina.confkit.loader.LoaderSettings} - Defaults shared by several builders</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>A loader starts {@link fr.lapetina.confkit.loader.LoaderState#UNBOOTSTRAPPED}. The builder
 * copies the bundled default when the file is missing, optionally reconciles an outdated file,
 * and builds the first object; any failure there propagates. Afterwards
 * {@link fr.lapetina.confkit.loader.ConfigLoader#reload()} is fail-safe: the previous object is
 * kept when the new one cannot be built.
 *
 * <h2>Hot-Reload</h2>
 * <p>{@link fr.lapetina.confkit.loader.ConfigLoader#startWatching()} watches the file's directory
 * and reloads when the file's modification time moves forward. Registered listeners are notified
 * after every successful load.
 *
 * @see fr.lapetina.confkit.Confkit
 */
package fr.lapetina.confkit.loader;
