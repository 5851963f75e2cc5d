/**
 * Document formats.
 *
 * <p>Each {@link fr.lapetina.confkit.infrastructure.format.ConfigFormat} exposes two views of a
 * document: a plain key/value bag consumed by the field resolver, and a native tree that the
 * merger edits through the format's {@link fr.lapetina.confkit.domain.merge.TreeAdapter}.
 *
 * <h2>Formats</h2>
 * <ul>
 *   <li>{@link fr.lapetina.confkit.infrastructure.format.YamlFormat}: SnakeYAML, comments kept</li>
 *   <li>{@link fr.lapetina.confkit.infrastructure.format.JsonFormat}: Jackson, pretty printed</li>
 * </ul>
 */
package fr.lapetina.confkit.infrastructure.format;
