package fr.lapetina.confkit.infrastructure.format;

import fr.lapetina.confkit.domain.merge.TreeAdapter;

import java.util.Map;
import java.util.Set;

/**
 * A document format: how bytes become a key/value bag for resolution, and a native tree for
 * merging and writing back.
 *
 * All methods throw {@link fr.lapetina.confkit.exception.StructureException} for content that is
 * empty, unparsable, or whose root is not a mapping.
 *
 * @param <N> native tree node type
 */
public interface ConfigFormat<N> {

    /**
     * File extensions handled by this format, lower case, without the dot.
     */
    Set<String> extensions();

    /**
     * Parses {@code content} into nested maps, lists and scalars.
     */
    Map<String, Object> readBag(byte[] content);

    /**
     * Parses {@code content} into the format's native tree, keeping whatever metadata the format
     * can round-trip.
     */
    N readTree(byte[] content);

    /**
     * Emits a tree fully in memory.
     */
    byte[] write(N tree);

    TreeAdapter<N> adapter();
}
