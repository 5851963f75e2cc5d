package fr.lapetina.confkit.domain.merge;

import java.util.List;

/**
 * View of a format-specific document tree, used by {@link DocumentMerger} so that one merge
 * algorithm serves every format.
 *
 * @param <N> node type of the tree
 */
public interface TreeAdapter<N> {

    boolean isMapping(N node);

    /**
     * Returns the scalar keys of a mapping, in document order.
     */
    List<String> keys(N mapping);

    /**
     * Returns the value stored under exactly {@code key}, or null.
     */
    N get(N mapping, String key);

    /**
     * Replaces the value of {@code key} in place, or appends the entry if the key is absent.
     */
    void put(N mapping, String key, N value);

    /**
     * Returns the text of a scalar node, or null for mappings, sequences and nulls.
     */
    String scalarText(N node);

    /**
     * Whether this tree carries comments that {@link #transplantComments} can move.
     */
    default boolean preservesComments() {
        return false;
    }

    /**
     * Copies comments attached to {@code sourceKey} in {@code source} (key and value nodes) onto
     * the entry {@code targetKey} of {@code target}.
     */
    default void transplantComments(N source, String sourceKey, N target, String targetKey) {
    }
}
