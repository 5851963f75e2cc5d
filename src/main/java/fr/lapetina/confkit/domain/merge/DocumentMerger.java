package fr.lapetina.confkit.domain.merge;

import fr.lapetina.confkit.domain.model.Version;
import fr.lapetina.confkit.exception.StructureException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a user's configuration document into a newer shipped default.
 *
 * The default tree is the base. Every key of the user tree then overrides the base: mappings
 * present on both sides merge recursively, anything else (including a scalar replacing a mapping)
 * replaces the base value in place. Keys only the user has are appended. The root-level
 * {@code version} key is never taken from the user, so the result carries the default's version.
 */
public final class DocumentMerger {

    private DocumentMerger() {
        // Utility class
    }

    /**
     * Merges {@code current} into {@code defaults}. The {@code defaults} tree is modified and
     * returned as the merged document.
     *
     * @throws StructureException if either root is not a mapping
     */
    public static <N> MergeResult<N> merge(TreeAdapter<N> adapter, N defaults, N current) {
        requireMapping(adapter, defaults, "default");
        requireMapping(adapter, current, "current");

        Version defaultVersion = versionOf(adapter, defaults);
        Version currentVersion = versionOf(adapter, current);

        mergeInto(adapter, defaults, current, true);
        return new MergeResult<>(defaults, currentVersion, defaultVersion);
    }

    /**
     * Merges two nested map documents without modifying either argument.
     */
    public static Map<String, Object> mergeMaps(Map<String, ?> defaults, Map<String, ?> current) {
        Object base = deepCopy(defaults);
        Object user = deepCopy(current);
        merge(MapTreeAdapter.INSTANCE, base, user);
        @SuppressWarnings("unchecked")
        Map<String, Object> merged = (Map<String, Object>) base;
        return merged;
    }

    /**
     * Reads the root-level version of a document, defaulting to {@link Version#DEFAULT}.
     */
    public static <N> Version versionOf(TreeAdapter<N> adapter, N root) {
        requireMapping(adapter, root, "document");
        for (String key : adapter.keys(root)) {
            if (Keys.isVersionKey(key)) {
                return Version.parse(adapter.scalarText(adapter.get(root, key)));
            }
        }
        return Version.DEFAULT;
    }

    private static <N> void mergeInto(TreeAdapter<N> adapter, N base, N current, boolean root) {
        // Copy: put() may append to the base while we iterate the user's keys
        for (String key : new ArrayList<>(adapter.keys(current))) {
            if (root && Keys.isVersionKey(key)) {
                continue;
            }
            N currentValue = adapter.get(current, key);
            String baseKey = findKey(adapter, base, key);

            if (baseKey == null) {
                // Appended under the user's spelling; its comments follow below
                baseKey = key;
                adapter.put(base, baseKey, currentValue);
            } else {
                N baseValue = adapter.get(base, baseKey);
                if (baseValue != null && currentValue != null
                        && adapter.isMapping(baseValue) && adapter.isMapping(currentValue)) {
                    mergeInto(adapter, baseValue, currentValue, false);
                } else {
                    adapter.put(base, baseKey, currentValue);
                }
            }

            if (adapter.preservesComments()) {
                adapter.transplantComments(current, key, base, baseKey);
            }
        }
    }

    private static <N> String findKey(TreeAdapter<N> adapter, N mapping, String key) {
        String normalized = Keys.normalize(key);
        for (String candidate : adapter.keys(mapping)) {
            if (Keys.normalize(candidate).equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }

    private static <N> void requireMapping(TreeAdapter<N> adapter, N node, String side) {
        if (node == null || !adapter.isMapping(node)) {
            throw new StructureException("The " + side + " config root must be a mapping");
        }
    }

    private static Object deepCopy(Object node) {
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (node instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return node;
    }
}
