package fr.lapetina.confkit.domain.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link TreeAdapter} over plain nested {@code Map}/{@code List} documents, as produced by the
 * formats' flat-bag readers.
 */
public final class MapTreeAdapter implements TreeAdapter<Object> {

    public static final MapTreeAdapter INSTANCE = new MapTreeAdapter();

    private MapTreeAdapter() {
    }

    @Override
    public boolean isMapping(Object node) {
        return node instanceof Map;
    }

    @Override
    public List<String> keys(Object mapping) {
        List<String> keys = new ArrayList<>();
        for (Object key : ((Map<?, ?>) mapping).keySet()) {
            if (key != null) {
                keys.add(key.toString());
            }
        }
        return keys;
    }

    @Override
    public Object get(Object mapping, String key) {
        return ((Map<?, ?>) mapping).get(key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void put(Object mapping, String key, Object value) {
        ((Map<String, Object>) mapping).put(key, value);
    }

    @Override
    public String scalarText(Object node) {
        if (node == null || node instanceof Map || node instanceof List) {
            return null;
        }
        return node.toString();
    }
}
