package fr.lapetina.confkit.infrastructure.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.confkit.domain.merge.TreeAdapter;
import fr.lapetina.confkit.exception.StructureException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON documents through Jackson. Output uses the default pretty printer.
 */
public final class JsonFormat implements ConfigFormat<JsonNode> {

    private static final Set<String> EXTENSIONS = Set.of("json");

    private final ObjectMapper mapper;
    private final TreeAdapter<JsonNode> adapter = new JsonTreeAdapter();

    public JsonFormat(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonFormat() {
        this(new ObjectMapper());
    }

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public Map<String, Object> readBag(byte[] content) {
        JsonNode root = readTree(content);
        @SuppressWarnings("unchecked")
        Map<String, Object> bag = mapper.convertValue(root, Map.class);
        return bag;
    }

    @Override
    public JsonNode readTree(byte[] content) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new StructureException("Invalid JSON document: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new StructureException("Empty JSON document");
        }
        if (!root.isObject()) {
            throw new StructureException("JSON document root must be an object, got " + root.getNodeType());
        }
        return root;
    }

    @Override
    public byte[] write(JsonNode tree) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            throw new StructureException("Failed to write JSON document", e);
        }
    }

    @Override
    public TreeAdapter<JsonNode> adapter() {
        return adapter;
    }

    private static final class JsonTreeAdapter implements TreeAdapter<JsonNode> {

        @Override
        public boolean isMapping(JsonNode node) {
            return node.isObject();
        }

        @Override
        public List<String> keys(JsonNode mapping) {
            List<String> keys = new ArrayList<>(mapping.size());
            Iterator<String> names = mapping.fieldNames();
            while (names.hasNext()) {
                keys.add(names.next());
            }
            return keys;
        }

        @Override
        public JsonNode get(JsonNode mapping, String key) {
            return mapping.get(key);
        }

        @Override
        public void put(JsonNode mapping, String key, JsonNode value) {
            // ObjectNode keeps insertion order and replaces existing fields in place
            ((ObjectNode) mapping).set(key, value);
        }

        @Override
        public String scalarText(JsonNode node) {
            if (node == null || !node.isValueNode() || node.isNull()) {
                return null;
            }
            return node.asText();
        }
    }
}
