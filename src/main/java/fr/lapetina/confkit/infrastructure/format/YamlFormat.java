package fr.lapetina.confkit.infrastructure.format;

import fr.lapetina.confkit.domain.merge.TreeAdapter;
import fr.lapetina.confkit.exception.StructureException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML documents through SnakeYAML.
 *
 * Trees are composed with comment processing enabled and serialized back with comments, so
 * block, inline and end comments survive a read/merge/write cycle. Only safe types are
 * constructed when reading the bag.
 */
public final class YamlFormat implements ConfigFormat<Node> {

    private static final Set<String> EXTENSIONS = Set.of("yml", "yaml");

    private final TreeAdapter<Node> adapter = new YamlTreeAdapter();

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public Map<String, Object> readBag(byte[] content) {
        Object root;
        try (Reader reader = reader(content)) {
            root = newYaml().load(reader);
        } catch (YAMLException | IOException e) {
            throw new StructureException("Invalid YAML document: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new StructureException("Empty YAML document");
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new StructureException("YAML document root must be a mapping, got " + root.getClass().getSimpleName());
        }
        return stringKeys(map);
    }

    @Override
    public Node readTree(byte[] content) {
        Node root;
        try (Reader reader = reader(content)) {
            root = newYaml().compose(reader);
        } catch (YAMLException | IOException e) {
            throw new StructureException("Invalid YAML document: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new StructureException("Empty YAML document");
        }
        if (!(root instanceof MappingNode)) {
            throw new StructureException("YAML document root must be a mapping, got " + root.getNodeId());
        }
        return root;
    }

    @Override
    public byte[] write(Node tree) {
        StringWriter writer = new StringWriter();
        try {
            newYaml().serialize(tree, writer);
        } catch (YAMLException e) {
            throw new StructureException("Failed to write YAML document", e);
        }
        return writer.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public TreeAdapter<Node> adapter() {
        return adapter;
    }

    // Yaml instances are not thread-safe
    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setProcessComments(true);
        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setProcessComments(true);
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions), dumperOptions, loaderOptions);
    }

    private static Reader reader(byte[] content) {
        return new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), stringKeysDeep(entry.getValue()));
        }
        return copy;
    }

    private static Object stringKeysDeep(Object value) {
        if (value instanceof Map<?, ?> map) {
            return stringKeys(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(stringKeysDeep(item));
            }
            return copy;
        }
        return value;
    }

    private static final class YamlTreeAdapter implements TreeAdapter<Node> {

        @Override
        public boolean isMapping(Node node) {
            return node instanceof MappingNode;
        }

        @Override
        public List<String> keys(Node mapping) {
            List<NodeTuple> tuples = ((MappingNode) mapping).getValue();
            List<String> keys = new ArrayList<>(tuples.size());
            for (NodeTuple tuple : tuples) {
                if (tuple.getKeyNode() instanceof ScalarNode key) {
                    keys.add(key.getValue());
                }
            }
            return keys;
        }

        @Override
        public Node get(Node mapping, String key) {
            NodeTuple tuple = tuple(mapping, key);
            return tuple != null ? tuple.getValueNode() : null;
        }

        @Override
        public void put(Node mapping, String key, Node value) {
            List<NodeTuple> tuples = ((MappingNode) mapping).getValue();
            int index = indexOf(tuples, key);
            if (index >= 0) {
                // NodeTuple is immutable: swap the tuple, keep the key node and its comments
                tuples.set(index, new NodeTuple(tuples.get(index).getKeyNode(), value));
            } else {
                Node keyNode = new ScalarNode(Tag.STR, key, null, null, DumperOptions.ScalarStyle.PLAIN);
                tuples.add(new NodeTuple(keyNode, value));
            }
        }

        @Override
        public String scalarText(Node node) {
            if (node instanceof ScalarNode scalar && !Tag.NULL.equals(scalar.getTag())) {
                return scalar.getValue();
            }
            return null;
        }

        @Override
        public boolean preservesComments() {
            return true;
        }

        @Override
        public void transplantComments(Node source, String sourceKey, Node target, String targetKey) {
            NodeTuple from = tuple(source, sourceKey);
            NodeTuple to = tuple(target, targetKey);
            if (from == null || to == null) {
                return;
            }
            copyComments(from.getKeyNode(), to.getKeyNode());
            copyComments(from.getValueNode(), to.getValueNode());
        }

        private static void copyComments(Node from, Node to) {
            if (from == to) {
                return;
            }
            if (hasAny(from.getBlockComments())) {
                to.setBlockComments(from.getBlockComments());
            }
            if (hasAny(from.getInLineComments())) {
                to.setInLineComments(from.getInLineComments());
            }
            if (hasAny(from.getEndComments())) {
                to.setEndComments(from.getEndComments());
            }
        }

        private static boolean hasAny(List<CommentLine> comments) {
            return comments != null && !comments.isEmpty();
        }

        private static NodeTuple tuple(Node mapping, String key) {
            List<NodeTuple> tuples = ((MappingNode) mapping).getValue();
            int index = indexOf(tuples, key);
            return index >= 0 ? tuples.get(index) : null;
        }

        private static int indexOf(List<NodeTuple> tuples, String key) {
            for (int i = 0; i < tuples.size(); i++) {
                if (tuples.get(i).getKeyNode() instanceof ScalarNode scalar && scalar.getValue().equals(key)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
