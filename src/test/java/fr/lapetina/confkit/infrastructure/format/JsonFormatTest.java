package fr.lapetina.confkit.infrastructure.format;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.confkit.domain.merge.DocumentMerger;
import fr.lapetina.confkit.domain.merge.MergeResult;
import fr.lapetina.confkit.domain.model.Version;
import fr.lapetina.confkit.exception.StructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFormatTest {

    private final JsonFormat format = new JsonFormat();

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should read objects into nested maps and lists")
    void shouldReadBag() {
        Map<String, Object> bag = format.readBag(bytes("""
                {"version": "1.0.0", "server": {"port": 8080}, "tags": ["a", "b"], "ratio": 0.5}
                """));

        assertThat(bag).containsEntry("version", "1.0.0").containsEntry("ratio", 0.5);
        assertThat(bag.get("server")).isEqualTo(Map.of("port", 8080));
        assertThat(bag.get("tags")).isEqualTo(List.of("a", "b"));
    }

    @Test
    @DisplayName("should reject empty, malformed and non-object documents")
    void shouldRejectInvalidDocuments() {
        assertThatThrownBy(() -> format.readTree(bytes("")))
                .isInstanceOf(StructureException.class)
                .hasMessageContaining("Empty");
        assertThatThrownBy(() -> format.readTree(bytes("{\"a\": ")))
                .isInstanceOf(StructureException.class)
                .hasMessageContaining("Invalid JSON");
        assertThatThrownBy(() -> format.readBag(bytes("[1, 2]")))
                .isInstanceOf(StructureException.class)
                .hasMessageContaining("must be an object");
    }

    @Test
    @DisplayName("should merge user values into the default tree")
    void shouldMergeTrees() {
        JsonNode defaults = format.readTree(bytes("""
                {"version": "1.2.0", "server": {"port": 8080, "host": "localhost"}, "timeout": 30}
                """));
        JsonNode current = format.readTree(bytes("""
                {"version": "1.0.0", "server": {"port": 9090}, "custom": true}
                """));

        MergeResult<JsonNode> result = DocumentMerger.merge(format.adapter(), defaults, current);
        Map<String, Object> merged = format.readBag(format.write(result.document()));

        assertThat(result.currentVersion()).isEqualTo(Version.parse("1.0.0"));
        assertThat(merged).containsEntry("version", "1.2.0")
                .containsEntry("timeout", 30)
                .containsEntry("custom", true);
        assertThat(merged.get("server")).isEqualTo(Map.of("port", 9090, "host", "localhost"));
        assertThat(merged.keySet()).containsExactly("version", "server", "timeout", "custom");
    }

    @Test
    @DisplayName("should pretty print output")
    void shouldPrettyPrint() {
        String written = new String(format.write(format.readTree(bytes("{\"a\":{\"b\":1}}"))), StandardCharsets.UTF_8);

        assertThat(written).contains("\n").contains("\"b\" : 1");
    }

    @Test
    @DisplayName("should be selected for json files")
    void shouldBeSelectedByExtension() {
        assertThat(ConfigFormats.forPath(Path.of("settings.json"))).isInstanceOf(JsonFormat.class);
        assertThatThrownBy(() -> ConfigFormats.forPath(Path.of("settings")))
                .isInstanceOf(StructureException.class);
    }
}
