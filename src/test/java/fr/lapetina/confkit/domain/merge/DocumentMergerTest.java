package fr.lapetina.confkit.domain.merge;

import fr.lapetina.confkit.domain.model.Version;
import fr.lapetina.confkit.exception.StructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentMergerTest {

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("mergeMaps")
    class MergeMaps {

        @Test
        @DisplayName("should keep user values for every key except version")
        void shouldKeepUserValues() {
            Map<String, Object> defaults = map("version", "1.2.0", "port", 8080, "host", "localhost");
            Map<String, Object> current = map("version", "1.0.0", "port", 9090, "host", "example.org");

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged)
                    .containsEntry("version", "1.2.0")
                    .containsEntry("port", 9090)
                    .containsEntry("host", "example.org");
        }

        @Test
        @DisplayName("should add keys that only the default has")
        void shouldAddNewKeys() {
            Map<String, Object> defaults = map("version", "1.2.0", "port", 8080, "timeout", 30);
            Map<String, Object> current = map("version", "1.0.0", "port", 9090);

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged).containsEntry("timeout", 30).containsEntry("port", 9090);
            assertThat(merged.keySet()).containsExactly("version", "port", "timeout");
        }

        @Test
        @DisplayName("should merge nested mappings recursively")
        void shouldMergeRecursively() {
            Map<String, Object> defaults = map("db", map("host", "localhost", "pool", 10));
            Map<String, Object> current = map("db", map("host", "db.internal"));

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged.get("db")).isEqualTo(map("host", "db.internal", "pool", 10));
        }

        @Test
        @DisplayName("should append keys only the user has")
        void shouldAppendUserKeys() {
            Map<String, Object> defaults = map("port", 8080);
            Map<String, Object> current = map("port", 9090, "custom", List.of("a", "b"));

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged.keySet()).containsExactly("port", "custom");
            assertThat(merged.get("custom")).isEqualTo(List.of("a", "b"));
        }

        @Test
        @DisplayName("should let a user scalar replace a default mapping")
        void shouldReplaceMappingWithScalar() {
            Map<String, Object> defaults = map("db", map("host", "localhost"));
            Map<String, Object> current = map("db", "disabled");

            assertThat(DocumentMerger.mergeMaps(defaults, current)).containsEntry("db", "disabled");
        }

        @Test
        @DisplayName("should match keys with relaxed spelling and keep the default spelling")
        void shouldMatchRelaxedKeys() {
            Map<String, Object> defaults = map("apiKey", "", "max-connections", 4);
            Map<String, Object> current = map("API_KEY", "secret", "max_connections", 16);

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged).containsOnlyKeys("apiKey", "max-connections");
            assertThat(merged).containsEntry("apiKey", "secret").containsEntry("max-connections", 16);
        }

        @Test
        @DisplayName("should treat nested version keys as ordinary keys")
        void shouldOnlyReserveRootVersion() {
            Map<String, Object> defaults = map("version", "2.0", "plugin", map("version", "5"));
            Map<String, Object> current = map("version", "1.0", "plugin", map("version", "3"));

            Map<String, Object> merged = DocumentMerger.mergeMaps(defaults, current);

            assertThat(merged).containsEntry("version", "2.0");
            assertThat(merged.get("plugin")).isEqualTo(map("version", "3"));
        }

        @Test
        @DisplayName("should not modify its arguments")
        void shouldNotModifyArguments() {
            Map<String, Object> defaults = map("db", map("host", "localhost"));
            Map<String, Object> current = map("db", map("host", "remote"), "extra", true);

            DocumentMerger.mergeMaps(defaults, current);

            assertThat(defaults).isEqualTo(map("db", map("host", "localhost")));
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("should report both versions")
        void shouldReportVersions() {
            Object defaults = map("version", "1.2.0", "a", 1);
            Object current = map("Version", "1.0", "a", 2);

            MergeResult<Object> result = DocumentMerger.merge(MapTreeAdapter.INSTANCE, defaults, current);

            assertThat(result.currentVersion()).isEqualTo(Version.parse("1.0.0"));
            assertThat(result.defaultVersion()).isEqualTo(Version.parse("1.2.0"));
            assertThat(result.changed()).isTrue();
            assertThat(result.document()).isSameAs(defaults);
        }

        @Test
        @DisplayName("should assume 1.0.0 when a document has no version")
        void shouldDefaultVersion() {
            assertThat(DocumentMerger.versionOf(MapTreeAdapter.INSTANCE, map("a", 1))).isEqualTo(Version.DEFAULT);
        }

        @Test
        @DisplayName("should reject roots that are not mappings")
        void shouldRejectNonMappingRoot() {
            assertThatThrownBy(() -> DocumentMerger.merge(MapTreeAdapter.INSTANCE, List.of(), map()))
                    .isInstanceOf(StructureException.class)
                    .hasMessageContaining("default");
            assertThatThrownBy(() -> DocumentMerger.merge(MapTreeAdapter.INSTANCE, map(), "text"))
                    .isInstanceOf(StructureException.class)
                    .hasMessageContaining("current");
        }
    }

    @Nested
    @DisplayName("Keys")
    class KeyPolicy {

        @Test
        @DisplayName("should ignore case, underscores and dashes")
        void shouldNormalize() {
            assertThat(Keys.matches("API_KEY", "apiKey")).isTrue();
            assertThat(Keys.matches("api-key", "ApiKey")).isTrue();
            assertThat(Keys.matches("api.key", "apiKey")).isFalse();
            assertThat(Keys.isVersionKey("VERSION")).isTrue();
        }
    }
}
