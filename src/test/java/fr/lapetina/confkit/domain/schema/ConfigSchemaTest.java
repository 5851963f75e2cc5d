package fr.lapetina.confkit.domain.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigSchemaTest {

    record Database(@Default("localhost") String host, @Default("5432") int port) {}

    record ServerConfig(
            @Default("8080") @Range(min = 1, max = 65535) int port,
            @Key("API_KEY") @Required(soft = true) String apiKey,
            @Required String name,
            Database database,
            List<String> tags
    ) {}

    static final class NotARecord {
    }

    record Chain(String name, Chain next) {}

    record Left(String id, Right right) {}

    record Right(String id, Left left) {}

    record Inverted(@Range(min = 10, max = 1) int size) {}

    @Nested
    @DisplayName("annotation scanning")
    class Scanning {

        @Test
        @DisplayName("should produce one rule per component in declaration order")
        void shouldKeepComponentOrder() {
            ConfigSchema<ServerConfig> schema = ConfigSchema.of(ServerConfig.class);

            assertThat(schema.rules())
                    .extracting(FieldRule::name)
                    .containsExactly("port", "apiKey", "name", "database", "tags");
        }

        @Test
        @DisplayName("should read defaults, ranges, aliases and requirements")
        void shouldReadAnnotations() {
            ConfigSchema<ServerConfig> schema = ConfigSchema.of(ServerConfig.class);

            FieldRule port = schema.rule("port");
            assertThat(port.defaultValue()).isEqualTo("8080");
            assertThat(port.rangeMin()).isEqualTo(1L);
            assertThat(port.rangeMax()).isEqualTo(65535L);
            assertThat(port.requirement()).isEqualTo(Requirement.OPTIONAL);

            FieldRule apiKey = schema.rule("apiKey");
            assertThat(apiKey.lookupKey()).isEqualTo("API_KEY");
            assertThat(apiKey.isSoftRequired()).isTrue();

            assertThat(schema.rule("name").isHardRequired()).isTrue();
            assertThat(schema.rule("tags").hasDefault()).isFalse();
        }

        @Test
        @DisplayName("should attach nested schemas to record components")
        void shouldAttachNestedSchema() {
            FieldRule database = ConfigSchema.of(ServerConfig.class).rule("database");

            assertThat(database.nested()).isSameAs(ConfigSchema.of(Database.class));
            assertThat(database.nested().rule("port").defaultValue()).isEqualTo("5432");
        }

        @Test
        @DisplayName("should cache schemas per type")
        void shouldCacheSchemas() {
            assertThat(ConfigSchema.of(ServerConfig.class)).isSameAs(ConfigSchema.of(ServerConfig.class));
        }

        @Test
        @DisplayName("should reject non-record types")
        void shouldRejectNonRecords() {
            assertThatThrownBy(() -> ConfigSchema.of(NotARecord.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be a record");
        }

        @Test
        @DisplayName("should reject records that contain themselves")
        void shouldRejectSelfContainingRecords() {
            assertThatThrownBy(() -> ConfigSchema.of(Chain.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("contains itself")
                    .hasMessageContaining("Chain -> Chain");
            assertThatThrownBy(() -> ConfigSchema.of(Left.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Left -> Right -> Left");
        }

        @Test
        @DisplayName("should reject an annotated range with min above max")
        void shouldRejectInvertedAnnotatedRange() {
            assertThatThrownBy(() -> ConfigSchema.of(Inverted.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Range of 'size' is empty");
        }
    }

    @Nested
    @DisplayName("builder")
    class Building {

        @Test
        @DisplayName("should override annotation rules without touching the cached schema")
        void shouldOverrideRules() {
            ConfigSchema<ServerConfig> custom = ConfigSchema.builder(ServerConfig.class)
                    .field("port", Integer.class, f -> f.defaultValue("9000").range(1024, 2048))
                    .field("name", f -> f.optional())
                    .build();

            assertThat(custom.rule("port").defaultValue()).isEqualTo("9000");
            assertThat(custom.rule("port").rangeMin()).isEqualTo(1024L);
            assertThat(custom.rule("name").isHardRequired()).isFalse();
            assertThat(ConfigSchema.of(ServerConfig.class).rule("port").defaultValue()).isEqualTo("8080");
        }

        @Test
        @DisplayName("should attach typed functions")
        void shouldAttachFunctions() {
            FieldValidator<String> notBlank = (value, config) -> {
                if (value.isBlank()) {
                    throw new IllegalArgumentException("blank");
                }
            };

            ConfigSchema<ServerConfig> custom = ConfigSchema.builder(ServerConfig.class)
                    .field("apiKey", String.class, f -> f.validator(notBlank).loader(raw -> raw.toString().trim()))
                    .field("name", f -> f.ifMissing((field, raw) -> "unnamed"))
                    .build();

            assertThat(custom.rule("apiKey").validators()).containsExactly(notBlank);
            assertThat(custom.rule("apiKey").loader()).isNotNull();
            assertThat(custom.rule("name").missingHandler()).isNotNull();
        }

        @Test
        @DisplayName("should reject unknown fields and mismatched types")
        void shouldRejectInvalidFields() {
            assertThatThrownBy(() -> ConfigSchema.builder(ServerConfig.class).field("missing", f -> f.required()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown field 'missing'");
            assertThatThrownBy(() -> ConfigSchema.builder(ServerConfig.class).field("port", String.class, f -> f.required()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("is Integer");
        }

        @Test
        @DisplayName("should reject an empty range")
        void shouldRejectEmptyRange() {
            ConfigSchema.Builder<ServerConfig> builder = ConfigSchema.builder(ServerConfig.class);

            assertThatThrownBy(() -> builder.field("port", f -> f.range(10, 1)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Range of 'port' is empty: [10, 1]");
        }
    }
}
