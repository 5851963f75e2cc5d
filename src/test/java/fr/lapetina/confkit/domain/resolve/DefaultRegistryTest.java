package fr.lapetina.confkit.domain.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultRegistryTest {

    enum Mode { FAST, SAFE_MODE }

    private final DefaultRegistry registry = DefaultRegistry.standard();

    @Test
    @DisplayName("should parse primitives and their wrappers")
    void shouldParsePrimitives() throws Exception {
        assertThat(registry.parse(int.class, "8080")).isEqualTo(8080);
        assertThat(registry.parse(Integer.class, " 42 ")).isEqualTo(42);
        assertThat(registry.parse(long.class, "9000000000")).isEqualTo(9_000_000_000L);
        assertThat(registry.parse(double.class, "0.5")).isEqualTo(0.5);
        assertThat(registry.parse(char.class, "x")).isEqualTo('x');
        assertThat(registry.parse(String.class, " kept ")).isEqualTo(" kept ");
    }

    @Test
    @DisplayName("should parse booleans strictly")
    void shouldParseBooleans() throws Exception {
        assertThat(registry.parse(boolean.class, "yes")).isEqualTo(true);
        assertThat(registry.parse(Boolean.class, "OFF")).isEqualTo(false);
        assertThatThrownBy(() -> registry.parse(boolean.class, "maybe"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should parse JDK value types")
    void shouldParseValueTypes() throws Exception {
        assertThat(registry.parse(BigDecimal.class, "1.50")).isEqualTo(new BigDecimal("1.50"));
        assertThat(registry.parse(Duration.class, "PT30S")).isEqualTo(Duration.ofSeconds(30));
        assertThat(registry.parse(Path.class, "logs/app.log")).isEqualTo(Path.of("logs/app.log"));
    }

    @Test
    @DisplayName("should parse any enum case-insensitively")
    void shouldParseEnums() throws Exception {
        assertThat(registry.parse(Mode.class, "fast")).isEqualTo(Mode.FAST);
        assertThat(registry.parse(Mode.class, "safe-mode")).isEqualTo(Mode.SAFE_MODE);
        assertThat(registry.supports(Mode.class)).isTrue();
    }

    @Test
    @DisplayName("should report unsupported types")
    void shouldReportUnsupportedTypes() {
        assertThat(registry.lookup(UUID.class)).isEmpty();
        assertThatThrownBy(() -> registry.parse(UUID.class, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No default parser");
    }

    @Test
    @DisplayName("should accept custom parsers")
    void shouldAcceptCustomParsers() throws Exception {
        DefaultRegistry custom = DefaultRegistry.empty()
                .register(UUID.class, (raw, type) -> UUID.fromString(raw));

        assertThat(custom.parse(UUID.class, "123e4567-e89b-12d3-a456-426614174000"))
                .isEqualTo(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));
        assertThat(custom.supports(int.class)).isFalse();
    }

    @Test
    @DisplayName("should keep registries independent")
    void shouldKeepRegistriesIndependent() {
        DefaultRegistry.standard().register(UUID.class, (raw, type) -> UUID.randomUUID());

        assertThat(registry.supports(UUID.class)).isFalse();
    }
}
