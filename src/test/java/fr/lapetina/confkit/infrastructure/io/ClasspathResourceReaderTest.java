package fr.lapetina.confkit.infrastructure.io;

import fr.lapetina.confkit.exception.StructureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClasspathResourceReaderTest {

    private final ClasspathResourceReader reader = new ClasspathResourceReader();

    @Test
    @DisplayName("should read resources with or without a leading slash")
    void shouldReadResources() {
        assertThat(new String(reader.read("/defaults/app.yml"), StandardCharsets.UTF_8)).contains("version");
        assertThat(reader.read("defaults/app.yml")).isEqualTo(reader.read("/defaults/app.yml"));
    }

    @Test
    @DisplayName("should fail on missing resources")
    void shouldFailOnMissingResources() {
        assertThatThrownBy(() -> reader.read("/defaults/missing.yml"))
                .isInstanceOf(StructureException.class)
                .hasMessageContaining("defaults/missing.yml");
    }
}
