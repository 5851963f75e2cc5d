package fr.lapetina.confkit.infrastructure.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AtomicFilesTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("should create parent directories and write content")
    void shouldCreateParents() throws IOException {
        Path target = dir.resolve("nested/deeper/app.yml");

        AtomicFiles.write(target, "port: 1".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("port: 1");
    }

    @Test
    @DisplayName("should replace existing content without leaving temporary files")
    void shouldReplaceContent() throws IOException {
        Path target = dir.resolve("app.yml");
        Files.writeString(target, "old");

        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertThat(target).hasContent("new");
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    @DisplayName("should keep the permissions of the replaced file")
    void shouldKeepPermissions() throws IOException {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path target = dir.resolve("app.yml");
        Files.writeString(target, "old");
        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r--r--"));

        AtomicFiles.write(target, "new".getBytes(StandardCharsets.UTF_8));

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(target))).isEqualTo("rw-r--r--");
    }
}
