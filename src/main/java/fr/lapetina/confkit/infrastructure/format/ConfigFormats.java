package fr.lapetina.confkit.infrastructure.format;

import fr.lapetina.confkit.exception.StructureException;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Format lookup by file extension.
 */
public final class ConfigFormats {

    private static final List<ConfigFormat<?>> KNOWN = List.of(new YamlFormat(), new JsonFormat());

    private ConfigFormats() {
        // Utility class
    }

    /**
     * Picks the format whose extensions include the extension of {@code path}.
     *
     * @throws StructureException if no known format handles the extension
     */
    public static ConfigFormat<?> forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString() : "";
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";

        for (ConfigFormat<?> format : KNOWN) {
            if (format.extensions().contains(extension)) {
                return format;
            }
        }
        throw new StructureException("No config format for extension '" + extension + "' of " + path);
    }
}
