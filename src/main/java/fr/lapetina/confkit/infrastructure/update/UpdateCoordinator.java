package fr.lapetina.confkit.infrastructure.update;

import fr.lapetina.confkit.domain.merge.DocumentMerger;
import fr.lapetina.confkit.domain.merge.MergeResult;
import fr.lapetina.confkit.domain.model.Version;
import fr.lapetina.confkit.exception.StructureException;
import fr.lapetina.confkit.infrastructure.format.ConfigFormat;
import fr.lapetina.confkit.infrastructure.io.AtomicFiles;
import fr.lapetina.confkit.infrastructure.io.ResourceReader;
import fr.lapetina.confkit.infrastructure.metrics.LoaderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Brings a user's configuration file up to the version of the bundled default.
 *
 * When the file's version is older than the default's, the file is merged into the default
 * (user values win, new keys are added, the default's version is kept) and written back
 * atomically. A file that is already current is left untouched, so reconciling twice is a no-op.
 *
 * @param <N> tree node type of the format
 */
public final class UpdateCoordinator<N> {

    private static final Logger log = LoggerFactory.getLogger(UpdateCoordinator.class);

    private final ConfigFormat<N> format;
    private final ResourceReader resourceReader;
    private final LoaderMetrics metrics;

    public UpdateCoordinator(ConfigFormat<N> format, ResourceReader resourceReader, LoaderMetrics metrics) {
        this.format = Objects.requireNonNull(format, "format");
        this.resourceReader = Objects.requireNonNull(resourceReader, "resourceReader");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Creates a coordinator for a format whose node type is not statically known.
     */
    public static <N> UpdateCoordinator<N> of(ConfigFormat<N> format, ResourceReader resourceReader, LoaderMetrics metrics) {
        return new UpdateCoordinator<>(format, resourceReader, metrics);
    }

    /**
     * Reconciles {@code targetFile} against the bundled resource at {@code resourcePath}.
     *
     * @return true if the file was rewritten, false if it was already up to date
     * @throws StructureException if either document is missing, unreadable, or not a mapping
     */
    public boolean reconcile(String resourcePath, Path targetFile) {
        log.info("Checking if config update is needed: {}", targetFile);
        try {
            N defaults = format.readTree(resourceReader.read(resourcePath));
            N current = format.readTree(readFile(targetFile));

            Version defaultVersion = DocumentMerger.versionOf(format.adapter(), defaults);
            Version currentVersion = DocumentMerger.versionOf(format.adapter(), current);

            if (!currentVersion.isOlderThan(defaultVersion)) {
                log.info("Config is up to date (version {} >= {})", currentVersion, defaultVersion);
                metrics.recordUpdate(LoaderMetrics.UpdateResult.UP_TO_DATE);
                return false;
            }

            log.info("Updating config {} from version {} to {}", targetFile, currentVersion, defaultVersion);
            MergeResult<N> result = DocumentMerger.merge(format.adapter(), defaults, current);
            byte[] merged = format.write(result.document());
            writeFile(targetFile, merged);

            log.info("Config {} updated to version {}", targetFile, result.defaultVersion());
            metrics.recordUpdate(LoaderMetrics.UpdateResult.UPDATED);
            return true;
        } catch (RuntimeException e) {
            metrics.recordUpdate(LoaderMetrics.UpdateResult.FAILED);
            throw e;
        }
    }

    private static byte[] readFile(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StructureException("Failed to read config file: " + file, e);
        }
    }

    private static void writeFile(Path file, byte[] content) {
        try {
            AtomicFiles.write(file, content);
        } catch (IOException e) {
            throw new StructureException("Failed to write config file: " + file, e);
        }
    }
}
