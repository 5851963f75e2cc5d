package fr.lapetina.confkit.infrastructure.io;

/**
 * Source of bundled default documents.
 */
@FunctionalInterface
public interface ResourceReader {

    /**
     * Returns the full contents of the resource at {@code path}.
     *
     * @throws fr.lapetina.confkit.exception.StructureException if the resource does not exist or cannot be read
     */
    byte[] read(String path);
}
