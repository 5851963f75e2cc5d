package fr.lapetina.confkit.exception;

/**
 * Thrown when a document cannot be used at all.
 *
 * This occurs when:
 * - The bundled resource is missing
 * - The file cannot be read or parsed
 * - The document is empty or its root is not a mapping
 */
public final class StructureException extends ConfigurationException {

    public StructureException(String message) {
        super(message);
    }

    public StructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
