package fr.lapetina.confkit.exception;

/**
 * Base class for configuration errors that abort a load or reload.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
