package fr.lapetina.confkit.exception;

/**
 * Thrown when a field validator, or the record constructor itself, rejects the resolved values.
 */
public final class CustomValidationException extends ConfigurationException {

    private final String field;

    public CustomValidationException(String field, Throwable cause) {
        super("Validation failed for '" + field + "': " + cause.getMessage(), cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
