package fr.lapetina.confkit.exception;

/**
 * Thrown when a hard-required field has no value after defaults were applied.
 */
public final class RequiredFieldMissingException extends ConfigurationException {

    private final String field;

    public RequiredFieldMissingException(String field) {
        super("Missing required config field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
