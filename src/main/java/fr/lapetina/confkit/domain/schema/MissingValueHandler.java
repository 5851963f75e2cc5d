package fr.lapetina.confkit.domain.schema;

/**
 * Called when a field is still empty after default injection.
 *
 * The handler may log, raise an alert, or recover by returning a substitute value. Returning
 * null leaves the field empty, and the required check then applies as usual.
 */
@FunctionalInterface
public interface MissingValueHandler {

    /**
     * @param field    dotted path of the field
     * @param rawValue value found in the document (null or blank)
     * @return substitute value, or null
     */
    Object handle(String field, Object rawValue) throws Exception;
}
