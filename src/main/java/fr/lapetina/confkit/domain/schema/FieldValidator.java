package fr.lapetina.confkit.domain.schema;

/**
 * Domain-specific check on a resolved field.
 *
 * Runs after the configuration object has been constructed, so cross-field rules can read the
 * other components from {@code config}. Any exception rejects the whole object.
 *
 * @param <V> field type
 */
@FunctionalInterface
public interface FieldValidator<V> {

    void validate(V value, Object config) throws Exception;
}
