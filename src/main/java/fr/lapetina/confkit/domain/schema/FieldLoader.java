package fr.lapetina.confkit.domain.schema;

/**
 * Converts the raw document value of one field into the field's value.
 *
 * Useful when the document holds generic structures (strings, lists) that must become enums,
 * wrappers or other domain types. A thrown exception is reported as a warning and the field is
 * treated as missing.
 *
 * @param <V> field type
 */
@FunctionalInterface
public interface FieldLoader<V> {

    /**
     * @param raw non-blank value read from the document (String, Number, Boolean, List or Map)
     */
    V load(Object raw) throws Exception;
}
