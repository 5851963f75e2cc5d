package fr.lapetina.confkit.domain.resolve;

/**
 * Converts raw text (a {@code @Default} value or a scalar read from a document) into a value of
 * the requested type.
 */
@FunctionalInterface
public interface DefaultParser<T> {

    /**
     * @param raw  text to convert
     * @param type declared type of the target field
     * @throws Exception if the text cannot represent a value of {@code type}
     */
    T parse(String raw, Class<?> type) throws Exception;
}
