package fr.lapetina.confkit.domain.resolve;

/**
 * A recoverable problem met while resolving a field. The field is treated as missing and
 * resolution continues.
 *
 * @param kind    what went wrong
 * @param field   dotted path of the field
 * @param message human-readable detail
 * @param cause   underlying exception, or null
 */
public record SoftWarning(Kind kind, String field, String message, Throwable cause) {

    public enum Kind {
        SOFT_REQUIRED_MISSING,
        NO_DEFAULT_PARSER,
        DEFAULT_PARSE_FAILED,
        LOADER_FAILED,
        CONVERSION_FAILED,
        MISSING_HANDLER_FAILED
    }

    public SoftWarning(Kind kind, String field, String message) {
        this(kind, field, message, null);
    }
}
