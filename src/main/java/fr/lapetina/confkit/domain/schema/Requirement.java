package fr.lapetina.confkit.domain.schema;

/**
 * How strictly a field must be present.
 */
public enum Requirement {
    OPTIONAL,
    /** Absence is reported as a warning. */
    SOFT,
    /** Absence fails the load. */
    HARD
}
