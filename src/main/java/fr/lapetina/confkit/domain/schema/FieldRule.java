package fr.lapetina.confkit.domain.schema;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/**
 * Resolution contract for one record component. Immutable; built once per schema.
 *
 * @param name          component name
 * @param key           document key to read instead of {@code name}, or null
 * @param type          declared component class
 * @param genericType   declared component type, including type arguments
 * @param requirement   presence requirement
 * @param rangeMin      inclusive lower bound, or null when no range is declared
 * @param rangeMax      inclusive upper bound, or null when no range is declared
 * @param defaultValue  raw default text, or null when there is no default
 * @param loader        custom raw-value loader, or null
 * @param validators    validators run against the constructed object
 * @param missingHandler handler for values still missing after defaults, or null
 * @param nested        schema for record-typed components, or null
 */
public record FieldRule(
        String name,
        String key,
        Class<?> type,
        Type genericType,
        Requirement requirement,
        Long rangeMin,
        Long rangeMax,
        String defaultValue,
        FieldLoader<?> loader,
        List<FieldValidator<?>> validators,
        MissingValueHandler missingHandler,
        ConfigSchema<?> nested
) {
    public FieldRule {
        Objects.requireNonNull(name, "Field name is required");
        Objects.requireNonNull(type, "Field type is required");
        if (genericType == null) {
            genericType = type;
        }
        if (requirement == null) {
            requirement = Requirement.OPTIONAL;
        }
        if ((rangeMin == null) != (rangeMax == null)) {
            throw new IllegalArgumentException("Range of '" + name + "' needs both bounds");
        }
        if (rangeMin != null && rangeMin > rangeMax) {
            throw new IllegalArgumentException(
                    "Range of '" + name + "' is empty: [" + rangeMin + ", " + rangeMax + "]");
        }
        validators = validators != null ? List.copyOf(validators) : List.of();
    }

    /**
     * Key looked up in the document: the alias when set, otherwise the component name.
     */
    public String lookupKey() {
        return key != null && !key.isBlank() ? key : name;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasRange() {
        return rangeMin != null;
    }

    public boolean isHardRequired() {
        return requirement == Requirement.HARD;
    }

    public boolean isSoftRequired() {
        return requirement == Requirement.SOFT;
    }
}
