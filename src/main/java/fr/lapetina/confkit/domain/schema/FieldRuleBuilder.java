package fr.lapetina.confkit.domain.schema;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent settings for one field of a {@link ConfigSchema}.
 *
 * Starts from whatever the component's annotations declare; every call overrides that.
 *
 * @param <V> field type, used to type loaders and validators
 */
public final class FieldRuleBuilder<V> {

    private final String name;
    private final Class<?> type;
    private final Type genericType;

    private String key;
    private Requirement requirement = Requirement.OPTIONAL;
    private Long rangeMin;
    private Long rangeMax;
    private String defaultValue;
    private FieldLoader<?> loader;
    private final List<FieldValidator<?>> validators = new ArrayList<>();
    private MissingValueHandler missingHandler;
    private ConfigSchema<?> nested;

    FieldRuleBuilder(String name, Class<?> type, Type genericType) {
        this.name = name;
        this.type = type;
        this.genericType = genericType;
    }

    static FieldRuleBuilder<Object> from(FieldRule rule) {
        FieldRuleBuilder<Object> builder = new FieldRuleBuilder<>(rule.name(), rule.type(), rule.genericType());
        builder.key = rule.key();
        builder.requirement = rule.requirement();
        builder.rangeMin = rule.rangeMin();
        builder.rangeMax = rule.rangeMax();
        builder.defaultValue = rule.defaultValue();
        builder.loader = rule.loader();
        builder.validators.addAll(rule.validators());
        builder.missingHandler = rule.missingHandler();
        builder.nested = rule.nested();
        return builder;
    }

    /**
     * Reads the field from {@code key} instead of its name.
     */
    public FieldRuleBuilder<V> key(String key) {
        this.key = key;
        return this;
    }

    public FieldRuleBuilder<V> required() {
        this.requirement = Requirement.HARD;
        return this;
    }

    public FieldRuleBuilder<V> softRequired() {
        this.requirement = Requirement.SOFT;
        return this;
    }

    public FieldRuleBuilder<V> optional() {
        this.requirement = Requirement.OPTIONAL;
        return this;
    }

    /**
     * Declares an inclusive range.
     *
     * @throws IllegalArgumentException if {@code min > max}
     */
    public FieldRuleBuilder<V> range(long min, long max) {
        if (min > max) {
            throw new IllegalArgumentException("Range of '" + name + "' is empty: [" + min + ", " + max + "]");
        }
        this.rangeMin = min;
        this.rangeMax = max;
        return this;
    }

    public FieldRuleBuilder<V> defaultValue(String raw) {
        this.defaultValue = raw;
        return this;
    }

    public FieldRuleBuilder<V> noDefault() {
        this.defaultValue = null;
        return this;
    }

    public FieldRuleBuilder<V> loader(FieldLoader<? extends V> loader) {
        this.loader = loader;
        return this;
    }

    /**
     * Adds a validator. Validators run in registration order.
     */
    public FieldRuleBuilder<V> validator(FieldValidator<? super V> validator) {
        this.validators.add(validator);
        return this;
    }

    public FieldRuleBuilder<V> ifMissing(MissingValueHandler handler) {
        this.missingHandler = handler;
        return this;
    }

    /**
     * Uses {@code schema} for a record-typed field instead of the annotation-derived one.
     */
    public FieldRuleBuilder<V> nested(ConfigSchema<?> schema) {
        if (!schema.type().equals(type)) {
            throw new IllegalArgumentException(
                    "Schema for " + schema.type().getSimpleName() + " cannot describe field '" + name
                            + "' of type " + type.getSimpleName());
        }
        this.nested = schema;
        return this;
    }

    FieldRule build() {
        return new FieldRule(name, key, type, genericType, requirement, rangeMin, rangeMax,
                defaultValue, loader, validators, missingHandler, nested);
    }
}
