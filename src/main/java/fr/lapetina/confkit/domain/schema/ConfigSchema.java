package fr.lapetina.confkit.domain.schema;

import fr.lapetina.confkit.domain.model.Primitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Field rules of a configuration record, in component order.
 *
 * Schemas are resolved once per type: annotation scanning happens when the schema is built, never
 * while loading. Instances are immutable and can be shared between loaders.
 *
 * <p>Usage:
 * <pre>{@code
 * record ServerConfig(@Default("8080") @Range(min = 1, max = 65535) int port,
 *                     @Required(soft = true) String apiKey) {}
 *
 * ConfigSchema<ServerConfig> schema = ConfigSchema.of(ServerConfig.class);
 *
 * ConfigSchema<ServerConfig> custom = ConfigSchema.builder(ServerConfig.class)
 *         .field("apiKey", String.class, f -> f.key("API_KEY")
 *                 .validator((key, cfg) -> { if (key.length() < 8) throw new IllegalArgumentException("too short"); }))
 *         .build();
 * }</pre>
 *
 * @param <T> record type
 */
public final class ConfigSchema<T> {

    private static final Logger log = LoggerFactory.getLogger(ConfigSchema.class);

    private static final Map<Class<?>, ConfigSchema<?>> CACHE = new ConcurrentHashMap<>();

    private final Class<T> type;
    private final List<FieldRule> rules;
    private final Constructor<T> constructor;

    private ConfigSchema(Class<T> type, List<FieldRule> rules) {
        this.type = type;
        this.rules = List.copyOf(rules);
        this.constructor = canonicalConstructor(type);
    }

    /**
     * Returns the annotation-derived schema of {@code type}, scanning it on first use.
     *
     * @throws IllegalArgumentException if {@code type} is not a record, or contains itself
     */
    public static <T> ConfigSchema<T> of(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return of(type, new LinkedHashSet<>());
    }

    @SuppressWarnings("unchecked")
    private static <T> ConfigSchema<T> of(Class<T> type, Set<Class<?>> scanning) {
        ConfigSchema<?> cached = CACHE.get(type);
        if (cached == null) {
            if (!scanning.add(type)) {
                throw new IllegalArgumentException("Config type " + type.getName()
                        + " contains itself: " + describe(scanning) + " -> " + type.getSimpleName());
            }
            // Not computeIfAbsent: scanning recurses into nested record types
            ConfigSchema<T> scanned = new ConfigSchema<>(type, scan(type, scanning));
            scanning.remove(type);
            cached = CACHE.putIfAbsent(type, scanned);
            if (cached == null) {
                log.debug("Scanned config schema for {}: {} fields", type.getSimpleName(), scanned.rules.size());
                return scanned;
            }
        }
        return (ConfigSchema<T>) cached;
    }

    /**
     * Starts a builder pre-populated with the annotation-derived rules of {@code type}.
     */
    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<T> type() {
        return type;
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * Returns the rule of the component named {@code name}, or null.
     */
    public FieldRule rule(String name) {
        for (FieldRule rule : rules) {
            if (rule.name().equals(name)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Invokes the canonical constructor with values in component order.
     *
     * @throws InvocationTargetException if the record constructor itself throws
     */
    public T instantiate(Object[] values) throws ReflectiveOperationException {
        if (values.length != rules.size()) {
            throw new IllegalArgumentException(
                    "Expected " + rules.size() + " values for " + type.getSimpleName() + ", got " + values.length);
        }
        return constructor.newInstance(values);
    }

    private static List<FieldRule> scan(Class<?> type, Set<Class<?>> scanning) {
        requireRecord(type);
        List<FieldRule> rules = new ArrayList<>();
        for (RecordComponent component : type.getRecordComponents()) {
            rules.add(scanComponent(component, scanning));
        }
        return rules;
    }

    private static String describe(Set<Class<?>> scanning) {
        StringJoiner path = new StringJoiner(" -> ");
        for (Class<?> type : scanning) {
            path.add(type.getSimpleName());
        }
        return path.toString();
    }

    private static FieldRule scanComponent(RecordComponent component, Set<Class<?>> scanning) {
        FieldRuleBuilder<Object> builder = new FieldRuleBuilder<>(
                component.getName(), component.getType(), component.getGenericType());

        Key key = component.getAnnotation(Key.class);
        if (key != null) {
            builder.key(key.value());
        }
        Required required = component.getAnnotation(Required.class);
        if (required != null) {
            if (required.soft()) {
                builder.softRequired();
            } else {
                builder.required();
            }
        }
        Default def = component.getAnnotation(Default.class);
        if (def != null) {
            builder.defaultValue(def.value());
        }
        Range range = component.getAnnotation(Range.class);
        if (range != null) {
            builder.range(range.min(), range.max());
        }
        if (component.getType().isRecord()) {
            builder.nested(of(component.getType(), scanning));
        }
        return builder.build();
    }

    private static void requireRecord(Class<?> type) {
        if (!type.isRecord()) {
            throw new IllegalArgumentException(
                    "Config type " + type.getName() + " must be a record (canonical constructor required)");
        }
    }

    private static <T> Constructor<T> canonicalConstructor(Class<T> type) {
        requireRecord(type);
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor on " + type.getName(), e);
        }
    }

    /**
     * Builder for schemas that need typed loaders, validators or rules differing from annotations.
     */
    public static final class Builder<T> {

        private final Class<T> type;
        private final Map<String, FieldRuleBuilder<?>> fields = new LinkedHashMap<>();

        private Builder(Class<T> type) {
            Objects.requireNonNull(type, "type");
            this.type = type;
            for (FieldRule rule : of(type).rules()) {
                fields.put(rule.name(), FieldRuleBuilder.from(rule));
            }
        }

        /**
         * Configures the component named {@code name}.
         */
        @SuppressWarnings("unchecked")
        public Builder<T> field(String name, Consumer<FieldRuleBuilder<Object>> configurer) {
            configurer.accept((FieldRuleBuilder<Object>) fieldBuilder(name));
            return this;
        }

        /**
         * Configures the component named {@code name}, typing loaders and validators as {@code V}.
         *
         * @throws IllegalArgumentException if the component is not assignable to {@code valueType}
         */
        @SuppressWarnings("unchecked")
        public <V> Builder<T> field(String name, Class<V> valueType, Consumer<FieldRuleBuilder<V>> configurer) {
            FieldRuleBuilder<?> builder = fieldBuilder(name);
            Class<?> componentType = Primitives.boxed(of(type).rule(name).type());
            if (!valueType.isAssignableFrom(componentType)) {
                throw new IllegalArgumentException("Field '" + name + "' of " + type.getSimpleName()
                        + " is " + componentType.getSimpleName() + ", not " + valueType.getSimpleName());
            }
            configurer.accept((FieldRuleBuilder<V>) builder);
            return this;
        }

        private FieldRuleBuilder<?> fieldBuilder(String name) {
            FieldRuleBuilder<?> builder = fields.get(name);
            if (builder == null) {
                throw new IllegalArgumentException(
                        "Unknown field '" + name + "' on " + type.getSimpleName() + ", known: " + fields.keySet());
            }
            return builder;
        }

        public ConfigSchema<T> build() {
            List<FieldRule> rules = new ArrayList<>(fields.size());
            for (FieldRuleBuilder<?> builder : fields.values()) {
                rules.add(builder.build());
            }
            return new ConfigSchema<>(type, rules);
        }
    }
}
