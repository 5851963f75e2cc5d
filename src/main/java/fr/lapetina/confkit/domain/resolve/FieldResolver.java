package fr.lapetina.confkit.domain.resolve;

import fr.lapetina.confkit.domain.merge.Keys;
import fr.lapetina.confkit.domain.model.Primitives;
import fr.lapetina.confkit.domain.schema.ConfigSchema;
import fr.lapetina.confkit.domain.schema.FieldRule;
import fr.lapetina.confkit.domain.schema.FieldValidator;
import fr.lapetina.confkit.domain.schema.MissingValueHandler;
import fr.lapetina.confkit.exception.ConfigurationException;
import fr.lapetina.confkit.exception.CustomValidationException;
import fr.lapetina.confkit.exception.RangeViolationException;
import fr.lapetina.confkit.exception.RequiredFieldMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a configuration record from a loosely typed key/value document.
 *
 * Each field goes through, in order:
 * 1. lookup by alias or name (relaxed key matching, see {@link Keys})
 * 2. custom loader, or conversion to the declared type
 * 3. default injection when the value is missing or blank
 * 4. missing-value handler
 * 5. required check (hard fails, soft warns)
 * 6. range check
 * The record is then constructed through its canonical constructor and the field validators run
 * against it. Hard failures throw and no object is returned; soft problems are collected as
 * {@link SoftWarning}s, logged, and leave the field missing.
 *
 * Stateless apart from the registry; safe to share between threads.
 */
public final class FieldResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);

    private final DefaultRegistry registry;

    public FieldResolver(DefaultRegistry registry) {
        this.registry = registry;
    }

    public FieldResolver() {
        this(DefaultRegistry.standard());
    }

    public DefaultRegistry getRegistry() {
        return registry;
    }

    /**
     * Resolves {@code document} against {@code schema}.
     *
     * @throws RequiredFieldMissingException if a hard-required field stays empty
     * @throws RangeViolationException       if a numeric field is out of its declared range
     * @throws CustomValidationException     if a validator or the record constructor rejects the values
     */
    public <T> Resolution<T> resolve(ConfigSchema<T> schema, Map<String, ?> document) {
        List<SoftWarning> warnings = new ArrayList<>();
        T value = resolveObject(schema, document != null ? document : Map.of(), "", warnings);
        log.debug("Resolved {} with {} warning(s)", schema.type().getSimpleName(), warnings.size());
        return new Resolution<>(value, warnings);
    }

    private <T> T resolveObject(ConfigSchema<T> schema, Map<?, ?> document, String path, List<SoftWarning> warnings) {
        Map<String, Object> index = index(document);
        List<FieldRule> rules = schema.rules();
        Object[] values = new Object[rules.size()];

        for (int i = 0; i < rules.size(); i++) {
            FieldRule rule = rules.get(i);
            values[i] = resolveField(rule, index, pathOf(path, rule.name()), warnings);
        }

        T instance = construct(schema, values, path);

        for (int i = 0; i < rules.size(); i++) {
            runValidators(rules.get(i), values[i], instance, pathOf(path, rules.get(i).name()));
        }
        return instance;
    }

    private Object resolveField(FieldRule rule, Map<String, Object> index, String field, List<SoftWarning> warnings) {
        // 1. Lookup
        String normalizedKey = Keys.normalize(rule.lookupKey());
        boolean present = index.containsKey(normalizedKey);
        Object raw = present ? index.get(normalizedKey) : null;
        boolean blank = present && isBlank(raw);

        // 2. Loader or conversion
        Object value = null;
        if (present && !blank) {
            value = load(rule, raw, field, warnings);
        } else if (blank && raw != null && rule.type() == String.class) {
            value = raw;
        }

        // 3. Default injection
        if (isBlank(value) && rule.hasDefault()) {
            Object injected = parseDefault(rule, field, warnings);
            if (injected != null) {
                value = injected;
                log.debug("Field '{}' was missing or blank, using default: {}", field, rule.defaultValue());
            }
        }

        // Absent section: resolve the nested record from an empty mapping so its own defaults apply
        if (value == null && rule.nested() != null && !rule.hasDefault()) {
            value = resolveObject(rule.nested(), Map.of(), field, warnings);
        }

        // 4. Missing-value handler
        if (isBlank(value) && rule.missingHandler() != null) {
            Object substitute = handleMissing(rule.missingHandler(), field, raw, warnings);
            if (substitute != null) {
                value = substitute;
            }
        }

        // 5. Required
        if (isBlank(value)) {
            if (rule.isHardRequired()) {
                log.error("Required field '{}' is missing or blank", field);
                throw new RequiredFieldMissingException(field);
            }
            if (rule.isSoftRequired()) {
                warn(warnings, new SoftWarning(SoftWarning.Kind.SOFT_REQUIRED_MISSING, field,
                        "Soft required field is not set"));
            }
        }

        // 6. Range
        if (value instanceof Number number && rule.hasRange()) {
            Number widened = truncate(number);
            if (!(widened instanceof Long bounded) || bounded < rule.rangeMin() || bounded > rule.rangeMax()) {
                log.error("Field '{}' is out of range ({}..{}): {}", field, rule.rangeMin(), rule.rangeMax(), widened);
                throw new RangeViolationException(field, rule.rangeMin(), rule.rangeMax(), widened);
            }
        }

        if (value == null && rule.type().isPrimitive()) {
            return Primitives.zeroValue(rule.type());
        }
        return value;
    }

    /**
     * Truncates toward zero. Big values that do not fit a long are returned as a {@link BigInteger},
     * which no range can contain.
     */
    private static Number truncate(Number number) {
        BigInteger integral;
        if (number instanceof BigInteger big) {
            integral = big;
        } else if (number instanceof BigDecimal decimal) {
            integral = decimal.toBigInteger();
        } else {
            return number.longValue();
        }
        return integral.bitLength() <= 63 ? (Number) integral.longValue() : integral;
    }

    private Object load(FieldRule rule, Object raw, String field, List<SoftWarning> warnings) {
        if (rule.loader() != null) {
            try {
                return rule.loader().load(raw);
            } catch (Exception e) {
                warn(warnings, new SoftWarning(SoftWarning.Kind.LOADER_FAILED, field,
                        "Custom loader failed: " + e.getMessage(), e));
                return null;
            }
        }
        try {
            return convert(rule, raw, field, warnings);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            warn(warnings, new SoftWarning(SoftWarning.Kind.CONVERSION_FAILED, field,
                    "Cannot convert " + describe(raw) + " to " + rule.type().getSimpleName() + ": " + e.getMessage(), e));
            return null;
        }
    }

    private Object convert(FieldRule rule, Object raw, String field, List<SoftWarning> warnings) throws Exception {
        Class<?> target = Primitives.boxed(rule.type());

        if (rule.nested() != null) {
            if (raw instanceof Map<?, ?> section) {
                return resolveObject(rule.nested(), section, field, warnings);
            }
            throw new IllegalArgumentException("expected a mapping");
        }
        if (target.isInstance(raw)) {
            return raw;
        }
        if (raw instanceof Number number && Number.class.isAssignableFrom(target)) {
            return convertNumber(number, target);
        }
        if (raw instanceof Map || raw instanceof List) {
            throw new IllegalArgumentException("expected a scalar");
        }
        return registry.parse(rule.type(), raw.toString());
    }

    private static Object convertNumber(Number number, Class<?> target) {
        if (target == Double.class) return number.doubleValue();
        if (target == Float.class) return number.floatValue();

        BigDecimal exact = new BigDecimal(number.toString());
        if (target == Integer.class) return exact.intValueExact();
        if (target == Long.class) return exact.longValueExact();
        if (target == Short.class) return exact.shortValueExact();
        if (target == Byte.class) return exact.byteValueExact();
        if (target == BigDecimal.class) return exact;
        if (target == BigInteger.class) return exact.toBigIntegerExact();
        throw new IllegalArgumentException("unsupported numeric type " + target.getSimpleName());
    }

    private Object parseDefault(FieldRule rule, String field, List<SoftWarning> warnings) {
        Optional<DefaultParser<?>> parser = registry.lookup(rule.type());
        if (parser.isEmpty()) {
            warn(warnings, new SoftWarning(SoftWarning.Kind.NO_DEFAULT_PARSER, field,
                    "No default parser registered for " + rule.type().getSimpleName()));
            return null;
        }
        try {
            return parser.get().parse(rule.defaultValue(), rule.type());
        } catch (Exception e) {
            warn(warnings, new SoftWarning(SoftWarning.Kind.DEFAULT_PARSE_FAILED, field,
                    "Failed to parse default '" + rule.defaultValue() + "': " + e.getMessage(), e));
            return null;
        }
    }

    private Object handleMissing(MissingValueHandler handler, String field, Object raw, List<SoftWarning> warnings) {
        try {
            Object substitute = handler.handle(field, raw);
            log.info("Missing-value handler ran for field '{}'", field);
            return substitute;
        } catch (Exception e) {
            warn(warnings, new SoftWarning(SoftWarning.Kind.MISSING_HANDLER_FAILED, field,
                    "Missing-value handler failed: " + e.getMessage(), e));
            return null;
        }
    }

    private static <T> T construct(ConfigSchema<T> schema, Object[] values, String path) {
        String target = path.isEmpty() ? schema.type().getSimpleName() : path;
        try {
            return schema.instantiate(values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Constructor of {} rejected the resolved values", target, cause);
            throw new CustomValidationException(target, cause);
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new ConfigurationException("Cannot construct " + target, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static void runValidators(FieldRule rule, Object value, Object instance, String field) {
        if (value == null) {
            return;
        }
        for (FieldValidator<?> validator : rule.validators()) {
            try {
                ((FieldValidator<Object>) validator).validate(value, instance);
            } catch (Exception e) {
                log.error("Validator rejected field '{}'", field, e);
                throw new CustomValidationException(field, e);
            }
        }
    }

    private static void warn(List<SoftWarning> warnings, SoftWarning warning) {
        warnings.add(warning);
        log.warn("{} on field '{}': {}", warning.kind(), warning.field(), warning.message(), warning.cause());
    }

    private static Map<String, Object> index(Map<?, ?> document) {
        Map<String, Object> index = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            if (entry.getKey() != null) {
                index.putIfAbsent(Keys.normalize(entry.getKey().toString()), entry.getValue());
            }
        }
        return index;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }

    private static String pathOf(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    private static String describe(Object raw) {
        return raw instanceof Map ? "a mapping" : raw instanceof List ? "a list" : "'" + raw + "'";
    }
}
