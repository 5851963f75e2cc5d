package fr.lapetina.confkit.domain.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsers from raw text to typed values, keyed by target type.
 *
 * A registry is an ordinary object owned by whoever builds the resolver; there is no global
 * instance. {@link #standard()} covers strings, primitives and their wrappers, big numbers,
 * {@link Duration} (ISO-8601), {@link Path}, and every enum type.
 */
public final class DefaultRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultRegistry.class);

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");

    private final Map<Class<?>, DefaultParser<?>> parsers = new ConcurrentHashMap<>();

    private DefaultRegistry() {
    }

    /**
     * Creates a registry with no parsers.
     */
    public static DefaultRegistry empty() {
        return new DefaultRegistry();
    }

    /**
     * Creates a registry with the built-in parsers.
     */
    public static DefaultRegistry standard() {
        DefaultRegistry registry = new DefaultRegistry();
        registry.register(String.class, (raw, type) -> raw);
        registry.registerBoth(boolean.class, Boolean.class, (raw, type) -> parseBoolean(raw));
        registry.registerBoth(int.class, Integer.class, (raw, type) -> Integer.parseInt(raw.trim()));
        registry.registerBoth(long.class, Long.class, (raw, type) -> Long.parseLong(raw.trim()));
        registry.registerBoth(short.class, Short.class, (raw, type) -> Short.parseShort(raw.trim()));
        registry.registerBoth(byte.class, Byte.class, (raw, type) -> Byte.parseByte(raw.trim()));
        registry.registerBoth(double.class, Double.class, (raw, type) -> Double.parseDouble(raw.trim()));
        registry.registerBoth(float.class, Float.class, (raw, type) -> Float.parseFloat(raw.trim()));
        registry.registerBoth(char.class, Character.class, (raw, type) -> parseChar(raw));
        registry.register(BigDecimal.class, (raw, type) -> new BigDecimal(raw.trim()));
        registry.register(BigInteger.class, (raw, type) -> new BigInteger(raw.trim()));
        registry.register(Duration.class, (raw, type) -> Duration.parse(raw.trim()));
        registry.register(Path.class, (raw, type) -> Path.of(raw.trim()));
        return registry;
    }

    /**
     * Registers a parser for {@code type}, replacing any existing one.
     */
    public <T> DefaultRegistry register(Class<T> type, DefaultParser<? extends T> parser) {
        DefaultParser<?> previous = parsers.put(type, parser);
        if (previous != null) {
            log.debug("Replaced default parser for {}", type.getName());
        }
        return this;
    }

    private <T> void registerBoth(Class<?> primitive, Class<T> boxed, DefaultParser<? extends T> parser) {
        parsers.put(primitive, parser);
        parsers.put(boxed, parser);
    }

    /**
     * Returns the parser for {@code type}. Enum types without an explicit parser get a
     * case-insensitive constant-name parser.
     */
    public Optional<DefaultParser<?>> lookup(Class<?> type) {
        DefaultParser<?> parser = parsers.get(type);
        if (parser != null) {
            return Optional.of(parser);
        }
        if (type.isEnum()) {
            DefaultParser<Object> enumParser = DefaultRegistry::parseEnum;
            return Optional.of(enumParser);
        }
        return Optional.empty();
    }

    public boolean supports(Class<?> type) {
        return lookup(type).isPresent();
    }

    /**
     * Parses {@code raw} into {@code type}.
     *
     * @throws IllegalArgumentException if no parser is registered for {@code type}
     * @throws Exception                if the parser rejects the text
     */
    public Object parse(Class<?> type, String raw) throws Exception {
        DefaultParser<?> parser = lookup(type)
                .orElseThrow(() -> new IllegalArgumentException("No default parser registered for " + type.getName()));
        return parser.parse(raw, type);
    }

    private static Boolean parseBoolean(String raw) {
        String word = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(word)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: '" + raw + "'");
    }

    private static Character parseChar(String raw) {
        if (raw.length() != 1) {
            throw new IllegalArgumentException("Expected a single character, got '" + raw + "'");
        }
        return raw.charAt(0);
    }

    private static Object parseEnum(String raw, Class<?> type) {
        String wanted = raw.trim().replace('-', '_');
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("No constant '" + raw + "' in " + type.getSimpleName());
    }
}
