package fr.lapetina.confkit.domain.model;

import java.util.Map;

/**
 * Boxing and zero values for primitive component types.
 */
public final class Primitives {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            boolean.class, Boolean.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            char.class, Character.class
    );

    private static final Map<Class<?>, Object> ZEROS = Map.of(
            int.class, 0,
            long.class, 0L,
            boolean.class, false,
            double.class, 0d,
            float.class, 0f,
            short.class, (short) 0,
            byte.class, (byte) 0,
            char.class, '\0'
    );

    private Primitives() {
        // Utility class
    }

    /**
     * Returns the wrapper class of a primitive type, or the type itself.
     */
    public static Class<?> boxed(Class<?> type) {
        return BOXES.getOrDefault(type, type);
    }

    /**
     * Returns the JVM default of a primitive type, or null for reference types.
     */
    public static Object zeroValue(Class<?> type) {
        return ZEROS.get(type);
    }
}
