package fr.lapetina.confkit.domain.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Dotted numeric version read from the reserved {@code version} key of a document.
 *
 * Components compare as integers from left to right. Missing trailing components count as 0,
 * and so do components that are not numeric. Immutable and thread-safe.
 */
public final class Version implements Comparable<Version> {

    /**
     * Version assumed for documents that carry no version key.
     */
    public static final Version DEFAULT = parse("1.0.0");

    private final String text;
    private final int[] components;

    private Version(String text, int[] components) {
        this.text = text;
        this.components = components;
    }

    /**
     * Parses a version string. Null or blank input yields {@link #DEFAULT}.
     */
    public static Version parse(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT;
        }
        String trimmed = text.trim();
        String[] parts = trimmed.split("\\.", -1);
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            components[i] = parseComponent(parts[i]);
        }
        return new Version(trimmed, components);
    }

    private static int parseComponent(String part) {
        try {
            return Integer.parseInt(part.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Returns true if this version sorts strictly before {@code other}.
     */
    public boolean isOlderThan(Version other) {
        return compareTo(other) < 0;
    }

    private int component(int index) {
        return index < components.length ? components[index] : 0;
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(component(i), other.component(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Version)) return false;
        return compareTo((Version) o) == 0;
    }

    @Override
    public int hashCode() {
        // Trailing zeros must not change the hash: 1.2 equals 1.2.0
        int end = components.length;
        while (end > 0 && components[end - 1] == 0) {
            end--;
        }
        return Arrays.hashCode(Arrays.copyOf(components, end));
    }

    /**
     * Returns the normalized dotted form, e.g. {@code "1.2.0"} for input {@code "1.2.x"}.
     */
    public String normalized() {
        return Arrays.stream(components)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return text;
    }
}
