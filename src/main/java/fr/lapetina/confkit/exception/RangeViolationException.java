package fr.lapetina.confkit.exception;

/**
 * Thrown when a numeric field lies outside its declared inclusive range.
 */
public final class RangeViolationException extends ConfigurationException {

    private final String field;
    private final long min;
    private final long max;
    private final Number value;

    public RangeViolationException(String field, long min, long max, Number value) {
        super("Config field '" + field + "' out of range [" + min + ", " + max + "]: " + value);
        this.field = field;
        this.min = min;
        this.max = max;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public long getMin() {
        return min;
    }

    public long getMax() {
        return max;
    }

    /**
     * The offending value as compared: truncated to a long, or a {@link java.math.BigInteger} when
     * it does not fit one.
     */
    public Number getValue() {
        return value;
    }
}
