package fr.lapetina.confkit.domain.resolve;

import java.util.List;
import java.util.Objects;

/**
 * A fully constructed configuration object plus the warnings raised while building it.
 */
public record Resolution<T>(T value, List<SoftWarning> warnings) {

    public Resolution {
        Objects.requireNonNull(value, "value");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
