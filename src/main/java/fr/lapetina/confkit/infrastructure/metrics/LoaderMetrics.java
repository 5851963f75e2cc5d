package fr.lapetina.confkit.infrastructure.metrics;

import fr.lapetina.confkit.domain.resolve.SoftWarning;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for configuration loading.
 *
 * Provides:
 * - Load and reload counters by outcome
 * - Update counters by result
 * - Soft warning counters by kind
 * - Load duration timer
 *
 * Meters are registered on the supplied {@link MeterRegistry}; applications pass their own
 * registry to export them, otherwise a {@link SimpleMeterRegistry} keeps them in memory.
 */
public final class LoaderMetrics {

    private static final Logger log = LoggerFactory.getLogger(LoaderMetrics.class);

    public static final String DEFAULT_PREFIX = "confkit";

    /**
     * Operation that produced a configuration object.
     */
    public enum Operation { LOAD, RELOAD }

    /**
     * Result of a file reconciliation.
     */
    public enum UpdateResult { UPDATED, UP_TO_DATE, FAILED }

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> loadCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UpdateResult, Counter> updateCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SoftWarning.Kind, Counter> warningCounters = new ConcurrentHashMap<>();
    private final Timer loadTimer;

    public LoaderMetrics(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
        this.loadTimer = Timer.builder(prefix + "_load_duration")
                .description("Time to read, resolve and construct a configuration")
                .register(registry);
        log.debug("LoaderMetrics initialized with prefix: {}", prefix);
    }

    public LoaderMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public LoaderMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Counts a load or reload attempt.
     */
    public void recordLoad(Operation operation, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = operation.name() + ":" + outcome;
        loadCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_loads_total")
                        .description("Total number of configuration loads")
                        .tag("operation", operation.name().toLowerCase(Locale.ROOT))
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a successful load took.
     */
    public void recordLoadDuration(Duration duration) {
        loadTimer.record(duration);
    }

    /**
     * Counts a reconciliation of the target file against the bundled default.
     */
    public void recordUpdate(UpdateResult result) {
        updateCounters.computeIfAbsent(result, r ->
                Counter.builder(prefix + "_updates_total")
                        .description("Total number of config file reconciliations")
                        .tag("result", r.name().toLowerCase(Locale.ROOT))
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a soft warning raised during resolution.
     */
    public void recordWarning(SoftWarning.Kind kind) {
        warningCounters.computeIfAbsent(kind, k ->
                Counter.builder(prefix + "_warnings_total")
                        .description("Total number of soft resolution warnings")
                        .tag("kind", k.name().toLowerCase(Locale.ROOT))
                        .register(registry)
        ).increment();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }
}
