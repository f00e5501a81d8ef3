package fr.lapetina.configgraph.infrastructure.metrics;

import fr.lapetina.configgraph.domain.model.ErrorType;
import fr.lapetina.configgraph.domain.model.SharingPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolution metrics using Micrometer.
 *
 * Provides:
 * - Cache hit, miss and eviction counters
 * - Created instance counters and build latency per sharing policy
 * - Error counters by type
 * - Cached instance gauge
 * - Prometheus exposition
 */
public final class ResolutionMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResolutionMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final boolean enabled;

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter evictions;
    private final Map<SharingPolicy, Counter> created = new ConcurrentHashMap<>();
    private final Map<SharingPolicy, Timer> buildTimers = new ConcurrentHashMap<>();
    private final Map<ErrorType, Counter> errors = new ConcurrentHashMap<>();

    private final AtomicInteger cachedInstances = new AtomicInteger(0);

    public ResolutionMetrics(String prefix, boolean enabled) {
        this.prefix = prefix;
        this.enabled = enabled;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        cacheHits = Counter.builder(prefix + "_cache_hits_total")
                .description("Resolutions answered from the instance cache")
                .register(registry);
        cacheMisses = Counter.builder(prefix + "_cache_misses_total")
                .description("Resolutions that had to build an instance")
                .register(registry);
        evictions = Counter.builder(prefix + "_evictions_total")
                .description("Instances dropped from the cache")
                .register(registry);
        Gauge.builder(prefix + "_cached_instances", cachedInstances, AtomicInteger::get)
                .description("Number of cached instances")
                .register(registry);

        log.debug("ResolutionMetrics initialized with prefix: {} (enabled={})", prefix, enabled);
    }

    public ResolutionMetrics() {
        this("config_graph", true);
    }

    public void recordCacheHit() {
        if (enabled) cacheHits.increment();
    }

    public void recordCacheMiss() {
        if (enabled) cacheMisses.increment();
    }

    public void recordEviction() {
        if (enabled) evictions.increment();
    }

    /**
     * Records a newly built instance and how long it took.
     */
    public void recordCreated(SharingPolicy policy, Duration latency) {
        if (!enabled) {
            return;
        }
        created.computeIfAbsent(policy, p ->
                Counter.builder(prefix + "_instances_created_total")
                        .description("Instances built")
                        .tag("policy", p.name())
                        .register(registry)
        ).increment();
        buildTimers.computeIfAbsent(policy, p ->
                Timer.builder(prefix + "_build_latency")
                        .description("Time spent building an instance and its dependencies")
                        .tag("policy", p.name())
                        .register(registry)
        ).record(latency);
    }

    public void recordError(ErrorType errorType) {
        if (!enabled) {
            return;
        }
        errors.computeIfAbsent(errorType, t ->
                Counter.builder(prefix + "_errors_total")
                        .description("Failed resolutions")
                        .tag("type", t.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Updates the cached instance gauge.
     */
    public void setCachedInstances(int value) {
        cachedInstances.set(value);
    }

    public double getCacheHits() {
        return cacheHits.count();
    }

    public double getCacheMisses() {
        return cacheMisses.count();
    }

    public double getEvictions() {
        return evictions.count();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
