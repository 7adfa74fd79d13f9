package fr.lapetina.hashlb.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Load balancer statistics backed by Micrometer.
 *
 * Provides:
 * - Refresh counters and duration timer
 * - Panic counter incremented when a selection lands on a priority without hosts
 * - Gauges for the published snapshot generation and ring hash sizing
 * - Ring buffer remaining capacity of the selection pipeline
 */
public final class LoadBalancerStats implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancerStats.class);

    public static final String DEFAULT_PREFIX = "hash_lb";

    private final MeterRegistry registry;
    private final String prefix;

    private final Counter refreshCounter;
    private final Counter refreshFailureCounter;
    private final Counter panicCounter;
    private final Timer refreshTimer;

    private final AtomicLong snapshotGeneration = new AtomicLong(0);
    private final AtomicLong minHashesPerHost = new AtomicLong(0);
    private final AtomicLong maxHashesPerHost = new AtomicLong(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public LoadBalancerStats(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;

        this.refreshCounter = Counter.builder(prefix + "_refresh_total")
                .description("Number of published snapshot rebuilds")
                .register(registry);
        this.refreshFailureCounter = Counter.builder(prefix + "_refresh_failures_total")
                .description("Number of rebuilds that failed and kept the previous snapshot")
                .register(registry);
        this.panicCounter = Counter.builder(prefix + "_healthy_panic_total")
                .description("Selections that hit a priority in global panic")
                .register(registry);
        this.refreshTimer = Timer.builder(prefix + "_refresh_duration")
                .description("Time spent rebuilding hashing tables")
                .register(registry);

        Gauge.builder(prefix + "_snapshot_generation", snapshotGeneration, AtomicLong::get)
                .description("Generation of the currently published snapshot")
                .register(registry);
        Gauge.builder(prefix + "_ring_min_hashes_per_host", minHashesPerHost, AtomicLong::get)
                .description("Smallest number of ring entries owned by a host")
                .register(registry);
        Gauge.builder(prefix + "_ring_max_hashes_per_host", maxHashesPerHost, AtomicLong::get)
                .description("Largest number of ring entries owned by a host")
                .register(registry);
        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the selection ring buffer")
                .register(registry);

        log.info("LoadBalancerStats initialized with prefix: {}", prefix);
    }

    public LoadBalancerStats(String prefix) {
        this(prefix, new SimpleMeterRegistry());
    }

    public LoadBalancerStats() {
        this(DEFAULT_PREFIX);
    }

    public void recordRefresh(Duration duration, long generation) {
        refreshCounter.increment();
        refreshTimer.record(duration);
        snapshotGeneration.set(generation);
    }

    public void incrementRefreshFailures() {
        refreshFailureCounter.increment();
    }

    public void incrementPanic() {
        panicCounter.increment();
    }

    public void setRingHashesPerHost(long min, long max) {
        minHashesPerHost.set(min);
        maxHashesPerHost.set(max);
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public double getRefreshCount() {
        return refreshCounter.count();
    }

    public double getRefreshFailureCount() {
        return refreshFailureCounter.count();
    }

    public double getPanicCount() {
        return panicCounter.count();
    }

    public long getSnapshotGeneration() {
        return snapshotGeneration.get();
    }

    public String getPrefix() {
        return prefix;
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
