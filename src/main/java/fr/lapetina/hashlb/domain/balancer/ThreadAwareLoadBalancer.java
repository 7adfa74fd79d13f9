package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.hashing.BoundedLoadHashingTable;
import fr.lapetina.hashlb.domain.hashing.HashingTable;
import fr.lapetina.hashlb.domain.hashing.HashingTableBuilder;
import fr.lapetina.hashlb.domain.hashing.RingHashTable;
import fr.lapetina.hashlb.domain.model.HostSet;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeights;
import fr.lapetina.hashlb.domain.priority.DefaultPrioritySelector;
import fr.lapetina.hashlb.domain.priority.PriorityLoadCalculator;
import fr.lapetina.hashlb.domain.priority.PrioritySelector;
import fr.lapetina.hashlb.infrastructure.membership.MembershipChangeEvent;
import fr.lapetina.hashlb.infrastructure.membership.PrioritySet;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Rebuilds the per-priority hashing tables on every membership change and publishes them
 * to worker threads as an immutable {@link LoadBalancerSnapshot}.
 *
 * <p>Rebuilds run on the thread that mutates the {@link PrioritySet} and are never
 * concurrent with each other. Tables are built outside of any lock; publishing is a single
 * reference assignment under the snapshot write lock. The {@link CrossPriorityHostMap} is
 * published under its own lock, so the two may briefly disagree.
 *
 * <p>Workers obtain their {@link WorkerSelector} from {@link #factory()} and recreate it
 * once {@link #epoch()} moves past the epoch their selector was created in.
 */
public final class ThreadAwareLoadBalancer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ThreadAwareLoadBalancer.class);

    private final PrioritySet prioritySet;
    private final HashingTableBuilder tableBuilder;
    private final int hashBalanceFactor;
    private final PriorityLoadCalculator loadCalculator;
    private final LoadBalancerStats stats;
    private final WorkerSelectorFactory factory;

    private final ReentrantReadWriteLock snapshotLock = new ReentrantReadWriteLock();
    private LoadBalancerSnapshot snapshot = LoadBalancerSnapshot.empty();

    private final ReentrantLock hostMapLock = new ReentrantLock();
    private CrossPriorityHostMap crossPriorityHostMap = CrossPriorityHostMap.empty();

    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong(0);
    private final AtomicLong epoch = new AtomicLong(0);
    private final Consumer<MembershipChangeEvent> membershipListener = this::onMembershipChange;

    private ThreadAwareLoadBalancer(Builder builder) {
        this.prioritySet = Objects.requireNonNull(builder.prioritySet, "prioritySet");
        this.tableBuilder = Objects.requireNonNull(builder.tableBuilder, "tableBuilder");
        if (builder.hashBalanceFactor < BoundedLoadHashingTable.DISABLED_BALANCE_FACTOR) {
            throw new IllegalArgumentException(
                    "Hash balance factor must be at least 100: " + builder.hashBalanceFactor);
        }
        this.hashBalanceFactor = builder.hashBalanceFactor;
        this.loadCalculator = builder.loadCalculator;
        this.stats = builder.stats;
        this.factory = new WorkerSelectorFactory(this, builder.prioritySelector, stats);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes to membership changes and performs the first rebuild.
     *
     * @throws IllegalStateException if already initialized
     * @throws RuntimeException      whatever the first rebuild throws; the balancer is then unusable
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Load balancer already initialized");
        }
        prioritySet.subscribe(membershipListener, () -> {
            refresh();
            updateCrossPriorityHostMap();
            epoch.incrementAndGet();
        });
        log.info("Load balancer initialized: {} priorities, hashBalanceFactor={}",
                currentSnapshot().priorityCount(), hashBalanceFactor);
    }

    /**
     * Rebuilds every priority's table from the current membership and publishes the result.
     * Either the whole new snapshot becomes visible or, if anything throws, nothing does.
     */
    public void refresh() {
        long startNanos = System.nanoTime();
        List<HostSet> hostSets = prioritySet.hostSetsPerPriority();

        List<PerPriorityState> states = new ArrayList<>(hostSets.size());
        for (HostSet hostSet : hostSets) {
            states.add(buildState(hostSet));
        }
        PriorityLoadCalculator.Loads loads = loadCalculator.calculate(hostSets);

        LoadBalancerSnapshot next = new LoadBalancerSnapshot(
                states, loads.healthy(), loads.degraded(), generation.incrementAndGet());

        snapshotLock.writeLock().lock();
        try {
            snapshot = next;
        } finally {
            snapshotLock.writeLock().unlock();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        stats.recordRefresh(elapsed, next.generation());
        log.debug("Published snapshot generation={} priorities={} healthyLoad={} degradedLoad={} in {}",
                next.generation(), states.size(), loads.healthy(), loads.degraded(), elapsed);
    }

    public WorkerSelectorFactory factory() {
        return factory;
    }

    /**
     * Counter bumped after each membership change has been fully published.
     */
    public long epoch() {
        return epoch.get();
    }

    public int getHashBalanceFactor() {
        return hashBalanceFactor;
    }

    public LoadBalancerStats getStats() {
        return stats;
    }

    LoadBalancerSnapshot currentSnapshot() {
        snapshotLock.readLock().lock();
        try {
            return snapshot;
        } finally {
            snapshotLock.readLock().unlock();
        }
    }

    CrossPriorityHostMap currentCrossPriorityHostMap() {
        hostMapLock.lock();
        try {
            return crossPriorityHostMap;
        } finally {
            hostMapLock.unlock();
        }
    }

    @Override
    public void close() {
        prioritySet.removeListener(membershipListener);
        log.info("Load balancer detached from membership updates");
    }

    private PerPriorityState buildState(HostSet hostSet) {
        if (hostSet.eligibleHosts().isEmpty()) {
            log.debug("Priority {} has no host, entering global panic", hostSet.priority());
            return PerPriorityState.panic();
        }
        if (hostSet.healthyHosts().isEmpty() && hostSet.degradedHosts().isEmpty()) {
            log.warn("Priority {} has no healthy or degraded host, hashing over all {} hosts",
                    hostSet.priority(), hostSet.hosts().size());
        }
        NormalizedHostWeights weights = NormalizedHostWeights.normalize(hostSet.eligibleHosts());
        HashingTable table = tableBuilder.createLoadBalancer(
                weights.weights(), weights.minWeight(), weights.maxWeight());
        if (table instanceof RingHashTable ring) {
            stats.setRingHashesPerHost(ring.getMinHashesPerHost(), ring.getMaxHashesPerHost());
        }
        if (hashBalanceFactor > BoundedLoadHashingTable.DISABLED_BALANCE_FACTOR) {
            table = new BoundedLoadHashingTable(table, weights, hashBalanceFactor);
        }
        return PerPriorityState.of(table);
    }

    private void updateCrossPriorityHostMap() {
        CrossPriorityHostMap next = prioritySet.crossPriorityHostMap();
        hostMapLock.lock();
        try {
            crossPriorityHostMap = next;
        } finally {
            hostMapLock.unlock();
        }
    }

    private void onMembershipChange(MembershipChangeEvent event) {
        log.debug("Membership change {} for {} host(s)", event.type(), event.hosts().size());
        try {
            refresh();
        } catch (RuntimeException e) {
            stats.incrementRefreshFailures();
            log.error("Failed to rebuild hashing tables after {}, keeping snapshot generation {}",
                    event.type(), currentSnapshot().generation(), e);
        }
        updateCrossPriorityHostMap();
        epoch.incrementAndGet();
    }

    /**
     * Builder for ThreadAwareLoadBalancer.
     */
    public static final class Builder {
        private PrioritySet prioritySet;
        private HashingTableBuilder tableBuilder;
        private int hashBalanceFactor = BoundedLoadHashingTable.DISABLED_BALANCE_FACTOR;
        private PriorityLoadCalculator loadCalculator = new PriorityLoadCalculator();
        private PrioritySelector prioritySelector = new DefaultPrioritySelector();
        private LoadBalancerStats stats;

        public Builder prioritySet(PrioritySet prioritySet) {
            this.prioritySet = prioritySet;
            return this;
        }

        public Builder tableBuilder(HashingTableBuilder tableBuilder) {
            this.tableBuilder = tableBuilder;
            return this;
        }

        public Builder hashBalanceFactor(int hashBalanceFactor) {
            this.hashBalanceFactor = hashBalanceFactor;
            return this;
        }

        public Builder loadCalculator(PriorityLoadCalculator loadCalculator) {
            this.loadCalculator = Objects.requireNonNull(loadCalculator);
            return this;
        }

        public Builder prioritySelector(PrioritySelector prioritySelector) {
            this.prioritySelector = Objects.requireNonNull(prioritySelector);
            return this;
        }

        public Builder stats(LoadBalancerStats stats) {
            this.stats = stats;
            return this;
        }

        public ThreadAwareLoadBalancer build() {
            if (stats == null) {
                stats = new LoadBalancerStats();
            }
            return new ThreadAwareLoadBalancer(this);
        }
    }
}
