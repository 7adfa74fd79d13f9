package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.hashing.HashingTable;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.HostHealth;
import fr.lapetina.hashlb.domain.model.LoadBalancerContext;
import fr.lapetina.hashlb.domain.priority.PrioritySelector;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Read-only view over one published snapshot, owned by a single worker thread.
 *
 * Selection never blocks and never throws; no host is always an empty result.
 */
public final class WorkerSelector {

    private static final Logger log = LoggerFactory.getLogger(WorkerSelector.class);

    private final LoadBalancerSnapshot snapshot;
    private final CrossPriorityHostMap crossPriorityHostMap;
    private final PrioritySelector prioritySelector;
    private final LoadBalancerStats stats;
    private final long epoch;

    WorkerSelector(
            LoadBalancerSnapshot snapshot,
            CrossPriorityHostMap crossPriorityHostMap,
            PrioritySelector prioritySelector,
            LoadBalancerStats stats,
            long epoch
    ) {
        this.snapshot = snapshot;
        this.crossPriorityHostMap = crossPriorityHostMap;
        this.prioritySelector = prioritySelector;
        this.stats = stats;
        this.epoch = epoch;
    }

    /**
     * Selects a host for the request.
     *
     * <ol>
     *   <li>An override address naming a known, not unhealthy host wins.</li>
     *   <li>The priority level is picked from the request hash, random when absent.</li>
     *   <li>A level in panic yields no host.</li>
     *   <li>Otherwise attempts 0..retryCount are tried until the context accepts a host;
     *       the last attempt is returned if all are rejected.</li>
     * </ol>
     */
    public Optional<Host> chooseHost(LoadBalancerContext context) {
        Optional<String> override = context.overrideHostAddress();
        if (override.isPresent()) {
            Optional<Host> host = crossPriorityHostMap.find(override.get());
            if (host.isPresent() && host.get().getHealth() != HostHealth.UNHEALTHY) {
                return host;
            }
            log.debug("Override host {} unavailable, falling back to hashing", override.get());
        }

        if (snapshot.priorityCount() == 0) {
            return Optional.empty();
        }

        OptionalLong hashKey = context.computeHashKey();
        final long hash = hashKey.isPresent() ? hashKey.getAsLong() : ThreadLocalRandom.current().nextLong();

        int priority = prioritySelector.choosePriority(hash, snapshot.healthyLoad(), snapshot.degradedLoad());
        PerPriorityState state = snapshot.stateFor(priority);
        if (!state.isUsable()) {
            stats.incrementPanic();
            log.debug("Priority {} is in global panic, no host selected", priority);
            return Optional.empty();
        }

        HashingTable table = state.table();
        final int retries = Math.max(context.hostSelectionRetryCount(), 0);
        Host host = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            host = table.chooseHost(hash, attempt);
            if (host == null || !context.shouldSelectAnotherHost(host)) {
                break;
            }
        }
        return Optional.ofNullable(host);
    }

    /**
     * Selecting a second host ahead of time is not supported by hashing tables.
     */
    public Optional<Host> peekAnotherHost(LoadBalancerContext context) {
        return Optional.empty();
    }

    public long getEpoch() {
        return epoch;
    }

    public long getGeneration() {
        return snapshot.generation();
    }

    LoadBalancerSnapshot snapshot() {
        return snapshot;
    }
}
