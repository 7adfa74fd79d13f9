package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.priority.PrioritySelector;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;

/**
 * Hands out {@link WorkerSelector}s bound to the currently published state.
 *
 * Safe to call from any thread. Each worker should call {@link #create()} once per epoch
 * and keep the selector to itself.
 */
public final class WorkerSelectorFactory {

    private final ThreadAwareLoadBalancer loadBalancer;
    private final PrioritySelector prioritySelector;
    private final LoadBalancerStats stats;

    WorkerSelectorFactory(ThreadAwareLoadBalancer loadBalancer, PrioritySelector prioritySelector, LoadBalancerStats stats) {
        this.loadBalancer = loadBalancer;
        this.prioritySelector = prioritySelector;
        this.stats = stats;
    }

    public WorkerSelector create() {
        // Epoch first: a selector may be older than its label, never newer
        long epoch = loadBalancer.epoch();
        LoadBalancerSnapshot snapshot = loadBalancer.currentSnapshot();
        CrossPriorityHostMap hostMap = loadBalancer.currentCrossPriorityHostMap();
        return new WorkerSelector(snapshot, hostMap, prioritySelector, stats, epoch);
    }
}
