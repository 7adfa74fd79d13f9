package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.priority.PriorityLoad;

import java.util.List;

/**
 * Immutable output of one rebuild. Every rebuild produces a new instance; selectors
 * holding an older one keep using it until they are recreated.
 *
 * @param perPriorityStates One state per priority level, indexed by priority
 * @param healthyLoad       Traffic share of the healthy hosts of each level
 * @param degradedLoad      Traffic share of the degraded hosts of each level
 * @param generation        Rebuild counter, 0 before the first rebuild
 */
public record LoadBalancerSnapshot(
        List<PerPriorityState> perPriorityStates,
        PriorityLoad healthyLoad,
        PriorityLoad degradedLoad,
        long generation
) {

    private static final LoadBalancerSnapshot EMPTY =
            new LoadBalancerSnapshot(List.of(), PriorityLoad.empty(), PriorityLoad.empty(), 0);

    public LoadBalancerSnapshot {
        perPriorityStates = List.copyOf(perPriorityStates);
    }

    public static LoadBalancerSnapshot empty() {
        return EMPTY;
    }

    public int priorityCount() {
        return perPriorityStates.size();
    }

    public PerPriorityState stateFor(int priority) {
        if (priority < 0 || priority >= perPriorityStates.size()) {
            return PerPriorityState.panic();
        }
        return perPriorityStates.get(priority);
    }
}
