package fr.lapetina.hashlb.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable view of the hosts of one priority level, partitioned by health at the time
 * the view was taken.
 *
 * @param priority      Priority level, 0 being the most preferred
 * @param hosts         All hosts of the level
 * @param healthyHosts  Hosts that were {@link HostHealth#HEALTHY}
 * @param degradedHosts Hosts that were {@link HostHealth#DEGRADED}
 */
public record HostSet(int priority, List<Host> hosts, List<Host> healthyHosts, List<Host> degradedHosts) {

    public HostSet {
        hosts = List.copyOf(hosts);
        healthyHosts = List.copyOf(healthyHosts);
        degradedHosts = List.copyOf(degradedHosts);
    }

    /**
     * Partitions hosts by their current health.
     */
    public static HostSet of(int priority, List<Host> hosts) {
        List<Host> healthy = new ArrayList<>();
        List<Host> degraded = new ArrayList<>();
        for (Host host : hosts) {
            switch (host.getHealth()) {
                case HEALTHY -> healthy.add(host);
                case DEGRADED -> degraded.add(host);
                case UNHEALTHY -> {
                    // never eligible
                }
            }
        }
        return new HostSet(priority, hosts, healthy, degraded);
    }

    public static HostSet empty(int priority) {
        return new HostSet(priority, List.of(), List.of(), List.of());
    }

    /**
     * Hosts eligible for hashing: healthy ones, else degraded ones, else every host of the
     * level regardless of health. Empty only when the level has no host.
     */
    public List<Host> eligibleHosts() {
        if (!healthyHosts.isEmpty()) {
            return healthyHosts;
        }
        return !degradedHosts.isEmpty() ? degradedHosts : hosts;
    }
}
