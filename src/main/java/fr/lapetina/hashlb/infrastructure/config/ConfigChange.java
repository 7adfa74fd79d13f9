package fr.lapetina.hashlb.infrastructure.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Difference between two successive validated configurations.
 *
 * <p>Only the host list is applied at runtime. The other sections are fixed when the load
 * balancer is built; a change to any of them is reported in {@link #restartRequiredSections()}.
 *
 * @param previous                the configuration replaced, null on the first load
 * @param current                 the configuration now in effect
 * @param hostsChanged            whether the host list differs
 * @param restartRequiredSections names of the other sections that differ, in document order
 */
public record ConfigChange(
        LoadBalancerConfig previous,
        LoadBalancerConfig current,
        boolean hostsChanged,
        List<String> restartRequiredSections
) {

    public ConfigChange {
        Objects.requireNonNull(current, "current");
        restartRequiredSections = List.copyOf(restartRequiredSections);
    }

    public static ConfigChange between(LoadBalancerConfig previous, LoadBalancerConfig current) {
        if (previous == null) {
            return new ConfigChange(null, current, true, List.of());
        }
        List<String> sections = new ArrayList<>();
        if (!Objects.equals(previous.getHashing(), current.getHashing())) {
            sections.add("hashing");
        }
        if (!Objects.equals(previous.getPriority(), current.getPriority())) {
            sections.add("priority");
        }
        if (!Objects.equals(previous.getWorkers(), current.getWorkers())) {
            sections.add("workers");
        }
        if (!Objects.equals(previous.getMetrics(), current.getMetrics())) {
            sections.add("metrics");
        }
        boolean hostsChanged = !Objects.equals(previous.getHosts(), current.getHosts());
        return new ConfigChange(previous, current, hostsChanged, sections);
    }

    /**
     * True when the new document is semantically identical to the previous one.
     */
    public boolean isEmpty() {
        return !hostsChanged && restartRequiredSections.isEmpty();
    }
}
