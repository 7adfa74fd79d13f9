package fr.lapetina.hashlb.domain.priority;

import fr.lapetina.hashlb.domain.model.HostSet;

import java.util.List;

/**
 * Splits traffic between priority levels from their health.
 *
 * <p>Each level advertises an availability of {@code overprovisioningFactor * healthy / total}
 * percent (capped at 100), and likewise for its degraded hosts. Traffic fills the healthy
 * availability of the levels in order, then their degraded availability. When no level has
 * any availability at all the calculator enters total panic and spreads traffic by host
 * count.
 */
public final class PriorityLoadCalculator {

    public static final int DEFAULT_OVERPROVISIONING_FACTOR = 140;

    private final int overprovisioningFactor;

    public PriorityLoadCalculator() {
        this(DEFAULT_OVERPROVISIONING_FACTOR);
    }

    public PriorityLoadCalculator(int overprovisioningFactor) {
        if (overprovisioningFactor <= 0) {
            throw new IllegalArgumentException("Overprovisioning factor must be positive: " + overprovisioningFactor);
        }
        this.overprovisioningFactor = overprovisioningFactor;
    }

    /**
     * Healthy and degraded load vectors, one entry per priority.
     */
    public record Loads(PriorityLoad healthy, PriorityLoad degraded) {
    }

    public Loads calculate(List<HostSet> hostSets) {
        final int levels = hostSets.size();
        int[] healthAvailability = new int[levels];
        int[] degradedAvailability = new int[levels];
        int totalAvailability = 0;

        for (int i = 0; i < levels; i++) {
            HostSet hostSet = hostSets.get(i);
            int total = hostSet.hosts().size();
            if (total > 0) {
                healthAvailability[i] = (int) Math.min(100L,
                        (long) overprovisioningFactor * hostSet.healthyHosts().size() / total);
                degradedAvailability[i] = (int) Math.min(100L,
                        (long) overprovisioningFactor * hostSet.degradedHosts().size() / total);
            }
            totalAvailability += Math.min(100, healthAvailability[i] + degradedAvailability[i]);
        }
        final int normalizedTotalAvailability = Math.min(100, totalAvailability);

        int[] healthyLoad = new int[levels];
        int[] degradedLoad = new int[levels];

        if (normalizedTotalAvailability == 0) {
            distributeByHostCount(hostSets, healthyLoad);
            return new Loads(PriorityLoad.of(healthyLoad), PriorityLoad.of(degradedLoad));
        }

        int[] firstHealthy = distributeLoad(healthyLoad, healthAvailability, 100, normalizedTotalAvailability);
        int[] firstDegraded = distributeLoad(
                degradedLoad, degradedAvailability, firstHealthy[1], normalizedTotalAvailability);
        int remaining = firstDegraded[1];
        if (remaining > 0) {
            if (firstHealthy[0] >= 0) {
                healthyLoad[firstHealthy[0]] += remaining;
            } else {
                degradedLoad[firstDegraded[0]] += remaining;
            }
        }
        return new Loads(PriorityLoad.of(healthyLoad), PriorityLoad.of(degradedLoad));
    }

    public int getOverprovisioningFactor() {
        return overprovisioningFactor;
    }

    /**
     * Fills {@code load} from {@code availability}. Returns the first level with any
     * availability (or -1) and the load left over.
     */
    private static int[] distributeLoad(int[] load, int[] availability, int totalLoad, int normalizedTotalAvailability) {
        int firstAvailable = -1;
        for (int i = 0; i < availability.length; i++) {
            if (availability[i] > 0 && firstAvailable == -1) {
                firstAvailable = i;
            }
            load[i] = Math.min(totalLoad, availability[i] * 100 / normalizedTotalAvailability);
            totalLoad -= load[i];
        }
        return new int[]{firstAvailable, totalLoad};
    }

    private static void distributeByHostCount(List<HostSet> hostSets, int[] healthyLoad) {
        int totalHosts = 0;
        for (HostSet hostSet : hostSets) {
            totalHosts += hostSet.hosts().size();
        }
        if (totalHosts == 0) {
            return;
        }
        int remaining = 100;
        int firstNonEmpty = -1;
        for (int i = 0; i < hostSets.size(); i++) {
            int hosts = hostSets.get(i).hosts().size();
            if (hosts > 0 && firstNonEmpty == -1) {
                firstNonEmpty = i;
            }
            healthyLoad[i] = 100 * hosts / totalHosts;
            remaining -= healthyLoad[i];
        }
        healthyLoad[firstNonEmpty] += remaining;
    }
}
