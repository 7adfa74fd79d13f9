package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.NormalizedHostWeight;

import java.util.List;

/**
 * Builds a {@link HashingTable} from the normalized weights of one priority level.
 *
 * Called on the control thread for every rebuild; implementations must return a table
 * that never changes after construction.
 */
@FunctionalInterface
public interface HashingTableBuilder {

    /**
     * Creates a table for the given hosts.
     *
     * @param normalizedHostWeights Hosts with weights summing to 1, never empty
     * @param minNormalizedWeight   Smallest weight in {@code normalizedHostWeights}
     * @param maxNormalizedWeight   Largest weight in {@code normalizedHostWeights}
     */
    HashingTable createLoadBalancer(
            List<NormalizedHostWeight> normalizedHostWeights,
            double minNormalizedWeight,
            double maxNormalizedWeight
    );
}
