package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.NormalizedHostWeight;

import java.util.List;
import java.util.Objects;

/**
 * Builds {@link RingHashTable} instances.
 */
public final class RingHashTableBuilder implements HashingTableBuilder {

    private final HashKeyPolicy hashKeyPolicy;
    private final long minimumRingSize;
    private final long maximumRingSize;

    public RingHashTableBuilder(HashKeyPolicy hashKeyPolicy, long minimumRingSize, long maximumRingSize) {
        this.hashKeyPolicy = Objects.requireNonNull(hashKeyPolicy, "hashKeyPolicy");
        if (minimumRingSize < 1 || minimumRingSize > maximumRingSize
                || maximumRingSize > HashingTableOptions.DEFAULT_MAXIMUM_RING_SIZE) {
            throw new IllegalArgumentException(
                    "Ring sizes must satisfy 1 <= min <= max <= "
                            + HashingTableOptions.DEFAULT_MAXIMUM_RING_SIZE
                            + ": min=" + minimumRingSize + ", max=" + maximumRingSize);
        }
        this.minimumRingSize = minimumRingSize;
        this.maximumRingSize = maximumRingSize;
    }

    public RingHashTableBuilder(HashingTableOptions options) {
        this(options.hashKeyPolicy(), options.minimumRingSize(), options.maximumRingSize());
    }

    @Override
    public RingHashTable createLoadBalancer(
            List<NormalizedHostWeight> normalizedHostWeights,
            double minNormalizedWeight,
            double maxNormalizedWeight
    ) {
        return new RingHashTable(
                normalizedHostWeights, minNormalizedWeight, minimumRingSize, maximumRingSize, hashKeyPolicy);
    }
}
