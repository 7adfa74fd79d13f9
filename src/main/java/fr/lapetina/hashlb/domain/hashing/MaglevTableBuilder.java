package fr.lapetina.hashlb.domain.hashing;

import com.google.common.math.LongMath;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeight;

import java.util.List;
import java.util.Objects;

/**
 * Builds {@link MaglevTable} instances.
 */
public final class MaglevTableBuilder implements HashingTableBuilder {

    private final HashKeyPolicy hashKeyPolicy;
    private final long tableSize;

    public MaglevTableBuilder(HashKeyPolicy hashKeyPolicy, long tableSize) {
        this.hashKeyPolicy = Objects.requireNonNull(hashKeyPolicy, "hashKeyPolicy");
        if (tableSize < 2 || tableSize > Integer.MAX_VALUE || !LongMath.isPrime(tableSize)) {
            throw new IllegalArgumentException("Maglev table size must be a prime number: " + tableSize);
        }
        this.tableSize = tableSize;
    }

    public MaglevTableBuilder(HashingTableOptions options) {
        this(options.hashKeyPolicy(), options.maglevTableSize());
    }

    @Override
    public MaglevTable createLoadBalancer(
            List<NormalizedHostWeight> normalizedHostWeights,
            double minNormalizedWeight,
            double maxNormalizedWeight
    ) {
        return new MaglevTable(normalizedHostWeights, maxNormalizedWeight, tableSize, hashKeyPolicy);
    }
}
