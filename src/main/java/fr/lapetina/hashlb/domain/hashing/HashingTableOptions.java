package fr.lapetina.hashlb.domain.hashing;

import java.util.Objects;

/**
 * Settings shared by the built-in table builders.
 *
 * @param hashKeyPolicy    How hosts are identified when placed in a table
 * @param minimumRingSize  Ring hash: lower bound on ring entries
 * @param maximumRingSize  Ring hash: upper bound on ring entries
 * @param maglevTableSize  Maglev: table size, must be prime
 */
public record HashingTableOptions(
        HashKeyPolicy hashKeyPolicy,
        long minimumRingSize,
        long maximumRingSize,
        long maglevTableSize
) {

    public static final long DEFAULT_MINIMUM_RING_SIZE = 1024;
    public static final long DEFAULT_MAXIMUM_RING_SIZE = 8 * 1024 * 1024;

    public HashingTableOptions {
        Objects.requireNonNull(hashKeyPolicy, "hashKeyPolicy");
    }

    public static HashingTableOptions defaults() {
        return new HashingTableOptions(
                HashKeyPolicy.defaults(),
                DEFAULT_MINIMUM_RING_SIZE,
                DEFAULT_MAXIMUM_RING_SIZE,
                MaglevTable.DEFAULT_TABLE_SIZE);
    }
}
