package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.hashing.HashingTable;

/**
 * Hashing table of one priority level together with its panic flag.
 *
 * @param table       Table to select from, null when the level had no eligible host
 * @param globalPanic True iff the level had no host at the last rebuild
 */
public record PerPriorityState(HashingTable table, boolean globalPanic) {

    private static final PerPriorityState PANIC = new PerPriorityState(null, true);

    public static PerPriorityState panic() {
        return PANIC;
    }

    public static PerPriorityState of(HashingTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Table is required outside of panic");
        }
        return new PerPriorityState(table, false);
    }

    public boolean isUsable() {
        return table != null && !globalPanic;
    }
}
