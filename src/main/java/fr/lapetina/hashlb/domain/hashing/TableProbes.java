package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;

/**
 * Alternate-host lookup shared by the slot-based tables. Allocation-free; it runs on the
 * selection hot path for every retry and bounded-load probe.
 */
final class TableProbes {

    private TableProbes() {
    }

    /**
     * Walks the slots forward from {@code start} and returns the {@code attempt}-th
     * distinct host met (attempt 0 being the host at {@code start}).
     *
     * <p>When the table holds at most {@code attempt} distinct hosts, falls back to the
     * slot {@code (start + attempt) mod size}.
     */
    static Host nthDistinctHost(Host[] slots, int start, int attempt, int distinctHosts) {
        int size = slots.length;
        if (attempt == 0) {
            return slots[start];
        }
        if (attempt >= distinctHosts) {
            return slots[slot(start, attempt, size)];
        }

        int found = 0;
        Host previous = null;
        for (int step = 0; step < size; step++) {
            Host candidate = slots[slot(start, step, size)];
            // Runs of the same host are the common case, no rescan needed for them
            boolean seen = candidate == previous || seenBefore(slots, start, step, candidate);
            previous = candidate;
            if (seen) {
                continue;
            }
            if (found == attempt) {
                return candidate;
            }
            found++;
        }
        return slots[slot(start, attempt, size)];
    }

    /**
     * Whether {@code candidate} occupies one of the {@code steps} slots walked from {@code start}.
     */
    private static boolean seenBefore(Host[] slots, int start, int steps, Host candidate) {
        for (int step = 0; step < steps; step++) {
            Host walked = slots[slot(start, step, slots.length)];
            if (walked == candidate || walked.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static int slot(int start, long offset, int size) {
        return (int) ((start + offset) % size);
    }
}
