package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maglev lookup table.
 * <p>
 * Every host walks its own permutation of the table slots, defined by an offset and a
 * skip derived from two independent hashes of its hash key. Hosts take turns claiming
 * their next free slot until the table is full; a host whose weight is a fraction of
 * the largest weight takes its turn on that fraction of the rounds.
 * </p>
 * <p>
 * The table size must be prime so every permutation visits all slots.
 * </p>
 * <p>
 * <b>Thread-safety:</b> immutable after construction; safe for concurrent reads.
 * </p>
 */
public final class MaglevTable implements HashingTable {

    public static final long DEFAULT_TABLE_SIZE = 65537;

    private static final Logger log = LoggerFactory.getLogger(MaglevTable.class);

    private final Host[] table;
    private final int distinctHosts;

    public MaglevTable(
            List<NormalizedHostWeight> normalizedHostWeights,
            double maxNormalizedWeight,
            long tableSize,
            HashKeyPolicy hashKeyPolicy
    ) {
        this.distinctHosts = normalizedHostWeights.size();
        if (normalizedHostWeights.isEmpty()) {
            this.table = new Host[0];
            return;
        }

        List<BuildEntry> buildEntries = new ArrayList<>(normalizedHostWeights.size());
        for (NormalizedHostWeight hostWeight : normalizedHostWeights) {
            String key = hashKeyPolicy.hashKey(hostWeight.host());
            long offset = Long.remainderUnsigned(Hashers.hash64(key), tableSize);
            long skip = Long.remainderUnsigned(Hashers.secondaryHash64(key), tableSize - 1) + 1;
            buildEntries.add(new BuildEntry(hostWeight.host(), offset, skip, hostWeight.weight()));
        }

        this.table = new Host[(int) tableSize];
        long filled = 0;
        for (long iteration = 1; filled < tableSize; iteration++) {
            for (int i = 0; i < buildEntries.size() && filled < tableSize; i++) {
                BuildEntry entry = buildEntries.get(i);
                // A host with the largest weight claims a slot every round, one with a
                // third of it every third round.
                if (iteration * entry.weight < entry.targetWeight) {
                    continue;
                }
                entry.targetWeight += maxNormalizedWeight;

                int slot = entry.permutation(tableSize);
                while (table[slot] != null) {
                    entry.next++;
                    slot = entry.permutation(tableSize);
                }
                table[slot] = entry.host;
                entry.next++;
                entry.count++;
                filled++;
            }
        }

        if (log.isDebugEnabled()) {
            for (BuildEntry entry : buildEntries) {
                log.debug("Maglev slots: host={}, weight={}, slots={}",
                        entry.host.getAddress(), entry.weight, entry.count);
            }
        }
    }

    @Override
    public Host chooseHost(long hash, int attempt) {
        if (table.length == 0) {
            return null;
        }
        int start = (int) Long.remainderUnsigned(hash, table.length);
        return TableProbes.nthDistinctHost(table, start, attempt, distinctHosts);
    }

    public int getTableSize() {
        return table.length;
    }

    private static final class BuildEntry {
        private final Host host;
        private final long offset;
        private final long skip;
        private final double weight;
        private double targetWeight;
        private long next;
        private long count;

        BuildEntry(Host host, long offset, long skip, double weight) {
            this.host = host;
            this.offset = offset;
            this.skip = skip;
            this.weight = weight;
        }

        int permutation(long tableSize) {
            return (int) ((offset + skip * (next % tableSize)) % tableSize);
        }
    }
}
