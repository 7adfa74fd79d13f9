package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted consistent hash ring (ketama style).
 * <p>
 * <b>Construction:</b> the ring is scaled so the least weighted host receives a whole
 * number of entries, capped by the maximum ring size. Each host then receives
 * {@code scale * weight} entries, tracked as running sums over all hosts so that
 * fractional shares are distributed in a stable way. Entry {@code i} of a host is
 * placed at {@code hash(hashKey + "_" + i)}.
 * </p>
 * <p>
 * <b>Lookup:</b> a request hash maps to the first entry whose hash is greater than or
 * equal to it (unsigned), wrapping around to the first entry.
 * </p>
 * <p>
 * <b>Thread-safety:</b> immutable after construction; safe for concurrent reads.
 * </p>
 */
public final class RingHashTable implements HashingTable {

    private static final Logger log = LoggerFactory.getLogger(RingHashTable.class);

    private final long[] hashes;
    private final Host[] hosts;
    private final int distinctHosts;
    private final long minHashesPerHost;
    private final long maxHashesPerHost;

    public RingHashTable(
            List<NormalizedHostWeight> normalizedHostWeights,
            double minNormalizedWeight,
            long minRingSize,
            long maxRingSize,
            HashKeyPolicy hashKeyPolicy
    ) {
        this.distinctHosts = normalizedHostWeights.size();
        if (normalizedHostWeights.isEmpty()) {
            this.hashes = new long[0];
            this.hosts = new Host[0];
            this.minHashesPerHost = 0;
            this.maxHashesPerHost = 0;
            return;
        }

        final double scale = Math.min(
                Math.ceil(minNormalizedWeight * minRingSize) / minNormalizedWeight,
                (double) maxRingSize);
        final int ringSize = (int) Math.ceil(scale);

        List<RingEntry> entries = new ArrayList<>(ringSize);
        double currentHashes = 0.0;
        double targetHashes = 0.0;
        long minHashes = ringSize;
        long maxHashes = 0;

        for (NormalizedHostWeight entry : normalizedHostWeights) {
            Host host = entry.host();
            String keyPrefix = hashKeyPolicy.hashKey(host) + "_";

            targetHashes += scale * entry.weight();
            long i = 0;
            while (currentHashes < targetHashes) {
                entries.add(new RingEntry(Hashers.hash64(keyPrefix + i), host));
                i++;
                currentHashes++;
            }
            minHashes = Math.min(i, minHashes);
            maxHashes = Math.max(i, maxHashes);
        }

        entries.sort((a, b) -> Long.compareUnsigned(a.hash(), b.hash()));

        this.hashes = new long[entries.size()];
        this.hosts = new Host[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            hashes[i] = entries.get(i).hash();
            hosts[i] = entries.get(i).host();
        }
        this.minHashesPerHost = minHashes;
        this.maxHashesPerHost = maxHashes;

        log.debug("Built ring: entries={}, hosts={}, minHashesPerHost={}, maxHashesPerHost={}",
                hashes.length, distinctHosts, minHashes, maxHashes);
    }

    @Override
    public Host chooseHost(long hash, int attempt) {
        if (hashes.length == 0) {
            return null;
        }

        // First entry whose hash is >= the request hash, as unsigned values
        int low = 0;
        int high = hashes.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (Long.compareUnsigned(hashes[mid], hash) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        int index = low == hashes.length ? 0 : low;

        return TableProbes.nthDistinctHost(hosts, index, attempt, distinctHosts);
    }

    public int getRingSize() {
        return hashes.length;
    }

    public long getMinHashesPerHost() {
        return minHashesPerHost;
    }

    public long getMaxHashesPerHost() {
        return maxHashesPerHost;
    }

    private record RingEntry(long hash, Host host) {
    }
}
