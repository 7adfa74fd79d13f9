package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.NormalizedHostWeights;

import java.util.Map;
import java.util.Objects;

/**
 * Consistent hashing with bounded loads, layered over any {@link HashingTable}.
 *
 * <p>Each host may carry at most {@code hashBalanceFactor / 100} times its
 * weight-proportional share of the requests currently active on the table's hosts.
 * When the host picked for a hash is above that bound, the next attempts of the
 * wrapped table are probed, up to one per distinct host, and the first host within
 * its bound wins. If every probe is overloaded the originally picked host is returned:
 * the bound steers traffic, it never refuses it.
 *
 * <p>A factor of 100 disables bounding and makes this a pass-through.
 *
 * <p>The only state is the immutable weight table; active request counts are read live
 * from the hosts. Safe for concurrent use without synchronization.
 */
public class BoundedLoadHashingTable implements HashingTable {

    public static final int DISABLED_BALANCE_FACTOR = 100;

    private final HashingTable delegate;
    private final Map<Host, Double> normalizedHostWeightMap;
    private final Host[] hosts;
    private final int hashBalanceFactor;

    public BoundedLoadHashingTable(
            HashingTable delegate,
            NormalizedHostWeights normalizedHostWeights,
            int hashBalanceFactor
    ) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (hashBalanceFactor < DISABLED_BALANCE_FACTOR) {
            throw new IllegalArgumentException(
                    "Hash balance factor must be at least " + DISABLED_BALANCE_FACTOR + ": " + hashBalanceFactor);
        }
        this.hashBalanceFactor = hashBalanceFactor;
        this.hosts = new Host[normalizedHostWeights.size()];
        for (int i = 0; i < hosts.length; i++) {
            hosts[i] = normalizedHostWeights.weights().get(i).host();
        }
        this.normalizedHostWeightMap = normalizedHostWeights.toMap();
    }

    @Override
    public Host chooseHost(long hash, int attempt) {
        Host candidate = delegate.chooseHost(hash, attempt);
        if (candidate == null || hashBalanceFactor == DISABLED_BALANCE_FACTOR) {
            return candidate;
        }
        if (hostOverloadFactor(candidate, weightOf(candidate)) <= 1.0) {
            return candidate;
        }

        final int maxAttempts = hosts.length;
        for (int probe = 1; probe < maxAttempts; probe++) {
            Host alternate = delegate.chooseHost(hash, attempt + probe);
            if (alternate == null) {
                break;
            }
            if (hostOverloadFactor(alternate, weightOf(alternate)) <= 1.0) {
                return alternate;
            }
        }
        return candidate;
    }

    /**
     * Ratio of a host's active requests to the slots it is allowed.
     *
     * <p>The allowance is computed over all active requests of the table's hosts plus the
     * request being routed: {@code totalSlots = ceil((active + 1) * factor / 100)} and the
     * host gets {@code max(ceil(totalSlots * weight), 1)} of them. Values above 1.0 mean
     * the host is overloaded.
     */
    protected double hostOverloadFactor(Host host, double weight) {
        long overallActive = 0;
        for (Host member : hosts) {
            overallActive += Math.max(member.getActiveRequests(), 0);
        }
        long totalSlots = ((overallActive + 1) * hashBalanceFactor + 99) / 100;
        long slots = Math.max((long) Math.ceil(totalSlots * weight), 1L);
        return (double) host.getActiveRequests() / slots;
    }

    public int getHashBalanceFactor() {
        return hashBalanceFactor;
    }

    public HashingTable getDelegate() {
        return delegate;
    }

    private double weightOf(Host host) {
        Double weight = normalizedHostWeightMap.get(host);
        return weight == null ? 0.0 : weight;
    }
}
