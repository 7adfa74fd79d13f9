package fr.lapetina.hashlb.domain.model;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable {@link LoadBalancerContext} carried through the selection pipeline.
 *
 * @param requestId       Identifier used for logging
 * @param hashKey         Precomputed request hash, empty for hash-less requests
 * @param overrideHost    Address of a directly requested host, or null
 * @param retryCount      Extra attempts when a candidate is in {@code excludedHosts}
 * @param excludedHosts   Addresses the caller does not want (previous attempts)
 */
public record SelectionContext(
        String requestId,
        OptionalLong hashKey,
        String overrideHost,
        int retryCount,
        Set<String> excludedHosts
) implements LoadBalancerContext {

    public SelectionContext {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (hashKey == null) {
            hashKey = OptionalLong.empty();
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must not be negative: " + retryCount);
        }
        excludedHosts = excludedHosts != null ? Set.copyOf(excludedHosts) : Set.of();
    }

    /**
     * Creates a context for a request with the given hash.
     */
    public static SelectionContext ofHash(long hash) {
        return new SelectionContext(null, OptionalLong.of(hash), null, 0, null);
    }

    /**
     * Creates a context for a request without a hash; selection falls back to a random value.
     */
    public static SelectionContext withoutHash() {
        return new SelectionContext(null, OptionalLong.empty(), null, 0, null);
    }

    /**
     * Creates a context asking for a specific host, with a hash used if the host is unknown.
     */
    public static SelectionContext ofOverride(String hostAddress, long hash) {
        return new SelectionContext(null, OptionalLong.of(hash), hostAddress, 0, null);
    }

    /**
     * Creates a context for a retried request that must avoid the given hosts.
     */
    public static SelectionContext ofRetry(long hash, int retryCount, Set<String> excludedHosts) {
        return new SelectionContext(null, OptionalLong.of(hash), null, retryCount, excludedHosts);
    }

    @Override
    public OptionalLong computeHashKey() {
        return hashKey;
    }

    @Override
    public Optional<String> overrideHostAddress() {
        return Optional.ofNullable(overrideHost);
    }

    @Override
    public int hostSelectionRetryCount() {
        return retryCount;
    }

    @Override
    public boolean shouldSelectAnotherHost(Host host) {
        return excludedHosts.contains(host.getAddress());
    }
}
