package fr.lapetina.hashlb.domain.model;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Per-request inputs to host selection.
 *
 * The hash is computed upstream (from headers, cookies, source address...) and is
 * opaque to the load balancer.
 */
public interface LoadBalancerContext {

    /**
     * Returns the precomputed 64-bit request hash, or empty when the request carries none.
     */
    OptionalLong computeHashKey();

    /**
     * Returns the address of a host the caller wants to reach directly, bypassing hashing.
     */
    default Optional<String> overrideHostAddress() {
        return Optional.empty();
    }

    /**
     * Number of extra attempts allowed when {@link #shouldSelectAnotherHost(Host)} rejects a host.
     */
    default int hostSelectionRetryCount() {
        return 0;
    }

    /**
     * Lets the caller reject a candidate (e.g. a host that already failed this request).
     */
    default boolean shouldSelectAnotherHost(Host host) {
        return false;
    }
}
