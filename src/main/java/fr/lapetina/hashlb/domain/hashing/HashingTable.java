package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;

/**
 * Immutable lookup structure mapping a request hash to a host.
 *
 * Implementations are built once per membership change and then shared by every
 * worker thread, so they must be safe for unsynchronized concurrent reads.
 */
public interface HashingTable {

    /**
     * Selects the host for a request hash.
     *
     * <p>For a fixed table, {@code chooseHost(h, 0)} always returns the same host.
     * For {@code attempt > 0} the returned host differs from the ones returned for
     * attempts {@code 0..attempt-1} as long as the table holds enough distinct hosts.
     *
     * @param hash    64-bit request hash, compared as unsigned
     * @param attempt Zero-based selection attempt
     * @return Selected host, or null when the table is empty
     */
    Host chooseHost(long hash, int attempt);
}
