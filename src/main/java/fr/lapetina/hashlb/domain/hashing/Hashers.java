package fr.lapetina.hashlb.domain.hashing;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable 64-bit hash functions used to place hosts in hashing tables.
 * <p>
 * Placement must be identical across processes and restarts so that every proxy
 * instance maps a request hash to the same host. Murmur3 is used for its
 * distribution quality; only the lower 64 bits of the 128-bit digest are kept.
 * </p>
 */
public final class Hashers {

    private static final HashFunction PRIMARY = Hashing.murmur3_128();
    private static final HashFunction SECONDARY = Hashing.murmur3_128(1);

    private Hashers() {
    }

    /**
     * Hashes a UTF-8 string with the primary seed.
     */
    public static long hash64(String key) {
        return PRIMARY.hashString(key, StandardCharsets.UTF_8).asLong();
    }

    /**
     * Hashes a UTF-8 string with a second, independent seed.
     */
    public static long secondaryHash64(String key) {
        return SECONDARY.hashString(key, StandardCharsets.UTF_8).asLong();
    }
}
