package fr.lapetina.hashlb.domain.hashing;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of hashing table algorithms, looked up by the name used in configuration.
 */
public final class HashingTableBuilders {

    public static final String RING_HASH = "ring-hash";
    public static final String MAGLEV = "maglev";

    private static final Map<String, Function<HashingTableOptions, HashingTableBuilder>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        // Register built-in algorithms
        register(RING_HASH, RingHashTableBuilder::new);
        register(MAGLEV, MaglevTableBuilder::new);
    }

    private HashingTableBuilders() {
        // Utility class
    }

    /**
     * Registers a custom table algorithm.
     *
     * @param name    Algorithm name (used in configuration)
     * @param factory Creates a builder from the configured options
     */
    public static void register(String name, Function<HashingTableOptions, HashingTableBuilder> factory) {
        REGISTRY.put(name.toLowerCase(), factory);
    }

    /**
     * Creates a builder by algorithm name.
     *
     * @param name    Algorithm name from configuration
     * @param options Options handed to the builder
     * @return Builder, or empty if the name is not registered
     * @throws IllegalArgumentException if the options are invalid for the algorithm
     */
    public static Optional<HashingTableBuilder> create(String name, HashingTableOptions options) {
        Function<HashingTableOptions, HashingTableBuilder> factory = REGISTRY.get(name.toLowerCase());
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(options));
    }

    /**
     * Returns all registered algorithm names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
