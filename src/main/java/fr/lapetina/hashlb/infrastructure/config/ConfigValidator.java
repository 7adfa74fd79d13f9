package fr.lapetina.hashlb.infrastructure.config;

import com.google.common.math.LongMath;
import fr.lapetina.hashlb.domain.hashing.HashingTableBuilders;
import fr.lapetina.hashlb.domain.hashing.HashingTableOptions;
import fr.lapetina.hashlb.domain.model.HostHealth;
import fr.lapetina.hashlb.infrastructure.config.ConfigLoader.ConfigurationException;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects configurations the load balancer cannot be activated with.
 */
public final class ConfigValidator {

    public static final int MAX_HOST_WEIGHT = 128;

    private static final Set<String> WAIT_STRATEGIES = Set.of("blocking", "yielding", "busy-spin", "sleeping");

    private ConfigValidator() {
    }

    /**
     * @return the given configuration, for chaining
     * @throws ConfigurationException describing the first invalid setting
     */
    public static LoadBalancerConfig validate(LoadBalancerConfig config) {
        validateHosts(config);
        validateHashing(config.getHashing());

        if (config.getPriority() == null || config.getPriority().getOverprovisioningFactor() <= 0) {
            throw new ConfigurationException("priority.overprovisioningFactor must be positive");
        }

        LoadBalancerConfig.WorkersConfig workers = config.getWorkers();
        if (workers == null || workers.getCount() < 1) {
            throw new ConfigurationException("workers.count must be at least 1");
        }
        if (workers.getRingBufferSize() < 1 || Integer.bitCount(workers.getRingBufferSize()) != 1) {
            throw new ConfigurationException(
                    "workers.ringBufferSize must be a power of 2: " + workers.getRingBufferSize());
        }
        if (workers.getWaitStrategy() == null
                || !WAIT_STRATEGIES.contains(workers.getWaitStrategy().toLowerCase(Locale.ROOT))) {
            throw new ConfigurationException("Unknown workers.waitStrategy: " + workers.getWaitStrategy());
        }

        if (config.getMetrics() == null || isBlank(config.getMetrics().getPrefix())) {
            throw new ConfigurationException("metrics.prefix must not be blank");
        }
        return config;
    }

    private static void validateHosts(LoadBalancerConfig config) {
        if (config.getHosts() == null) {
            throw new ConfigurationException("hosts must be a list");
        }
        Set<String> addresses = new HashSet<>();
        for (LoadBalancerConfig.HostConfig host : config.getHosts()) {
            if (isBlank(host.getAddress())) {
                throw new ConfigurationException("Host address is required");
            }
            if (!addresses.add(host.getAddress())) {
                throw new ConfigurationException("Duplicate host address: " + host.getAddress());
            }
            if (host.getWeight() < 1 || host.getWeight() > MAX_HOST_WEIGHT) {
                throw new ConfigurationException("Host " + host.getAddress()
                        + " weight must be within 1.." + MAX_HOST_WEIGHT + ": " + host.getWeight());
            }
            if (host.getPriority() < 0) {
                throw new ConfigurationException(
                        "Host " + host.getAddress() + " priority must not be negative: " + host.getPriority());
            }
            parseHealth(host);
        }
    }

    private static void validateHashing(LoadBalancerConfig.HashingConfig hashing) {
        if (hashing == null) {
            throw new ConfigurationException("hashing section is required");
        }
        if (hashing.getHashBalanceFactor() < 100) {
            throw new ConfigurationException(
                    "hashing.hashBalanceFactor must be at least 100: " + hashing.getHashBalanceFactor());
        }
        LoadBalancerConfig.HashKeyMetadataConfig metadata = hashing.getHashKeyMetadata();
        if (metadata == null || isBlank(metadata.getNamespace()) || isBlank(metadata.getKey())) {
            throw new ConfigurationException("hashing.hashKeyMetadata namespace and key must not be blank");
        }

        boolean known = false;
        if (hashing.getType() != null) {
            String type = hashing.getType().toLowerCase(Locale.ROOT);
            for (String name : HashingTableBuilders.getRegisteredNames()) {
                known |= name.equals(type);
            }
        }
        if (!known) {
            throw new ConfigurationException("Unknown hashing.type: " + hashing.getType());
        }

        LoadBalancerConfig.RingHashConfig ring = hashing.getRingHash();
        if (ring == null
                || ring.getMinimumRingSize() < 1
                || ring.getMinimumRingSize() > ring.getMaximumRingSize()
                || ring.getMaximumRingSize() > HashingTableOptions.DEFAULT_MAXIMUM_RING_SIZE) {
            throw new ConfigurationException("hashing.ringHash sizes must satisfy 1 <= minimumRingSize <= maximumRingSize <= "
                    + HashingTableOptions.DEFAULT_MAXIMUM_RING_SIZE);
        }

        LoadBalancerConfig.MaglevConfig maglev = hashing.getMaglev();
        if (maglev == null
                || maglev.getTableSize() < 2
                || maglev.getTableSize() > Integer.MAX_VALUE
                || !LongMath.isPrime(maglev.getTableSize())) {
            throw new ConfigurationException("hashing.maglev.tableSize must be a prime number: "
                    + (maglev == null ? null : maglev.getTableSize()));
        }
    }

    /**
     * Parses the configured health of a host, case-insensitively.
     */
    public static HostHealth parseHealth(LoadBalancerConfig.HostConfig host) {
        if (host.getHealth() == null) {
            return HostHealth.HEALTHY;
        }
        try {
            return HostHealth.valueOf(host.getHealth().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Host " + host.getAddress() + " has unknown health: " + host.getHealth(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
