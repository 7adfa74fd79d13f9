package fr.lapetina.hashlb.domain.hashing;

import fr.lapetina.hashlb.domain.model.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides which string identifies a host when placing it in a hashing table.
 *
 * <p>In order of precedence:
 * <ol>
 *   <li>a non-empty string stored in the host metadata under
 *       {@code metadataNamespace}/{@code metadataKey}</li>
 *   <li>the hostname, when {@code useHostname} is set and the host has one</li>
 *   <li>the address</li>
 * </ol>
 *
 * A metadata value of any other type is logged and ignored.
 *
 * @param useHostname       Prefer hostnames over addresses
 * @param metadataNamespace Metadata namespace holding the override
 * @param metadataKey       Key of the override inside the namespace
 */
public record HashKeyPolicy(boolean useHostname, String metadataNamespace, String metadataKey) {

    public static final String DEFAULT_METADATA_NAMESPACE = "lb";
    public static final String DEFAULT_METADATA_KEY = "hash_key";

    private static final Logger log = LoggerFactory.getLogger(HashKeyPolicy.class);

    public HashKeyPolicy {
        Objects.requireNonNull(metadataNamespace, "metadataNamespace");
        Objects.requireNonNull(metadataKey, "metadataKey");
        if (metadataNamespace.isBlank() || metadataKey.isBlank()) {
            throw new IllegalArgumentException("Hash key metadata namespace and key must not be blank");
        }
    }

    /**
     * Address-based keys with the default metadata location.
     */
    public static HashKeyPolicy defaults() {
        return new HashKeyPolicy(false, DEFAULT_METADATA_NAMESPACE, DEFAULT_METADATA_KEY);
    }

    /**
     * Returns the string to hash for the given host. Never empty.
     */
    public String hashKey(Host host) {
        Object override = host.getMetadataValue(metadataNamespace, metadataKey);
        if (override instanceof String key && !key.isEmpty()) {
            return key;
        }
        if (override != null && !(override instanceof String)) {
            log.warn("Ignoring hash key metadata of type {} on host {}: {}/{} must be a string",
                    override.getClass().getSimpleName(), host.getAddress(), metadataNamespace, metadataKey);
        }

        if (useHostname && !host.getHostname().isEmpty()) {
            return host.getHostname();
        }
        return host.getAddress();
    }
}
