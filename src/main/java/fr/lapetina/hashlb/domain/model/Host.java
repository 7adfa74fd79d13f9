package fr.lapetina.hashlb.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents an upstream host of a cluster.
 *
 * Identity, weight, priority and metadata are fixed at construction. Health and the
 * active request counter are mutable and thread-safe; the load balancer only reads
 * them.
 */
public final class Host {
    private final String address;
    private final String hostname;
    private final int weight;
    private final int priority;
    private final Map<String, Map<String, Object>> metadata;

    // Mutable state - thread-safe
    private final AtomicReference<HostHealth> health;
    private final AtomicInteger activeRequests;

    private Host(Builder builder) {
        this.address = Objects.requireNonNull(builder.address, "Host address is required");
        this.hostname = builder.hostname == null ? "" : builder.hostname;
        if (builder.weight < 1) {
            throw new IllegalArgumentException("Host weight must be positive: " + builder.weight);
        }
        if (builder.priority < 0) {
            throw new IllegalArgumentException("Host priority must not be negative: " + builder.priority);
        }
        this.weight = builder.weight;
        this.priority = builder.priority;
        Map<String, Map<String, Object>> metadataCopy = new HashMap<>();
        builder.metadata.forEach((namespace, values) ->
                metadataCopy.put(namespace, Collections.unmodifiableMap(new HashMap<>(values))));
        this.metadata = Collections.unmodifiableMap(metadataCopy);
        this.health = new AtomicReference<>(builder.initialHealth);
        this.activeRequests = new AtomicInteger(0);
    }

    public String getAddress() {
        return address;
    }

    public String getHostname() {
        return hostname;
    }

    public int getWeight() {
        return weight;
    }

    public int getPriority() {
        return priority;
    }

    public Map<String, Map<String, Object>> getMetadata() {
        return metadata;
    }

    /**
     * Returns a single metadata value, or null when the namespace or key is absent.
     */
    public Object getMetadataValue(String namespace, String key) {
        Map<String, Object> values = metadata.get(namespace);
        return values == null ? null : values.get(key);
    }

    public HostHealth getHealth() {
        return health.get();
    }

    /**
     * Updates the health status.
     * @return the previous status
     */
    public HostHealth setHealth(HostHealth newHealth) {
        return health.getAndSet(Objects.requireNonNull(newHealth, "health"));
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    /**
     * Records the start of a request proxied to this host.
     */
    public int incrementActiveRequests() {
        return activeRequests.incrementAndGet();
    }

    /**
     * Records the completion of a request proxied to this host.
     */
    public int decrementActiveRequests() {
        return activeRequests.decrementAndGet();
    }

    /**
     * Whether {@code other} describes the same host: same address, hostname, weight,
     * priority and metadata. Health and the active request counter are not compared.
     */
    public boolean hasSameDefinition(Host other) {
        return other != null
                && address.equals(other.address)
                && hostname.equals(other.hostname)
                && weight == other.weight
                && priority == other.priority
                && metadata.equals(other.metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Host that = (Host) o;
        return address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return "Host{" +
                "address='" + address + '\'' +
                ", priority=" + priority +
                ", weight=" + weight +
                ", health=" + health.get() +
                ", active=" + activeRequests.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String address;
        private String hostname;
        private int weight = 1;
        private int priority = 0;
        private final Map<String, Map<String, Object>> metadata = new HashMap<>();
        private HostHealth initialHealth = HostHealth.HEALTHY;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder addMetadata(String namespace, String key, Object value) {
            this.metadata.computeIfAbsent(namespace, k -> new HashMap<>()).put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Map<String, Object>> metadata) {
            metadata.forEach((namespace, values) ->
                    this.metadata.computeIfAbsent(namespace, k -> new HashMap<>()).putAll(values));
            return this;
        }

        public Builder initialHealth(HostHealth health) {
            this.initialHealth = health;
            return this;
        }

        public Host build() {
            return new Host(this);
        }
    }
}
