package fr.lapetina.hashlb.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration object for the load balancer.
 * Designed to be populated from YAML. Sections compare by value so reloads can be diffed.
 */
public class LoadBalancerConfig {

    private List<HostConfig> hosts = new ArrayList<>();
    private HashingConfig hashing = new HashingConfig();
    private PriorityConfig priority = new PriorityConfig();
    private WorkersConfig workers = new WorkersConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<HostConfig> getHosts() { return hosts; }
    public void setHosts(List<HostConfig> hosts) { this.hosts = hosts; }

    public HashingConfig getHashing() { return hashing; }
    public void setHashing(HashingConfig hashing) { this.hashing = hashing; }

    public PriorityConfig getPriority() { return priority; }
    public void setPriority(PriorityConfig priority) { this.priority = priority; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Individual upstream host configuration.
     */
    public static class HostConfig {
        private String address;
        private String hostname;
        private int weight = 1;
        private int priority = 0;
        private String health = "HEALTHY";
        private Map<String, Map<String, Object>> metadata = new LinkedHashMap<>();

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public String getHostname() { return hostname; }
        public void setHostname(String hostname) { this.hostname = hostname; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public String getHealth() { return health; }
        public void setHealth(String health) { this.health = health; }

        public Map<String, Map<String, Object>> getMetadata() { return metadata; }
        public void setMetadata(Map<String, Map<String, Object>> metadata) { this.metadata = metadata; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            HostConfig that = (HostConfig) o;
            return Objects.equals(address, that.address)
                    && Objects.equals(hostname, that.hostname)
                    && weight == that.weight
                    && priority == that.priority
                    && Objects.equals(health, that.health)
                    && Objects.equals(metadata, that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(address, hostname, weight, priority, health, metadata);
        }
    }

    /**
     * Hashing table configuration.
     */
    public static class HashingConfig {
        private String type = "ring-hash";
        private int hashBalanceFactor = 100;
        private boolean useHostnameForHashing = false;
        private HashKeyMetadataConfig hashKeyMetadata = new HashKeyMetadataConfig();
        private RingHashConfig ringHash = new RingHashConfig();
        private MaglevConfig maglev = new MaglevConfig();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getHashBalanceFactor() { return hashBalanceFactor; }
        public void setHashBalanceFactor(int hashBalanceFactor) { this.hashBalanceFactor = hashBalanceFactor; }

        public boolean isUseHostnameForHashing() { return useHostnameForHashing; }
        public void setUseHostnameForHashing(boolean useHostnameForHashing) { this.useHostnameForHashing = useHostnameForHashing; }

        public HashKeyMetadataConfig getHashKeyMetadata() { return hashKeyMetadata; }
        public void setHashKeyMetadata(HashKeyMetadataConfig hashKeyMetadata) { this.hashKeyMetadata = hashKeyMetadata; }

        public RingHashConfig getRingHash() { return ringHash; }
        public void setRingHash(RingHashConfig ringHash) { this.ringHash = ringHash; }

        public MaglevConfig getMaglev() { return maglev; }
        public void setMaglev(MaglevConfig maglev) { this.maglev = maglev; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            HashingConfig that = (HashingConfig) o;
            return Objects.equals(type, that.type)
                    && hashBalanceFactor == that.hashBalanceFactor
                    && useHostnameForHashing == that.useHostnameForHashing
                    && Objects.equals(hashKeyMetadata, that.hashKeyMetadata)
                    && Objects.equals(ringHash, that.ringHash)
                    && Objects.equals(maglev, that.maglev);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, hashBalanceFactor, useHostnameForHashing, hashKeyMetadata, ringHash, maglev);
        }
    }

    /**
     * Location of the per-host hash key override in host metadata.
     */
    public static class HashKeyMetadataConfig {
        private String namespace = "lb";
        private String key = "hash_key";

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            HashKeyMetadataConfig that = (HashKeyMetadataConfig) o;
            return Objects.equals(namespace, that.namespace)
                    && Objects.equals(key, that.key);
        }

        @Override
        public int hashCode() {
            return Objects.hash(namespace, key);
        }
    }

    /**
     * Ring hash sizing.
     */
    public static class RingHashConfig {
        private long minimumRingSize = 1024;
        private long maximumRingSize = 8 * 1024 * 1024;

        public long getMinimumRingSize() { return minimumRingSize; }
        public void setMinimumRingSize(long minimumRingSize) { this.minimumRingSize = minimumRingSize; }

        public long getMaximumRingSize() { return maximumRingSize; }
        public void setMaximumRingSize(long maximumRingSize) { this.maximumRingSize = maximumRingSize; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            RingHashConfig that = (RingHashConfig) o;
            return minimumRingSize == that.minimumRingSize
                    && maximumRingSize == that.maximumRingSize;
        }

        @Override
        public int hashCode() {
            return Objects.hash(minimumRingSize, maximumRingSize);
        }
    }

    /**
     * Maglev sizing.
     */
    public static class MaglevConfig {
        private long tableSize = 65537;

        public long getTableSize() { return tableSize; }
        public void setTableSize(long tableSize) { this.tableSize = tableSize; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MaglevConfig that = (MaglevConfig) o;
            return tableSize == that.tableSize;
        }

        @Override
        public int hashCode() {
            return Objects.hash(tableSize);
        }
    }

    /**
     * Priority load configuration.
     */
    public static class PriorityConfig {
        private int overprovisioningFactor = 140;

        public int getOverprovisioningFactor() { return overprovisioningFactor; }
        public void setOverprovisioningFactor(int overprovisioningFactor) { this.overprovisioningFactor = overprovisioningFactor; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            PriorityConfig that = (PriorityConfig) o;
            return overprovisioningFactor == that.overprovisioningFactor;
        }

        @Override
        public int hashCode() {
            return Objects.hash(overprovisioningFactor);
        }
    }

    /**
     * Selection workers and LMAX Disruptor configuration.
     */
    public static class WorkersConfig {
        private int count = 4;
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            WorkersConfig that = (WorkersConfig) o;
            return count == that.count
                    && ringBufferSize == that.ringBufferSize
                    && Objects.equals(waitStrategy, that.waitStrategy);
        }

        @Override
        public int hashCode() {
            return Objects.hash(count, ringBufferSize, waitStrategy);
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "hash_lb";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MetricsConfig that = (MetricsConfig) o;
            return Objects.equals(prefix, that.prefix);
        }

        @Override
        public int hashCode() {
            return Objects.hash(prefix);
        }
    }
}
