package fr.lapetina.hashlb;

import fr.lapetina.hashlb.disruptor.SelectionPipeline;
import fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer;
import fr.lapetina.hashlb.domain.hashing.HashKeyPolicy;
import fr.lapetina.hashlb.domain.hashing.HashingTableBuilder;
import fr.lapetina.hashlb.domain.hashing.HashingTableBuilders;
import fr.lapetina.hashlb.domain.hashing.HashingTableOptions;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.LoadBalancerContext;
import fr.lapetina.hashlb.domain.priority.PriorityLoadCalculator;
import fr.lapetina.hashlb.infrastructure.config.ConfigChange;
import fr.lapetina.hashlb.infrastructure.config.ConfigLoader;
import fr.lapetina.hashlb.infrastructure.config.ConfigValidator;
import fr.lapetina.hashlb.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.hashlb.infrastructure.membership.PrioritySet;
import fr.lapetina.hashlb.infrastructure.metrics.LoadBalancerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fully-wired load balancer created from configuration.
 * This is the primary entry point of the library.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClusterLoadBalancer lb = ClusterLoadBalancer.create("config.yaml").start()) {
 *     Optional<Host> host = lb.select(SelectionContext.ofHash(hash)).get();
 * }
 * }</pre>
 */
public class ClusterLoadBalancer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterLoadBalancer.class);

    private final ConfigLoader configLoader;
    private final LoadBalancerConfig config;
    private final LoadBalancerStats stats;
    private final PrioritySet prioritySet;
    private final ThreadAwareLoadBalancer loadBalancer;
    private final SelectionPipeline pipeline;

    protected ClusterLoadBalancer(String configPath) {
        log.info("Initializing ClusterLoadBalancer from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.stats = new LoadBalancerStats(config.getMetrics().getPrefix());

        this.prioritySet = new PrioritySet();
        prioritySet.replaceAll(toHosts(config));

        HashingTableOptions options = toTableOptions(config.getHashing());
        HashingTableBuilder tableBuilder = HashingTableBuilders.create(config.getHashing().getType(), options)
                .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                        "Unknown hashing.type: " + config.getHashing().getType()));
        log.info("Using hashing table: {}", config.getHashing().getType());

        this.loadBalancer = ThreadAwareLoadBalancer.builder()
                .prioritySet(prioritySet)
                .tableBuilder(tableBuilder)
                .hashBalanceFactor(config.getHashing().getHashBalanceFactor())
                .loadCalculator(new PriorityLoadCalculator(config.getPriority().getOverprovisioningFactor()))
                .stats(stats)
                .build();
        loadBalancer.initialize();

        this.pipeline = SelectionPipeline.builder()
                .fromConfig(config)
                .loadBalancer(loadBalancer)
                .stats(stats)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("ClusterLoadBalancer initialized with {} hosts", prioritySet.size());
    }

    /**
     * Creates a load balancer from the specified configuration file.
     */
    public static ClusterLoadBalancer create(String configPath) {
        return new ClusterLoadBalancer(configPath);
    }

    /**
     * Creates a load balancer from the default configuration (config.yaml).
     */
    public static ClusterLoadBalancer create() {
        return create("config.yaml");
    }

    /**
     * Starts the selection workers and configuration hot reload.
     */
    public ClusterLoadBalancer start() {
        pipeline.start();
        configLoader.startWatching();
        log.info("ClusterLoadBalancer started");
        return this;
    }

    /**
     * Selects a host through the worker pool.
     */
    public CompletableFuture<Optional<Host>> select(LoadBalancerContext context) {
        return pipeline.submit(context);
    }

    public SelectionPipeline getPipeline() {
        return pipeline;
    }

    public ThreadAwareLoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public PrioritySet getPrioritySet() {
        return prioritySet;
    }

    public LoadBalancerStats getStats() {
        return stats;
    }

    public LoadBalancerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    static List<Host> toHosts(LoadBalancerConfig config) {
        List<Host> hosts = new ArrayList<>(config.getHosts().size());
        for (LoadBalancerConfig.HostConfig hostConfig : config.getHosts()) {
            Host.Builder builder = Host.builder()
                    .address(hostConfig.getAddress())
                    .hostname(hostConfig.getHostname())
                    .weight(hostConfig.getWeight())
                    .priority(hostConfig.getPriority())
                    .initialHealth(ConfigValidator.parseHealth(hostConfig));
            if (hostConfig.getMetadata() != null) {
                builder.metadata(hostConfig.getMetadata());
            }
            hosts.add(builder.build());
        }
        return hosts;
    }

    static HashingTableOptions toTableOptions(LoadBalancerConfig.HashingConfig hashing) {
        HashKeyPolicy policy = new HashKeyPolicy(
                hashing.isUseHostnameForHashing(),
                hashing.getHashKeyMetadata().getNamespace(),
                hashing.getHashKeyMetadata().getKey()
        );
        return new HashingTableOptions(
                policy,
                hashing.getRingHash().getMinimumRingSize(),
                hashing.getRingHash().getMaximumRingSize(),
                hashing.getMaglev().getTableSize()
        );
    }

    private void onConfigChanged(ConfigChange change) {
        if (change.hostsChanged()) {
            // One membership event, hence one rebuild; unchanged hosts keep their runtime state
            prioritySet.replaceAll(toHosts(change.current()));
            applyConfiguredHealthChanges(change);
            log.info("Host list reloaded: {} hosts", prioritySet.size());
        }
        if (!change.restartRequiredSections().isEmpty()) {
            log.warn("Changes to {} take effect after a restart", change.restartRequiredSections());
        }
    }

    /**
     * A host kept across a reload keeps its current health, unless the health written in
     * the configuration itself was edited.
     */
    private void applyConfiguredHealthChanges(ConfigChange change) {
        if (change.previous() == null) {
            return;
        }
        Map<String, String> previousHealth = new HashMap<>();
        for (LoadBalancerConfig.HostConfig hostConfig : change.previous().getHosts()) {
            previousHealth.put(hostConfig.getAddress(), hostConfig.getHealth());
        }
        for (LoadBalancerConfig.HostConfig hostConfig : change.current().getHosts()) {
            String before = previousHealth.get(hostConfig.getAddress());
            if (before != null && !before.equalsIgnoreCase(hostConfig.getHealth())) {
                prioritySet.updateHostHealth(hostConfig.getAddress(), ConfigValidator.parseHealth(hostConfig));
            }
        }
    }

    @Override
    public void close() {
        log.info("Shutting down ClusterLoadBalancer...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            loadBalancer.close();
        } catch (Exception e) {
            log.warn("Error closing load balancer", e);
        }

        try {
            stats.close();
        } catch (Exception e) {
            log.warn("Error closing stats", e);
        }

        log.info("ClusterLoadBalancer shut down");
    }
}
