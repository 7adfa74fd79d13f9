package fr.lapetina.hashlb.infrastructure.config;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;
import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Loads the YAML configuration and keeps it current.
 *
 * <p>The document is read from the file system, or from the classpath when no such file
 * exists. Every document is validated before it replaces the current one. Reloads are
 * compared section by section with the configuration in effect: a document whose bytes
 * did not change is not even parsed, and listeners only hear about documents that differ.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private LoadBalancerConfig currentConfig;
    private HashCode currentDigest;

    private volatile WatchService watchService;
    private volatile Thread watcher;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(LoadBalancerConfig.class, new LoaderOptions()));
    }

    /**
     * Reads, validates and applies the configuration at the configured location.
     *
     * @return the configuration in effect afterwards
     * @throws ConfigurationException if the document cannot be read or is invalid
     */
    public LoadBalancerConfig load() {
        if (Files.exists(configPath)) {
            return apply(readFile(), configPath.toString());
        }
        String resource = classpathResource();
        URL url = getClass().getClassLoader().getResource(resource);
        if (url == null) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        try {
            return apply(Resources.toByteArray(url), "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + resource, e);
        }
    }

    /**
     * Validates and applies a configuration document read from a stream.
     */
    public LoadBalancerConfig loadFromStream(InputStream inputStream) {
        try {
            return apply(ByteStreams.toByteArray(inputStream), "stream");
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
    }

    /**
     * Re-reads the configuration. A document that cannot be loaded keeps the current one.
     */
    public LoadBalancerConfig reload() {
        try {
            return load();
        } catch (RuntimeException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return getCurrentConfig();
        }
    }

    public synchronized LoadBalancerConfig getCurrentConfig() {
        return currentConfig;
    }

    private synchronized LoadBalancerConfig apply(byte[] document, String source) {
        HashCode digest = Hashing.sha256().hashBytes(document);
        if (digest.equals(currentDigest)) {
            log.debug("Configuration {} unchanged (sha256 {})", source, digest);
            return currentConfig;
        }

        LoadBalancerConfig config = ConfigValidator.validate(parse(document, source));
        ConfigChange change = ConfigChange.between(currentConfig, config);
        currentConfig = config;
        currentDigest = digest;

        if (change.isEmpty()) {
            log.info("Configuration {} rewritten without effective changes", source);
            return config;
        }
        log.info("Configuration loaded from {}: {} hosts, hostsChanged={}, restartRequired={}",
                source, config.getHosts().size(), change.hostsChanged(), change.restartRequiredSections());
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(change);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
        return config;
    }

    private LoadBalancerConfig parse(byte[] document, String source) {
        LoadBalancerConfig config;
        try {
            config = yaml.load(new String(document, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration is empty: " + source);
        }
        return config;
    }

    private byte[] readFile() {
        try {
            return Files.readAllBytes(configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
        }
    }

    private String classpathResource() {
        String resource = configPath.toString().replace('\\', '/');
        return resource.startsWith("/") ? resource.substring(1) : resource;
    }

    /**
     * Watches the configuration file and reloads it whenever it is written or recreated.
     * Does nothing when the configuration does not come from the file system.
     */
    public synchronized void startWatching() {
        if (watcher != null) {
            return;
        }
        if (!Files.exists(configPath)) {
            log.info("Configuration is not a file, hot reload disabled: {}", configPath);
            return;
        }

        Path directory = configPath.toAbsolutePath().getParent();
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Failed to start config watcher, hot reload disabled", e);
            return;
        }

        watcher = new Thread(() -> watch(watchService), "config-watcher");
        watcher.setDaemon(true);
        watcher.start();
        log.info("Configuration hot reload enabled for: {}", configPath);
    }

    private void watch(WatchService service) {
        Path fileName = configPath.getFileName();
        try {
            while (true) {
                WatchKey key = service.take();
                boolean touched = false;
                for (WatchEvent<?> event : key.pollEvents()) {
                    touched |= fileName.equals(event.context());
                }
                if (touched) {
                    reload();
                }
                if (!key.reset()) {
                    log.warn("Configuration directory is no longer accessible, hot reload stopped");
                    return;
                }
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("Config watcher stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
        Thread thread = watcher;
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
