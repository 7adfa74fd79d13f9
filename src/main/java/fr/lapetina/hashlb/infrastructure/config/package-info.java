/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hashlb.infrastructure.config.LoadBalancerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.hashlb.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.hashlb.infrastructure.config.ConfigValidator} - Rejects unusable settings</li>
 *   <li>{@link fr.lapetina.hashlb.infrastructure.config.ConfigChange} - Section-level difference between two documents</li>
 *   <li>{@link fr.lapetina.hashlb.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Only the {@code hosts} section is applied at runtime. Changes to the other sections are
 * logged and take effect on the next start. Hosts whose definition did not change keep
 * their health and in-flight request count across a reload.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code hosts} - Upstream hosts with weight, priority, health and metadata</li>
 *   <li>{@code hashing} - Table type, bounded-load factor and hash key settings</li>
 *   <li>{@code priority} - Overprovisioning factor</li>
 *   <li>{@code workers} - Worker count, ring buffer and wait strategy</li>
 *   <li>{@code metrics} - Meter name prefix</li>
 * </ul>
 */
package fr.lapetina.hashlb.infrastructure.config;
