/**
 * Hash Affinity Load Balancer - consistent-hashing host selection with bounded loads.
 *
 * <p>Hosts are grouped by priority level and placed in per-priority hashing tables (ring hash
 * or maglev). Tables are rebuilt on every membership change and published to a pool of
 * selection workers as immutable snapshots.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hashlb.ClusterLoadBalancer} - Main entry point, wires everything from YAML</li>
 *   <li>{@link fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer} - Rebuilds and publishes snapshots</li>
 *   <li>{@link fr.lapetina.hashlb.disruptor.SelectionPipeline} - Worker pool fed by a ring buffer</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ClusterLoadBalancer lb = ClusterLoadBalancer.create("config.yaml").start()) {
 *     Optional<Host> host = lb.select(SelectionContext.ofHash(requestHash)).get();
 * }
 * }</pre>
 *
 * @see fr.lapetina.hashlb.ClusterLoadBalancer
 */
package fr.lapetina.hashlb;
