/**
 * Domain model classes representing hosts and selection requests.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hashlb.domain.model.Host} - Thread-safe upstream host</li>
 *   <li>{@link fr.lapetina.hashlb.domain.model.HostHealth} - Host health states (HEALTHY, DEGRADED, UNHEALTHY)</li>
 *   <li>{@link fr.lapetina.hashlb.domain.model.HostSet} - Hosts of one priority level partitioned by health</li>
 *   <li>{@link fr.lapetina.hashlb.domain.model.NormalizedHostWeights} - Weights of eligible hosts summing to 1</li>
 *   <li>{@link fr.lapetina.hashlb.domain.model.LoadBalancerContext} - Per-request hash and selection hints</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records are immutable. {@code Host} keeps its health and active request count in atomics;
 * everything else about a host is fixed at construction.
 */
package fr.lapetina.hashlb.domain.model;
