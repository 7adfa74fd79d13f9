/**
 * Snapshot publication and per-worker host selection.
 *
 * <p>The {@link fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer} rebuilds one
 * hashing table per priority level on the membership thread and publishes them as an
 * immutable {@link fr.lapetina.hashlb.domain.balancer.LoadBalancerSnapshot}. Worker threads
 * each hold a {@link fr.lapetina.hashlb.domain.balancer.WorkerSelector} bound to the snapshot
 * current when it was created, and select hosts from it without locking.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.hashlb.domain.balancer.ThreadAwareLoadBalancer} - Rebuild and publication</li>
 *   <li>{@link fr.lapetina.hashlb.domain.balancer.WorkerSelectorFactory} - Hands out selectors</li>
 *   <li>{@link fr.lapetina.hashlb.domain.balancer.CrossPriorityHostMap} - Address lookup for override hosts</li>
 * </ul>
 */
package fr.lapetina.hashlb.domain.balancer;
