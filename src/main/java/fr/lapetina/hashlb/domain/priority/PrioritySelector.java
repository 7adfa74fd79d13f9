package fr.lapetina.hashlb.domain.priority;

/**
 * Picks the priority level that serves a request.
 *
 * Implementations must be stateless or thread-safe; one instance is shared by all
 * worker selectors.
 */
@FunctionalInterface
public interface PrioritySelector {

    /**
     * @param hash     Request hash, so the same request keeps landing on the same level
     * @param healthy  Load routed to the healthy hosts of each level
     * @param degraded Load routed to the degraded hosts of each level
     * @return Index of the selected priority level
     */
    int choosePriority(long hash, PriorityLoad healthy, PriorityLoad degraded);
}
