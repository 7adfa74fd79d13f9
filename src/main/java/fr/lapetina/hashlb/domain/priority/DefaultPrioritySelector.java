package fr.lapetina.hashlb.domain.priority;

/**
 * Maps the request hash onto the cumulative healthy loads, then the cumulative degraded
 * loads, and returns the first level covering it.
 */
public final class DefaultPrioritySelector implements PrioritySelector {

    @Override
    public int choosePriority(long hash, PriorityLoad healthy, PriorityLoad degraded) {
        // 1..100
        final long point = Long.remainderUnsigned(hash, 100) + 1;

        int aggregate = 0;
        for (int i = 0; i < healthy.size(); i++) {
            aggregate += healthy.get(i);
            if (point <= aggregate) {
                return i;
            }
        }
        for (int i = 0; i < degraded.size(); i++) {
            aggregate += degraded.get(i);
            if (point <= aggregate) {
                return i;
            }
        }
        // Loads sum to 100 unless there are no hosts at all
        return 0;
    }
}
