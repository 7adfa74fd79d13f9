package fr.lapetina.hashlb.domain.priority;

import java.util.Arrays;

/**
 * Immutable percentage of traffic assigned to each priority level.
 *
 * Healthy and degraded loads are kept as two instances; together they sum to 100
 * whenever at least one host exists.
 */
public final class PriorityLoad {

    private static final PriorityLoad EMPTY = new PriorityLoad(new int[0]);

    private final int[] percentages;

    private PriorityLoad(int[] percentages) {
        this.percentages = percentages;
    }

    public static PriorityLoad of(int... percentages) {
        for (int percentage : percentages) {
            if (percentage < 0 || percentage > 100) {
                throw new IllegalArgumentException("Load percentage out of range: " + percentage);
            }
        }
        return new PriorityLoad(percentages.clone());
    }

    public static PriorityLoad empty() {
        return EMPTY;
    }

    public int get(int priority) {
        return percentages[priority];
    }

    public int size() {
        return percentages.length;
    }

    public int total() {
        int total = 0;
        for (int percentage : percentages) {
            total += percentage;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(percentages, ((PriorityLoad) o).percentages);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(percentages);
    }

    @Override
    public String toString() {
        return Arrays.toString(percentages);
    }
}
