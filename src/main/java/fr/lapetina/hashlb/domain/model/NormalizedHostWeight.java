package fr.lapetina.hashlb.domain.model;

import java.util.Objects;

/**
 * A host paired with its share of the total weight of its priority level.
 *
 * @param host   The host
 * @param weight Normalized weight in (0, 1]
 */
public record NormalizedHostWeight(Host host, double weight) {

    public NormalizedHostWeight {
        Objects.requireNonNull(host, "host");
        if (!(weight > 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("Normalized weight out of range: " + weight);
        }
    }
}
