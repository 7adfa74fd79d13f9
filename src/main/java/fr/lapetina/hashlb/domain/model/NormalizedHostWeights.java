package fr.lapetina.hashlb.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered host weights of one priority level, normalized so they sum to 1.
 *
 * @param weights   Hosts in membership order with their normalized weight
 * @param minWeight Smallest normalized weight (1.0 when empty)
 * @param maxWeight Largest normalized weight (0.0 when empty)
 */
public record NormalizedHostWeights(List<NormalizedHostWeight> weights, double minWeight, double maxWeight) {

    private static final long MAX_WEIGHT_SUM = 0xFFFF_FFFFL;

    public NormalizedHostWeights {
        weights = List.copyOf(weights);
    }

    /**
     * Divides each host weight by the sum of all weights.
     *
     * @throws IllegalArgumentException if the weight sum does not fit an unsigned 32-bit integer
     */
    public static NormalizedHostWeights normalize(List<Host> hosts) {
        long sum = 0;
        for (Host host : hosts) {
            sum += host.getWeight();
            if (sum > MAX_WEIGHT_SUM) {
                throw new IllegalArgumentException(
                        "The sum of weights of all hosts in a priority exceeds " + MAX_WEIGHT_SUM);
            }
        }

        List<NormalizedHostWeight> result = new ArrayList<>(hosts.size());
        double min = 1.0;
        double max = 0.0;
        for (Host host : hosts) {
            double weight = (double) host.getWeight() / sum;
            result.add(new NormalizedHostWeight(host, weight));
            min = Math.min(min, weight);
            max = Math.max(max, weight);
        }
        return new NormalizedHostWeights(result, min, max);
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    /**
     * Builds the host to weight lookup used by the bounded-load decorator.
     */
    public Map<Host, Double> toMap() {
        Map<Host, Double> map = new HashMap<>(weights.size() * 2);
        for (NormalizedHostWeight entry : weights) {
            map.put(entry.host(), entry.weight());
        }
        return Collections.unmodifiableMap(map);
    }
}
