package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.exception.RebalanceException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Target weight per symbol. Construction fails when the weights are negative or do not sum to one.
 *
 * @param safeFloorUnmet true when no safe asset is held, so the safe-asset floor could not be applied
 */
public record AllocationTarget(Map<String, Double> weights, boolean safeFloorApplied, boolean safeFloorUnmet) {

    public static final double SUM_TOLERANCE = 0.01;

    public AllocationTarget {
        if (weights == null || weights.isEmpty()) {
            throw new RebalanceException("Allocation target has no weights");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight < 0.0) {
                throw new RebalanceException("Invalid target weight " + weight + " for " + entry.getKey());
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new RebalanceException("Allocation target weights sum to " + sum + ", expected 1.0");
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public static AllocationTarget of(Map<String, Double> weights) {
        return new AllocationTarget(weights, false, false);
    }

    public double weightOf(String symbol) {
        return weights.getOrDefault(symbol, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
