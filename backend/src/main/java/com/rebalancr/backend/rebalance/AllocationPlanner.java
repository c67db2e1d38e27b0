package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.exception.RebalanceException;
import com.rebalancr.backend.model.RecommendedAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AllocationPlanner {

    private final RebalanceProperties rebalanceProperties;
    private final ScoreCombiner scoreCombiner;

    /**
     * Builds target weights from current weights and per-asset scores.
     * <p>
     * Assets whose action is not maintain move by {@code maxAdjustment * |score|} and are clamped to the
     * per-asset band. After normalizing, a shortfall of safe assets below the floor is taken from the
     * other assets in proportion to their weight and spread evenly over the safe assets held.
     * Assets with zero current weight (unpriced) stay at zero.
     */
    public AllocationTarget plan(Map<String, Double> currentWeights, Map<String, Double> scores) {
        RebalanceProperties.Allocation allocation = rebalanceProperties.getAllocation();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : currentWeights.entrySet()) {
            double current = entry.getValue() == null ? 0.0 : Math.max(0.0, entry.getValue());
            weights.put(entry.getKey(), current);
        }

        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            double current = entry.getValue();
            if (current <= 0.0) {
                continue;
            }
            double score = scores.getOrDefault(entry.getKey(), 0.0);
            RecommendedAction action = scoreCombiner.actionFor(score);
            if (action == RecommendedAction.MAINTAIN) {
                continue;
            }
            double factor = action == RecommendedAction.INCREASE
                    ? 1 + allocation.getMaxAdjustment() * Math.abs(score)
                    : 1 - allocation.getMaxAdjustment() * Math.abs(score);
            entry.setValue(clamp(current * factor, allocation.getMinWeight(), allocation.getMaxWeight()));
        }
        normalize(weights);

        List<String> safeHeld = new ArrayList<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getValue() > 0.0 && allocation.isSafeAsset(entry.getKey())) {
                safeHeld.add(entry.getKey());
            }
        }
        if (safeHeld.isEmpty()) {
            log.debug("No safe asset held, floor {} not applied", allocation.getSafeAssetFloor());
            return new AllocationTarget(weights, false, allocation.getSafeAssetFloor() > 0.0);
        }

        boolean floorApplied = applySafeFloor(weights, safeHeld, allocation.getSafeAssetFloor());
        normalize(weights);
        return new AllocationTarget(weights, floorApplied, false);
    }

    private boolean applySafeFloor(Map<String, Double> weights, List<String> safeHeld, double floor) {
        double safeTotal = safeHeld.stream().mapToDouble(weights::get).sum();
        if (safeTotal >= floor) {
            return false;
        }
        double deficit = floor - safeTotal;
        double otherTotal = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (!safeHeld.contains(entry.getKey())) {
                otherTotal += entry.getValue();
            }
        }
        if (otherTotal > 0.0) {
            for (Map.Entry<String, Double> entry : weights.entrySet()) {
                if (!safeHeld.contains(entry.getKey())) {
                    double share = entry.getValue() / otherTotal;
                    entry.setValue(Math.max(0.0, entry.getValue() - deficit * share));
                }
            }
        }
        double increment = deficit / safeHeld.size();
        for (String symbol : safeHeld) {
            weights.put(symbol, weights.get(symbol) + increment);
        }
        return true;
    }

    private void normalize(Map<String, Double> weights) {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0.0) {
            throw new RebalanceException("Cannot plan an allocation for a portfolio with no value");
        }
        weights.replaceAll((symbol, weight) -> weight / total);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
