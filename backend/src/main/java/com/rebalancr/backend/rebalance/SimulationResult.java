package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.MarketCondition;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SimulationResult(
        Long portfolioId,
        double totalValue,
        Map<String, Double> requestedAllocation,
        TradePlan tradePlan,
        double estimatedCost,
        MarketCondition marketCondition,
        ValidationResult validation,
        List<String> unpricedAssets,
        Instant simulatedAt
) {
}
