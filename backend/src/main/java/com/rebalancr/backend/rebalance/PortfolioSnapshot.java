package com.rebalancr.backend.rebalance;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holdings of one portfolio valued at live prices, plus the portfolio settings the gate needs.
 */
public record PortfolioSnapshot(
        Long portfolioId,
        String userId,
        List<AssetHolding> holdings,
        double totalValue,
        Instant lastRebalanceTimestamp,
        long checkIntervalSeconds,
        double maxSlippage,
        Instant capturedAt
) {

    public PortfolioSnapshot {
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
    }

    public Map<String, Double> currentWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (AssetHolding holding : holdings) {
            weights.put(holding.symbol(), holding.weight());
        }
        return weights;
    }

    public List<String> symbols() {
        return holdings.stream().map(AssetHolding::symbol).toList();
    }

    public Optional<AssetHolding> holding(String symbol) {
        return holdings.stream().filter(holding -> holding.symbol().equals(symbol)).findFirst();
    }

    public boolean hasPricedHoldings() {
        return totalValue > 0 && holdings.stream().anyMatch(AssetHolding::priced);
    }
}
