package com.rebalancr.backend.dto;

import com.rebalancr.backend.model.Portfolio;

import java.time.Instant;
import java.util.List;

public record PortfolioResponse(
        Long id,
        String userId,
        String name,
        boolean autoRebalance,
        double maxSlippage,
        long checkInterval,
        Instant lastRebalanceTimestamp,
        Instant createdAt,
        List<Asset> assets
) {

    public static PortfolioResponse from(Portfolio portfolio) {
        List<Asset> assets = portfolio.getAssets().stream()
                .map(asset -> new Asset(asset.getSymbol(), asset.getTokenAddress(), asset.getAmount(), asset.getLastUpdated()))
                .toList();
        return new PortfolioResponse(portfolio.getId(), portfolio.getUserId(), portfolio.getName(),
                portfolio.isAutoRebalance(), portfolio.getMaxSlippage(), portfolio.getCheckInterval(),
                portfolio.getLastRebalanceTimestamp(), portfolio.getCreatedAt(), assets);
    }

    public record Asset(String symbol, String tokenAddress, double amount, Instant lastUpdated) {
    }
}
