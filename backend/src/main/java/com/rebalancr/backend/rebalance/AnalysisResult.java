package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.MarketCondition;

import java.time.Instant;
import java.util.List;

/**
 * Best-effort, read-only report for one portfolio. Degraded assets are listed so that callers can
 * tell which recommendations rest on default signals.
 */
public record AnalysisResult(
        Long portfolioId,
        double totalValue,
        List<AssetAnalysis> assets,
        AllocationTarget target,
        TradePlan tradePlan,
        GateDecision gate,
        MarketCondition marketCondition,
        ValidationResult validation,
        boolean insufficientData,
        boolean rebalanceRecommended,
        List<String> degradedAssets,
        Instant analyzedAt
) {

    public AnalysisResult {
        assets = assets == null ? List.of() : List.copyOf(assets);
        degradedAssets = degradedAssets == null ? List.of() : List.copyOf(degradedAssets);
    }
}
