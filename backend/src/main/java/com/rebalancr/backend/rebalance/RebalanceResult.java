package com.rebalancr.backend.rebalance;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record RebalanceResult(
        Long portfolioId,
        RebalanceStatus status,
        SkipReason skipReason,
        String message,
        boolean dryRun,
        AllocationTarget target,
        TradePlan tradePlan,
        GateDecision gate,
        ValidationResult validation,
        List<TradeOutcome> outcomes,
        boolean allSucceeded,
        boolean portfolioUpdated,
        List<String> degradedAssets,
        Instant completedAt
) {

    public RebalanceResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        degradedAssets = degradedAssets == null ? List.of() : List.copyOf(degradedAssets);
    }

    public enum RebalanceStatus {
        SKIPPED,
        REJECTED,
        DRY_RUN,
        EXECUTED
    }
}
