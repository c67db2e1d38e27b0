package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.RecommendedAction;

import java.util.List;

public record AssetAnalysis(
        String symbol,
        double amount,
        double price,
        double value,
        boolean priced,
        double currentWeight,
        double targetWeight,
        double score,
        double confidence,
        RecommendedAction action,
        SignalSet signals,
        AssetSignal.SignalStatus signalStatus,
        boolean degradedSignal,
        List<String> signalErrors
) {
}
