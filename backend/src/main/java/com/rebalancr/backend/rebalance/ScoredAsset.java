package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.RecommendedAction;

public record ScoredAsset(String symbol, double score, RecommendedAction action) {

    public double confidence() {
        return Math.abs(score);
    }
}
