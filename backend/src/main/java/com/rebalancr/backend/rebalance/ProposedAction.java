package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.RecommendedAction;

public record ProposedAction(String symbol, RecommendedAction action) {

    public static ProposedAction fromScore(ScoredAsset asset) {
        return new ProposedAction(asset.symbol(), asset.action());
    }

    /**
     * Direction implied by an order. Used when the allocation is supplied by the caller
     * and there are no scores to review.
     */
    public static ProposedAction fromOrder(TradeOrder order) {
        return new ProposedAction(order.symbol(), order.isBuy() ? RecommendedAction.INCREASE : RecommendedAction.DECREASE);
    }
}
