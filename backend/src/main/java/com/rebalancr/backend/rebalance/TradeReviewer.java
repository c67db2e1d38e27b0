package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.MarketCondition;

import java.util.List;

/**
 * Second opinion on proposed actions. Implementations see only action labels and the market
 * condition, never the scores that produced the actions.
 */
public interface TradeReviewer {

    ValidationResult validate(List<ProposedAction> proposedActions, MarketCondition marketCondition);
}
