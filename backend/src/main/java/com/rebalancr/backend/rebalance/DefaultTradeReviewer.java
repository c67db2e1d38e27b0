package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.MarketCondition;
import com.rebalancr.backend.model.RecommendedAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultTradeReviewer implements TradeReviewer {

    private final RebalanceProperties rebalanceProperties;

    @Override
    public ValidationResult validate(List<ProposedAction> proposedActions, MarketCondition marketCondition) {
        RebalanceProperties.Review review = rebalanceProperties.getReview();
        MarketCondition condition = marketCondition == null ? MarketCondition.NORMAL : marketCondition;
        if (proposedActions.isEmpty()) {
            return ValidationResult.of(1.0, 0.0, condition, List.of(), review.getMinApprovalRate(), review.getMaxRisk());
        }

        List<ValidationResult.ActionReview> reviews = new ArrayList<>();
        int acceptable = 0;
        double riskSum = 0.0;
        for (ProposedAction proposed : proposedActions) {
            ValidationResult.ActionReview actionReview = review(proposed, condition);
            if (actionReview.acceptable()) {
                acceptable++;
            }
            riskSum += actionReview.risk();
            reviews.add(actionReview);
        }
        double approvalRate = (double) acceptable / proposedActions.size();
        double overallRisk = riskSum / proposedActions.size();
        ValidationResult result = ValidationResult.of(approvalRate, overallRisk, condition, reviews,
                review.getMinApprovalRate(), review.getMaxRisk());
        log.info("Trade review condition={} actions={} approvalRate={} risk={} approved={}",
                condition.label(), proposedActions.size(), approvalRate, overallRisk, result.approved());
        return result;
    }

    private ValidationResult.ActionReview review(ProposedAction proposed, MarketCondition condition) {
        boolean safe = rebalanceProperties.getAllocation().isSafeAsset(proposed.symbol());
        double base = baseRisk(condition);
        RecommendedAction action = proposed.action();

        if (action == RecommendedAction.MAINTAIN) {
            return new ValidationResult.ActionReview(proposed.symbol(), action, true, bounded(base - 2), "no change");
        }
        if (action == RecommendedAction.INCREASE) {
            if (safe) {
                return new ValidationResult.ActionReview(proposed.symbol(), action, true, bounded(base - 2),
                        "moving into a safe asset");
            }
            boolean accepted = condition != MarketCondition.HIGH_VOLATILITY && condition != MarketCondition.BEARISH;
            return new ValidationResult.ActionReview(proposed.symbol(), action, accepted, bounded(base + 1),
                    accepted ? "increase fits " + condition.label() + " market"
                            : "increase rejected in " + condition.label() + " market");
        }
        boolean accepted = condition != MarketCondition.BULLISH || safe;
        return new ValidationResult.ActionReview(proposed.symbol(), action, accepted, bounded(base - 1),
                accepted ? "decrease fits " + condition.label() + " market"
                        : "decrease rejected in bullish market");
    }

    private double baseRisk(MarketCondition condition) {
        return switch (condition) {
            case NORMAL -> 3.0;
            case BULLISH -> 4.0;
            case BEARISH -> 6.0;
            case HIGH_VOLATILITY -> 8.0;
        };
    }

    private static double bounded(double risk) {
        return Math.max(0.0, Math.min(10.0, risk));
    }
}
