package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.MarketCondition;
import com.rebalancr.backend.model.RecommendedAction;

import java.util.List;

public record ValidationResult(
        boolean approved,
        double approvalRate,
        double overallRisk,
        MarketCondition marketCondition,
        List<ActionReview> reviews
) {

    public ValidationResult {
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }

    public static ValidationResult of(double approvalRate, double overallRisk, MarketCondition marketCondition,
                                      List<ActionReview> reviews, double minApprovalRate, double maxRisk) {
        boolean approved = approvalRate >= minApprovalRate && overallRisk <= maxRisk;
        return new ValidationResult(approved, approvalRate, overallRisk, marketCondition, reviews);
    }

    public record ActionReview(String symbol, RecommendedAction action, boolean acceptable, double risk, String note) {
    }
}
