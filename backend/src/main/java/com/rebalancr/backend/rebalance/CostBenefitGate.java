package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.RecommendedAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Blocks a rebalance that is too soon after the last one or whose estimated cost is not covered
 * by its estimated benefit. A skip is final for the invocation.
 */
@Component
@RequiredArgsConstructor
public class CostBenefitGate {

    private final RebalanceProperties rebalanceProperties;

    public GateDecision evaluate(PortfolioSnapshot snapshot, TradePlan plan, Collection<ScoredAsset> scoredAssets,
                                 Instant now) {
        if (!intervalElapsed(snapshot.lastRebalanceTimestamp(), snapshot.checkIntervalSeconds(), now)) {
            return GateDecision.skip(SkipReason.TOO_FREQUENT, "too frequent, next rebalance allowed after "
                    + nextEligibleAt(snapshot.lastRebalanceTimestamp(), snapshot.checkIntervalSeconds()));
        }
        if (plan.isEmpty()) {
            return GateDecision.skip(SkipReason.NO_TRADES, SkipReason.NO_TRADES.description());
        }
        double cost = estimateCost(plan);
        double benefit = estimateBenefit(snapshot, scoredAssets);
        if (benefit > cost) {
            return GateDecision.proceed(cost, benefit);
        }
        return GateDecision.skip(SkipReason.COST_EXCEEDS_BENEFIT, cost, benefit);
    }

    public double estimateCost(TradePlan plan) {
        RebalanceProperties.CostBenefit costBenefit = rebalanceProperties.getCostBenefit();
        double turnover = plan.turnover();
        return costBenefit.getTradingFeeRate() * turnover
                + costBenefit.getGasEstimate()
                + costBenefit.getSlippageRate() * turnover;
    }

    public double estimateBenefit(PortfolioSnapshot snapshot, Collection<ScoredAsset> scoredAssets) {
        RebalanceProperties.CostBenefit costBenefit = rebalanceProperties.getCostBenefit();
        Map<String, Double> weights = snapshot.currentWeights();
        double benefit = costBenefit.getYieldDeltaEstimate();
        for (ScoredAsset asset : scoredAssets) {
            double weight = weights.getOrDefault(asset.symbol(), 0.0);
            boolean counts = (asset.action() == RecommendedAction.INCREASE && weight < costBenefit.getIncreaseBandCeiling())
                    || (asset.action() == RecommendedAction.DECREASE && weight > costBenefit.getDecreaseBandFloor());
            if (counts) {
                benefit += asset.confidence() * costBenefit.getImprovementRate() * snapshot.totalValue();
            }
        }
        return benefit;
    }

    public Duration effectiveInterval(long checkIntervalSeconds) {
        Duration configured = Duration.ofSeconds(Math.max(0L, checkIntervalSeconds));
        Duration minimum = rebalanceProperties.getCostBenefit().getMinRebalanceInterval();
        return configured.compareTo(minimum) >= 0 ? configured : minimum;
    }

    public boolean intervalElapsed(Instant lastRebalance, long checkIntervalSeconds, Instant now) {
        if (lastRebalance == null) {
            return true;
        }
        return Duration.between(lastRebalance, now).compareTo(effectiveInterval(checkIntervalSeconds)) >= 0;
    }

    public Instant nextEligibleAt(Instant lastRebalance, long checkIntervalSeconds) {
        if (lastRebalance == null) {
            return null;
        }
        return lastRebalance.plus(effectiveInterval(checkIntervalSeconds));
    }
}
