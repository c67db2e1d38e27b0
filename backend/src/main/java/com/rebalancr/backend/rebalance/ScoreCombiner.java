package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.RecommendedAction;
import com.rebalancr.backend.model.Sentiment;
import com.rebalancr.backend.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Folds one asset's signals into a score in [-1, 1] and maps it to an action
 * with a dead band between the two thresholds.
 */
@Component
@RequiredArgsConstructor
public class ScoreCombiner {

    private final RebalanceProperties rebalanceProperties;

    public double score(SignalSet signals) {
        RebalanceProperties.Scoring scoring = rebalanceProperties.getScoring();
        double score = 0.0;

        if (signals.sentiment() == Sentiment.GREED) {
            score += scoring.getSentimentWeight();
        } else if (signals.sentiment() == Sentiment.FEAR) {
            score -= scoring.getSentimentWeight();
        }

        if (signals.belowMedianFrequency() < scoring.getBelowMedianLow()) {
            score += scoring.getBelowMedianWeight();
        } else if (signals.belowMedianFrequency() > scoring.getBelowMedianHigh()) {
            score -= scoring.getBelowMedianWeight();
        }

        if (signals.volatility() > scoring.getVolatilityHigh()) {
            score -= scoring.getVolatilityWeight();
        } else if (signals.volatility() < scoring.getVolatilityLow()) {
            score += scoring.getVolatilityWeight();
        }

        if (signals.trend() == Trend.UPTREND) {
            score += scoring.getTrendWeight();
        } else {
            score -= scoring.getTrendWeight();
        }

        if (signals.manipulationDetected()) {
            score *= scoring.getManipulationDampening();
        }
        return Math.max(-1.0, Math.min(1.0, score));
    }

    public RecommendedAction actionFor(double score) {
        RebalanceProperties.Scoring scoring = rebalanceProperties.getScoring();
        if (score > scoring.getIncreaseThreshold()) {
            return RecommendedAction.INCREASE;
        }
        if (score < scoring.getDecreaseThreshold()) {
            return RecommendedAction.DECREASE;
        }
        return RecommendedAction.MAINTAIN;
    }

    public ScoredAsset evaluate(AssetSignal signal) {
        if (!signal.usable()) {
            return new ScoredAsset(signal.symbol(), 0.0, RecommendedAction.MAINTAIN);
        }
        double score = score(signal.signals());
        return new ScoredAsset(signal.symbol(), score, actionFor(score));
    }
}
