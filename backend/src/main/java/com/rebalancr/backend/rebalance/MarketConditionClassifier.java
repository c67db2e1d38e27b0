package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import com.rebalancr.backend.model.MarketCondition;
import com.rebalancr.backend.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
@RequiredArgsConstructor
public class MarketConditionClassifier {

    private final RebalanceProperties rebalanceProperties;

    public MarketCondition classify(Collection<AssetSignal> signals) {
        RebalanceProperties.Review review = rebalanceProperties.getReview();
        int count = 0;
        double volatility = 0.0;
        double direction = 0.0;
        for (AssetSignal signal : signals) {
            if (!signal.usable()) {
                continue;
            }
            SignalSet set = signal.signals();
            volatility += set.volatility();
            double trend = set.trend() == Trend.UPTREND ? 1.0 : set.trend() == Trend.DOWNTREND ? -1.0 : 0.0;
            direction += 0.5 * trend + 0.5 * (set.greedScore() - set.fearScore());
            count++;
        }
        if (count == 0) {
            return MarketCondition.NORMAL;
        }
        volatility /= count;
        direction /= count;
        if (volatility > review.getHighVolatilityThreshold()) {
            return MarketCondition.HIGH_VOLATILITY;
        }
        if (direction < -review.getDirectionalThreshold()) {
            return MarketCondition.BEARISH;
        }
        if (direction > review.getDirectionalThreshold()) {
            return MarketCondition.BULLISH;
        }
        return MarketCondition.NORMAL;
    }
}
