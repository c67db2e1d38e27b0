package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.Sentiment;
import com.rebalancr.backend.model.Trend;

public record SignalSet(
        Sentiment sentiment,
        double fearScore,
        double greedScore,
        boolean manipulationDetected,
        double volatility,
        double belowMedianFrequency,
        Trend trend
) {

    public static SignalSet of(SentimentReading sentiment, StatisticsReading statistics) {
        return new SignalSet(
                sentiment.sentiment(),
                sentiment.fearScore(),
                sentiment.greedScore(),
                sentiment.manipulationDetected(),
                statistics.volatility(),
                statistics.belowMedianFrequency(),
                statistics.trend()
        );
    }

    public static SignalSet neutral() {
        return of(SentimentReading.neutral(), StatisticsReading.neutral());
    }

    public SignalSet withManipulation(boolean detected) {
        return new SignalSet(sentiment, fearScore, greedScore, detected, volatility, belowMedianFrequency, trend);
    }
}
