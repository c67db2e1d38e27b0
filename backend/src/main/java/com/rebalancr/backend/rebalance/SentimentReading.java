package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.Sentiment;

public record SentimentReading(
        Sentiment sentiment,
        double fearScore,
        double greedScore,
        double manipulationScore,
        boolean manipulationDetected
) {

    public static SentimentReading neutral() {
        return new SentimentReading(Sentiment.NEUTRAL, 0.5, 0.5, 0.0, false);
    }
}
