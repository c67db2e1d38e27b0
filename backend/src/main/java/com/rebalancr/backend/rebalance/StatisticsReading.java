package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.model.Trend;

public record StatisticsReading(double volatility, double belowMedianFrequency, Trend trend) {

    public static StatisticsReading neutral() {
        return new StatisticsReading(0.5, 0.5, Trend.SIDEWAYS);
    }
}
