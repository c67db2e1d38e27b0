package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.exception.SignalSourceException;
import com.rebalancr.backend.model.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Local statistics source computed from a price history (oldest first).
 */
@Component
@RequiredArgsConstructor
public class StatisticalAnalyzer implements StatisticsSource {

    private final SignalProperties signalProperties;

    @Override
    public StatisticsReading analyze(String symbol, List<Double> priceHistory) {
        List<Double> prices = cleaned(priceHistory);
        if (prices.size() < 2) {
            throw new SignalSourceException("statistics", "insufficient price history for " + symbol);
        }
        return new StatisticsReading(volatility(prices), belowMedianFrequency(prices), trend(prices));
    }

    double volatility(List<Double> prices) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < prices.size(); i++) {
            returns.add(prices.get(i) / prices.get(i - 1) - 1.0);
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .average()
                .orElse(0.0);
        double scaled = Math.sqrt(variance) / signalProperties.getStatistics().getVolatilityScale();
        return Math.min(1.0, scaled);
    }

    // Share of samples that close below the median of the window before them.
    double belowMedianFrequency(List<Double> prices) {
        int window = Math.max(2, Math.min(signalProperties.getStatistics().getMedianWindow(), prices.size() / 2));
        int below = 0;
        int samples = 0;
        for (int i = window; i < prices.size(); i++) {
            double median = median(prices.subList(i - window, i));
            if (prices.get(i) < median) {
                below++;
            }
            samples++;
        }
        return samples == 0 ? 0.5 : (double) below / samples;
    }

    Trend trend(List<Double> prices) {
        int half = prices.size() / 2;
        double first = prices.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double second = prices.subList(half, prices.size()).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (first <= 0.0) {
            return Trend.SIDEWAYS;
        }
        double change = (second - first) / first;
        double threshold = signalProperties.getStatistics().getTrendThreshold();
        if (change > threshold) {
            return Trend.UPTREND;
        }
        if (change < -threshold) {
            return Trend.DOWNTREND;
        }
        return Trend.SIDEWAYS;
    }

    private static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    private static List<Double> cleaned(List<Double> history) {
        List<Double> prices = new ArrayList<>();
        if (history == null) {
            return prices;
        }
        for (Double price : history) {
            if (price != null && price > 0.0 && !price.isNaN() && !price.isInfinite()) {
                prices.add(price);
            }
        }
        return prices;
    }
}
