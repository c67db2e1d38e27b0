package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.exception.SignalSourceException;
import com.rebalancr.backend.model.Trend;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatisticalAnalyzerTest {

    private final StatisticalAnalyzer analyzer = new StatisticalAnalyzer(new SignalProperties());

    @Test
    void steadilyRisingPricesTrendUpAndNeverCloseBelowMedian() {
        StatisticsReading reading = analyzer.analyze("BTC", series(100, 1, 30));

        assertThat(reading.trend()).isEqualTo(Trend.UPTREND);
        assertThat(reading.belowMedianFrequency()).isZero();
        assertThat(reading.volatility()).isBetween(0.0, 0.1);
    }

    @Test
    void steadilyFallingPricesTrendDownAndAlwaysCloseBelowMedian() {
        StatisticsReading reading = analyzer.analyze("ETH", series(130, -1, 30));

        assertThat(reading.trend()).isEqualTo(Trend.DOWNTREND);
        assertThat(reading.belowMedianFrequency()).isEqualTo(1.0);
    }

    @Test
    void choppyPricesAreSidewaysWithVolatilityCapped() {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            prices.add(i % 2 == 0 ? 100.0 : 120.0);
        }

        StatisticsReading reading = analyzer.analyze("SOL", prices);

        assertThat(reading.volatility()).isEqualTo(1.0);
        assertThat(reading.trend()).isEqualTo(Trend.SIDEWAYS);
    }

    @Test
    void tooShortHistoryFailsTheSource() {
        assertThatThrownBy(() -> analyzer.analyze("SOL", List.of(100.0)))
                .isInstanceOf(SignalSourceException.class)
                .hasMessageContaining("SOL");
        assertThatThrownBy(() -> analyzer.analyze("SOL", Arrays.asList(null, -1.0, Double.NaN, 50.0)))
                .isInstanceOf(SignalSourceException.class);
        assertThatThrownBy(() -> analyzer.analyze("SOL", null))
                .isInstanceOf(SignalSourceException.class);
    }

    private static List<Double> series(double start, double step, int size) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            prices.add(start + step * i);
        }
        return prices;
    }
}
