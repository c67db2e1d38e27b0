package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.SignalProperties;
import com.rebalancr.backend.exception.SignalSourceException;
import com.rebalancr.backend.model.Sentiment;
import com.rebalancr.backend.model.Trend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalCollectorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(6);
    private final SignalProperties properties = new SignalProperties();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failingSentimentDegradesOnlyThatAsset() {
        MarketDataProvider marketData = mock(MarketDataProvider.class);
        SentimentSource sentiment = mock(SentimentSource.class);
        StatisticsSource statistics = mock(StatisticsSource.class);
        when(marketData.socialContent(anyString())).thenReturn("posts");
        when(marketData.priceHistory(anyString(), anyInt())).thenReturn(List.of(1.0, 2.0));
        when(sentiment.analyze(eq("BTC"), anyString()))
                .thenReturn(new SentimentReading(Sentiment.GREED, 0.2, 0.8, 0.1, false));
        when(sentiment.analyze(eq("SOL"), anyString()))
                .thenThrow(new SignalSourceException("sentiment", "sentiment endpoint returned 503"));
        when(statistics.analyze(anyString(), anyList()))
                .thenReturn(new StatisticsReading(0.2, 0.3, Trend.UPTREND));
        SignalCollector collector = new SignalCollector(marketData, sentiment, statistics, properties, executor);

        Map<String, AssetSignal> signals = collector.collect(List.of("BTC", "SOL"));

        assertThat(signals).containsOnlyKeys("BTC", "SOL");
        assertThat(signals.get("BTC").status()).isEqualTo(AssetSignal.SignalStatus.COMPLETE);
        AssetSignal sol = signals.get("SOL");
        assertThat(sol.status()).isEqualTo(AssetSignal.SignalStatus.DEGRADED);
        assertThat(sol.degraded()).isTrue();
        assertThat(sol.usable()).isTrue();
        assertThat(sol.signals().sentiment()).isEqualTo(Sentiment.NEUTRAL);
        assertThat(sol.signals().fearScore()).isEqualTo(0.5);
        assertThat(sol.signals().trend()).isEqualTo(Trend.UPTREND);
        assertThat(sol.errors()).hasSize(1);
        assertThat(sol.errors().get(0)).startsWith("sentiment:");
    }

    @Test
    void bothSourcesFailingLeavesAssetUnavailableWithNeutralSignals() {
        MarketDataProvider marketData = mock(MarketDataProvider.class);
        when(marketData.socialContent(anyString())).thenThrow(new IllegalStateException("social feed down"));
        when(marketData.priceHistory(anyString(), anyInt())).thenThrow(new IllegalStateException("prices down"));
        SignalCollector collector = new SignalCollector(marketData, mock(SentimentSource.class),
                mock(StatisticsSource.class), properties, executor);

        AssetSignal signal = collector.collect(List.of("ETH")).get("ETH");

        assertThat(signal.status()).isEqualTo(AssetSignal.SignalStatus.UNAVAILABLE);
        assertThat(signal.usable()).isFalse();
        assertThat(signal.signals()).isEqualTo(SignalSet.neutral());
        assertThat(signal.errors()).containsExactly("sentiment: social feed down", "statistics: prices down");
    }

    @Test
    void progressIsReportedPerAssetAndOnceOnCompletion() {
        SignalCollector collector = new SignalCollector(mock(MarketDataProvider.class), (symbol, content) ->
                SentimentReading.neutral(), (symbol, history) -> StatisticsReading.neutral(), properties, executor);
        List<Integer> totals = new CopyOnWriteArrayList<>();
        AtomicInteger completions = new AtomicInteger();

        Map<String, AssetSignal> signals = collector.collect(List.of("BTC", "ETH", "BTC", "USDC"),
                new SignalProgressListener() {
                    @Override
                    public void onAssetCollected(AssetSignal signal, int completed, int total) {
                        totals.add(total);
                    }

                    @Override
                    public void onCompleted(Map<String, AssetSignal> collected) {
                        completions.incrementAndGet();
                    }
                });

        assertThat(signals).containsOnlyKeys("BTC", "ETH", "USDC");
        assertThat(totals).hasSize(3).containsOnly(3);
        assertThat(completions).hasValue(1);
    }

    @Test
    void concurrentFetchesStayWithinConfiguredLimit() {
        properties.setMaxConcurrency(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StatisticsSource slowStatistics = (symbol, history) -> {
            int current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return StatisticsReading.neutral();
        };
        SignalCollector collector = new SignalCollector(mock(MarketDataProvider.class),
                (symbol, content) -> SentimentReading.neutral(), slowStatistics, properties, executor);

        Map<String, AssetSignal> signals = collector.collect(List.of("A", "B", "C", "D", "E", "F"));

        assertThat(signals).hasSize(6);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void mergeUsesNeutralDefaultsForMissingReadings() {
        AssetSignal signal = SignalCollector.merge("BTC",
                SourceResult.failed("sentiment: timeout"),
                SourceResult.ok(new StatisticsReading(0.9, 0.1, Trend.DOWNTREND)));

        assertThat(signal.status()).isEqualTo(AssetSignal.SignalStatus.DEGRADED);
        assertThat(signal.signals().sentiment()).isEqualTo(Sentiment.NEUTRAL);
        assertThat(signal.signals().volatility()).isEqualTo(0.9);
    }
}
