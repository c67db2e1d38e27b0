package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.SignalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches sentiment and statistics for every asset in parallel, bounded by a semaphore.
 * A failing source never aborts the collection; its reading is replaced by the neutral default.
 */
@Slf4j
@Service
public class SignalCollector {

    private final MarketDataProvider marketDataProvider;
    private final SentimentSource sentimentSource;
    private final StatisticsSource statisticsSource;
    private final SignalProperties signalProperties;
    private final Executor signalExecutor;

    public SignalCollector(MarketDataProvider marketDataProvider,
                           SentimentSource sentimentSource,
                           StatisticsSource statisticsSource,
                           SignalProperties signalProperties,
                           @Qualifier("signalExecutor") Executor signalExecutor) {
        this.marketDataProvider = marketDataProvider;
        this.sentimentSource = sentimentSource;
        this.statisticsSource = statisticsSource;
        this.signalProperties = signalProperties;
        this.signalExecutor = signalExecutor;
    }

    public Map<String, AssetSignal> collect(Collection<String> symbols) {
        return collect(symbols, SignalProgressListener.NONE);
    }

    public Map<String, AssetSignal> collect(Collection<String> symbols, SignalProgressListener listener) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(symbols));
        Map<String, AssetSignal> results = new LinkedHashMap<>();
        if (unique.isEmpty()) {
            listener.onCompleted(results);
            return results;
        }

        int permits = Math.max(1, Math.min(unique.size(), signalProperties.getMaxConcurrency()));
        Semaphore semaphore = new Semaphore(permits);
        AtomicInteger completed = new AtomicInteger();
        int total = unique.size();

        Map<String, CompletableFuture<AssetSignal>> futures = new LinkedHashMap<>();
        for (String symbol : unique) {
            CompletableFuture<AssetSignal> future = CompletableFuture
                    .supplyAsync(() -> collectBounded(symbol, semaphore), signalExecutor)
                    .exceptionally(ex -> merge(symbol,
                            SourceResult.failed("sentiment: " + describe(ex)),
                            SourceResult.failed("statistics: " + describe(ex))))
                    .thenApply(signal -> {
                        notifyProgress(listener, signal, completed.incrementAndGet(), total);
                        return signal;
                    });
            futures.put(symbol, future);
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        int degraded = 0;
        for (Map.Entry<String, CompletableFuture<AssetSignal>> entry : futures.entrySet()) {
            AssetSignal signal = entry.getValue().join();
            if (signal.degraded()) {
                degraded++;
            }
            results.put(entry.getKey(), signal);
        }
        log.info("Signals collected assets={} degraded={} permits={}", total, degraded, permits);
        listener.onCompleted(results);
        return results;
    }

    private AssetSignal collectBounded(String symbol, Semaphore semaphore) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return merge(symbol, SourceResult.failed("sentiment: interrupted"), SourceResult.failed("statistics: interrupted"));
        }
        try {
            return merge(symbol, fetchSentiment(symbol), fetchStatistics(symbol));
        } finally {
            semaphore.release();
        }
    }

    private SourceResult<SentimentReading> fetchSentiment(String symbol) {
        try {
            String content = marketDataProvider.socialContent(symbol);
            SentimentReading reading = sentimentSource.analyze(symbol, content);
            if (reading == null) {
                return SourceResult.failed("sentiment: empty reading");
            }
            return SourceResult.ok(reading);
        } catch (RuntimeException e) {
            log.warn("Sentiment unavailable for {}: {}", symbol, describe(e));
            return SourceResult.failed("sentiment: " + describe(e));
        }
    }

    private SourceResult<StatisticsReading> fetchStatistics(String symbol) {
        try {
            List<Double> history = marketDataProvider.priceHistory(symbol, signalProperties.getHistoryBars());
            StatisticsReading reading = statisticsSource.analyze(symbol, history);
            if (reading == null) {
                return SourceResult.failed("statistics: empty reading");
            }
            return SourceResult.ok(reading);
        } catch (RuntimeException e) {
            log.warn("Statistics unavailable for {}: {}", symbol, describe(e));
            return SourceResult.failed("statistics: " + describe(e));
        }
    }

    /**
     * The only place where neutral defaults replace missing readings.
     */
    static AssetSignal merge(String symbol, SourceResult<SentimentReading> sentiment,
                             SourceResult<StatisticsReading> statistics) {
        List<String> errors = new ArrayList<>();
        if (!sentiment.isOk()) {
            errors.add(sentiment.error());
        }
        if (!statistics.isOk()) {
            errors.add(statistics.error());
        }
        AssetSignal.SignalStatus status;
        if (errors.isEmpty()) {
            status = AssetSignal.SignalStatus.COMPLETE;
        } else if (errors.size() == 2) {
            status = AssetSignal.SignalStatus.UNAVAILABLE;
        } else {
            status = AssetSignal.SignalStatus.DEGRADED;
        }
        SignalSet signals = SignalSet.of(
                sentiment.orElse(SentimentReading.neutral()),
                statistics.orElse(StatisticsReading.neutral()));
        return new AssetSignal(symbol, signals, status, errors);
    }

    private void notifyProgress(SignalProgressListener listener, AssetSignal signal, int completed, int total) {
        try {
            listener.onAssetCollected(signal, completed, total);
        } catch (RuntimeException e) {
            log.warn("Signal progress listener failed for {}: {}", signal.symbol(), e.getMessage());
        }
    }

    private static String describe(Throwable throwable) {
        Throwable cause = throwable;
        while (cause.getCause() != null && cause != cause.getCause()) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
