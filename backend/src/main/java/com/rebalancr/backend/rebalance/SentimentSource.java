package com.rebalancr.backend.rebalance;

public interface SentimentSource {

    SentimentReading analyze(String symbol, String content);
}
