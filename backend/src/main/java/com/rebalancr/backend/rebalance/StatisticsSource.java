package com.rebalancr.backend.rebalance;

import java.util.List;

public interface StatisticsSource {

    StatisticsReading analyze(String symbol, List<Double> priceHistory);
}
