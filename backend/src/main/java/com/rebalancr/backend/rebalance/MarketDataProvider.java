package com.rebalancr.backend.rebalance;

import java.util.List;
import java.util.OptionalDouble;

public interface MarketDataProvider {

    OptionalDouble latestPrice(String symbol);

    // Oldest first.
    List<Double> priceHistory(String symbol, int bars);

    String socialContent(String symbol);
}
