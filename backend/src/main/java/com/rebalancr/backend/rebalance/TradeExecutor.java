package com.rebalancr.backend.rebalance;

/**
 * Submits one swap to the venue. Implementations may block on network I/O; callers bound the wait.
 */
public interface TradeExecutor {

    OrderReceipt submitOrder(String symbol, double signedAmount, double maxSlippagePercent);
}
