package com.rebalancr.backend.rebalance;

/**
 * One leg of a rebalance. Positive amounts buy, negative amounts sell; the value carries the same sign.
 */
public record TradeOrder(String symbol, double amount, double estimatedValue, double estimatedPrice) {

    public boolean isBuy() {
        return amount > 0;
    }

    public boolean isSell() {
        return amount < 0;
    }
}
