package com.rebalancr.backend.rebalance;

public record TradeOutcome(
        String symbol,
        double amount,
        double value,
        OutcomeStatus status,
        String txReference,
        String error
) {

    public static TradeOutcome succeeded(TradeOrder order, String txReference) {
        return new TradeOutcome(order.symbol(), order.amount(), order.estimatedValue(), OutcomeStatus.SUCCESS,
                txReference, null);
    }

    public static TradeOutcome failed(TradeOrder order, OutcomeStatus status, String error) {
        return new TradeOutcome(order.symbol(), order.amount(), order.estimatedValue(), status, null, error);
    }

    public boolean success() {
        return status == OutcomeStatus.SUCCESS;
    }

    public enum OutcomeStatus {
        SUCCESS,
        REJECTED,
        TIMEOUT,
        ERROR
    }
}
