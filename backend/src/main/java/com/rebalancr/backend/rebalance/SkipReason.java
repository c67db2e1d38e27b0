package com.rebalancr.backend.rebalance;

public enum SkipReason {
    TOO_FREQUENT("too frequent"),
    COST_EXCEEDS_BENEFIT("cost exceeds benefit"),
    NO_TRADES("no trades required"),
    INSUFFICIENT_DATA("insufficient data"),
    IN_PROGRESS("rebalance already in progress"),
    CANCELLED("cancelled");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
