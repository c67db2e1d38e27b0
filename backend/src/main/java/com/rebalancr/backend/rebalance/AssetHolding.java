package com.rebalancr.backend.rebalance;

public record AssetHolding(String symbol, double amount, double price, double value, double weight, boolean priced) {
}
