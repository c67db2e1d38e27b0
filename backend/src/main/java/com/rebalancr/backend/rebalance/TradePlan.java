package com.rebalancr.backend.rebalance;

import java.util.List;

public record TradePlan(List<TradeOrder> orders) {

    public TradePlan {
        orders = orders == null ? List.of() : List.copyOf(orders);
    }

    public static TradePlan empty() {
        return new TradePlan(List.of());
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int size() {
        return orders.size();
    }

    public double turnover() {
        return orders.stream().mapToDouble(order -> Math.abs(order.estimatedValue())).sum();
    }
}
