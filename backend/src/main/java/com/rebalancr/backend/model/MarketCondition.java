package com.rebalancr.backend.model;

import java.util.Locale;

public enum MarketCondition {
    NORMAL,
    BULLISH,
    BEARISH,
    HIGH_VOLATILITY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MarketCondition fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NORMAL;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (MarketCondition condition : values()) {
            if (condition.name().equals(normalized)) {
                return condition;
            }
        }
        return NORMAL;
    }
}
