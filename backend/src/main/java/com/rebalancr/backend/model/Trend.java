package com.rebalancr.backend.model;

import java.util.Locale;

public enum Trend {
    UPTREND,
    DOWNTREND,
    SIDEWAYS;

    public static Trend fromLabel(String label) {
        if (label == null) {
            return SIDEWAYS;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "uptrend", "up" -> UPTREND;
            case "downtrend", "down" -> DOWNTREND;
            default -> SIDEWAYS;
        };
    }
}
