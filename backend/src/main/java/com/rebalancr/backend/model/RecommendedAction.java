package com.rebalancr.backend.model;

import java.util.Locale;

public enum RecommendedAction {
    INCREASE,
    DECREASE,
    MAINTAIN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
