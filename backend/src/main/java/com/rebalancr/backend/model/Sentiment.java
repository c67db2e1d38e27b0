package com.rebalancr.backend.model;

public enum Sentiment {
    FEAR,
    NEUTRAL,
    GREED
}
