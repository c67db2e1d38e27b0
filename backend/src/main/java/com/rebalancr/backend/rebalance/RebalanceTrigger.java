package com.rebalancr.backend.rebalance;

public enum RebalanceTrigger {
    USER,
    MONITOR
}
