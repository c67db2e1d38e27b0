package com.rebalancr.backend.model;

import java.util.Arrays;
import java.util.Optional;

public enum RebalanceEventType {
    REBALANCE_RECOMMENDATION("rebalance_recommendation"),
    AUTO_REBALANCE("auto_rebalance"),
    REBALANCE_SKIPPED("rebalance_skipped"),
    REBALANCE_REJECTED("rebalance_rejected"),
    REBALANCE_EXECUTED("rebalance_executed"),
    REBALANCE_DRY_RUN("rebalance_dry_run");

    private final String code;

    RebalanceEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<RebalanceEventType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
