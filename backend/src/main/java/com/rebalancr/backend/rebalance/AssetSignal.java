package com.rebalancr.backend.rebalance;

import java.util.List;

public record AssetSignal(String symbol, SignalSet signals, SignalStatus status, List<String> errors) {

    public AssetSignal {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean degraded() {
        return status != SignalStatus.COMPLETE;
    }

    public boolean usable() {
        return status != SignalStatus.UNAVAILABLE;
    }

    public enum SignalStatus {
        COMPLETE,
        DEGRADED,
        UNAVAILABLE
    }
}
