package com.rebalancr.backend.rebalance;

public record GateDecision(boolean proceed, SkipReason reason, String message, double cost, double benefit) {

    public static GateDecision proceed(double cost, double benefit) {
        return new GateDecision(true, null, "benefit exceeds cost", cost, benefit);
    }

    public static GateDecision skip(SkipReason reason, double cost, double benefit) {
        return new GateDecision(false, reason, reason.description(), cost, benefit);
    }

    public static GateDecision skip(SkipReason reason, String message) {
        return new GateDecision(false, reason, message, 0.0, 0.0);
    }
}
