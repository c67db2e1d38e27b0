package com.rebalancr.backend.model;

import java.util.Locale;

/**
 * Frequency words accepted by the auto-rebalance settings and the check interval each maps to.
 */
public enum RebalanceFrequency {
    HOURLY(3_600L),
    DAILY(86_400L),
    WEEKLY(604_800L),
    MONTHLY(2_592_000L);

    private final long seconds;

    RebalanceFrequency(long seconds) {
        this.seconds = seconds;
    }

    public long seconds() {
        return seconds;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    // Unknown words fall back to daily.
    public static RebalanceFrequency fromLabel(String label) {
        if (label == null) {
            return DAILY;
        }
        for (RebalanceFrequency frequency : values()) {
            if (frequency.name().equalsIgnoreCase(label.trim())) {
                return frequency;
            }
        }
        return DAILY;
    }

    public static RebalanceFrequency fromSeconds(long seconds) {
        if (seconds <= HOURLY.seconds) {
            return HOURLY;
        }
        if (seconds <= DAILY.seconds) {
            return DAILY;
        }
        if (seconds <= WEEKLY.seconds) {
            return WEEKLY;
        }
        return MONTHLY;
    }
}
