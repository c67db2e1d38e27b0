package com.rebalancr.backend.rebalance;

import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
