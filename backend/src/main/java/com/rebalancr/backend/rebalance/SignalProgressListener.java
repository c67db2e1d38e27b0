package com.rebalancr.backend.rebalance;

import java.util.Map;

/**
 * Receives per-asset progress while signals are collected. {@link #onAssetCollected} may be
 * called from collector threads; {@link #onCompleted} is called exactly once, on the calling
 * thread, after every asset has reported.
 */
public interface SignalProgressListener {

    SignalProgressListener NONE = new SignalProgressListener() {
    };

    default void onAssetCollected(AssetSignal signal, int completed, int total) {
    }

    default void onCompleted(Map<String, AssetSignal> signals) {
    }
}
