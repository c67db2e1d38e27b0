package com.rebalancr.backend.rebalance;

/**
 * Outcome of one call to an external signal source: either a value or the reason it is missing.
 */
public record SourceResult<T>(T value, String error) {

    public static <T> SourceResult<T> ok(T value) {
        return new SourceResult<>(value, null);
    }

    public static <T> SourceResult<T> failed(String error) {
        return new SourceResult<>(null, error == null ? "unknown error" : error);
    }

    public boolean isOk() {
        return error == null && value != null;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }
}
