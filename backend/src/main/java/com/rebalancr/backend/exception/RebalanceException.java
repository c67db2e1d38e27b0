package com.rebalancr.backend.exception;

/**
 * Raised only for broken contracts inside the rebalance pipeline, such as an allocation whose
 * weights do not sum to one. Recoverable outcomes are returned as results instead.
 */
public class RebalanceException extends RuntimeException {

    public RebalanceException(String message) {
        super(message);
    }

    public RebalanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
