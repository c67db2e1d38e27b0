package com.rebalancr.backend.exception;

public class SignalSourceException extends RuntimeException {

    private final String source;

    public SignalSourceException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SignalSourceException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
