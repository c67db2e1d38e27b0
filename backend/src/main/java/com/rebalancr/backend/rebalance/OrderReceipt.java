package com.rebalancr.backend.rebalance;

public record OrderReceipt(boolean success, String txReference, String error) {

    public static OrderReceipt filled(String txReference) {
        return new OrderReceipt(true, txReference, null);
    }

    public static OrderReceipt rejected(String error) {
        return new OrderReceipt(false, null, error);
    }
}
