package com.g2e.brokerage.domain.model;

/**
 * Outcome of a place or cancel call. Vendor rejections are success=false, not exceptions.
 */
public record OrderResult(
    boolean success,
    String orderId,
    String message,
    Order order
) {
    public static OrderResult success(String orderId, String message, Order order) {
        return new OrderResult(true, orderId, message, order);
    }

    public static OrderResult failure(String message) {
        return new OrderResult(false, null, message, null);
    }

    public static OrderResult failure(String orderId, String message) {
        return new OrderResult(false, orderId, message, null);
    }
}
