package com.g2e.brokerage.domain.model;

/**
 * Normalized order lifecycle status.
 * Vendor codes that are not recognized map to PENDING.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    REJECTED,
    EXPIRED
}
