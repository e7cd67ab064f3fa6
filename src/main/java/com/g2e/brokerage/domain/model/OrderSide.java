package com.g2e.brokerage.domain.model;

/**
 * Normalized order side.
 */
public enum OrderSide {
    BUY,
    SELL,
    BUY_TO_COVER,
    SELL_SHORT;

    /**
     * BUY and BUY_TO_COVER consume buying power and add to the position.
     */
    public boolean isBuy() {
        return this == BUY || this == BUY_TO_COVER;
    }
}
