package com.g2e.brokerage.domain.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Order to submit. Limit price is required for LIMIT/STOP_LIMIT, stop price for STOP/STOP_LIMIT.
 */
public record OrderRequest(
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    OrderType orderType,
    BigDecimal limitPrice,
    BigDecimal stopPrice,
    TimeInForce timeInForce,
    boolean extendedHours
) {
    public OrderRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
        orderType = orderType == null ? OrderType.MARKET : orderType;
        timeInForce = timeInForce == null ? TimeInForce.DAY : timeInForce;
        if ((orderType == OrderType.LIMIT || orderType == OrderType.STOP_LIMIT) && limitPrice == null) {
            throw new IllegalArgumentException(orderType + " order requires a limit price");
        }
        if ((orderType == OrderType.STOP || orderType == OrderType.STOP_LIMIT) && stopPrice == null) {
            throw new IllegalArgumentException(orderType + " order requires a stop price");
        }
    }

    public static OrderRequest market(String symbol, OrderSide side, BigDecimal quantity) {
        return new OrderRequest(symbol, side, quantity, OrderType.MARKET, null, null, TimeInForce.DAY, false);
    }

    public static OrderRequest limit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal limitPrice) {
        return new OrderRequest(symbol, side, quantity, OrderType.LIMIT, limitPrice, null, TimeInForce.DAY, false);
    }
}
