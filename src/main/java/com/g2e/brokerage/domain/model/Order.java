package com.g2e.brokerage.domain.model;

import com.g2e.brokerage.domain.broker.BrokerId;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order as reported by the vendor after normalization.
 */
public record Order(
    BrokerId brokerId,
    String accountId,
    String orderId,
    String clientOrderId,
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    BigDecimal filledQuantity,
    OrderType orderType,
    BigDecimal limitPrice,
    BigDecimal stopPrice,
    TimeInForce timeInForce,
    OrderStatus status,
    Instant submittedAt,
    Instant filledAt,
    BigDecimal averageFillPrice
) {}
