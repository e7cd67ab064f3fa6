package com.g2e.brokerage.domain.model;

import com.g2e.brokerage.domain.broker.BrokerId;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Holding in a single symbol.
 */
public record Position(
    BrokerId brokerId,
    String accountId,
    String symbol,
    BigDecimal quantity,
    BigDecimal averageCost,
    BigDecimal currentPrice,
    BigDecimal marketValue,
    BigDecimal unrealizedPl,
    BigDecimal unrealizedPlPercent,
    AssetType assetType,
    Instant lastUpdated
) {
    public BigDecimal costBasis() {
        return quantity.multiply(averageCost);
    }
}
