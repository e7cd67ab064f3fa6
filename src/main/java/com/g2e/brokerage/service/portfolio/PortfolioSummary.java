package com.g2e.brokerage.service.portfolio;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Cross-broker portfolio view. Totals cover only brokers that answered successfully.
 */
public record PortfolioSummary(
    BigDecimal totalValue,
    BigDecimal totalCash,
    BigDecimal totalBuyingPower,
    int totalPositions,
    BigDecimal totalUnrealizedPl,
    BigDecimal totalUnrealizedPlPercent,
    List<BrokerSummary> byBroker,
    Instant lastUpdated
) {}
