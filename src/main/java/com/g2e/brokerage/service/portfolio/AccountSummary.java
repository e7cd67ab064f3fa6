package com.g2e.brokerage.service.portfolio;

import java.math.BigDecimal;

public record AccountSummary(
    String accountId,
    String accountName,
    String accountNumber,
    BigDecimal portfolioValue,
    BigDecimal cashAvailable,
    BigDecimal buyingPower,
    int positionCount,
    BigDecimal unrealizedPl
) {}
