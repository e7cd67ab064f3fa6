package com.g2e.brokerage.domain.model;

import com.g2e.brokerage.domain.broker.BrokerId;

import java.math.BigDecimal;

/**
 * Account balance snapshot.
 * dayTradingBuyingPower and marginUsed are null when the vendor does not report them.
 */
public record Balance(
    BrokerId brokerId,
    String accountId,
    BigDecimal cashAvailable,
    BigDecimal cashBalance,
    BigDecimal buyingPower,
    BigDecimal dayTradingBuyingPower,
    BigDecimal portfolioValue,
    BigDecimal marginUsed
) {}
