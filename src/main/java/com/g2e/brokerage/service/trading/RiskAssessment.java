package com.g2e.brokerage.service.trading;

import java.math.BigDecimal;

/**
 * @param concentrationPercent estimated cost as a percentage of portfolio value
 * @param concentrated         true above 10%
 */
public record RiskAssessment(
    BigDecimal concentrationPercent,
    boolean concentrated,
    BigDecimal positionSizeDollars,
    BigDecimal currentPositionQuantity,
    boolean extendedHoursSupported,
    boolean fractionalSharesSupported,
    boolean shortSellingSupported
) {}
