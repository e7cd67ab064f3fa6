package com.g2e.brokerage.service.trading;

import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.model.OrderSide;
import com.g2e.brokerage.domain.model.OrderType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Estimated effect of an order before submission. Numbers are exact decimals.
 */
public record OrderPreview(
    BrokerId brokerId,
    String accountId,
    String symbol,
    OrderSide side,
    BigDecimal quantity,
    OrderType orderType,
    BigDecimal estimatedPrice,
    BigDecimal estimatedCost,
    BigDecimal estimatedCommission,
    BigDecimal buyingPowerImpact,
    BigDecimal buyingPowerAfter,
    BigDecimal positionAfter,
    RiskAssessment risk,
    List<String> warnings,
    boolean canExecute
) {
    public OrderPreview {
        warnings = List.copyOf(warnings);
    }
}
