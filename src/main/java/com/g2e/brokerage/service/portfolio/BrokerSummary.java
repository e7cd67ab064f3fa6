package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.domain.broker.BrokerId;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Per-broker slice of a portfolio summary. When error is set the numeric fields are zero
 * and the broker did not contribute to the totals.
 */
public record BrokerSummary(
    BrokerId brokerId,
    String brokerName,
    UUID connectionId,
    List<AccountSummary> accounts,
    BigDecimal totalValue,
    BigDecimal totalCash,
    BigDecimal totalBuyingPower,
    int positionCount,
    BigDecimal unrealizedPl,
    String error
) {
    public static BrokerSummary failed(BrokerId brokerId, String brokerName, UUID connectionId, String error) {
        return new BrokerSummary(brokerId, brokerName, connectionId, List.of(),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, BigDecimal.ZERO, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
