package com.g2e.brokerage.domain.broker;

import java.time.Instant;
import java.util.UUID;

/**
 * Vendor account persisted under a connection. Only isDefault and includeInAggregate change after creation.
 */
public record BrokerAccount(
    UUID id,
    UUID connectionId,
    UUID userId,
    BrokerId brokerId,
    String brokerAccountId,
    String accountNumberMasked,
    String accountType,
    String accountName,
    boolean isDefault,
    boolean includeInAggregate,
    Instant createdAt
) {
    public BrokerAccount withPreferences(Boolean newIsDefault, Boolean newIncludeInAggregate) {
        return new BrokerAccount(
            id, connectionId, userId, brokerId, brokerAccountId, accountNumberMasked,
            accountType, accountName,
            newIsDefault != null ? newIsDefault : isDefault,
            newIncludeInAggregate != null ? newIncludeInAggregate : includeInAggregate,
            createdAt
        );
    }
}
