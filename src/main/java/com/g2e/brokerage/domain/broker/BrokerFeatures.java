package com.g2e.brokerage.domain.broker;

/**
 * Capabilities advertised by an adapter.
 *
 * @param tokenRefreshDays     0 when the vendor token does not need periodic renewal
 * @param requiresManualReauth true when the user must re-run the handshake once tokens lapse
 */
public record BrokerFeatures(
    boolean stockTrading,
    boolean optionsTrading,
    boolean cryptoTrading,
    boolean fractionalShares,
    boolean extendedHours,
    boolean shortSelling,
    boolean paperTrading,
    boolean realTimeQuotes,
    int tokenRefreshDays,
    boolean requiresManualReauth
) {}
