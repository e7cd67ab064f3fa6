package com.g2e.brokerage.infrastructure.broker.metrics;

import java.time.Duration;

/**
 * Metrics sink for vendor traffic. Callers treat a null instance as "metrics disabled".
 */
public interface BrokerMetrics {

    /**
     * Record one adapter call made on behalf of a connection.
     *
     * @param operation short operation name (accounts, balance, positions, orders, quotes, place, cancel)
     */
    void recordVendorCall(String brokerCode, String operation, boolean success, Duration latency);

    void recordOAuthExchange(String brokerCode, boolean success);

    void recordTokenRefresh(String brokerCode, boolean success);

    /**
     * @param reason timeout, rejected, unavailable, tokens or error
     */
    void recordAggregationFailure(String brokerCode, String reason);
}
