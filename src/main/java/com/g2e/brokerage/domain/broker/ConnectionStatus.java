package com.g2e.brokerage.domain.broker;

/**
 * Lifecycle of a broker connection: PENDING, then ACTIVE, then one of EXPIRED, REVOKED or ERROR.
 */
public enum ConnectionStatus {
    PENDING,
    ACTIVE,
    EXPIRED,
    REVOKED,
    ERROR
}
