package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.domain.broker.BrokerConnection;

/**
 * Result of one per-broker call in a fan-out: a value or an error message.
 */
public record BrokerOutcome<T>(BrokerConnection connection, T value, String error) {

    public static <T> BrokerOutcome<T> success(BrokerConnection connection, T value) {
        return new BrokerOutcome<>(connection, value, null);
    }

    public static <T> BrokerOutcome<T> failure(BrokerConnection connection, String error) {
        return new BrokerOutcome<>(connection, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
