package com.g2e.brokerage.broker.exception;

import java.util.UUID;

/**
 * Connection (or account under a connection) is unknown or belongs to another user.
 */
public class ConnectionNotFoundException extends BrokerageException {

    private final UUID id;

    public ConnectionNotFoundException(UUID connectionId) {
        this(connectionId, "Connection not found: " + connectionId);
    }

    private ConnectionNotFoundException(UUID id, String message) {
        super(ErrorCode.CONNECTION_NOT_FOUND, null, message);
        this.id = id;
    }

    public static ConnectionNotFoundException forAccount(UUID accountId) {
        return new ConnectionNotFoundException(accountId, "Account not found: " + accountId);
    }

    public static ConnectionNotFoundException noActiveConnection(String brokerDescription) {
        return new ConnectionNotFoundException(null, "No active connection for " + brokerDescription);
    }

    public UUID getId() {
        return id;
    }
}
