package com.g2e.brokerage.broker.exception;

/**
 * Handshake state is unknown, expired or already used.
 */
public class StateExpiredOrMissingException extends BrokerageException {

    public StateExpiredOrMissingException(String brokerCode, String message) {
        super(ErrorCode.STATE_EXPIRED_OR_MISSING, brokerCode, message);
    }

    @Override
    public boolean requiresReconnect() {
        return true;
    }
}
