package com.g2e.brokerage.broker.exception;

/**
 * No usable token bundle for a connection.
 */
public class TokensUnavailableException extends BrokerageException {

    public TokensUnavailableException(String brokerCode, String message) {
        super(ErrorCode.TOKENS_UNAVAILABLE, brokerCode, message);
    }

    @Override
    public boolean requiresReconnect() {
        return true;
    }
}
