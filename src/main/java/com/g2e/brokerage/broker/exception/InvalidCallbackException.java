package com.g2e.brokerage.broker.exception;

/**
 * OAuth callback is missing required fields.
 */
public class InvalidCallbackException extends BrokerageException {

    public InvalidCallbackException(String brokerCode, String message) {
        super(ErrorCode.INVALID_CALLBACK, brokerCode, message);
    }
}
