package com.g2e.brokerage.broker.exception;

/**
 * Handshake state belongs to a different user or broker than the caller.
 */
public class StateMismatchException extends BrokerageException {

    public StateMismatchException(String brokerCode, String message) {
        super(ErrorCode.STATE_MISMATCH, brokerCode, message);
    }
}
