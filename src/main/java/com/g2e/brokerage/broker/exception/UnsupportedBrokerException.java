package com.g2e.brokerage.broker.exception;

public class UnsupportedBrokerException extends BrokerageException {

    public UnsupportedBrokerException(String brokerCode) {
        super(ErrorCode.UNSUPPORTED_BROKER, brokerCode, "Broker is not supported");
    }
}
