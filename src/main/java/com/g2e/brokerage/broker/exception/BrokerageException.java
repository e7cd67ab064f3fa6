package com.g2e.brokerage.broker.exception;

/**
 * Base type for every error surfaced by the brokerage core.
 * Vendor transport errors are converted to a subclass before leaving an adapter.
 */
public class BrokerageException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String brokerCode;

    public BrokerageException(ErrorCode errorCode, String brokerCode, String message) {
        super(format(brokerCode, message));
        this.errorCode = errorCode;
        this.brokerCode = brokerCode;
    }

    public BrokerageException(ErrorCode errorCode, String brokerCode, String message, Throwable cause) {
        super(format(brokerCode, message), cause);
        this.errorCode = errorCode;
        this.brokerCode = brokerCode;
    }

    private static String format(String brokerCode, String message) {
        return brokerCode == null ? message : String.format("[%s] %s", brokerCode, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    /**
     * True when the user has to run the connect flow again to recover.
     */
    public boolean requiresReconnect() {
        return false;
    }
}
