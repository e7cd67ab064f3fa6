package com.g2e.brokerage.broker.exception;

/**
 * Vendor could not be reached (I/O failure, timeout, interrupted call).
 */
public class VendorUnavailableException extends BrokerageException {

    public VendorUnavailableException(String brokerCode, String message) {
        super(ErrorCode.VENDOR_UNAVAILABLE, brokerCode, message);
    }

    public VendorUnavailableException(String brokerCode, String message, Throwable cause) {
        super(ErrorCode.VENDOR_UNAVAILABLE, brokerCode, message, cause);
    }
}
