package com.g2e.brokerage.broker.exception;

/**
 * Vendor answered with a non-success status.
 */
public class VendorRejectedException extends BrokerageException {

    private final int httpStatus;

    public VendorRejectedException(String brokerCode, int httpStatus, String message) {
        super(ErrorCode.VENDOR_REJECTED, brokerCode, message);
        this.httpStatus = httpStatus;
    }

    public VendorRejectedException(String brokerCode, int httpStatus, String message, Throwable cause) {
        super(ErrorCode.VENDOR_REJECTED, brokerCode, message, cause);
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isAuthenticationFailure() {
        return httpStatus == 401;
    }
}
