package com.g2e.brokerage.broker.exception;

public enum ErrorCode {
    INVALID_CALLBACK,
    STATE_MISMATCH,
    STATE_EXPIRED_OR_MISSING,
    STATE_STORE_UNAVAILABLE,
    VENDOR_REJECTED,
    VENDOR_UNAVAILABLE,
    TOKENS_UNAVAILABLE,
    UNSUPPORTED_BROKER,
    CONNECTION_NOT_FOUND
}
