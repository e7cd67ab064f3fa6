package com.g2e.brokerage.infrastructure.broker.http;

/**
 * Raw vendor response: status code and body text.
 */
public record VendorResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNoContent() {
        return statusCode == 204;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }
}
