package com.g2e.brokerage.domain.broker;

import java.time.Instant;

/**
 * Vendor credential bundle obtained from an OAuth handshake.
 */
public interface TokenSet {

    String accessToken();

    /**
     * Vendor-side expiry, or null when the vendor did not report one.
     */
    Instant expiresAt();
}
