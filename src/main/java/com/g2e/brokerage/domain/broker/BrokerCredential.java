package com.g2e.brokerage.domain.broker;

import java.util.UUID;

/**
 * Vendor API key pair used to parameterize an adapter.
 * userId is null for the application-wide credential of a vendor.
 */
public record BrokerCredential(
    UUID userId,
    BrokerId brokerId,
    String apiKey,
    String apiSecret,
    boolean sandbox
) {
    public static BrokerCredential application(BrokerId brokerId, String apiKey, String apiSecret, boolean sandbox) {
        return new BrokerCredential(null, brokerId, apiKey, apiSecret, sandbox);
    }

    /**
     * Masked key safe to show users: first and last 3 chars, or 2 when the key is short.
     */
    public String apiKeyHint() {
        return maskKey(apiKey);
    }

    public static String maskKey(String key) {
        if (key == null || key.isEmpty()) {
            return "***";
        }
        if (key.length() <= 4) {
            return "***";
        }
        int visible = key.length() <= 8 ? 2 : 3;
        return key.substring(0, visible) + "..." + key.substring(key.length() - visible);
    }

    @Override
    public String toString() {
        return "BrokerCredential[userId=" + userId + ", brokerId=" + brokerId
            + ", apiKey=" + apiKeyHint() + ", apiSecret=***, sandbox=" + sandbox + "]";
    }
}
