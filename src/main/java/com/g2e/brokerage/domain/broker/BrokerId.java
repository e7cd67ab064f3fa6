package com.g2e.brokerage.domain.broker;

import java.util.Locale;

/**
 * Supported broker identifiers. Only brokers with a registered adapter can be connected.
 */
public enum BrokerId {
    ALPACA("alpaca"),
    ETRADE("etrade"),
    SCHWAB("schwab"),
    IBKR("ibkr");

    private final String code;

    BrokerId(String code) {
        this.code = code;
    }

    /**
     * Lower-case wire code used in cache keys and persistence.
     */
    public String code() {
        return code;
    }

    public static BrokerId fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Broker code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (BrokerId id : values()) {
            if (id.code.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown broker: " + code);
    }
}
