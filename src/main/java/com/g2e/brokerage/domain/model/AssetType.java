package com.g2e.brokerage.domain.model;

/**
 * Normalized asset classes across brokers.
 */
public enum AssetType {
    STOCK,
    ETF,
    OPTION,
    CRYPTO,
    MUTUAL_FUND,
    BOND,
    OTHER
}
