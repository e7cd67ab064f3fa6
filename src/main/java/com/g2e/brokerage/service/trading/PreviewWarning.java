package com.g2e.brokerage.service.trading;

/**
 * Fixed preview warnings. Dynamic warnings (quote or account data failures) carry their own text.
 */
public enum PreviewWarning {
    INSUFFICIENT_BUYING_POWER("Insufficient buying power"),
    SELLING_MORE_THAN_OWNED("Selling more shares than owned"),
    SHORT_SELLING_NOT_SUPPORTED("This broker does not support short selling"),
    HIGH_CONCENTRATION("High concentration: position would be >=20% of portfolio"),
    MODERATE_CONCENTRATION("Moderate concentration: position would be >=10% of portfolio");

    private final String message;

    PreviewWarning(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
