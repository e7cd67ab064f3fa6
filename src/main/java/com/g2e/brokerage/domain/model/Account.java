package com.g2e.brokerage.domain.model;

import com.g2e.brokerage.domain.broker.BrokerId;

/**
 * Brokerage account as reported by the vendor.
 * accountNumber is always masked.
 */
public record Account(
    BrokerId brokerId,
    String accountId,
    String accountNumber,
    String accountType,
    String accountName,
    boolean isDefault
) {}
