package com.g2e.brokerage.domain.model;

import com.g2e.brokerage.domain.broker.BrokerId;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest market quote. Optional fields (high, low, open, previousClose) may be null.
 */
public record Quote(
    String symbol,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal last,
    long volume,
    BigDecimal change,
    BigDecimal changePercent,
    BigDecimal high,
    BigDecimal low,
    BigDecimal open,
    BigDecimal previousClose,
    Instant timestamp,
    BrokerId source
) {}
