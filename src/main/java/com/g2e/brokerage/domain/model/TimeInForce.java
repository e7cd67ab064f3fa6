package com.g2e.brokerage.domain.model;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK
}
