package com.g2e.brokerage.domain.broker;

import java.util.UUID;

public record ConnectionInitiation(
    UUID connectionId,
    String authorizationUrl,
    String state,
    long expiresInSeconds,
    boolean oob
) {}
