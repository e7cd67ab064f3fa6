package com.g2e.brokerage.domain.broker;

public record SupportedBroker(BrokerId brokerId, String name, BrokerFeatures features) {}
