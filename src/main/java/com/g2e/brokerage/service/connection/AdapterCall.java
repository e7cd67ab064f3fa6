package com.g2e.brokerage.service.connection;

import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.domain.broker.TokenSet;

/**
 * Adapter call executed with a connection's current tokens.
 */
@FunctionalInterface
public interface AdapterCall<T> {
    T apply(BrokerAdapter adapter, TokenSet tokens);
}
