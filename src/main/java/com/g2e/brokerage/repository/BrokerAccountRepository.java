package com.g2e.brokerage.repository;

import com.g2e.brokerage.domain.broker.BrokerAccount;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for vendor accounts attached to a connection.
 */
public interface BrokerAccountRepository {

    void insertAll(List<BrokerAccount> accounts);

    void update(BrokerAccount account);

    Optional<BrokerAccount> findById(UUID id);

    List<BrokerAccount> findByConnectionId(UUID connectionId);

    int deleteByConnectionId(UUID connectionId);
}
