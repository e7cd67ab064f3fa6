package com.g2e.brokerage.repository;

import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for broker connections.
 */
public interface BrokerConnectionRepository {

    void insert(BrokerConnection connection);

    void update(BrokerConnection connection);

    Optional<BrokerConnection> findById(UUID id);

    /**
     * All connections for a user, oldest first, revoked ones included.
     */
    List<BrokerConnection> findByUserId(UUID userId);

    Optional<BrokerConnection> findPending(UUID userId, BrokerId brokerId);

    /**
     * Delete PENDING rows for the pair.
     *
     * @return number of rows removed
     */
    int deletePending(UUID userId, BrokerId brokerId);
}
