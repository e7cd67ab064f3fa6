package com.g2e.brokerage.repository;

import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerId;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-user vendor API credentials.
 */
public interface BrokerCredentialRepository {

    Optional<BrokerCredential> find(UUID userId, BrokerId brokerId);

    void save(BrokerCredential credential);

    boolean delete(UUID userId, BrokerId brokerId);
}
