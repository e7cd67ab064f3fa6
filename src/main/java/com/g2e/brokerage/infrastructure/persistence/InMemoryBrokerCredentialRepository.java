package com.g2e.brokerage.infrastructure.persistence;

import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.repository.BrokerCredentialRepository;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryBrokerCredentialRepository implements BrokerCredentialRepository {

    private final ConcurrentHashMap<String, BrokerCredential> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<BrokerCredential> find(UUID userId, BrokerId brokerId) {
        return Optional.ofNullable(rows.get(key(userId, brokerId)));
    }

    @Override
    public void save(BrokerCredential credential) {
        if (credential.userId() == null) {
            throw new IllegalArgumentException("Per-user credential requires a userId");
        }
        rows.put(key(credential.userId(), credential.brokerId()), credential);
    }

    @Override
    public boolean delete(UUID userId, BrokerId brokerId) {
        return rows.remove(key(userId, brokerId)) != null;
    }

    private static String key(UUID userId, BrokerId brokerId) {
        return userId + ":" + brokerId.code();
    }
}
