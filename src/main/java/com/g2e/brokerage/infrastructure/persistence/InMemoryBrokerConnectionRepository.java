package com.g2e.brokerage.infrastructure.persistence;

import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.ConnectionStatus;
import com.g2e.brokerage.repository.BrokerConnectionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local connection store for tests and single-node deployments.
 */
public final class InMemoryBrokerConnectionRepository implements BrokerConnectionRepository {

    private final ConcurrentHashMap<UUID, BrokerConnection> rows = new ConcurrentHashMap<>();

    /**
     * Rejects a second PENDING row for the same user and broker, as the
     * {@code uq_broker_connections_pending} index does in PostgreSQL.
     */
    @Override
    public synchronized void insert(BrokerConnection connection) {
        if (connection.status() == ConnectionStatus.PENDING
                && findPending(connection.userId(), connection.brokerId()).isPresent()) {
            throw new IllegalStateException("Pending connection already exists for user="
                + connection.userId() + " broker=" + connection.brokerId().code());
        }
        if (rows.putIfAbsent(connection.id(), connection) != null) {
            throw new IllegalStateException("Connection already exists: " + connection.id());
        }
    }

    @Override
    public void update(BrokerConnection connection) {
        if (rows.replace(connection.id(), connection) == null) {
            throw new IllegalStateException("Connection not found: " + connection.id());
        }
    }

    @Override
    public Optional<BrokerConnection> findById(UUID id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<BrokerConnection> findByUserId(UUID userId) {
        return rows.values().stream()
            .filter(c -> c.userId().equals(userId))
            .sorted(Comparator.comparing(BrokerConnection::createdAt).thenComparing(c -> c.id().toString()))
            .toList();
    }

    @Override
    public Optional<BrokerConnection> findPending(UUID userId, BrokerId brokerId) {
        return findByUserId(userId).stream()
            .filter(c -> c.brokerId() == brokerId && c.status() == ConnectionStatus.PENDING)
            .reduce((first, second) -> second);
    }

    @Override
    public synchronized int deletePending(UUID userId, BrokerId brokerId) {
        int removed = 0;
        for (BrokerConnection c : findByUserId(userId)) {
            if (c.brokerId() == brokerId && c.status() == ConnectionStatus.PENDING && rows.remove(c.id(), c)) {
                removed++;
            }
        }
        return removed;
    }
}
