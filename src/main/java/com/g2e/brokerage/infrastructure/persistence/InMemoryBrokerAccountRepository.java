package com.g2e.brokerage.infrastructure.persistence;

import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.repository.BrokerAccountRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryBrokerAccountRepository implements BrokerAccountRepository {

    private final ConcurrentHashMap<UUID, BrokerAccount> rows = new ConcurrentHashMap<>();

    @Override
    public void insertAll(List<BrokerAccount> accounts) {
        accounts.forEach(a -> rows.put(a.id(), a));
    }

    @Override
    public void update(BrokerAccount account) {
        if (rows.replace(account.id(), account) == null) {
            throw new IllegalStateException("Account not found: " + account.id());
        }
    }

    @Override
    public Optional<BrokerAccount> findById(UUID id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<BrokerAccount> findByConnectionId(UUID connectionId) {
        return rows.values().stream()
            .filter(a -> a.connectionId().equals(connectionId))
            .sorted(Comparator.comparing(BrokerAccount::createdAt).thenComparing(BrokerAccount::brokerAccountId))
            .toList();
    }

    @Override
    public int deleteByConnectionId(UUID connectionId) {
        int removed = 0;
        for (BrokerAccount a : findByConnectionId(connectionId)) {
            if (rows.remove(a.id(), a)) {
                removed++;
            }
        }
        return removed;
    }
}
