package com.g2e.brokerage.domain.broker;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's link to one brokerage.
 *
 * tokenRef is the opaque handle under which the token bundle is cached; it is null
 * while PENDING and after the connection is revoked.
 */
public record BrokerConnection(
    UUID id,
    UUID userId,
    BrokerId brokerId,
    ConnectionStatus status,
    String tokenRef,
    Instant connectedAt,
    Instant lastSyncAt,
    Instant expiresAt,
    boolean primary,
    String nickname,
    Instant createdAt,
    Instant updatedAt
) {
    public static BrokerConnection pending(UUID userId, BrokerId brokerId, Instant now) {
        return new BrokerConnection(
            UUID.randomUUID(), userId, brokerId, ConnectionStatus.PENDING,
            null, null, null, null, false, null, now, now
        );
    }

    public boolean isActive() {
        return status == ConnectionStatus.ACTIVE;
    }

    public BrokerConnection withStatus(ConnectionStatus newStatus, Instant now) {
        return new BrokerConnection(
            id, userId, brokerId, newStatus, tokenRef, connectedAt, lastSyncAt,
            expiresAt, primary, nickname, createdAt, now
        );
    }

    public BrokerConnection activated(String newTokenRef, Instant tokenExpiresAt, Instant now) {
        return new BrokerConnection(
            id, userId, brokerId, ConnectionStatus.ACTIVE, newTokenRef, now, lastSyncAt,
            tokenExpiresAt, primary, nickname, createdAt, now
        );
    }

    public BrokerConnection revoked(Instant now) {
        return new BrokerConnection(
            id, userId, brokerId, ConnectionStatus.REVOKED, null, connectedAt, lastSyncAt,
            expiresAt, primary, nickname, createdAt, now
        );
    }

    public BrokerConnection withExpiresAt(Instant newExpiresAt, Instant now) {
        return new BrokerConnection(
            id, userId, brokerId, status, tokenRef, connectedAt, lastSyncAt,
            newExpiresAt, primary, nickname, createdAt, now
        );
    }

    public BrokerConnection withLastSyncAt(Instant syncedAt) {
        return new BrokerConnection(
            id, userId, brokerId, status, tokenRef, connectedAt, syncedAt,
            expiresAt, primary, nickname, createdAt, syncedAt
        );
    }
}
