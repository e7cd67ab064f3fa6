package com.g2e.brokerage.infrastructure.persistence;

import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.ConnectionStatus;
import com.g2e.brokerage.repository.BrokerConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of BrokerConnectionRepository.
 */
public final class PostgresBrokerConnectionRepository implements BrokerConnectionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresBrokerConnectionRepository.class);

    private final DataSource dataSource;

    public PostgresBrokerConnectionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(BrokerConnection c) {
        String sql = """
            INSERT INTO broker_connections (
                id, user_id, broker_id, status, token_ref, connected_at, last_sync_at,
                expires_at, is_primary, nickname, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, c.id());
            ps.setObject(2, c.userId());
            ps.setString(3, c.brokerId().code());
            ps.setString(4, c.status().name());
            ps.setString(5, c.tokenRef());
            ps.setTimestamp(6, toTimestamp(c.connectedAt()));
            ps.setTimestamp(7, toTimestamp(c.lastSyncAt()));
            ps.setTimestamp(8, toTimestamp(c.expiresAt()));
            ps.setBoolean(9, c.primary());
            ps.setString(10, c.nickname());
            ps.setTimestamp(11, toTimestamp(c.createdAt()));
            ps.setTimestamp(12, toTimestamp(c.updatedAt()));
            ps.executeUpdate();

            log.debug("Inserted broker connection: {} ({}, {})", c.id(), c.brokerId(), c.status());
        } catch (SQLException e) {
            log.error("Failed to insert broker connection {}: {}", c.id(), e.getMessage());
            throw new RuntimeException("Failed to insert broker connection", e);
        }
    }

    @Override
    public void update(BrokerConnection c) {
        String sql = """
            UPDATE broker_connections
            SET status = ?, token_ref = ?, connected_at = ?, last_sync_at = ?, expires_at = ?,
                is_primary = ?, nickname = ?, updated_at = ?
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, c.status().name());
            ps.setString(2, c.tokenRef());
            ps.setTimestamp(3, toTimestamp(c.connectedAt()));
            ps.setTimestamp(4, toTimestamp(c.lastSyncAt()));
            ps.setTimestamp(5, toTimestamp(c.expiresAt()));
            ps.setBoolean(6, c.primary());
            ps.setString(7, c.nickname());
            ps.setTimestamp(8, toTimestamp(c.updatedAt()));
            ps.setObject(9, c.id());

            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Connection not found: " + c.id());
            }
        } catch (SQLException e) {
            log.error("Failed to update broker connection {}: {}", c.id(), e.getMessage());
            throw new RuntimeException("Failed to update broker connection", e);
        }
    }

    @Override
    public Optional<BrokerConnection> findById(UUID id) {
        String sql = """
            SELECT * FROM broker_connections WHERE id = ?
            """;
        List<BrokerConnection> rows = queryList(sql, ps -> ps.setObject(1, id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<BrokerConnection> findByUserId(UUID userId) {
        String sql = """
            SELECT * FROM broker_connections WHERE user_id = ? ORDER BY created_at ASC
            """;
        return queryList(sql, ps -> ps.setObject(1, userId));
    }

    @Override
    public Optional<BrokerConnection> findPending(UUID userId, BrokerId brokerId) {
        String sql = """
            SELECT * FROM broker_connections
            WHERE user_id = ? AND broker_id = ? AND status = 'PENDING'
            ORDER BY created_at DESC
            LIMIT 1
            """;
        List<BrokerConnection> rows = queryList(sql, ps -> {
            ps.setObject(1, userId);
            ps.setString(2, brokerId.code());
        });
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public int deletePending(UUID userId, BrokerId brokerId) {
        String sql = """
            DELETE FROM broker_connections
            WHERE user_id = ? AND broker_id = ? AND status = 'PENDING'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, userId);
            ps.setString(2, brokerId.code());
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to delete pending connections for user={} broker={}: {}", userId, brokerId, e.getMessage());
            throw new RuntimeException("Failed to delete pending broker connections", e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<BrokerConnection> queryList(String sql, Binder binder) {
        List<BrokerConnection> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error querying broker connections: {}", e.getMessage());
            throw new RuntimeException("Failed to query broker connections", e);
        }
        return results;
    }

    private BrokerConnection mapRow(ResultSet rs) throws SQLException {
        return new BrokerConnection(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            BrokerId.fromCode(rs.getString("broker_id")),
            ConnectionStatus.valueOf(rs.getString("status")),
            rs.getString("token_ref"),
            toInstant(rs.getTimestamp("connected_at")),
            toInstant(rs.getTimestamp("last_sync_at")),
            toInstant(rs.getTimestamp("expires_at")),
            rs.getBoolean("is_primary"),
            rs.getString("nickname"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
