package com.g2e.brokerage.infrastructure.persistence;

import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.repository.BrokerAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.g2e.brokerage.infrastructure.persistence.PostgresBrokerConnectionRepository.toInstant;
import static com.g2e.brokerage.infrastructure.persistence.PostgresBrokerConnectionRepository.toTimestamp;

/**
 * PostgreSQL implementation of BrokerAccountRepository.
 */
public final class PostgresBrokerAccountRepository implements BrokerAccountRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresBrokerAccountRepository.class);

    private final DataSource dataSource;

    public PostgresBrokerAccountRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insertAll(List<BrokerAccount> accounts) {
        if (accounts.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO broker_accounts (
                id, connection_id, user_id, broker_id, broker_account_id, account_number_masked,
                account_type, account_name, is_default, include_in_aggregate, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            for (BrokerAccount a : accounts) {
                ps.setObject(1, a.id());
                ps.setObject(2, a.connectionId());
                ps.setObject(3, a.userId());
                ps.setString(4, a.brokerId().code());
                ps.setString(5, a.brokerAccountId());
                ps.setString(6, a.accountNumberMasked());
                ps.setString(7, a.accountType());
                ps.setString(8, a.accountName());
                ps.setBoolean(9, a.isDefault());
                ps.setBoolean(10, a.includeInAggregate());
                ps.setTimestamp(11, toTimestamp(a.createdAt()));
                ps.addBatch();
            }
            ps.executeBatch();
            log.debug("Inserted {} broker accounts", accounts.size());
        } catch (SQLException e) {
            log.error("Failed to insert broker accounts: {}", e.getMessage());
            throw new RuntimeException("Failed to insert broker accounts", e);
        }
    }

    @Override
    public void update(BrokerAccount a) {
        String sql = """
            UPDATE broker_accounts SET is_default = ?, include_in_aggregate = ? WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, a.isDefault());
            ps.setBoolean(2, a.includeInAggregate());
            ps.setObject(3, a.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("Account not found: " + a.id());
            }
        } catch (SQLException e) {
            log.error("Failed to update broker account {}: {}", a.id(), e.getMessage());
            throw new RuntimeException("Failed to update broker account", e);
        }
    }

    @Override
    public Optional<BrokerAccount> findById(UUID id) {
        List<BrokerAccount> rows = query("SELECT * FROM broker_accounts WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<BrokerAccount> findByConnectionId(UUID connectionId) {
        return query("SELECT * FROM broker_accounts WHERE connection_id = ? ORDER BY created_at ASC", connectionId);
    }

    @Override
    public int deleteByConnectionId(UUID connectionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM broker_accounts WHERE connection_id = ?")) {

            ps.setObject(1, connectionId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to delete accounts for connection {}: {}", connectionId, e.getMessage());
            throw new RuntimeException("Failed to delete broker accounts", e);
        }
    }

    private List<BrokerAccount> query(String sql, UUID param) {
        List<BrokerAccount> results = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error querying broker accounts: {}", e.getMessage());
            throw new RuntimeException("Failed to query broker accounts", e);
        }
        return results;
    }

    private BrokerAccount mapRow(ResultSet rs) throws SQLException {
        return new BrokerAccount(
            rs.getObject("id", UUID.class),
            rs.getObject("connection_id", UUID.class),
            rs.getObject("user_id", UUID.class),
            BrokerId.fromCode(rs.getString("broker_id")),
            rs.getString("broker_account_id"),
            rs.getString("account_number_masked"),
            rs.getString("account_type"),
            rs.getString("account_name"),
            rs.getBoolean("is_default"),
            rs.getBoolean("include_in_aggregate"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }
}
