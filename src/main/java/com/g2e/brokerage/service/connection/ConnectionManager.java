package com.g2e.brokerage.service.connection;

import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.broker.BrokerAdapterFactory;
import com.g2e.brokerage.broker.exception.BrokerageException;
import com.g2e.brokerage.broker.exception.ConnectionNotFoundException;
import com.g2e.brokerage.broker.exception.ErrorCode;
import com.g2e.brokerage.broker.exception.InvalidCallbackException;
import com.g2e.brokerage.broker.exception.StateExpiredOrMissingException;
import com.g2e.brokerage.broker.exception.StateMismatchException;
import com.g2e.brokerage.broker.exception.TokensUnavailableException;
import com.g2e.brokerage.broker.exception.VendorRejectedException;
import com.g2e.brokerage.broker.exception.VendorUnavailableException;
import com.g2e.brokerage.domain.broker.AuthorizationRequest;
import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.ConnectionInitiation;
import com.g2e.brokerage.domain.broker.ConnectionStatus;
import com.g2e.brokerage.domain.broker.OAuthHandshake;
import com.g2e.brokerage.domain.broker.TokenSet;
import com.g2e.brokerage.domain.model.Account;
import com.g2e.brokerage.infrastructure.broker.metrics.BrokerMetrics;
import com.g2e.brokerage.infrastructure.cache.HandshakeStateStore;
import com.g2e.brokerage.infrastructure.cache.TokenStore;
import com.g2e.brokerage.repository.BrokerAccountRepository;
import com.g2e.brokerage.repository.BrokerConnectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Owns the connection lifecycle: OAuth handshake, token custody, refresh and disconnect.
 *
 * State machine: none, PENDING, ACTIVE, then EXPIRED / REVOKED / ERROR. Vendor calls made
 * through {@link #execute} refresh tokens lazily on an authentication failure.
 */
public class ConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final SecureRandom RANDOM = new SecureRandom();

    enum RefreshOutcome { REFRESHED, TRANSIENT_FAILURE, REJECTED }

    private final BrokerAdapterFactory adapterFactory;
    private final BrokerConnectionRepository connectionRepo;
    private final BrokerAccountRepository accountRepo;
    private final TokenStore tokenStore;
    private final HandshakeStateStore handshakeStore;
    private final BrokerMetrics metrics;
    private final Clock clock;
    private final ConcurrentHashMap<String, Object> pendingLocks = new ConcurrentHashMap<>();

    public ConnectionManager(
        BrokerAdapterFactory adapterFactory,
        BrokerConnectionRepository connectionRepo,
        BrokerAccountRepository accountRepo,
        TokenStore tokenStore,
        HandshakeStateStore handshakeStore,
        BrokerMetrics metrics,
        Clock clock
    ) {
        this.adapterFactory = adapterFactory;
        this.connectionRepo = connectionRepo;
        this.accountRepo = accountRepo;
        this.tokenStore = tokenStore;
        this.handshakeStore = handshakeStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ===== Handshake =====

    /**
     * Start connecting a broker. Any earlier pending handshake for the same user and broker
     * is discarded.
     */
    public ConnectionInitiation initiate(UUID userId, BrokerId brokerId, String redirectUri) {
        BrokerAdapter adapter = adapterFactory.forUser(userId, brokerId);

        String state = generateState();
        AuthorizationRequest auth = adapter.getAuthorizationUrl(state, redirectUri);

        Instant now = clock.instant();
        BrokerConnection pending = BrokerConnection.pending(userId, brokerId, now);
        OAuthHandshake handshake = new OAuthHandshake(
            state, userId, brokerId, redirectUri,
            auth.metadata().get("oauth_token"),
            auth.metadata().get("oauth_token_secret"),
            now
        );

        // one PENDING row per (user, broker); replace-and-insert must not interleave
        synchronized (pendingLock(userId, brokerId)) {
            int superseded = connectionRepo.deletePending(userId, brokerId);
            if (superseded > 0) {
                log.info("[CONNECT] Superseded {} pending connection(s) for user={} broker={}",
                    superseded, userId, brokerId);
            }
            connectionRepo.insert(pending);

            if (!handshakeStore.save(handshake)) {
                connectionRepo.deletePending(userId, brokerId);
                throw new BrokerageException(ErrorCode.STATE_STORE_UNAVAILABLE, brokerId.code(),
                    "Could not store OAuth handshake state");
            }
        }

        log.info("[CONNECT] Initiated {} connection for user={} connection={} oob={}",
            brokerId, userId, pending.id(), auth.oob());
        return new ConnectionInitiation(pending.id(), auth.url(), state,
            handshakeStore.ttl().toSeconds(), auth.oob());
    }

    /**
     * Finish the handshake with the vendor callback data. The handshake state is consumed
     * before the token exchange, so a given state completes at most once.
     */
    public BrokerConnection complete(UUID userId, BrokerId brokerId, Map<String, String> callbackData,
                                     String redirectUri) {
        String state = callbackData.get("state");
        if (state == null || state.isBlank()) {
            throw new InvalidCallbackException(brokerId.code(), "Missing state parameter");
        }

        OAuthHandshake handshake = handshakeStore.find(state)
            .orElseThrow(() -> new StateExpiredOrMissingException(brokerId.code(),
                "OAuth state expired or unknown; start the connection again"));

        if (!handshake.userId().equals(userId) || handshake.brokerId() != brokerId) {
            log.warn("[CONNECT] State mismatch: state bound to user={} broker={}, callback from user={} broker={}",
                handshake.userId(), handshake.brokerId(), userId, brokerId);
            throw new StateMismatchException(brokerId.code(), "OAuth state does not belong to this user or broker");
        }

        Map<String, String> exchangeData = new HashMap<>(callbackData);
        if (handshake.isOAuth1()) {
            String callbackToken = callbackData.get("oauth_token");
            if (callbackToken != null && !callbackToken.equals(handshake.requestToken())) {
                throw new StateMismatchException(brokerId.code(), "Request token does not match the handshake");
            }
            exchangeData.put("oauth_token", handshake.requestToken());
            exchangeData.put("oauth_token_secret", handshake.requestTokenSecret());
        }

        BrokerConnection pending = connectionRepo.findPending(userId, brokerId)
            .orElseThrow(() -> new StateExpiredOrMissingException(brokerId.code(), "No pending connection"));

        if (!handshakeStore.consume(state)) {
            throw new StateExpiredOrMissingException(brokerId.code(), "OAuth state already used");
        }

        BrokerAdapter adapter = adapterFactory.forUser(userId, brokerId);
        TokenSet tokens;
        try {
            tokens = adapter.handleOAuthCallback(exchangeData,
                redirectUri != null ? redirectUri : handshake.redirectUri());
            recordExchange(brokerId, true);
        } catch (BrokerageException e) {
            recordExchange(brokerId, false);
            log.warn("[CONNECT] Token exchange failed for user={} broker={}: {}", userId, brokerId, e.getMessage());
            connectionRepo.update(pending.withStatus(ConnectionStatus.ERROR, clock.instant()));
            throw e;
        }

        String tokenRef = TokenStore.tokenKey(userId, brokerId);
        if (!tokenStore.save(tokenRef, tokens)) {
            log.warn("[CONNECT] Token cache unavailable - tokens for user={} broker={} were not persisted",
                userId, brokerId);
        }

        revokeSuperseded(userId, brokerId, pending.id());

        Instant now = clock.instant();
        BrokerConnection active = pending.activated(tokenRef, tokens.expiresAt(), now);
        connectionRepo.update(active);

        syncAccounts(active, adapter, tokens);

        log.info("[CONNECT] Connected {} for user={} connection={}", brokerId, userId, active.id());
        return active;
    }

    /**
     * Drop an in-flight handshake.
     *
     * @return true when a live state was removed
     */
    public boolean abandon(String state) {
        boolean removed = handshakeStore.consume(state);
        if (removed) {
            log.info("[CONNECT] Handshake abandoned");
        }
        return removed;
    }

    public boolean tokensPersisted() {
        return tokenStore.isPersistent();
    }

    public boolean isHandshakeStateProcessLocal() {
        return handshakeStore.isProcessLocal();
    }

    // ===== Tokens =====

    /**
     * @throws TokensUnavailableException when the handle is gone, the cache is not
     *                                    configured, or the bundle expired from the cache
     */
    public TokenSet getTokens(BrokerConnection connection) {
        String code = connection.brokerId().code();
        if (connection.tokenRef() == null) {
            throw new TokensUnavailableException(code, "Connection has no token handle; reconnect required");
        }
        if (!tokenStore.isPersistent()) {
            throw new TokensUnavailableException(code, "Token cache not configured; reconnect required");
        }
        return tokenStore.load(connection.tokenRef())
            .orElseThrow(() -> new TokensUnavailableException(code, "Tokens expired or not found; reconnect required"));
    }

    /**
     * Best-effort token refresh. Never moves the connection to a terminal status.
     */
    public boolean refresh(BrokerConnection connection) {
        return tryRefresh(connection) == RefreshOutcome.REFRESHED;
    }

    RefreshOutcome tryRefresh(BrokerConnection connection) {
        TokenSet current;
        try {
            current = getTokens(connection);
        } catch (TokensUnavailableException e) {
            log.warn("[CONNECT] Cannot refresh connection={}: {}", connection.id(), e.getMessage());
            return RefreshOutcome.REJECTED;
        }

        BrokerAdapter adapter = adapterFor(connection);
        try {
            TokenSet renewed = adapter.refreshToken(current);
            tokenStore.save(connection.tokenRef(), renewed);
            connectionRepo.findById(connection.id()).ifPresent(latest ->
                connectionRepo.update(latest.withExpiresAt(renewed.expiresAt(), clock.instant())));
            recordRefresh(connection.brokerId(), true);
            log.info("[CONNECT] Refreshed tokens for connection={} broker={}", connection.id(), connection.brokerId());
            return RefreshOutcome.REFRESHED;
        } catch (VendorUnavailableException e) {
            recordRefresh(connection.brokerId(), false);
            log.warn("[CONNECT] Refresh unavailable for connection={}: {}", connection.id(), e.getMessage());
            return RefreshOutcome.TRANSIENT_FAILURE;
        } catch (BrokerageException e) {
            recordRefresh(connection.brokerId(), false);
            log.warn("[CONNECT] Refresh rejected for connection={}: {}", connection.id(), e.getMessage());
            return RefreshOutcome.REJECTED;
        }
    }

    /**
     * Run an adapter call with the connection's tokens. On HTTP 401 the tokens are refreshed
     * once and the call retried; if that does not help the connection is marked EXPIRED and
     * the rejection is rethrown.
     */
    public <T> T execute(BrokerConnection connection, String operation, AdapterCall<T> call) {
        BrokerAdapter adapter = adapterFor(connection);
        TokenSet tokens = getTokens(connection);
        try {
            T result = timed(connection, operation, () -> call.apply(adapter, tokens));
            markSynced(connection);
            return result;
        } catch (VendorRejectedException e) {
            if (!e.isAuthenticationFailure()) {
                throw e;
            }
            log.info("[CONNECT] {} rejected with 401 for connection={}, refreshing", operation, connection.id());
            RefreshOutcome outcome = tryRefresh(connection);
            if (outcome == RefreshOutcome.TRANSIENT_FAILURE) {
                throw e;
            }
            if (outcome == RefreshOutcome.REJECTED) {
                markStatus(connection, ConnectionStatus.EXPIRED);
                throw e;
            }
            TokenSet renewed = getTokens(connection);
            try {
                T result = timed(connection, operation, () -> call.apply(adapter, renewed));
                markSynced(connection);
                return result;
            } catch (VendorRejectedException retry) {
                if (retry.isAuthenticationFailure()) {
                    markStatus(connection, ConnectionStatus.EXPIRED);
                }
                throw retry;
            }
        }
    }

    private <T> T timed(BrokerConnection connection, String operation, Supplier<T> body) {
        Instant start = clock.instant();
        boolean success = false;
        try {
            T result = body.get();
            success = true;
            return result;
        } finally {
            if (metrics != null) {
                metrics.recordVendorCall(connection.brokerId().code(), operation, success,
                    Duration.between(start, clock.instant()));
            }
        }
    }

    // ===== Connections =====

    /**
     * Revoke the connection and delete its tokens. Idempotent for the owner.
     *
     * @return false when the connection does not exist or belongs to another user
     */
    public boolean disconnect(UUID userId, UUID connectionId) {
        Optional<BrokerConnection> found = connectionRepo.findById(connectionId)
            .filter(c -> c.userId().equals(userId));
        if (found.isEmpty()) {
            return false;
        }
        BrokerConnection connection = found.get();
        if (connection.status() == ConnectionStatus.REVOKED) {
            return true;
        }
        if (connection.tokenRef() != null) {
            tokenStore.delete(connection.tokenRef());
        }
        connectionRepo.update(connection.revoked(clock.instant()));
        log.info("[CONNECT] Disconnected {} connection={} user={}", connection.brokerId(), connectionId, userId);
        return true;
    }

    /**
     * Connections for the user, revoked ones excluded.
     */
    public List<BrokerConnection> listConnections(UUID userId) {
        return connectionRepo.findByUserId(userId).stream()
            .filter(c -> c.status() != ConnectionStatus.REVOKED)
            .toList();
    }

    public List<BrokerConnection> activeConnections(UUID userId) {
        return connectionRepo.findByUserId(userId).stream()
            .filter(BrokerConnection::isActive)
            .toList();
    }

    public Optional<BrokerConnection> getConnection(UUID userId, UUID connectionId) {
        return connectionRepo.findById(connectionId).filter(c -> c.userId().equals(userId));
    }

    public Optional<BrokerConnection> findActive(UUID userId, BrokerId brokerId) {
        return activeConnections(userId).stream()
            .filter(c -> c.brokerId() == brokerId)
            .findFirst();
    }

    // ===== Accounts =====

    /**
     * Accounts of the user's ACTIVE connections, optionally for one broker.
     */
    public List<BrokerAccount> listAccounts(UUID userId, BrokerId brokerId) {
        List<BrokerAccount> result = new ArrayList<>();
        for (BrokerConnection connection : activeConnections(userId)) {
            if (brokerId == null || connection.brokerId() == brokerId) {
                result.addAll(accountRepo.findByConnectionId(connection.id()));
            }
        }
        return result;
    }

    public List<BrokerAccount> accountsFor(BrokerConnection connection) {
        return accountRepo.findByConnectionId(connection.id());
    }

    /**
     * @throws ConnectionNotFoundException when the account does not belong to the user
     */
    public BrokerAccount updateAccountPreferences(UUID userId, UUID accountId, Boolean isDefault,
                                                  Boolean includeInAggregate) {
        BrokerAccount account = accountRepo.findById(accountId)
            .filter(a -> a.userId().equals(userId))
            .orElseThrow(() -> ConnectionNotFoundException.forAccount(accountId));

        if (Boolean.TRUE.equals(isDefault)) {
            for (BrokerAccount sibling : accountRepo.findByConnectionId(account.connectionId())) {
                if (!sibling.id().equals(accountId) && sibling.isDefault()) {
                    accountRepo.update(sibling.withPreferences(false, null));
                }
            }
        }
        BrokerAccount updated = account.withPreferences(isDefault, includeInAggregate);
        accountRepo.update(updated);
        return updated;
    }

    /**
     * Re-read the vendor account list for an active connection and replace the stored accounts.
     * Existing preferences are kept for accounts that are still present.
     */
    public List<BrokerAccount> syncAccounts(UUID userId, UUID connectionId) {
        BrokerConnection connection = getConnection(userId, connectionId)
            .filter(BrokerConnection::isActive)
            .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
        List<Account> vendorAccounts = execute(connection, "accounts", BrokerAdapter::getAccounts);
        return replaceAccounts(connection, vendorAccounts);
    }

    private void syncAccounts(BrokerConnection connection, BrokerAdapter adapter, TokenSet tokens) {
        try {
            replaceAccounts(connection, adapter.getAccounts(tokens));
            markSynced(connection);
        } catch (BrokerageException e) {
            log.warn("[CONNECT] Account enumeration failed for connection={}: {} - accounts can be re-synced later",
                connection.id(), e.getMessage());
        }
    }

    private List<BrokerAccount> replaceAccounts(BrokerConnection connection, List<Account> vendorAccounts) {
        Map<String, BrokerAccount> previous = new HashMap<>();
        for (BrokerAccount existing : accountRepo.findByConnectionId(connection.id())) {
            previous.put(existing.brokerAccountId(), existing);
        }
        Instant now = clock.instant();
        List<BrokerAccount> rows = new ArrayList<>();
        for (Account account : vendorAccounts) {
            BrokerAccount prior = previous.get(account.accountId());
            rows.add(new BrokerAccount(
                prior != null ? prior.id() : UUID.randomUUID(),
                connection.id(),
                connection.userId(),
                connection.brokerId(),
                account.accountId(),
                account.accountNumber(),
                account.accountType(),
                account.accountName(),
                prior != null ? prior.isDefault() : account.isDefault(),
                prior == null || prior.includeInAggregate(),
                prior != null ? prior.createdAt() : now
            ));
        }
        accountRepo.deleteByConnectionId(connection.id());
        accountRepo.insertAll(rows);
        log.info("[CONNECT] Stored {} account(s) for connection={}", rows.size(), connection.id());
        return rows;
    }

    // ===== Internals =====

    public BrokerAdapter adapterFor(BrokerConnection connection) {
        return adapterFactory.forUser(connection.userId(), connection.brokerId());
    }

    private void revokeSuperseded(UUID userId, BrokerId brokerId, UUID keepId) {
        Instant now = clock.instant();
        for (BrokerConnection other : connectionRepo.findByUserId(userId)) {
            if (other.brokerId() == brokerId && !other.id().equals(keepId)
                && other.status() != ConnectionStatus.REVOKED && other.status() != ConnectionStatus.PENDING) {
                connectionRepo.update(other.revoked(now));
                log.info("[CONNECT] Revoked superseded connection={} ({})", other.id(), other.status());
            }
        }
    }

    private void markSynced(BrokerConnection connection) {
        connectionRepo.findById(connection.id()).ifPresent(latest ->
            connectionRepo.update(latest.withLastSyncAt(clock.instant())));
    }

    private void markStatus(BrokerConnection connection, ConnectionStatus status) {
        connectionRepo.findById(connection.id()).ifPresent(latest -> {
            if (latest.status() == ConnectionStatus.ACTIVE) {
                connectionRepo.update(latest.withStatus(status, clock.instant()));
                log.warn("[CONNECT] Connection={} broker={} marked {}", connection.id(), connection.brokerId(), status);
            }
        });
    }

    private void recordExchange(BrokerId brokerId, boolean success) {
        if (metrics != null) {
            metrics.recordOAuthExchange(brokerId.code(), success);
        }
    }

    private void recordRefresh(BrokerId brokerId, boolean success) {
        if (metrics != null) {
            metrics.recordTokenRefresh(brokerId.code(), success);
        }
    }

    private Object pendingLock(UUID userId, BrokerId brokerId) {
        return pendingLocks.computeIfAbsent(userId + ":" + brokerId.code(), k -> new Object());
    }

    static String generateState() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
