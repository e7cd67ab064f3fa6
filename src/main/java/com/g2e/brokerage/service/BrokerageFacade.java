package com.g2e.brokerage.service;

import com.g2e.brokerage.broker.BrokerAdapterFactory;
import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.ConnectionInitiation;
import com.g2e.brokerage.domain.broker.SupportedBroker;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.Order;
import com.g2e.brokerage.domain.model.OrderRequest;
import com.g2e.brokerage.domain.model.OrderResult;
import com.g2e.brokerage.domain.model.OrderStatus;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.service.connection.ConnectionManager;
import com.g2e.brokerage.service.portfolio.PortfolioAggregator;
import com.g2e.brokerage.service.portfolio.PortfolioSummary;
import com.g2e.brokerage.service.trading.OrderPreview;
import com.g2e.brokerage.service.trading.TradingService;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for callers (HTTP layer, jobs). Every operation is scoped to a user.
 */
public class BrokerageFacade {

    private final BrokerAdapterFactory adapterFactory;
    private final ConnectionManager connectionManager;
    private final PortfolioAggregator aggregator;
    private final TradingService tradingService;

    public BrokerageFacade(BrokerAdapterFactory adapterFactory, ConnectionManager connectionManager,
                           PortfolioAggregator aggregator, TradingService tradingService) {
        this.adapterFactory = adapterFactory;
        this.connectionManager = connectionManager;
        this.aggregator = aggregator;
        this.tradingService = tradingService;
    }

    // ===== Connections =====

    public List<SupportedBroker> listSupportedBrokers() {
        return adapterFactory.supportedBrokers();
    }

    public ConnectionInitiation initiateConnection(UUID userId, BrokerId brokerId, String redirectUri) {
        return connectionManager.initiate(userId, brokerId, redirectUri);
    }

    public BrokerConnection completeConnection(UUID userId, BrokerId brokerId, Map<String, String> callbackData,
                                               String redirectUri) {
        return connectionManager.complete(userId, brokerId, callbackData, redirectUri);
    }

    public boolean abandonConnection(String state) {
        return connectionManager.abandon(state);
    }

    public List<BrokerConnection> listConnections(UUID userId) {
        return connectionManager.listConnections(userId);
    }

    public Optional<BrokerConnection> getConnection(UUID userId, UUID connectionId) {
        return connectionManager.getConnection(userId, connectionId);
    }

    public boolean disconnect(UUID userId, UUID connectionId) {
        return connectionManager.disconnect(userId, connectionId);
    }

    public List<BrokerAccount> listAccounts(UUID userId, BrokerId brokerId) {
        return connectionManager.listAccounts(userId, brokerId);
    }

    public BrokerAccount updateAccountPreferences(UUID userId, UUID accountId, Boolean isDefault,
                                                  Boolean includeInAggregate) {
        return connectionManager.updateAccountPreferences(userId, accountId, isDefault, includeInAggregate);
    }

    /**
     * Masked hint of the user's own API key for the broker, if one is stored.
     */
    public Optional<String> credentialHint(UUID userId, BrokerId brokerId) {
        return adapterFactory.userCredential(userId, brokerId).map(BrokerCredential::apiKeyHint);
    }

    // ===== Portfolio =====

    public PortfolioSummary getPortfolioSummary(UUID userId) {
        return aggregator.getPortfolioSummary(userId);
    }

    public List<Position> getAllPositions(UUID userId) {
        return aggregator.getAllPositions(userId);
    }

    public List<Position> getPositionsBySymbol(UUID userId, String symbol) {
        return aggregator.getPositionsBySymbol(userId, symbol);
    }

    public List<Balance> getAllBalances(UUID userId) {
        return aggregator.getAllBalances(userId);
    }

    public List<Quote> getQuotes(UUID userId, List<String> symbols) {
        return aggregator.getQuotes(userId, symbols);
    }

    // ===== Trading =====

    public OrderPreview previewOrder(UUID userId, BrokerId brokerId, String accountId, OrderRequest request) {
        return tradingService.previewOrder(userId, brokerId, accountId, request);
    }

    public OrderResult placeOrder(UUID userId, BrokerId brokerId, String accountId, OrderRequest request) {
        return tradingService.placeOrder(userId, brokerId, accountId, request);
    }

    public OrderResult cancelOrder(UUID userId, BrokerId brokerId, String accountId, String orderId) {
        return tradingService.cancelOrder(userId, brokerId, accountId, orderId);
    }

    public List<Order> listOrders(UUID userId, BrokerId brokerId, OrderStatus status) {
        return tradingService.listOrders(userId, brokerId, status);
    }
}
