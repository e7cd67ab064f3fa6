package com.g2e.brokerage.service.trading;

import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.model.Order;
import com.g2e.brokerage.domain.model.OrderRequest;
import com.g2e.brokerage.domain.model.OrderResult;
import com.g2e.brokerage.domain.model.OrderStatus;
import com.g2e.brokerage.service.connection.ConnectionManager;
import com.g2e.brokerage.service.portfolio.BrokerFanOut;
import com.g2e.brokerage.service.portfolio.BrokerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order entry on top of the connection manager.
 */
public class TradingService {
    private static final Logger log = LoggerFactory.getLogger(TradingService.class);

    private final ConnectionManager connectionManager;
    private final OrderPreviewEngine previewEngine;
    private final BrokerFanOut fanOut;

    public TradingService(ConnectionManager connectionManager, OrderPreviewEngine previewEngine, BrokerFanOut fanOut) {
        this.connectionManager = connectionManager;
        this.previewEngine = previewEngine;
        this.fanOut = fanOut;
    }

    public OrderPreview previewOrder(UUID userId, BrokerId brokerId, String accountId, OrderRequest request) {
        return previewEngine.preview(userId, brokerId, accountId, request);
    }

    /**
     * @return failure result when there is no active connection or the vendor rejects the order
     */
    public OrderResult placeOrder(UUID userId, BrokerId brokerId, String accountId, OrderRequest request) {
        Optional<BrokerConnection> connection = connectionManager.findActive(userId, brokerId);
        if (connection.isEmpty()) {
            return OrderResult.failure("No active connection to " + brokerId.code());
        }
        OrderResult result = connectionManager.execute(connection.get(), "place",
            (a, t) -> a.placeOrder(accountId, request, t));
        if (result.success()) {
            log.info("[TRADE] Order placed on {} for user={}: orderId={}", brokerId, userId, result.orderId());
        } else {
            log.warn("[TRADE] Order on {} for user={} not placed: {}", brokerId, userId, result.message());
        }
        return result;
    }

    public OrderResult cancelOrder(UUID userId, BrokerId brokerId, String accountId, String orderId) {
        Optional<BrokerConnection> connection = connectionManager.findActive(userId, brokerId);
        if (connection.isEmpty()) {
            return OrderResult.failure(orderId, "No active connection to " + brokerId.code());
        }
        return connectionManager.execute(connection.get(), "cancel",
            (a, t) -> a.cancelOrder(accountId, orderId, t));
    }

    /**
     * Orders across the user's active connections (or one broker), newest first.
     * Brokers that fail are skipped.
     */
    public List<Order> listOrders(UUID userId, BrokerId brokerId, OrderStatus status) {
        List<BrokerConnection> connections = connectionManager.activeConnections(userId).stream()
            .filter(c -> brokerId == null || c.brokerId() == brokerId)
            .toList();

        List<Order> orders = new ArrayList<>();
        for (BrokerOutcome<List<Order>> outcome : fanOut.run(connections, "orders", c -> ordersFor(c, status))) {
            if (outcome.isSuccess()) {
                orders.addAll(outcome.value());
            }
        }
        orders.sort(Comparator.comparing(Order::submittedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return orders;
    }

    private List<Order> ordersFor(BrokerConnection connection, OrderStatus status) {
        List<Order> orders = new ArrayList<>();
        for (BrokerAccount account : connectionManager.accountsFor(connection)) {
            orders.addAll(connectionManager.execute(connection, "orders",
                (a, t) -> a.getOrders(account.brokerAccountId(), t, status)));
        }
        return orders;
    }
}
