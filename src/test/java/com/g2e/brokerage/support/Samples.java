package com.g2e.brokerage.support;

import com.g2e.brokerage.domain.broker.BrokerFeatures;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.model.Account;
import com.g2e.brokerage.domain.model.AssetType;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.Order;
import com.g2e.brokerage.domain.model.OrderSide;
import com.g2e.brokerage.domain.model.OrderStatus;
import com.g2e.brokerage.domain.model.OrderType;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.domain.model.TimeInForce;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalized model values for service tests.
 */
public final class Samples {

    public static final Instant T0 = Instant.parse("2024-05-06T14:30:00Z");

    public static Account account(BrokerId brokerId, String accountId) {
        return new Account(brokerId, accountId, "****" + accountId, "margin", "Account " + accountId, true);
    }

    public static Balance balance(BrokerId brokerId, String accountId, String cash, String buyingPower,
                                  String portfolioValue) {
        return new Balance(brokerId, accountId, new BigDecimal(cash), new BigDecimal(cash),
            new BigDecimal(buyingPower), null, new BigDecimal(portfolioValue), null);
    }

    public static Position position(BrokerId brokerId, String accountId, String symbol, String qty,
                                    String averageCost, String currentPrice) {
        BigDecimal quantity = new BigDecimal(qty);
        BigDecimal cost = new BigDecimal(averageCost);
        BigDecimal price = new BigDecimal(currentPrice);
        BigDecimal marketValue = quantity.multiply(price);
        BigDecimal pl = marketValue.subtract(quantity.multiply(cost));
        return new Position(brokerId, accountId, symbol, quantity, cost, price, marketValue, pl,
            BigDecimal.ZERO, AssetType.STOCK, T0);
    }

    public static Quote quote(String symbol, String last) {
        BigDecimal price = new BigDecimal(last);
        return new Quote(symbol, price, price, price, 1000L, BigDecimal.ZERO, BigDecimal.ZERO,
            null, null, null, null, T0, BrokerId.ALPACA);
    }

    public static Order order(BrokerId brokerId, String orderId, Instant submittedAt) {
        return new Order(brokerId, "acc", orderId, null, "AAPL", OrderSide.BUY, BigDecimal.ONE, BigDecimal.ZERO,
            OrderType.MARKET, null, null, TimeInForce.DAY, OrderStatus.OPEN, submittedAt, null, null);
    }

    public static BrokerFeatures features(boolean shortSelling) {
        return new BrokerFeatures(true, true, false, true, true, shortSelling, true, true, 0, false);
    }

    private Samples() {}
}
