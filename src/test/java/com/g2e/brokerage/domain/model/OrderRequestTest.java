package com.g2e.brokerage.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTest {

    @Test
    void defaultsToMarketDayAndUppercasesSymbol() {
        OrderRequest request = new OrderRequest(" aapl ", OrderSide.BUY, BigDecimal.TEN, null, null, null, null, false);

        assertEquals("AAPL", request.symbol());
        assertEquals(OrderType.MARKET, request.orderType());
        assertEquals(TimeInForce.DAY, request.timeInForce());
    }

    @Test
    void symbolUppercasingIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("FIG", OrderRequest.market("fig", OrderSide.BUY, BigDecimal.ONE).symbol());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void limitOrderRequiresLimitPrice() {
        assertThrows(IllegalArgumentException.class,
            () -> new OrderRequest("AAPL", OrderSide.BUY, BigDecimal.ONE, OrderType.LIMIT, null, null, null, false));
    }

    @Test
    void stopLimitRequiresBothPrices() {
        assertThrows(IllegalArgumentException.class, () -> new OrderRequest("AAPL", OrderSide.SELL, BigDecimal.ONE,
            OrderType.STOP_LIMIT, new BigDecimal("10"), null, null, false));
        assertThrows(IllegalArgumentException.class, () -> new OrderRequest("AAPL", OrderSide.SELL, BigDecimal.ONE,
            OrderType.STOP_LIMIT, null, new BigDecimal("9"), null, false));
    }

    @Test
    void quantityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.market("AAPL", OrderSide.BUY, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.market("AAPL", OrderSide.BUY, new BigDecimal("-1")));
    }

    @Test
    void buyFamilySides() {
        assertTrue(OrderSide.BUY.isBuy());
        assertTrue(OrderSide.BUY_TO_COVER.isBuy());
        assertFalse(OrderSide.SELL.isBuy());
        assertFalse(OrderSide.SELL_SHORT.isBuy());
    }
}
