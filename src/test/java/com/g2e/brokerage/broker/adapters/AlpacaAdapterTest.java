package com.g2e.brokerage.broker.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.g2e.brokerage.broker.exception.InvalidCallbackException;
import com.g2e.brokerage.broker.exception.TokensUnavailableException;
import com.g2e.brokerage.broker.exception.VendorRejectedException;
import com.g2e.brokerage.domain.broker.AuthorizationRequest;
import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.OAuth1TokenSet;
import com.g2e.brokerage.domain.broker.OAuth2TokenSet;
import com.g2e.brokerage.domain.broker.TokenSet;
import com.g2e.brokerage.domain.model.Account;
import com.g2e.brokerage.domain.model.AssetType;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.Order;
import com.g2e.brokerage.domain.model.OrderRequest;
import com.g2e.brokerage.domain.model.OrderResult;
import com.g2e.brokerage.domain.model.OrderSide;
import com.g2e.brokerage.domain.model.OrderStatus;
import com.g2e.brokerage.domain.model.OrderType;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.domain.model.TimeInForce;
import com.g2e.brokerage.infrastructure.broker.http.VendorHttpClient;
import com.g2e.brokerage.support.FakeVendorServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlpacaAdapterTest {

    private static final Instant NOW = Instant.parse("2024-05-06T14:30:00Z");
    private static final TokenSet TOKENS = new OAuth2TokenSet("access-abc", "refresh-xyz", NOW.plusSeconds(3600));

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeVendorServer server;
    private AlpacaAdapter adapter;

    @BeforeEach
    void setUp() {
        server = new FakeVendorServer();
        BrokerCredential credential = BrokerCredential.application(BrokerId.ALPACA, "client-id-123", "client-secret", true);
        adapter = new AlpacaAdapter(credential, AlpacaAdapter.Endpoints.at(server.baseUrl()),
            new VendorHttpClient(Duration.ofSeconds(5)), mapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void authorizationUrlCarriesClientStateAndScope() {
        AuthorizationRequest request = adapter.getAuthorizationUrl("state-1", "https://app.example.com/cb");

        assertTrue(request.url().startsWith(server.baseUrl() + "/oauth/authorize?response_type=code"));
        assertTrue(request.url().contains("client_id=client-id-123"));
        assertTrue(request.url().contains("state=state-1"));
        assertTrue(request.url().contains("redirect_uri=https%3A%2F%2Fapp.example.com%2Fcb"));
        assertTrue(request.url().contains("scope=account%3Awrite+trading+data"));
        assertFalse(request.oob());
        assertEquals("Alpaca (Paper)", adapter.brokerName());
    }

    @Test
    void codeIsExchangedForTokens() {
        server.on("POST", "/oauth/token", 200,
            "{\"access_token\":\"at-1\",\"refresh_token\":\"rt-1\",\"expires_in\":3600,\"token_type\":\"bearer\"}");

        TokenSet tokens = adapter.handleOAuthCallback(Map.of("code", "auth-code"), "https://app.example.com/cb");

        OAuth2TokenSet oauth2 = assertInstanceOf(OAuth2TokenSet.class, tokens);
        assertEquals("at-1", oauth2.accessToken());
        assertEquals("rt-1", oauth2.refreshToken());
        assertEquals(NOW.plusSeconds(3600), oauth2.expiresAt());

        FakeVendorServer.Recorded sent = server.lastRequest("POST", "/oauth/token");
        assertTrue(sent.contentType().startsWith("application/x-www-form-urlencoded"));
        assertTrue(sent.body().contains("grant_type=authorization_code"));
        assertTrue(sent.body().contains("code=auth-code"));
        assertTrue(sent.body().contains("client_secret=client-secret"));
    }

    @Test
    void missingCodeIsInvalidCallback() {
        assertThrows(InvalidCallbackException.class,
            () -> adapter.handleOAuthCallback(Map.of("state", "s"), "https://app.example.com/cb"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void rejectedExchangeSurfacesVendorStatus() {
        server.on("POST", "/oauth/token", 400, "{\"error\":\"invalid_grant\",\"error_description\":\"code expired\"}");

        VendorRejectedException e = assertThrows(VendorRejectedException.class,
            () -> adapter.handleOAuthCallback(Map.of("code", "stale"), "https://app.example.com/cb"));

        assertEquals(400, e.getHttpStatus());
        assertTrue(e.getMessage().contains("code expired"));
    }

    @Test
    void refreshKeepsOldRefreshTokenWhenVendorOmitsIt() {
        server.on("POST", "/oauth/token", 200, "{\"access_token\":\"at-2\",\"expires_in\":1800}");

        OAuth2TokenSet refreshed = assertInstanceOf(OAuth2TokenSet.class, adapter.refreshToken(TOKENS));

        assertEquals("at-2", refreshed.accessToken());
        assertEquals("refresh-xyz", refreshed.refreshToken());
        assertTrue(server.lastRequest("POST", "/oauth/token").body().contains("grant_type=refresh_token"));
    }

    @Test
    void refreshWithoutRefreshTokenIsUnavailable() {
        assertThrows(TokensUnavailableException.class,
            () -> adapter.refreshToken(new OAuth2TokenSet("at", null, null)));
        assertThrows(TokensUnavailableException.class,
            () -> adapter.refreshToken(new OAuth1TokenSet("at", "secret", null)));
    }

    @Test
    void accountIsMaskedAndNamed() {
        server.on("GET", "/v2/account", 200,
            "{\"id\":\"acc-uuid\",\"account_number\":\"PA12345678\",\"account_type\":\"margin\","
                + "\"cash\":\"1000.50\",\"buying_power\":\"4000\",\"portfolio_value\":\"25000.25\"}");

        List<Account> accounts = adapter.getAccounts(TOKENS);

        assertEquals(1, accounts.size());
        Account account = accounts.get(0);
        assertEquals("acc-uuid", account.accountId());
        assertEquals("****5678", account.accountNumber());
        assertEquals("Alpaca Margin Account", account.accountName());
        assertTrue(account.isDefault());
        assertEquals("Bearer access-abc", server.lastRequest("GET", "/v2/account").authorization());

        Balance balance = adapter.getAccountBalance("acc-uuid", TOKENS);
        assertEquals(0, new BigDecimal("1000.50").compareTo(balance.cashAvailable()));
        assertEquals(0, new BigDecimal("25000.25").compareTo(balance.portfolioValue()));
        assertNull(balance.dayTradingBuyingPower());
    }

    @Test
    void positionsAreNormalized() {
        server.on("GET", "/v2/positions", 200,
            "[{\"symbol\":\"AAPL\",\"qty\":\"10\",\"avg_entry_price\":\"150\",\"current_price\":\"165\","
                + "\"market_value\":\"1650\",\"unrealized_pl\":\"150\",\"asset_class\":\"us_equity\"},"
                + "{\"symbol\":\"BTCUSD\",\"qty\":\"0.5\",\"avg_entry_price\":\"40000\",\"current_price\":\"42000\","
                + "\"market_value\":\"21000\",\"unrealized_pl\":\"1000\",\"asset_class\":\"crypto\"}]");

        List<Position> positions = adapter.getPositions("acc-uuid", TOKENS);

        assertEquals(2, positions.size());
        Position aapl = positions.get(0);
        assertEquals("AAPL", aapl.symbol());
        assertEquals(AssetType.STOCK, aapl.assetType());
        assertEquals(0, new BigDecimal("10").compareTo(aapl.unrealizedPlPercent()));
        assertEquals(NOW, aapl.lastUpdated());
        assertEquals(AssetType.CRYPTO, positions.get(1).assetType());
        assertEquals(0, new BigDecimal("5").compareTo(positions.get(1).unrealizedPlPercent()));
    }

    @Test
    void ordersFilterByVendorStatusGroup() {
        server.on("GET", "/v2/orders", 200, "[]");

        adapter.getOrders("acc-uuid", TOKENS, OrderStatus.FILLED);

        assertEquals("status=closed", server.lastRequest("GET", "/v2/orders").query());
    }

    @Test
    void quotesCombineTradeQuoteAndBar() {
        server.on("GET", "/v2/stocks/trades/latest", 200,
            "{\"trades\":{\"AAPL\":{\"p\":110.0,\"t\":\"2024-05-06T14:29:59Z\"}}}");
        server.on("GET", "/v2/stocks/quotes/latest", 200,
            "{\"quotes\":{\"AAPL\":{\"bp\":109.9,\"ap\":110.1,\"t\":\"2024-05-06T14:29:58Z\"}}}");
        server.on("GET", "/v2/stocks/bars/latest", 200,
            "{\"bars\":{\"AAPL\":{\"o\":101,\"h\":111,\"l\":99,\"c\":100,\"v\":123456}}}");

        Quote quote = adapter.getQuote("AAPL", TOKENS);

        assertEquals(0, new BigDecimal("110.0").compareTo(quote.last()));
        assertEquals(0, new BigDecimal("10").compareTo(quote.change()));
        assertEquals(0, new BigDecimal("10").compareTo(quote.changePercent()));
        assertEquals(123456L, quote.volume());
        assertEquals(Instant.parse("2024-05-06T14:29:59Z"), quote.timestamp());
        assertEquals(BrokerId.ALPACA, quote.source());
        assertEquals("symbols=AAPL", server.lastRequest("GET", "/v2/stocks/bars/latest").query());
    }

    @Test
    void placedOrderIsParsedFromVendorEcho() throws Exception {
        server.on("POST", "/v2/orders", 200,
            "{\"id\":\"ord-1\",\"client_order_id\":\"cli-1\",\"symbol\":\"AAPL\",\"side\":\"buy\",\"qty\":\"5\","
                + "\"filled_qty\":\"0\",\"type\":\"limit\",\"limit_price\":\"150.25\",\"time_in_force\":\"gtc\","
                + "\"status\":\"accepted\",\"submitted_at\":\"2024-05-06T14:30:00.123456Z\",\"filled_at\":null}");

        OrderRequest request = new OrderRequest("aapl", OrderSide.BUY, new BigDecimal("5"), OrderType.LIMIT,
            new BigDecimal("150.25"), null, TimeInForce.GTC, false);
        OrderResult result = adapter.placeOrder("acc-uuid", request, TOKENS);

        assertTrue(result.success());
        assertEquals("ord-1", result.orderId());
        Order order = result.order();
        assertEquals(OrderStatus.OPEN, order.status());
        assertEquals(OrderType.LIMIT, order.orderType());
        assertEquals(TimeInForce.GTC, order.timeInForce());
        assertNull(order.filledAt());
        assertEquals("acc-uuid", order.accountId());

        JsonNode sent = mapper.readTree(server.lastRequest("POST", "/v2/orders").body());
        assertEquals("AAPL", sent.get("symbol").asText());
        assertEquals("5", sent.get("qty").asText());
        assertEquals("limit", sent.get("type").asText());
        assertEquals("150.25", sent.get("limit_price").asText());
        assertEquals("gtc", sent.get("time_in_force").asText());
    }

    @Test
    void vendorRejectionBecomesFailedResult() {
        server.on("POST", "/v2/orders", 403, "{\"code\":40310000,\"message\":\"insufficient buying power\"}");

        OrderResult result = adapter.placeOrder("acc-uuid",
            OrderRequest.market("AAPL", OrderSide.BUY, BigDecimal.ONE), TOKENS);

        assertFalse(result.success());
        assertEquals("Order failed: insufficient buying power", result.message());
    }

    @Test
    void unauthorizedOrderIsRethrown() {
        server.on("POST", "/v2/orders", 401, "{\"message\":\"unauthorized\"}");

        VendorRejectedException e = assertThrows(VendorRejectedException.class, () -> adapter.placeOrder("acc-uuid",
            OrderRequest.market("AAPL", OrderSide.BUY, BigDecimal.ONE), TOKENS));

        assertTrue(e.isAuthenticationFailure());
    }

    @Test
    void cancelAcceptsNoContent() {
        server.on("DELETE", "/v2/orders/ord-9", 204, "");

        OrderResult result = adapter.cancelOrder("acc-uuid", "ord-9", TOKENS);

        assertTrue(result.success());
        assertEquals("ord-9", result.orderId());
    }

    @Test
    void statusTableCoversVendorCodes() {
        List<String> codes = List.of("new", "accepted", "accepted_for_bidding", "stopped", "suspended", "calculated",
            "done_for_day", "pending_cancel", "pending_replace", "pending_new", "held", "partially_filled",
            "filled", "canceled", "replaced", "expired", "rejected");

        for (String code : codes) {
            assertTrue(AlpacaAdapter.ORDER_STATUS_MAP.containsKey(code), "Unmapped status " + code);
        }
        assertEquals(OrderStatus.PARTIALLY_FILLED, AlpacaAdapter.mapStatus("PARTIALLY_FILLED"));
        assertEquals(OrderStatus.PENDING, AlpacaAdapter.mapStatus("something_new"));
        assertEquals(OrderStatus.PENDING, AlpacaAdapter.mapStatus(null));
    }

    @Test
    void unknownCodesFallBack() {
        assertEquals(OrderSide.BUY, AlpacaAdapter.mapSide("short"));
        assertEquals(OrderType.MARKET, AlpacaAdapter.mapOrderType("bracket"));
        assertEquals(TimeInForce.DAY, AlpacaAdapter.mapTimeInForce("opg"));
        assertEquals(AssetType.STOCK, AlpacaAdapter.mapAssetClass("us_future"));
        assertEquals(AssetType.OPTION, AlpacaAdapter.mapAssetClass("us_option"));
        assertEquals(TimeInForce.FOK, AlpacaAdapter.mapTimeInForce("FOK"));
    }
}
