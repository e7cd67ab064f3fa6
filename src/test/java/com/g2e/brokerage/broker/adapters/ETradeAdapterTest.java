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
import com.g2e.brokerage.infrastructure.broker.oauth.OAuth1Signer;
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

class ETradeAdapterTest {

    private static final Instant NOW = Instant.parse("2024-05-06T14:30:00Z");
    private static final OAuth1TokenSet TOKENS = new OAuth1TokenSet("access-tok", "access-sec", NOW.plusSeconds(3600));
    private static final String ACCOUNT_KEY = "dBZOKt9xDrtRSAOl4MSiiA";

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeVendorServer server;
    private ETradeAdapter adapter;

    @BeforeEach
    void setUp() {
        server = new FakeVendorServer();
        adapter = adapterAt(NOW);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ETradeAdapter adapterAt(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        BrokerCredential credential = BrokerCredential.application(BrokerId.ETRADE, "consumer-key", "consumer-secret", true);
        return new ETradeAdapter(credential, ETradeAdapter.Endpoints.at(server.baseUrl()),
            new VendorHttpClient(Duration.ofSeconds(5)), mapper, clock,
            new OAuth1Signer("consumer-key", "consumer-secret", clock, () -> "fixed-nonce"));
    }

    @Test
    void requestTokenIsTurnedIntoOobAuthorizeUrl() {
        server.on("GET", "/oauth/request_token", 200,
            "oauth_token=req%2Btoken&oauth_token_secret=req-secret&oauth_callback_confirmed=true");

        AuthorizationRequest request = adapter.getAuthorizationUrl("state-1", null);

        assertTrue(request.oob());
        assertEquals(server.baseUrl() + "/e/t/etws/authorize?key=consumer-key&token=req%2Btoken", request.url());
        assertEquals("req+token", request.metadata().get("oauth_token"));
        assertEquals("req-secret", request.metadata().get("oauth_token_secret"));

        String header = server.lastRequest("GET", "/oauth/request_token").authorization();
        assertTrue(header.contains("oauth_callback=\"oob\""), header);
        assertTrue(header.contains("oauth_consumer_key=\"consumer-key\""));
        assertFalse(header.contains("oauth_token="));
    }

    @Test
    void verifierIsExchangedForAccessToken() {
        server.on("GET", "/oauth/access_token", 200, "oauth_token=acc&oauth_token_secret=acc-secret");

        TokenSet tokens = adapter.handleOAuthCallback(
            Map.of("oauth_token", "req-token", "oauth_verifier", " 12345 ", "oauth_token_secret", "req-secret"), null);

        OAuth1TokenSet oauth1 = assertInstanceOf(OAuth1TokenSet.class, tokens);
        assertEquals("acc", oauth1.accessToken());
        assertEquals("acc-secret", oauth1.accessTokenSecret());
        assertEquals(Instant.parse("2024-05-07T04:00:00Z"), oauth1.expiresAt());

        String header = server.lastRequest("GET", "/oauth/access_token").authorization();
        assertTrue(header.contains("oauth_token=\"req-token\""));
        assertTrue(header.contains("oauth_verifier=\"12345\""));
    }

    @Test
    void callbackWithoutVerifierIsInvalid() {
        assertThrows(InvalidCallbackException.class, () -> adapter.handleOAuthCallback(
            Map.of("oauth_token", "req-token", "oauth_token_secret", "req-secret"), null));
        assertThrows(InvalidCallbackException.class, () -> adapter.handleOAuthCallback(
            Map.of("oauth_token", "req-token", "oauth_verifier", "123"), null));
    }

    @Test
    void renewalExtendsToNextEasternMidnight() {
        server.on("GET", "/oauth/renew_access_token", 200, "Access Token has been renewed");

        OAuth1TokenSet renewed = assertInstanceOf(OAuth1TokenSet.class, adapter.refreshToken(TOKENS));

        assertEquals("access-tok", renewed.accessToken());
        assertEquals(Instant.parse("2024-05-07T04:00:00Z"), renewed.expiresAt());
    }

    @Test
    void rejectedRenewalIsVendorRejection() {
        server.on("GET", "/oauth/renew_access_token", 401, "oauth_problem=token_expired");

        VendorRejectedException e = assertThrows(VendorRejectedException.class, () -> adapter.refreshToken(TOKENS));

        assertTrue(e.isAuthenticationFailure());
    }

    @Test
    void oauth2BundleIsNotAccepted() {
        assertThrows(TokensUnavailableException.class,
            () -> adapter.refreshToken(new OAuth2TokenSet("at", "rt", null)));
    }

    @Test
    void nextMidnightUsesEasternStandardTimeInWinter() {
        ETradeAdapter winter = adapterAt(Instant.parse("2024-01-10T03:00:00Z"));

        assertEquals(Instant.parse("2024-01-10T05:00:00Z"), winter.nextMidnightEastern());
    }

    @Test
    void firstActiveAccountIsDefault() {
        server.on("GET", "/v1/accounts/list.json", 200,
            "{\"AccountListResponse\":{\"Accounts\":{\"Account\":["
                + "{\"accountId\":\"11112222\",\"accountIdKey\":\"closedKey\",\"accountDesc\":\"Old IRA\","
                + "\"accountType\":\"IRA\",\"accountStatus\":\"CLOSED\"},"
                + "{\"accountId\":\"83405188\",\"accountIdKey\":\"" + ACCOUNT_KEY + "\",\"accountDesc\":\"Brokerage\","
                + "\"accountType\":\"INDIVIDUAL\",\"accountStatus\":\"ACTIVE\"}]}}}");

        List<Account> accounts = adapter.getAccounts(TOKENS);

        assertEquals(2, accounts.size());
        assertFalse(accounts.get(0).isDefault());
        Account active = accounts.get(1);
        assertTrue(active.isDefault());
        assertEquals(ACCOUNT_KEY, active.accountId());
        assertEquals("****5188", active.accountNumber());
        assertEquals("Brokerage", active.accountName());
        assertTrue(server.lastRequest("GET", "/v1/accounts/list.json").authorization().contains("oauth_token=\"access-tok\""));
    }

    @Test
    void balanceReadsComputedSection() {
        server.on("GET", "/v1/accounts/" + ACCOUNT_KEY + "/balance.json", 200,
            "{\"BalanceResponse\":{\"Computed\":{\"cashAvailableForInvestment\":100.5,\"cashBalance\":120,"
                + "\"cashBuyingPower\":200,\"RealTimeValues\":{\"totalAccountValue\":5000}}}}");

        Balance balance = adapter.getAccountBalance(ACCOUNT_KEY, TOKENS);

        assertEquals(0, new BigDecimal("100.5").compareTo(balance.cashAvailable()));
        assertEquals(0, new BigDecimal("200").compareTo(balance.buyingPower()));
        assertEquals(0, new BigDecimal("5000").compareTo(balance.portfolioValue()));
        assertEquals("instType=BROKERAGE&realTimeNAV=true",
            server.lastRequest("GET", "/v1/accounts/" + ACCOUNT_KEY + "/balance.json").query());
    }

    @Test
    void positionPlIsDerivedFromCost() {
        server.on("GET", "/v1/accounts/" + ACCOUNT_KEY + "/portfolio.json", 200,
            "{\"PortfolioResponse\":{\"AccountPortfolio\":[{\"Position\":[{\"Product\":{\"symbol\":\"IBM\","
                + "\"securityType\":\"EQ\"},\"quantity\":10,\"costPerShare\":100,\"marketValue\":1200,"
                + "\"Quick\":{\"lastTrade\":120}},{\"Product\":{\"symbol\":\"VFIAX\",\"securityType\":\"MF\"},"
                + "\"quantity\":2,\"costPerShare\":400,\"marketValue\":760,\"Quick\":{\"lastTrade\":380}}]}]}}");

        List<Position> positions = adapter.getPositions(ACCOUNT_KEY, TOKENS);

        assertEquals(2, positions.size());
        Position ibm = positions.get(0);
        assertEquals(0, new BigDecimal("200").compareTo(ibm.unrealizedPl()));
        assertEquals(0, new BigDecimal("20").compareTo(ibm.unrealizedPlPercent()));
        assertEquals(0, new BigDecimal("120").compareTo(ibm.currentPrice()));
        Position fund = positions.get(1);
        assertEquals(AssetType.MUTUAL_FUND, fund.assetType());
        assertEquals(0, new BigDecimal("-40").compareTo(fund.unrealizedPl()));
    }

    @Test
    void ordersAreParsedFromOrderDetail() {
        server.on("GET", "/v1/accounts/" + ACCOUNT_KEY + "/orders.json", 200,
            "{\"OrdersResponse\":{\"Order\":[{\"orderId\":42,\"OrderDetail\":[{\"status\":\"EXECUTED\","
                + "\"priceType\":\"MARKET\",\"orderTerm\":\"GOOD_FOR_DAY\",\"placedTime\":1714999800000,"
                + "\"executedTime\":1715000000000,\"Instrument\":[{\"Product\":{\"symbol\":\"IBM\"},"
                + "\"orderAction\":\"SELL\",\"orderedQuantity\":3,\"filledQuantity\":3,"
                + "\"averageExecutionPrice\":120.5}]}]}]}}");

        List<Order> orders = adapter.getOrders(ACCOUNT_KEY, TOKENS, OrderStatus.FILLED);

        assertEquals(1, orders.size());
        Order order = orders.get(0);
        assertEquals("42", order.orderId());
        assertEquals("IBM", order.symbol());
        assertEquals(OrderSide.SELL, order.side());
        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(Instant.ofEpochMilli(1714999800000L), order.submittedAt());
        assertEquals(Instant.ofEpochMilli(1715000000000L), order.filledAt());
        assertEquals(0, new BigDecimal("120.5").compareTo(order.averageFillPrice()));
        assertEquals("status=EXECUTED", server.lastRequest("GET", "/v1/accounts/" + ACCOUNT_KEY + "/orders.json").query());
    }

    @Test
    void quotesAreRequestedInOneCall() {
        server.on("GET", "/v1/market/quote/IBM,MSFT.json", 200,
            "{\"QuoteResponse\":{\"QuoteData\":[{\"dateTimeUTC\":1715005800,\"Product\":{\"symbol\":\"IBM\"},"
                + "\"All\":{\"bid\":119.9,\"ask\":120.1,\"lastTrade\":120,\"totalVolume\":1000,\"changeClose\":2,"
                + "\"changeClosePercentage\":1.69,\"previousClose\":118}},{\"dateTimeUTC\":1715005800,"
                + "\"Product\":{\"symbol\":\"MSFT\"},\"All\":{\"bid\":400,\"ask\":401,\"lastTrade\":400.5}}]}}");

        List<Quote> quotes = adapter.getQuotes(List.of("IBM", "MSFT"), TOKENS);

        assertEquals(2, quotes.size());
        assertEquals("IBM", quotes.get(0).symbol());
        assertEquals(Instant.ofEpochSecond(1715005800L), quotes.get(0).timestamp());
        assertEquals(0, new BigDecimal("118").compareTo(quotes.get(0).previousClose()));
        assertEquals(BrokerId.ETRADE, quotes.get(1).source());
        assertNull(quotes.get(1).previousClose());
    }

    @Test
    void orderIsPreviewedThenPlaced() throws Exception {
        String base = "/v1/accounts/" + ACCOUNT_KEY + "/orders/";
        server.on("POST", base + "preview.json", 200,
            "{\"PreviewOrderResponse\":{\"PreviewIds\":[{\"previewId\":1234567}]}}");
        server.on("POST", base + "place.json", 200,
            "{\"PlaceOrderResponse\":{\"OrderIds\":[{\"orderId\":555}],\"Order\":[{\"priceType\":\"LIMIT\","
                + "\"orderTerm\":\"GOOD_FOR_DAY\",\"limitPrice\":150,\"Instrument\":[{\"Product\":"
                + "{\"symbol\":\"IBM\",\"securityType\":\"EQ\"},\"orderAction\":\"BUY\","
                + "\"quantityType\":\"QUANTITY\",\"quantity\":10}]}]}}");

        OrderResult result = adapter.placeOrder(ACCOUNT_KEY,
            OrderRequest.limit("ibm", OrderSide.BUY, BigDecimal.TEN, new BigDecimal("150")), TOKENS);

        assertTrue(result.success(), result.message());
        assertEquals("555", result.orderId());
        Order order = result.order();
        assertEquals(OrderStatus.OPEN, order.status());
        assertEquals(OrderType.LIMIT, order.orderType());
        assertEquals(TimeInForce.DAY, order.timeInForce());
        assertEquals("IBM", order.symbol());
        assertEquals(0, BigDecimal.TEN.compareTo(order.quantity()));
        assertEquals("240506103000000", order.clientOrderId());

        JsonNode preview = mapper.readTree(server.lastRequest("POST", base + "preview.json").body())
            .get("PreviewOrderRequest");
        assertEquals("EQ", preview.get("orderType").asText());
        assertEquals("240506103000000", preview.get("clientOrderId").asText());
        JsonNode previewOrder = preview.get("Order").get(0);
        assertEquals("LIMIT", previewOrder.get("priceType").asText());
        assertEquals("REGULAR", previewOrder.get("marketSession").asText());
        assertEquals("IBM", previewOrder.get("Instrument").get(0).get("Product").get("symbol").asText());

        JsonNode place = mapper.readTree(server.lastRequest("POST", base + "place.json").body())
            .get("PlaceOrderRequest");
        assertEquals(1234567L, place.get("PreviewIds").get(0).get("previewId").asLong());
        assertEquals("240506103000000", place.get("clientOrderId").asText());
    }

    @Test
    void previewErrorStopsPlacement() {
        String base = "/v1/accounts/" + ACCOUNT_KEY + "/orders/";
        server.on("POST", base + "preview.json", 400, "{\"Error\":{\"code\":1019,\"message\":\"Invalid symbol\"}}");

        OrderResult result = adapter.placeOrder(ACCOUNT_KEY,
            OrderRequest.market("ZZZZ", OrderSide.BUY, BigDecimal.ONE), TOKENS);

        assertFalse(result.success());
        assertEquals("Order preview failed: Invalid symbol", result.message());
        assertTrue(server.requests().stream().noneMatch(r -> r.path().endsWith("place.json")));
    }

    @Test
    void cancelSendsOrderIdInBody() throws Exception {
        server.on("PUT", "/v1/accounts/" + ACCOUNT_KEY + "/orders/cancel.json", 200,
            "{\"CancelOrderResponse\":{\"orderId\":555}}");

        OrderResult result = adapter.cancelOrder(ACCOUNT_KEY, "555", TOKENS);

        assertTrue(result.success());
        JsonNode sent = mapper.readTree(server.lastRequest("PUT", "/v1/accounts/" + ACCOUNT_KEY + "/orders/cancel.json").body());
        assertEquals("555", sent.get("CancelOrderRequest").get("orderId").asText());
    }

    @Test
    void mappingTablesFallBackOnUnknownCodes() {
        for (String code : List.of("OPEN", "EXECUTED", "CANCELLED", "CANCEL_REQUESTED", "EXPIRED", "REJECTED",
            "PARTIAL", "INDIVIDUAL_FILLS", "PENDING")) {
            assertTrue(ETradeAdapter.ORDER_STATUS_MAP.containsKey(code), "Unmapped status " + code);
        }
        assertEquals(OrderStatus.PENDING, ETradeAdapter.mapStatus("DO_NOT_EXERCISE"));
        assertEquals(OrderStatus.CANCELED, ETradeAdapter.mapStatus("cancelled"));
        assertEquals(OrderSide.SELL_SHORT, ETradeAdapter.mapSide("SELL_SHORT"));
        assertEquals(OrderSide.BUY, ETradeAdapter.mapSide("EXCHANGE"));
        assertEquals(OrderType.TRAILING_STOP, ETradeAdapter.mapOrderType("TRAILING_STOP_PRCT"));
        assertEquals(OrderType.MARKET, ETradeAdapter.mapOrderType("NET_DEBIT"));
        assertEquals(TimeInForce.DAY, ETradeAdapter.mapTimeInForce("EXTENDED"));
        assertEquals(AssetType.BOND, ETradeAdapter.mapSecurityType("BOND"));
        assertEquals(AssetType.STOCK, ETradeAdapter.mapSecurityType("WARRANT"));
    }
}
