package com.g2e.brokerage.broker.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.broker.exception.InvalidCallbackException;
import com.g2e.brokerage.broker.exception.TokensUnavailableException;
import com.g2e.brokerage.broker.exception.VendorRejectedException;
import com.g2e.brokerage.domain.broker.AuthorizationRequest;
import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerFeatures;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.OAuth1TokenSet;
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
import com.g2e.brokerage.infrastructure.broker.http.VendorResponse;
import com.g2e.brokerage.infrastructure.broker.oauth.OAuth1Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.decimal;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.decimalOrNull;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.first;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.list;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.longValue;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.text;

/**
 * E*TRADE adapter (OAuth 1.0a three-legged, out-of-band verifier).
 *
 * Access tokens lapse at midnight US/Eastern and can be renewed until then; after a
 * longer idle period the user has to authorize again.
 */
public class ETradeAdapter implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(ETradeAdapter.class);

    private static final String BROKER_CODE = "ETRADE";
    static final ZoneId EASTERN = ZoneId.of("America/New_York");
    private static final DateTimeFormatter CLIENT_ORDER_ID_FORMAT =
        DateTimeFormatter.ofPattern("yyMMddHHmmssSSS").withZone(EASTERN);

    static final Map<String, OrderStatus> ORDER_STATUS_MAP = Map.of(
        "OPEN", OrderStatus.OPEN,
        "EXECUTED", OrderStatus.FILLED,
        "CANCELLED", OrderStatus.CANCELED,
        "CANCEL_REQUESTED", OrderStatus.PENDING,
        "EXPIRED", OrderStatus.EXPIRED,
        "REJECTED", OrderStatus.REJECTED,
        "PARTIAL", OrderStatus.PARTIALLY_FILLED,
        "INDIVIDUAL_FILLS", OrderStatus.PARTIALLY_FILLED,
        "PENDING", OrderStatus.PENDING
    );

    static final Map<String, OrderSide> ORDER_SIDE_MAP = Map.of(
        "BUY", OrderSide.BUY,
        "SELL", OrderSide.SELL,
        "BUY_TO_COVER", OrderSide.BUY_TO_COVER,
        "SELL_SHORT", OrderSide.SELL_SHORT
    );

    static final Map<String, OrderType> ORDER_TYPE_MAP = Map.of(
        "MARKET", OrderType.MARKET,
        "LIMIT", OrderType.LIMIT,
        "STOP", OrderType.STOP,
        "STOP_LIMIT", OrderType.STOP_LIMIT,
        "TRAILING_STOP_CNST", OrderType.TRAILING_STOP,
        "TRAILING_STOP_PRCT", OrderType.TRAILING_STOP
    );

    static final Map<String, TimeInForce> TIF_MAP = Map.of(
        "GOOD_FOR_DAY", TimeInForce.DAY,
        "GOOD_UNTIL_CANCEL", TimeInForce.GTC,
        "IMMEDIATE_OR_CANCEL", TimeInForce.IOC,
        "FILL_OR_KILL", TimeInForce.FOK
    );

    static final Map<String, AssetType> SECURITY_TYPE_MAP = Map.of(
        "EQ", AssetType.STOCK,
        "OPTN", AssetType.OPTION,
        "MF", AssetType.MUTUAL_FUND,
        "MMF", AssetType.MUTUAL_FUND,
        "BOND", AssetType.BOND
    );

    private static final Map<OrderSide, String> SIDE_CODES = new EnumMap<>(Map.of(
        OrderSide.BUY, "BUY",
        OrderSide.SELL, "SELL",
        OrderSide.BUY_TO_COVER, "BUY_TO_COVER",
        OrderSide.SELL_SHORT, "SELL_SHORT"
    ));

    private static final Map<OrderType, String> TYPE_CODES = new EnumMap<>(Map.of(
        OrderType.MARKET, "MARKET",
        OrderType.LIMIT, "LIMIT",
        OrderType.STOP, "STOP",
        OrderType.STOP_LIMIT, "STOP_LIMIT",
        OrderType.TRAILING_STOP, "TRAILING_STOP_CNST"
    ));

    private static final Map<TimeInForce, String> TIF_CODES = new EnumMap<>(Map.of(
        TimeInForce.DAY, "GOOD_FOR_DAY",
        TimeInForce.GTC, "GOOD_UNTIL_CANCEL",
        TimeInForce.IOC, "IMMEDIATE_OR_CANCEL",
        TimeInForce.FOK, "FILL_OR_KILL"
    ));

    public record Endpoints(String apiUrl, String authorizeUrl) {

        public static Endpoints production(boolean sandbox) {
            return new Endpoints(
                sandbox ? "https://apisb.etrade.com" : "https://api.etrade.com",
                "https://us.etrade.com/e/t/etws/authorize"
            );
        }

        public static Endpoints at(String baseUrl) {
            return new Endpoints(baseUrl, baseUrl + "/e/t/etws/authorize");
        }
    }

    private final BrokerCredential credential;
    private final Endpoints endpoints;
    private final VendorHttpClient http;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final OAuth1Signer signer;

    public ETradeAdapter(BrokerCredential credential, VendorHttpClient http, ObjectMapper mapper, Clock clock) {
        this(credential, Endpoints.production(credential.sandbox()), http, mapper, clock,
            new OAuth1Signer(credential.apiKey(), credential.apiSecret(), clock));
    }

    public ETradeAdapter(BrokerCredential credential, Endpoints endpoints, VendorHttpClient http,
                         ObjectMapper mapper, Clock clock, OAuth1Signer signer) {
        this.credential = credential;
        this.endpoints = endpoints;
        this.http = http;
        this.mapper = mapper;
        this.clock = clock;
        this.signer = signer;
    }

    @Override
    public BrokerId brokerId() {
        return BrokerId.ETRADE;
    }

    @Override
    public String brokerName() {
        return credential.sandbox() ? "E*TRADE (Sandbox)" : "E*TRADE";
    }

    @Override
    public BrokerFeatures features() {
        return new BrokerFeatures(true, true, false, false, true, true, credential.sandbox(), true, 1, true);
    }

    // ===== OAuth =====

    /**
     * Fetches a request token and returns the authorize URL. The request token pair is
     * returned in metadata under oauth_token / oauth_token_secret.
     */
    @Override
    public AuthorizationRequest getAuthorizationUrl(String state, String redirectUri) {
        URI uri = URI.create(endpoints.apiUrl() + "/oauth/request_token");
        String header = signer.authorizationHeader("GET", uri, null, null, Map.of("oauth_callback", "oob"), Map.of());
        Map<String, String> body = sendOAuth(uri, header, "request token");

        String requestToken = body.get("oauth_token");
        String requestTokenSecret = body.get("oauth_token_secret");
        if (requestToken == null || requestTokenSecret == null) {
            throw new VendorRejectedException(BROKER_CODE, 200, "Request token response incomplete");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", credential.apiKey());
        params.put("token", requestToken);
        String url = endpoints.authorizeUrl() + "?" + VendorHttpClient.formEncode(params);
        log.info("[ETRADE] Obtained request token for consumer={}", credential.apiKeyHint());

        return new AuthorizationRequest(url, Map.of(
            "oauth_token", requestToken,
            "oauth_token_secret", requestTokenSecret
        ), true);
    }

    @Override
    public TokenSet handleOAuthCallback(Map<String, String> callbackData, String redirectUri) {
        String token = callbackData.get("oauth_token");
        String verifier = callbackData.get("oauth_verifier");
        String tokenSecret = callbackData.get("oauth_token_secret");
        if (isBlank(token) || isBlank(verifier) || tokenSecret == null) {
            throw new InvalidCallbackException(BROKER_CODE, "Missing oauth_token, oauth_verifier or request token secret");
        }

        URI uri = URI.create(endpoints.apiUrl() + "/oauth/access_token");
        String header = signer.authorizationHeader("GET", uri, token, tokenSecret,
            Map.of("oauth_verifier", verifier.trim()), Map.of());
        Map<String, String> body = sendOAuth(uri, header, "access token");

        String accessToken = body.get("oauth_token");
        String accessSecret = body.get("oauth_token_secret");
        if (accessToken == null || accessSecret == null) {
            throw new VendorRejectedException(BROKER_CODE, 200, "Access token response incomplete");
        }
        log.info("[ETRADE] Access token obtained");
        return new OAuth1TokenSet(accessToken, accessSecret, nextMidnightEastern());
    }

    /**
     * Renews the current token; E*TRADE keeps the token values and extends validity to
     * the next midnight US/Eastern.
     */
    @Override
    public TokenSet refreshToken(TokenSet current) {
        if (!(current instanceof OAuth1TokenSet oauth1)) {
            throw new TokensUnavailableException(BROKER_CODE, "Token bundle is not an OAuth 1.0a bundle");
        }
        URI uri = URI.create(endpoints.apiUrl() + "/oauth/renew_access_token");
        String header = signer.authorizationHeader("GET", uri, oauth1.accessToken(), oauth1.accessTokenSecret(),
            Map.of(), Map.of());
        HttpRequest request = http.request(uri).header("Authorization", header).GET().build();
        VendorResponse response = http.send(BROKER_CODE, request);
        if (!response.isSuccess()) {
            log.warn("[ETRADE] Token renewal failed: status={}", response.statusCode());
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(), "Token renewal failed");
        }
        log.info("[ETRADE] Access token renewed");
        return oauth1.withExpiresAt(nextMidnightEastern());
    }

    Instant nextMidnightEastern() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(EASTERN));
        return now.toLocalDate().plusDays(1).atStartOfDay(EASTERN).toInstant();
    }

    private Map<String, String> sendOAuth(URI uri, String authorizationHeader, String operation) {
        HttpRequest request = http.request(uri).header("Authorization", authorizationHeader).GET().build();
        VendorResponse response = http.send(BROKER_CODE, request);
        if (!response.isSuccess()) {
            log.warn("[ETRADE] {} failed: status={}", operation, response.statusCode());
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(), operation + " failed");
        }
        return VendorHttpClient.formDecode(response.body());
    }

    // ===== Account data =====

    @Override
    public List<Account> getAccounts(TokenSet tokens) {
        JsonNode data = get("/v1/accounts/list.json", Map.of(), tokens);
        List<JsonNode> items = list(data.path("AccountListResponse").path("Accounts"), "Account");
        List<Account> accounts = new ArrayList<>();
        boolean defaultAssigned = false;
        for (JsonNode item : items) {
            boolean active = "ACTIVE".equalsIgnoreCase(text(item, "accountStatus", "ACTIVE"));
            boolean isDefault = active && !defaultAssigned;
            defaultAssigned |= isDefault;
            String accountType = text(item, "accountType", "BROKERAGE");
            accounts.add(new Account(
                BrokerId.ETRADE,
                text(item, "accountIdKey"),
                maskAccountNumber(text(item, "accountId", "")),
                accountType,
                text(item, "accountDesc", "E*TRADE " + accountType),
                isDefault
            ));
        }
        return accounts;
    }

    @Override
    public Balance getAccountBalance(String accountId, TokenSet tokens) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("instType", "BROKERAGE");
        query.put("realTimeNAV", "true");
        JsonNode data = get("/v1/accounts/" + accountId + "/balance.json", query, tokens);
        JsonNode computed = data.path("BalanceResponse").path("Computed");
        return new Balance(
            BrokerId.ETRADE,
            accountId,
            decimal(computed, "cashAvailableForInvestment"),
            decimal(computed, "cashBalance"),
            decimal(computed, "cashBuyingPower"),
            decimalOrNull(computed, "dtCashBuyingPower"),
            decimal(computed.path("RealTimeValues"), "totalAccountValue"),
            decimalOrNull(computed, "marginBuyingPower")
        );
    }

    @Override
    public List<Position> getPositions(String accountId, TokenSet tokens) {
        JsonNode data = get("/v1/accounts/" + accountId + "/portfolio.json", Map.of(), tokens);
        Instant now = clock.instant();
        List<Position> positions = new ArrayList<>();
        for (JsonNode portfolio : list(data.path("PortfolioResponse"), "AccountPortfolio")) {
            for (JsonNode item : list(portfolio, "Position")) {
                JsonNode product = item.path("Product");
                BigDecimal qty = decimal(item, "quantity");
                BigDecimal costPerShare = decimal(item, "costPerShare");
                BigDecimal marketValue = decimal(item, "marketValue");
                BigDecimal costBasis = qty.multiply(costPerShare);
                BigDecimal unrealizedPl = marketValue.subtract(costBasis);
                BigDecimal plPercent = costBasis.signum() > 0
                    ? unrealizedPl.divide(costBasis, MathContext.DECIMAL128).multiply(BigDecimal.valueOf(100))
                    : BigDecimal.ZERO;

                positions.add(new Position(
                    BrokerId.ETRADE,
                    accountId,
                    text(product, "symbol"),
                    qty,
                    costPerShare,
                    decimal(item.path("Quick"), "lastTrade"),
                    marketValue,
                    unrealizedPl,
                    plPercent,
                    mapSecurityType(text(product, "securityType")),
                    now
                ));
            }
        }
        return positions;
    }

    @Override
    public List<Order> getOrders(String accountId, TokenSet tokens, OrderStatus status) {
        Map<String, String> query = new LinkedHashMap<>();
        if (status != null) {
            query.put("status", statusFilter(status));
        }
        JsonNode data = get("/v1/accounts/" + accountId + "/orders.json", query, tokens);
        List<Order> orders = new ArrayList<>();
        for (JsonNode item : list(data.path("OrdersResponse"), "Order")) {
            orders.add(parseOrder(item, accountId));
        }
        return orders;
    }

    private static String statusFilter(OrderStatus status) {
        return switch (status) {
            case OPEN, PENDING -> "OPEN";
            case PARTIALLY_FILLED -> "PARTIAL";
            case FILLED -> "EXECUTED";
            case CANCELED -> "CANCELLED";
            case REJECTED -> "REJECTED";
            case EXPIRED -> "EXPIRED";
        };
    }

    // ===== Market data =====

    @Override
    public Quote getQuote(String symbol, TokenSet tokens) {
        List<Quote> quotes = getQuotes(List.of(symbol), tokens);
        if (quotes.isEmpty()) {
            throw new VendorRejectedException(BROKER_CODE, 404, "No quote found for " + symbol);
        }
        return quotes.get(0);
    }

    @Override
    public List<Quote> getQuotes(List<String> symbols, TokenSet tokens) {
        if (symbols.isEmpty()) {
            return List.of();
        }
        JsonNode data = get("/v1/market/quote/" + String.join(",", symbols) + ".json", Map.of(), tokens);
        List<Quote> quotes = new ArrayList<>();
        for (JsonNode item : list(data.path("QuoteResponse"), "QuoteData")) {
            JsonNode all = item.path("All");
            long epochSeconds = longValue(item, "dateTimeUTC");
            quotes.add(new Quote(
                text(item.path("Product"), "symbol"),
                decimal(all, "bid"),
                decimal(all, "ask"),
                decimal(all, "lastTrade"),
                longValue(all, "totalVolume"),
                decimal(all, "changeClose"),
                decimal(all, "changeClosePercentage"),
                decimalOrNull(all, "high"),
                decimalOrNull(all, "low"),
                decimalOrNull(all, "open"),
                decimalOrNull(all, "previousClose"),
                epochSeconds > 0 ? Instant.ofEpochSecond(epochSeconds) : clock.instant(),
                BrokerId.ETRADE
            ));
        }
        return quotes;
    }

    // ===== Trading =====

    /**
     * E*TRADE requires a preview before placement; the previewId is carried into the place call.
     */
    @Override
    public OrderResult placeOrder(String accountId, OrderRequest request, TokenSet tokens) {
        String clientOrderId = CLIENT_ORDER_ID_FORMAT.format(clock.instant());
        ObjectNode payload = buildOrderPayload(request, clientOrderId);

        log.info("[ETRADE] Previewing order: {} {} {} {}", request.side(), request.quantity(), request.symbol(), request.orderType());

        ObjectNode previewBody = mapper.createObjectNode();
        previewBody.set("PreviewOrderRequest", payload);
        VendorResponse previewResponse = sendJson("POST", "/v1/accounts/" + accountId + "/orders/preview.json",
            previewBody, tokens);
        rethrowIfUnauthorized(previewResponse, "preview order");
        if (!previewResponse.isSuccess()) {
            return OrderResult.failure("Order preview failed: " + errorMessage(previewResponse));
        }
        JsonNode previewId = first(readJson(previewResponse).path("PreviewOrderResponse"), "PreviewIds");
        if (previewId == null || text(previewId, "previewId") == null) {
            return OrderResult.failure("Order preview failed: no previewId returned");
        }

        ObjectNode placePayload = payload.deepCopy();
        ArrayNode previewIds = placePayload.putArray("PreviewIds");
        previewIds.addObject().put("previewId", previewId.get("previewId").asLong());
        ObjectNode placeBody = mapper.createObjectNode();
        placeBody.set("PlaceOrderRequest", placePayload);

        VendorResponse placeResponse = sendJson("POST", "/v1/accounts/" + accountId + "/orders/place.json",
            placeBody, tokens);
        rethrowIfUnauthorized(placeResponse, "place order");
        if (!placeResponse.isSuccess()) {
            String message = errorMessage(placeResponse);
            log.warn("[ETRADE] Order rejected: status={} message={}", placeResponse.statusCode(), message);
            return OrderResult.failure("Order failed: " + message);
        }

        JsonNode placed = readJson(placeResponse).path("PlaceOrderResponse");
        JsonNode orderIdNode = first(placed, "OrderIds");
        String orderId = orderIdNode != null ? text(orderIdNode, "orderId") : null;
        Order order = parsePlacedOrder(placed, accountId, orderId, clientOrderId);
        log.info("[ETRADE] Order placed: orderId={}", orderId);
        return OrderResult.success(orderId, "Order placed successfully", order);
    }

    private ObjectNode buildOrderPayload(OrderRequest request, String clientOrderId) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("orderType", "EQ");
        payload.put("clientOrderId", clientOrderId);

        ObjectNode order = payload.putArray("Order").addObject();
        order.put("allOrNone", false);
        order.put("priceType", TYPE_CODES.get(request.orderType()));
        order.put("orderTerm", TIF_CODES.get(request.timeInForce()));
        order.put("marketSession", request.extendedHours() ? "EXTENDED" : "REGULAR");
        if (request.limitPrice() != null) {
            order.put("limitPrice", request.limitPrice());
        }
        if (request.stopPrice() != null) {
            order.put("stopPrice", request.stopPrice());
        }

        ObjectNode instrument = order.putArray("Instrument").addObject();
        ObjectNode product = instrument.putObject("Product");
        product.put("securityType", "EQ");
        product.put("symbol", request.symbol());
        instrument.put("orderAction", SIDE_CODES.get(request.side()));
        instrument.put("quantityType", "QUANTITY");
        instrument.put("quantity", request.quantity());
        return payload;
    }

    @Override
    public OrderResult cancelOrder(String accountId, String orderId, TokenSet tokens) {
        ObjectNode body = mapper.createObjectNode();
        body.putObject("CancelOrderRequest").put("orderId", orderId);
        VendorResponse response = sendJson("PUT", "/v1/accounts/" + accountId + "/orders/cancel.json", body, tokens);
        rethrowIfUnauthorized(response, "cancel order");
        if (!response.isSuccess()) {
            return OrderResult.failure(orderId, "Cancel failed: " + errorMessage(response));
        }
        log.info("[ETRADE] Order canceled: orderId={}", orderId);
        return OrderResult.success(orderId, "Order canceled", null);
    }

    // ===== Parsing =====

    Order parseOrder(JsonNode data, String accountId) {
        JsonNode detail = first(data, "OrderDetail");
        return parseDetail(detail, accountId, text(data, "orderId"), text(data, "clientOrderId"),
            mapStatus(text(detail, "status", text(data, "orderStatus"))));
    }

    Order parsePlacedOrder(JsonNode placeResponse, String accountId, String orderId, String clientOrderId) {
        JsonNode detail = first(placeResponse, "Order");
        return parseDetail(detail, accountId, orderId, clientOrderId, OrderStatus.OPEN);
    }

    private Order parseDetail(JsonNode detail, String accountId, String orderId, String clientOrderId,
                              OrderStatus status) {
        JsonNode instrument = first(detail, "Instrument");
        BigDecimal quantity = decimalOrNull(instrument, "orderedQuantity");
        if (quantity == null) {
            quantity = decimal(instrument, "quantity");
        }
        long placedTime = longValue(detail, "placedTime");
        long executedTime = longValue(detail, "executedTime");
        return new Order(
            BrokerId.ETRADE,
            accountId,
            orderId,
            clientOrderId,
            instrument != null ? text(instrument.path("Product"), "symbol") : null,
            mapSide(text(instrument, "orderAction")),
            quantity,
            decimal(instrument, "filledQuantity"),
            mapOrderType(text(detail, "priceType")),
            decimalOrNull(detail, "limitPrice"),
            decimalOrNull(detail, "stopPrice"),
            mapTimeInForce(text(detail, "orderTerm")),
            status,
            placedTime > 0 ? Instant.ofEpochMilli(placedTime) : clock.instant(),
            executedTime > 0 ? Instant.ofEpochMilli(executedTime) : null,
            decimalOrNull(instrument, "averageExecutionPrice")
        );
    }

    static OrderStatus mapStatus(String code) {
        return code == null ? OrderStatus.PENDING
            : ORDER_STATUS_MAP.getOrDefault(code.toUpperCase(Locale.ROOT), OrderStatus.PENDING);
    }

    static OrderSide mapSide(String code) {
        return code == null ? OrderSide.BUY
            : ORDER_SIDE_MAP.getOrDefault(code.toUpperCase(Locale.ROOT), OrderSide.BUY);
    }

    static OrderType mapOrderType(String code) {
        return code == null ? OrderType.MARKET
            : ORDER_TYPE_MAP.getOrDefault(code.toUpperCase(Locale.ROOT), OrderType.MARKET);
    }

    static TimeInForce mapTimeInForce(String code) {
        return code == null ? TimeInForce.DAY
            : TIF_MAP.getOrDefault(code.toUpperCase(Locale.ROOT), TimeInForce.DAY);
    }

    static AssetType mapSecurityType(String code) {
        return code == null ? AssetType.STOCK
            : SECURITY_TYPE_MAP.getOrDefault(code.toUpperCase(Locale.ROOT), AssetType.STOCK);
    }

    // ===== HTTP helpers =====

    private JsonNode get(String path, Map<String, String> query, TokenSet tokens) {
        URI uri = VendorHttpClient.uri(endpoints.apiUrl(), path, query);
        OAuth1TokenSet oauth1 = requireOAuth1(tokens);
        String header = signer.authorizationHeader("GET", uri, oauth1.accessToken(), oauth1.accessTokenSecret(),
            Map.of(), Map.of());
        HttpRequest request = http.request(uri)
            .header("Authorization", header)
            .header("Accept", "application/json")
            .GET()
            .build();
        VendorResponse response = http.send(BROKER_CODE, request);
        if (!response.isSuccess()) {
            log.warn("[ETRADE] GET {} failed: status={}", path, response.statusCode());
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(),
                "GET " + path + " failed: " + errorMessage(response));
        }
        return readJson(response);
    }

    private VendorResponse sendJson(String method, String path, JsonNode body, TokenSet tokens) {
        URI uri = URI.create(endpoints.apiUrl() + path);
        OAuth1TokenSet oauth1 = requireOAuth1(tokens);
        String header = signer.authorizationHeader(method, uri, oauth1.accessToken(), oauth1.accessTokenSecret(),
            Map.of(), Map.of());
        HttpRequest request = http.request(uri)
            .header("Authorization", header)
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();
        return http.send(BROKER_CODE, request);
    }

    private static OAuth1TokenSet requireOAuth1(TokenSet tokens) {
        if (tokens instanceof OAuth1TokenSet oauth1) {
            return oauth1;
        }
        throw new TokensUnavailableException(BROKER_CODE, "Token bundle is not an OAuth 1.0a bundle");
    }

    private void rethrowIfUnauthorized(VendorResponse response, String operation) {
        if (response.isUnauthorized()) {
            throw new VendorRejectedException(BROKER_CODE, 401, operation + " unauthorized");
        }
    }

    private JsonNode readJson(VendorResponse response) {
        try {
            return mapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(), "Malformed response body", e);
        }
    }

    private String errorMessage(VendorResponse response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return "HTTP " + response.statusCode();
        }
        try {
            String message = text(mapper.readTree(body).path("Error"), "message");
            if (message != null) return message;
        } catch (JsonProcessingException ignored) {
            // non-JSON error page
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String maskAccountNumber(String accountNumber) {
        if (accountNumber == null || accountNumber.length() < 4) {
            return "****";
        }
        return "****" + accountNumber.substring(accountNumber.length() - 4);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
