package com.g2e.brokerage.broker.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.broker.exception.InvalidCallbackException;
import com.g2e.brokerage.broker.exception.TokensUnavailableException;
import com.g2e.brokerage.broker.exception.VendorRejectedException;
import com.g2e.brokerage.domain.broker.AuthorizationRequest;
import com.g2e.brokerage.domain.broker.BrokerCredential;
import com.g2e.brokerage.domain.broker.BrokerFeatures;
import com.g2e.brokerage.domain.broker.BrokerId;
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
import com.g2e.brokerage.infrastructure.broker.http.VendorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.decimal;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.decimalOrNull;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.longValue;
import static com.g2e.brokerage.infrastructure.broker.http.JsonFields.text;

/**
 * Alpaca Markets adapter (OAuth 2.0 authorization code flow).
 *
 * API Docs: https://alpaca.markets/docs/api-references/trading-api/
 */
public class AlpacaAdapter implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(AlpacaAdapter.class);

    private static final String BROKER_CODE = "ALPACA";
    private static final String SCOPE = "account:write trading data";

    static final Map<String, OrderStatus> ORDER_STATUS_MAP = Map.ofEntries(
        Map.entry("new", OrderStatus.OPEN),
        Map.entry("accepted", OrderStatus.OPEN),
        Map.entry("accepted_for_bidding", OrderStatus.OPEN),
        Map.entry("stopped", OrderStatus.OPEN),
        Map.entry("suspended", OrderStatus.OPEN),
        Map.entry("calculated", OrderStatus.OPEN),
        Map.entry("done_for_day", OrderStatus.OPEN),
        Map.entry("pending_cancel", OrderStatus.OPEN),
        Map.entry("pending_replace", OrderStatus.OPEN),
        Map.entry("pending_new", OrderStatus.PENDING),
        Map.entry("held", OrderStatus.PENDING),
        Map.entry("partially_filled", OrderStatus.PARTIALLY_FILLED),
        Map.entry("filled", OrderStatus.FILLED),
        Map.entry("canceled", OrderStatus.CANCELED),
        Map.entry("replaced", OrderStatus.CANCELED),
        Map.entry("expired", OrderStatus.EXPIRED),
        Map.entry("rejected", OrderStatus.REJECTED)
    );

    static final Map<String, OrderSide> ORDER_SIDE_MAP = Map.of(
        "buy", OrderSide.BUY,
        "sell", OrderSide.SELL
    );

    static final Map<String, OrderType> ORDER_TYPE_MAP = Map.of(
        "market", OrderType.MARKET,
        "limit", OrderType.LIMIT,
        "stop", OrderType.STOP,
        "stop_limit", OrderType.STOP_LIMIT,
        "trailing_stop", OrderType.TRAILING_STOP
    );

    static final Map<String, TimeInForce> TIF_MAP = Map.of(
        "day", TimeInForce.DAY,
        "gtc", TimeInForce.GTC,
        "ioc", TimeInForce.IOC,
        "fok", TimeInForce.FOK
    );

    static final Map<String, AssetType> ASSET_CLASS_MAP = Map.of(
        "us_equity", AssetType.STOCK,
        "us_option", AssetType.OPTION,
        "crypto", AssetType.CRYPTO
    );

    private static final Map<OrderSide, String> SIDE_CODES = new EnumMap<>(Map.of(
        OrderSide.BUY, "buy",
        OrderSide.SELL, "sell",
        OrderSide.BUY_TO_COVER, "buy",
        OrderSide.SELL_SHORT, "sell"
    ));

    private static final Map<OrderType, String> TYPE_CODES = new EnumMap<>(Map.of(
        OrderType.MARKET, "market",
        OrderType.LIMIT, "limit",
        OrderType.STOP, "stop",
        OrderType.STOP_LIMIT, "stop_limit",
        OrderType.TRAILING_STOP, "trailing_stop"
    ));

    private static final Map<TimeInForce, String> TIF_CODES = new EnumMap<>(Map.of(
        TimeInForce.DAY, "day",
        TimeInForce.GTC, "gtc",
        TimeInForce.IOC, "ioc",
        TimeInForce.FOK, "fok"
    ));

    /**
     * Vendor endpoint roots. Production values differ between paper and live trading.
     */
    public record Endpoints(String authorizeUrl, String tokenUrl, String apiUrl, String dataUrl) {

        public static Endpoints production(boolean paper) {
            return new Endpoints(
                "https://app.alpaca.markets/oauth/authorize",
                "https://api.alpaca.markets/oauth/token",
                paper ? "https://paper-api.alpaca.markets" : "https://api.alpaca.markets",
                "https://data.alpaca.markets"
            );
        }

        /**
         * All endpoints served from one base URL.
         */
        public static Endpoints at(String baseUrl) {
            return new Endpoints(baseUrl + "/oauth/authorize", baseUrl + "/oauth/token", baseUrl, baseUrl);
        }
    }

    private final BrokerCredential credential;
    private final Endpoints endpoints;
    private final VendorHttpClient http;
    private final ObjectMapper mapper;
    private final Clock clock;

    public AlpacaAdapter(BrokerCredential credential, VendorHttpClient http, ObjectMapper mapper, Clock clock) {
        this(credential, Endpoints.production(credential.sandbox()), http, mapper, clock);
    }

    public AlpacaAdapter(BrokerCredential credential, Endpoints endpoints, VendorHttpClient http,
                         ObjectMapper mapper, Clock clock) {
        this.credential = credential;
        this.endpoints = endpoints;
        this.http = http;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public BrokerId brokerId() {
        return BrokerId.ALPACA;
    }

    @Override
    public String brokerName() {
        return credential.sandbox() ? "Alpaca (Paper)" : "Alpaca";
    }

    @Override
    public BrokerFeatures features() {
        return new BrokerFeatures(true, true, true, true, true, true, true, true, 0, false);
    }

    // ===== OAuth =====

    @Override
    public AuthorizationRequest getAuthorizationUrl(String state, String redirectUri) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", credential.apiKey());
        params.put("redirect_uri", redirectUri);
        params.put("state", state);
        params.put("scope", SCOPE);
        String url = endpoints.authorizeUrl() + "?" + VendorHttpClient.formEncode(params);
        log.info("[ALPACA] Generated authorization URL for client={}", credential.apiKeyHint());
        return AuthorizationRequest.redirect(url);
    }

    @Override
    public TokenSet handleOAuthCallback(Map<String, String> callbackData, String redirectUri) {
        String code = callbackData.get("code");
        if (code == null || code.isBlank()) {
            throw new InvalidCallbackException(BROKER_CODE, "Missing authorization code");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("client_id", credential.apiKey());
        form.put("client_secret", credential.apiSecret());
        form.put("redirect_uri", redirectUri);

        JsonNode json = postTokenRequest(form, "token exchange");
        String accessToken = text(json, "access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new VendorRejectedException(BROKER_CODE, 200, "Token response missing access_token");
        }
        log.info("[ALPACA] Token exchange succeeded");
        return new OAuth2TokenSet(accessToken, text(json, "refresh_token"), expiry(json));
    }

    @Override
    public TokenSet refreshToken(TokenSet current) {
        if (!(current instanceof OAuth2TokenSet oauth2) || oauth2.refreshToken() == null) {
            throw new TokensUnavailableException(BROKER_CODE, "No refresh token available");
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", oauth2.refreshToken());
        form.put("client_id", credential.apiKey());
        form.put("client_secret", credential.apiSecret());

        JsonNode json = postTokenRequest(form, "token refresh");
        String accessToken = text(json, "access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new VendorRejectedException(BROKER_CODE, 200, "Refresh response missing access_token");
        }
        String refreshToken = text(json, "refresh_token");
        log.info("[ALPACA] Token refreshed");
        return new OAuth2TokenSet(accessToken, refreshToken != null ? refreshToken : oauth2.refreshToken(), expiry(json));
    }

    private JsonNode postTokenRequest(Map<String, String> form, String operation) {
        HttpRequest request = http.request(URI.create(endpoints.tokenUrl()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(VendorHttpClient.formEncode(form)))
            .build();
        VendorResponse response = http.send(BROKER_CODE, request);
        if (!response.isSuccess()) {
            log.warn("[ALPACA] {} failed: status={}", operation, response.statusCode());
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(),
                operation + " failed: " + errorMessage(response));
        }
        return readJson(response);
    }

    private Instant expiry(JsonNode json) {
        long expiresIn = longValue(json, "expires_in");
        return expiresIn > 0 ? clock.instant().plusSeconds(expiresIn) : null;
    }

    // ===== Account data =====

    @Override
    public List<Account> getAccounts(TokenSet tokens) {
        JsonNode data = get(endpoints.apiUrl(), "/v2/account", Map.of(), tokens);
        String accountType = text(data, "account_type", "trading");
        String accountNumber = text(data, "account_number", "");
        return List.of(new Account(
            BrokerId.ALPACA,
            text(data, "id"),
            maskAccountNumber(accountNumber),
            accountType,
            "Alpaca " + capitalize(accountType) + " Account",
            true
        ));
    }

    @Override
    public Balance getAccountBalance(String accountId, TokenSet tokens) {
        JsonNode data = get(endpoints.apiUrl(), "/v2/account", Map.of(), tokens);
        return new Balance(
            BrokerId.ALPACA,
            accountId,
            decimal(data, "cash"),
            decimal(data, "cash"),
            decimal(data, "buying_power"),
            decimalOrNull(data, "daytrading_buying_power"),
            decimal(data, "portfolio_value"),
            decimalOrNull(data, "initial_margin")
        );
    }

    @Override
    public List<Position> getPositions(String accountId, TokenSet tokens) {
        JsonNode data = get(endpoints.apiUrl(), "/v2/positions", Map.of(), tokens);
        Instant now = clock.instant();
        List<Position> positions = new ArrayList<>();
        for (JsonNode item : data) {
            BigDecimal qty = decimal(item, "qty");
            BigDecimal avgCost = decimal(item, "avg_entry_price");
            BigDecimal unrealizedPl = decimal(item, "unrealized_pl");
            BigDecimal costBasis = qty.multiply(avgCost);
            BigDecimal plPercent = costBasis.signum() > 0
                ? unrealizedPl.divide(costBasis, MathContext.DECIMAL128).multiply(BigDecimal.valueOf(100))
                : BigDecimal.ZERO;

            positions.add(new Position(
                BrokerId.ALPACA,
                accountId,
                text(item, "symbol"),
                qty,
                avgCost,
                decimal(item, "current_price"),
                decimal(item, "market_value"),
                unrealizedPl,
                plPercent,
                mapAssetClass(text(item, "asset_class")),
                now
            ));
        }
        return positions;
    }

    @Override
    public List<Order> getOrders(String accountId, TokenSet tokens, OrderStatus status) {
        Map<String, String> query = new LinkedHashMap<>();
        if (status != null) {
            query.put("status", statusFilter(status));
        }
        JsonNode data = get(endpoints.apiUrl(), "/v2/orders", query, tokens);
        List<Order> orders = new ArrayList<>();
        for (JsonNode item : data) {
            orders.add(parseOrder(item, accountId));
        }
        return orders;
    }

    private static String statusFilter(OrderStatus status) {
        return switch (status) {
            case OPEN, PENDING, PARTIALLY_FILLED -> "open";
            case FILLED, CANCELED, REJECTED, EXPIRED -> "closed";
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
        Map<String, String> query = Map.of("symbols", String.join(",", symbols));
        JsonNode trades = get(endpoints.dataUrl(), "/v2/stocks/trades/latest", query, tokens).path("trades");
        JsonNode quotes = get(endpoints.dataUrl(), "/v2/stocks/quotes/latest", query, tokens).path("quotes");
        JsonNode bars = get(endpoints.dataUrl(), "/v2/stocks/bars/latest", query, tokens).path("bars");

        List<Quote> result = new ArrayList<>();
        for (String symbol : symbols) {
            JsonNode trade = trades.path(symbol);
            JsonNode quote = quotes.path(symbol);
            JsonNode bar = bars.path(symbol);

            BigDecimal last = decimal(trade, "p");
            BigDecimal prevClose = decimalOrNull(bar, "c");
            BigDecimal change = prevClose != null ? last.subtract(prevClose) : BigDecimal.ZERO;
            BigDecimal changePercent = prevClose != null && prevClose.signum() != 0
                ? change.divide(prevClose, MathContext.DECIMAL128).multiply(BigDecimal.valueOf(100))
                : BigDecimal.ZERO;

            String ts = text(trade, "t");
            if (ts == null) {
                ts = text(quote, "t");
            }

            result.add(new Quote(
                symbol,
                decimal(quote, "bp"),
                decimal(quote, "ap"),
                last,
                longValue(bar, "v"),
                change,
                changePercent,
                decimalOrNull(bar, "h"),
                decimalOrNull(bar, "l"),
                decimalOrNull(bar, "o"),
                prevClose,
                parseTimestamp(ts),
                BrokerId.ALPACA
            ));
        }
        return result;
    }

    // ===== Trading =====

    @Override
    public OrderResult placeOrder(String accountId, OrderRequest request, TokenSet tokens) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("symbol", request.symbol());
        payload.put("qty", request.quantity().toPlainString());
        payload.put("side", SIDE_CODES.get(request.side()));
        payload.put("type", TYPE_CODES.get(request.orderType()));
        payload.put("time_in_force", TIF_CODES.get(request.timeInForce()));
        if (request.limitPrice() != null) {
            payload.put("limit_price", request.limitPrice().toPlainString());
        }
        if (request.stopPrice() != null) {
            payload.put("stop_price", request.stopPrice().toPlainString());
        }
        if (request.extendedHours()) {
            payload.put("extended_hours", true);
        }

        log.info("[ALPACA] Placing order: {} {} {} {}", request.side(), request.quantity(), request.symbol(), request.orderType());

        HttpRequest httpRequest = authorized(URI.create(endpoints.apiUrl() + "/v2/orders"), tokens)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
            .build();
        VendorResponse response = http.send(BROKER_CODE, httpRequest);
        rethrowIfUnauthorized(response, "place order");
        if (!response.isSuccess()) {
            String message = errorMessage(response);
            log.warn("[ALPACA] Order rejected: status={} message={}", response.statusCode(), message);
            return OrderResult.failure("Order failed: " + message);
        }

        Order order = parseOrder(readJson(response), accountId);
        log.info("[ALPACA] Order placed: orderId={} status={}", order.orderId(), order.status());
        return OrderResult.success(order.orderId(), "Order placed successfully", order);
    }

    @Override
    public OrderResult cancelOrder(String accountId, String orderId, TokenSet tokens) {
        HttpRequest httpRequest = authorized(URI.create(endpoints.apiUrl() + "/v2/orders/" + orderId), tokens)
            .DELETE()
            .build();
        VendorResponse response = http.send(BROKER_CODE, httpRequest);
        rethrowIfUnauthorized(response, "cancel order");
        if (response.isNoContent() || response.isSuccess()) {
            log.info("[ALPACA] Order canceled: orderId={}", orderId);
            return OrderResult.success(orderId, "Order canceled", null);
        }
        return OrderResult.failure(orderId, "Cancel failed: " + errorMessage(response));
    }

    // ===== Parsing =====

    Order parseOrder(JsonNode data, String accountId) {
        String filledAt = text(data, "filled_at");
        return new Order(
            BrokerId.ALPACA,
            accountId,
            text(data, "id"),
            text(data, "client_order_id"),
            text(data, "symbol"),
            mapSide(text(data, "side")),
            decimal(data, "qty"),
            decimal(data, "filled_qty"),
            mapOrderType(text(data, "type")),
            decimalOrNull(data, "limit_price"),
            decimalOrNull(data, "stop_price"),
            mapTimeInForce(text(data, "time_in_force")),
            mapStatus(text(data, "status")),
            parseTimestamp(text(data, "submitted_at")),
            filledAt != null ? parseTimestamp(filledAt) : null,
            decimalOrNull(data, "filled_avg_price")
        );
    }

    static OrderStatus mapStatus(String code) {
        return code == null ? OrderStatus.PENDING
            : ORDER_STATUS_MAP.getOrDefault(code.toLowerCase(Locale.ROOT), OrderStatus.PENDING);
    }

    static OrderSide mapSide(String code) {
        return code == null ? OrderSide.BUY
            : ORDER_SIDE_MAP.getOrDefault(code.toLowerCase(Locale.ROOT), OrderSide.BUY);
    }

    static OrderType mapOrderType(String code) {
        return code == null ? OrderType.MARKET
            : ORDER_TYPE_MAP.getOrDefault(code.toLowerCase(Locale.ROOT), OrderType.MARKET);
    }

    static TimeInForce mapTimeInForce(String code) {
        return code == null ? TimeInForce.DAY
            : TIF_MAP.getOrDefault(code.toLowerCase(Locale.ROOT), TimeInForce.DAY);
    }

    static AssetType mapAssetClass(String code) {
        return code == null ? AssetType.STOCK
            : ASSET_CLASS_MAP.getOrDefault(code.toLowerCase(Locale.ROOT), AssetType.STOCK);
    }

    private Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return clock.instant();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[ALPACA] Unparseable timestamp '{}', using current time", value);
            return clock.instant();
        }
    }

    // ===== HTTP helpers =====

    private JsonNode get(String base, String path, Map<String, String> query, TokenSet tokens) {
        HttpRequest request = authorized(VendorHttpClient.uri(base, path, query), tokens).GET().build();
        VendorResponse response = http.send(BROKER_CODE, request);
        if (!response.isSuccess()) {
            log.warn("[ALPACA] GET {} failed: status={}", path, response.statusCode());
            throw new VendorRejectedException(BROKER_CODE, response.statusCode(),
                "GET " + path + " failed: " + errorMessage(response));
        }
        return readJson(response);
    }

    private HttpRequest.Builder authorized(URI uri, TokenSet tokens) {
        return http.request(uri)
            .header("Authorization", "Bearer " + tokens.accessToken())
            .header("Accept", "application/json");
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
            JsonNode json = mapper.readTree(body);
            String message = text(json, "message");
            if (message != null) return message;
            String error = text(json, "error_description");
            if (error != null) return error;
        } catch (JsonProcessingException ignored) {
            // plain-text error body
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String maskAccountNumber(String accountNumber) {
        if (accountNumber == null || accountNumber.length() < 4) {
            return "****";
        }
        return "****" + accountNumber.substring(accountNumber.length() - 4);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) return value;
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }
}
