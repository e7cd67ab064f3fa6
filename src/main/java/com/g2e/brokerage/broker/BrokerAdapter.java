package com.g2e.brokerage.broker;

import com.g2e.brokerage.domain.broker.AuthorizationRequest;
import com.g2e.brokerage.domain.broker.BrokerFeatures;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.TokenSet;
import com.g2e.brokerage.domain.model.Account;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.Order;
import com.g2e.brokerage.domain.model.OrderRequest;
import com.g2e.brokerage.domain.model.OrderResult;
import com.g2e.brokerage.domain.model.OrderStatus;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;

import java.util.List;
import java.util.Map;

/**
 * Broker adapter interface: OAuth handshake, account data, quotes and order entry.
 *
 * Calls are blocking and bounded by the HTTP client timeout. Transport errors surface as
 * {@code VendorUnavailableException}, non-success statuses as {@code VendorRejectedException}.
 * Order rejections are returned as {@code OrderResult.failure}, except authentication
 * failures which are thrown so the caller can refresh and retry.
 */
public interface BrokerAdapter {

    BrokerId brokerId();

    /**
     * Display name, e.g. "Alpaca (Paper)".
     */
    String brokerName();

    BrokerFeatures features();

    // ===== OAuth =====

    /**
     * Build the URL the user is sent to. OAuth 1.0a vendors fetch a request token first
     * and return it in the metadata.
     */
    AuthorizationRequest getAuthorizationUrl(String state, String redirectUri);

    /**
     * Exchange callback data (code, or token + verifier + request secret) for a token bundle.
     */
    TokenSet handleOAuthCallback(Map<String, String> callbackData, String redirectUri);

    TokenSet refreshToken(TokenSet current);

    // ===== Account data =====

    List<Account> getAccounts(TokenSet tokens);

    Balance getAccountBalance(String accountId, TokenSet tokens);

    List<Position> getPositions(String accountId, TokenSet tokens);

    /**
     * @param status optional filter, null for all
     */
    List<Order> getOrders(String accountId, TokenSet tokens, OrderStatus status);

    // ===== Market data =====

    Quote getQuote(String symbol, TokenSet tokens);

    List<Quote> getQuotes(List<String> symbols, TokenSet tokens);

    // ===== Trading =====

    OrderResult placeOrder(String accountId, OrderRequest request, TokenSet tokens);

    OrderResult cancelOrder(String accountId, String orderId, TokenSet tokens);
}
