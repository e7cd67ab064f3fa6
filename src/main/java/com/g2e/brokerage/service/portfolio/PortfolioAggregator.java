package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.broker.exception.BrokerageException;
import com.g2e.brokerage.broker.exception.ConnectionNotFoundException;
import com.g2e.brokerage.domain.broker.BrokerAccount;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.model.Account;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.service.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Combines balances and positions across all of a user's active connections.
 *
 * Brokers are queried concurrently; a broker that fails or times out is reported in
 * {@link BrokerSummary#error()} and excluded from the totals.
 */
public class PortfolioAggregator {
    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final int PERCENT_SCALE = 10;

    private final ConnectionManager connectionManager;
    private final BrokerFanOut fanOut;
    private final QuoteCache quoteCache;
    private final Clock clock;

    public PortfolioAggregator(ConnectionManager connectionManager, BrokerFanOut fanOut,
                               QuoteCache quoteCache, Clock clock) {
        this.connectionManager = connectionManager;
        this.fanOut = fanOut;
        this.quoteCache = quoteCache;
        this.clock = clock;
    }

    private record AccountSnapshot(Account account, Balance balance, List<Position> positions) {}

    private record BrokerSnapshot(String brokerName, List<AccountSnapshot> accounts) {}

    public PortfolioSummary getPortfolioSummary(UUID userId) {
        List<BrokerConnection> connections = connectionManager.activeConnections(userId);
        List<BrokerOutcome<BrokerSnapshot>> outcomes = fanOut.run(connections, "portfolio summary", this::snapshot);

        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalCash = BigDecimal.ZERO;
        BigDecimal totalBuyingPower = BigDecimal.ZERO;
        BigDecimal totalPl = BigDecimal.ZERO;
        BigDecimal totalCostBasis = BigDecimal.ZERO;
        int totalPositions = 0;
        List<BrokerSummary> byBroker = new ArrayList<>();

        for (BrokerOutcome<BrokerSnapshot> outcome : outcomes) {
            BrokerConnection connection = outcome.connection();
            if (!outcome.isSuccess()) {
                byBroker.add(BrokerSummary.failed(connection.brokerId(), brokerName(connection),
                    connection.id(), outcome.error()));
                continue;
            }

            BigDecimal brokerValue = BigDecimal.ZERO;
            BigDecimal brokerCash = BigDecimal.ZERO;
            BigDecimal brokerBuyingPower = BigDecimal.ZERO;
            BigDecimal brokerPl = BigDecimal.ZERO;
            int brokerPositions = 0;
            List<AccountSummary> accounts = new ArrayList<>();

            for (AccountSnapshot snapshot : outcome.value().accounts()) {
                Balance balance = snapshot.balance();
                BigDecimal accountPl = BigDecimal.ZERO;
                for (Position position : snapshot.positions()) {
                    accountPl = accountPl.add(position.unrealizedPl());
                    totalCostBasis = totalCostBasis.add(position.costBasis());
                }
                accounts.add(new AccountSummary(
                    snapshot.account().accountId(),
                    snapshot.account().accountName(),
                    snapshot.account().accountNumber(),
                    balance.portfolioValue(),
                    balance.cashAvailable(),
                    balance.buyingPower(),
                    snapshot.positions().size(),
                    accountPl
                ));
                brokerValue = brokerValue.add(balance.portfolioValue());
                brokerCash = brokerCash.add(balance.cashAvailable());
                brokerBuyingPower = brokerBuyingPower.add(balance.buyingPower());
                brokerPl = brokerPl.add(accountPl);
                brokerPositions += snapshot.positions().size();
            }

            byBroker.add(new BrokerSummary(connection.brokerId(), outcome.value().brokerName(), connection.id(),
                accounts, brokerValue, brokerCash, brokerBuyingPower, brokerPositions, brokerPl, null));

            totalValue = totalValue.add(brokerValue);
            totalCash = totalCash.add(brokerCash);
            totalBuyingPower = totalBuyingPower.add(brokerBuyingPower);
            totalPl = totalPl.add(brokerPl);
            totalPositions += brokerPositions;
        }

        long failed = byBroker.stream().filter(BrokerSummary::hasError).count();
        log.info("[AGGREGATE] Summary for user={}: {} broker(s), {} failed, value={}",
            userId, byBroker.size(), failed, totalValue);

        return new PortfolioSummary(
            totalValue,
            totalCash,
            totalBuyingPower,
            totalPositions,
            totalPl,
            plPercent(totalPl, totalCostBasis),
            byBroker,
            clock.instant()
        );
    }

    /**
     * Sum of unrealized P/L over sum of cost basis, as a percentage; zero without cost basis.
     */
    static BigDecimal plPercent(BigDecimal unrealizedPl, BigDecimal costBasis) {
        if (costBasis.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return unrealizedPl.multiply(HUNDRED).divide(costBasis, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Positions from every responding broker; failing brokers are skipped.
     */
    public List<Position> getAllPositions(UUID userId) {
        List<Position> positions = new ArrayList<>();
        for (BrokerOutcome<List<Position>> outcome : fanOut.run(
                connectionManager.activeConnections(userId), "positions", this::positions)) {
            if (outcome.isSuccess()) {
                positions.addAll(outcome.value());
            }
        }
        return positions;
    }

    public List<Balance> getAllBalances(UUID userId) {
        List<Balance> balances = new ArrayList<>();
        for (BrokerOutcome<List<Balance>> outcome : fanOut.run(
                connectionManager.activeConnections(userId), "balances", this::balances)) {
            if (outcome.isSuccess()) {
                balances.addAll(outcome.value());
            }
        }
        return balances;
    }

    /**
     * Holdings of one symbol across brokers.
     */
    public List<Position> getPositionsBySymbol(UUID userId, String symbol) {
        String wanted = symbol.trim().toUpperCase(Locale.ROOT);
        return getAllPositions(userId).stream()
            .filter(p -> p.symbol() != null && p.symbol().equalsIgnoreCase(wanted))
            .toList();
    }

    /**
     * Quotes via the user's first active connection, served from the quote cache when fresh.
     * Symbols the vendor does not know are omitted.
     */
    public List<Quote> getQuotes(UUID userId, List<String> symbols) {
        Set<String> wanted = symbols.stream()
            .map(s -> s.trim().toUpperCase(Locale.ROOT))
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<String, Quote> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String symbol : wanted) {
            Optional<Quote> cached = quoteCache.get(symbol);
            if (cached.isPresent()) {
                found.put(symbol, cached.get());
            } else {
                missing.add(symbol);
            }
        }

        if (!missing.isEmpty()) {
            BrokerConnection connection = connectionManager.activeConnections(userId).stream()
                .findFirst()
                .orElseThrow(() -> ConnectionNotFoundException.noActiveConnection("quotes"));
            List<Quote> fetched = connectionManager.execute(connection, "quotes", (a, t) -> a.getQuotes(missing, t));
            for (Quote quote : fetched) {
                quoteCache.put(quote);
                if (quote.symbol() != null) {
                    found.put(quote.symbol().toUpperCase(Locale.ROOT), quote);
                }
            }
        }

        List<Quote> result = new ArrayList<>();
        for (String symbol : wanted) {
            Quote quote = found.get(symbol);
            if (quote != null) {
                result.add(quote);
            }
        }
        return result;
    }

    // ===== Per-broker tasks =====

    private BrokerSnapshot snapshot(BrokerConnection connection) {
        List<AccountSnapshot> accounts = new ArrayList<>();
        for (Account account : includedAccounts(connection)) {
            Balance balance = connectionManager.execute(connection, "balance",
                (a, t) -> a.getAccountBalance(account.accountId(), t));
            List<Position> positions = connectionManager.execute(connection, "positions",
                (a, t) -> a.getPositions(account.accountId(), t));
            accounts.add(new AccountSnapshot(account, balance, positions));
        }
        return new BrokerSnapshot(connectionManager.adapterFor(connection).brokerName(), accounts);
    }

    private List<Position> positions(BrokerConnection connection) {
        List<Position> positions = new ArrayList<>();
        for (Account account : includedAccounts(connection)) {
            positions.addAll(connectionManager.execute(connection, "positions",
                (a, t) -> a.getPositions(account.accountId(), t)));
        }
        return positions;
    }

    private List<Balance> balances(BrokerConnection connection) {
        List<Balance> balances = new ArrayList<>();
        for (Account account : includedAccounts(connection)) {
            balances.add(connectionManager.execute(connection, "balance",
                (a, t) -> a.getAccountBalance(account.accountId(), t)));
        }
        return balances;
    }

    /**
     * Vendor accounts minus those the user excluded from aggregation.
     */
    private List<Account> includedAccounts(BrokerConnection connection) {
        Set<String> excluded = connectionManager.accountsFor(connection).stream()
            .filter(a -> !a.includeInAggregate())
            .map(BrokerAccount::brokerAccountId)
            .collect(Collectors.toSet());
        List<Account> accounts = connectionManager.execute(connection, "accounts", BrokerAdapter::getAccounts);
        return accounts.stream()
            .filter(a -> !excluded.contains(a.accountId()))
            .toList();
    }

    private String brokerName(BrokerConnection connection) {
        try {
            return connectionManager.adapterFor(connection).brokerName();
        } catch (BrokerageException e) {
            return connection.brokerId().name();
        }
    }
}
