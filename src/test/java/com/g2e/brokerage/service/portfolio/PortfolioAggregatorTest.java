package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.broker.BrokerAdapter;
import com.g2e.brokerage.broker.exception.ConnectionNotFoundException;
import com.g2e.brokerage.broker.exception.VendorUnavailableException;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.broker.OAuth1TokenSet;
import com.g2e.brokerage.domain.broker.OAuth2TokenSet;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.infrastructure.broker.metrics.PrometheusBrokerMetrics;
import com.g2e.brokerage.support.ConnectionFixture;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.g2e.brokerage.support.Samples.account;
import static com.g2e.brokerage.support.Samples.balance;
import static com.g2e.brokerage.support.Samples.position;
import static com.g2e.brokerage.support.Samples.quote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PortfolioAggregatorTest {

    private static final UUID USER = UUID.fromString("00000000-0000-0000-0000-0000000000aa");
    private static final OAuth2TokenSet ALPACA_TOKENS = new OAuth2TokenSet("alpaca-at", null, null);
    private static final OAuth1TokenSet ETRADE_TOKENS = new OAuth1TokenSet("etrade-at", "etrade-sec", null);

    @Mock
    private BrokerAdapter alpaca;
    @Mock
    private BrokerAdapter etrade;

    private ConnectionFixture fixture;
    private ExecutorService executor;
    private CollectorRegistry registry;
    private QuoteCache quoteCache;
    private PortfolioAggregator aggregator;

    @BeforeEach
    void setUp() {
        fixture = new ConnectionFixture(Map.of(BrokerId.ALPACA, alpaca, BrokerId.ETRADE, etrade));
        executor = Executors.newFixedThreadPool(4);
        registry = new CollectorRegistry();
        BrokerFanOut fanOut = new BrokerFanOut(executor, Duration.ofSeconds(1), new PrometheusBrokerMetrics(registry));
        quoteCache = new QuoteCache(Duration.ofSeconds(15), fixture.clock);
        aggregator = new PortfolioAggregator(fixture.manager, fanOut, quoteCache, fixture.clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BrokerConnection connectAlpaca() {
        BrokerConnection connection = fixture.activeConnection(USER, BrokerId.ALPACA, ALPACA_TOKENS);
        when(alpaca.getAccounts(ALPACA_TOKENS)).thenReturn(List.of(account(BrokerId.ALPACA, "A1")));
        lenient().when(alpaca.getAccountBalance("A1", ALPACA_TOKENS))
            .thenReturn(balance(BrokerId.ALPACA, "A1", "2000", "4000", "10000"));
        lenient().when(alpaca.getPositions("A1", ALPACA_TOKENS)).thenReturn(List.of(
            position(BrokerId.ALPACA, "A1", "AAPL", "10", "100", "120")));
        return connection;
    }

    @Test
    void summaryToleratesFailingBroker() {
        connectAlpaca();
        when(alpaca.brokerName()).thenReturn("Alpaca (Paper)");
        fixture.activeConnection(USER, BrokerId.ETRADE, ETRADE_TOKENS);
        when(etrade.brokerName()).thenReturn("E*TRADE");
        when(etrade.getAccounts(ETRADE_TOKENS)).thenThrow(new VendorUnavailableException("ETRADE", "Service down"));

        PortfolioSummary summary = aggregator.getPortfolioSummary(USER);

        assertEquals(0, new BigDecimal("10000").compareTo(summary.totalValue()));
        assertEquals(0, new BigDecimal("2000").compareTo(summary.totalCash()));
        assertEquals(0, new BigDecimal("4000").compareTo(summary.totalBuyingPower()));
        assertEquals(1, summary.totalPositions());
        assertEquals(0, new BigDecimal("200").compareTo(summary.totalUnrealizedPl()));
        assertEquals(new BigDecimal("20.0000000000"), summary.totalUnrealizedPlPercent());
        assertEquals(2, summary.byBroker().size());

        BrokerSummary alpacaSummary = byBroker(summary, BrokerId.ALPACA);
        assertNull(alpacaSummary.error());
        assertEquals("Alpaca (Paper)", alpacaSummary.brokerName());
        assertEquals(1, alpacaSummary.accounts().size());

        BrokerSummary etradeSummary = byBroker(summary, BrokerId.ETRADE);
        assertTrue(etradeSummary.hasError());
        assertTrue(etradeSummary.error().contains("Service down"), etradeSummary.error());
        assertEquals("E*TRADE", etradeSummary.brokerName());
        assertEquals(0, BigDecimal.ZERO.compareTo(etradeSummary.totalValue()));

        assertEquals(1.0, registry.getSampleValue("broker_aggregation_failures_total",
            new String[]{"broker", "reason"}, new String[]{"etrade", "unavailable"}));
    }

    @Test
    void slowBrokerBecomesTimeoutEntry() {
        connectAlpaca();
        when(alpaca.brokerName()).thenReturn("Alpaca (Paper)");
        fixture.activeConnection(USER, BrokerId.ETRADE, ETRADE_TOKENS);
        when(etrade.brokerName()).thenReturn("E*TRADE");
        when(etrade.getAccounts(ETRADE_TOKENS)).thenAnswer(inv -> {
            Thread.sleep(5000);
            return List.of();
        });

        long start = System.nanoTime();
        PortfolioSummary summary = aggregator.getPortfolioSummary(USER);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.compareTo(Duration.ofSeconds(4)) < 0, "Aggregation should not wait for the slow broker");
        assertEquals("Timed out after 1s", byBroker(summary, BrokerId.ETRADE).error());
        assertEquals(0, new BigDecimal("10000").compareTo(summary.totalValue()));
    }

    @Test
    void noConnectionsGiveEmptySummary() {
        PortfolioSummary summary = aggregator.getPortfolioSummary(USER);

        assertTrue(summary.byBroker().isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.totalValue()));
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.totalUnrealizedPlPercent()));
        assertEquals(fixture.clock.instant(), summary.lastUpdated());
    }

    @Test
    void excludedAccountsAreSkipped() {
        BrokerConnection connection = fixture.activeConnection(USER, BrokerId.ALPACA, ALPACA_TOKENS);
        fixture.account(connection, "A1", true, true);
        fixture.account(connection, "A2", false, false);
        when(alpaca.getAccounts(ALPACA_TOKENS)).thenReturn(List.of(
            account(BrokerId.ALPACA, "A1"), account(BrokerId.ALPACA, "A2")));
        when(alpaca.getPositions("A1", ALPACA_TOKENS)).thenReturn(List.of(
            position(BrokerId.ALPACA, "A1", "MSFT", "2", "300", "330")));

        List<Position> positions = aggregator.getAllPositions(USER);

        assertEquals(1, positions.size());
        assertEquals("MSFT", positions.get(0).symbol());
        verify(alpaca, never()).getPositions(eq("A2"), any());
    }

    @Test
    void positionsBySymbolSpanBrokers() {
        connectAlpaca();
        fixture.activeConnection(USER, BrokerId.ETRADE, ETRADE_TOKENS);
        when(etrade.getAccounts(ETRADE_TOKENS)).thenReturn(List.of(account(BrokerId.ETRADE, "E1")));
        when(etrade.getPositions("E1", ETRADE_TOKENS)).thenReturn(List.of(
            position(BrokerId.ETRADE, "E1", "AAPL", "5", "90", "120"),
            position(BrokerId.ETRADE, "E1", "IBM", "1", "100", "100")));

        List<Position> aapl = aggregator.getPositionsBySymbol(USER, " aapl ");

        assertEquals(2, aapl.size());
        assertTrue(aapl.stream().allMatch(p -> p.symbol().equals("AAPL")));
    }

    @Test
    void balancesFromEveryAccount() {
        connectAlpaca();

        assertEquals(1, aggregator.getAllBalances(USER).size());
    }

    @Test
    void plPercentIsSumOverSum() {
        assertEquals(new BigDecimal("33.3333333333"), PortfolioAggregator.plPercent(BigDecimal.ONE, new BigDecimal("3")));
        assertEquals(new BigDecimal("-12.5000000000"),
            PortfolioAggregator.plPercent(new BigDecimal("-25"), new BigDecimal("200")));
        assertEquals(BigDecimal.ZERO, PortfolioAggregator.plPercent(BigDecimal.TEN, BigDecimal.ZERO));
    }

    @Test
    void quotesAreCachedAndReturnedInRequestOrder() {
        fixture.activeConnection(USER, BrokerId.ALPACA, ALPACA_TOKENS);
        when(alpaca.getQuotes(anyList(), eq(ALPACA_TOKENS)))
            .thenReturn(List.of(quote("MSFT", "410.5"), quote("AAPL", "190.1")));

        List<Quote> first = aggregator.getQuotes(USER, List.of("aapl", "MSFT", "AAPL"));
        List<Quote> second = aggregator.getQuotes(USER, List.of("MSFT"));

        assertEquals(List.of("AAPL", "MSFT"), first.stream().map(Quote::symbol).toList());
        assertEquals("MSFT", second.get(0).symbol());
        verify(alpaca, times(1)).getQuotes(List.of("AAPL", "MSFT"), ALPACA_TOKENS);
        assertEquals(2, quoteCache.size());
    }

    @Test
    void staleQuotesAreRefetched() {
        fixture.activeConnection(USER, BrokerId.ALPACA, ALPACA_TOKENS);
        when(alpaca.getQuotes(anyList(), eq(ALPACA_TOKENS))).thenReturn(List.of(quote("AAPL", "190.1")));

        aggregator.getQuotes(USER, List.of("AAPL"));
        fixture.clock.advance(Duration.ofSeconds(15));
        aggregator.getQuotes(USER, List.of("AAPL"));

        verify(alpaca, times(2)).getQuotes(anyList(), eq(ALPACA_TOKENS));
    }

    @Test
    void quotesRequireActiveConnection() {
        assertThrows(ConnectionNotFoundException.class, () -> aggregator.getQuotes(USER, List.of("AAPL")));
    }

    private static BrokerSummary byBroker(PortfolioSummary summary, BrokerId brokerId) {
        return summary.byBroker().stream()
            .filter(b -> b.brokerId() == brokerId)
            .findFirst()
            .orElseThrow();
    }
}
