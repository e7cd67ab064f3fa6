package com.g2e.brokerage.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.g2e.brokerage.broker.BrokerAdapterFactory;
import com.g2e.brokerage.config.BrokerageConfig;
import com.g2e.brokerage.infrastructure.broker.http.VendorHttpClient;
import com.g2e.brokerage.infrastructure.broker.metrics.BrokerMetrics;
import com.g2e.brokerage.infrastructure.broker.metrics.PrometheusBrokerMetrics;
import com.g2e.brokerage.infrastructure.cache.HandshakeStateStore;
import com.g2e.brokerage.infrastructure.cache.InMemoryKeyValueCache;
import com.g2e.brokerage.infrastructure.cache.KeyValueCache;
import com.g2e.brokerage.infrastructure.cache.TokenStore;
import com.g2e.brokerage.infrastructure.persistence.InMemoryBrokerAccountRepository;
import com.g2e.brokerage.infrastructure.persistence.InMemoryBrokerConnectionRepository;
import com.g2e.brokerage.infrastructure.persistence.InMemoryBrokerCredentialRepository;
import com.g2e.brokerage.infrastructure.persistence.PostgresBrokerAccountRepository;
import com.g2e.brokerage.infrastructure.persistence.PostgresBrokerConnectionRepository;
import com.g2e.brokerage.repository.BrokerAccountRepository;
import com.g2e.brokerage.repository.BrokerConnectionRepository;
import com.g2e.brokerage.repository.BrokerCredentialRepository;
import com.g2e.brokerage.service.BrokerageFacade;
import com.g2e.brokerage.service.connection.ConnectionManager;
import com.g2e.brokerage.service.portfolio.BrokerFanOut;
import com.g2e.brokerage.service.portfolio.PortfolioAggregator;
import com.g2e.brokerage.service.portfolio.QuoteCache;
import com.g2e.brokerage.service.trading.OrderPreviewEngine;
import com.g2e.brokerage.service.trading.TradingService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires config, cache, repositories, adapters and services into a {@link BrokerageFacade}.
 */
public final class BrokerageModule implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrokerageModule.class);

    private final BrokerageConfig config;
    private final ExecutorService executor;
    private final HikariDataSource dataSource;
    private final ConnectionManager connectionManager;
    private final BrokerageFacade facade;

    private BrokerageModule(BrokerageConfig config, KeyValueCache cache, BrokerMetrics metrics,
                            BrokerCredentialRepository credentialRepo, Clock clock) {
        this.config = config;
        ObjectMapper mapper = new ObjectMapper();

        BrokerConnectionRepository connectionRepo;
        BrokerAccountRepository accountRepo;
        if (config.persistence() == BrokerageConfig.Persistence.POSTGRES) {
            this.dataSource = createDataSource(config);
            connectionRepo = new PostgresBrokerConnectionRepository(dataSource);
            accountRepo = new PostgresBrokerAccountRepository(dataSource);
        } else {
            this.dataSource = null;
            connectionRepo = new InMemoryBrokerConnectionRepository();
            accountRepo = new InMemoryBrokerAccountRepository();
        }

        VendorHttpClient http = new VendorHttpClient(config.vendorHttpTimeout());
        BrokerAdapterFactory adapterFactory = BrokerAdapterFactory.standard(config, credentialRepo, http, mapper, clock);

        TokenStore tokenStore = new TokenStore(cache, config.tokenTtl(), mapper);
        HandshakeStateStore handshakeStore = HandshakeStateStore.create(cache, config.oauthStateTtl(), mapper, clock);
        if (!tokenStore.isPersistent()) {
            log.warn("[CONNECT] Token cache not configured - connections will require re-authorization");
        }

        this.executor = createExecutor(config.aggregationThreads());
        BrokerFanOut fanOut = new BrokerFanOut(executor, config.aggregationTimeout(), metrics);

        this.connectionManager = new ConnectionManager(adapterFactory, connectionRepo, accountRepo,
            tokenStore, handshakeStore, metrics, clock);
        PortfolioAggregator aggregator = new PortfolioAggregator(connectionManager, fanOut,
            new QuoteCache(config.quoteCacheTtl(), clock), clock);
        TradingService tradingService = new TradingService(connectionManager,
            new OrderPreviewEngine(connectionManager), fanOut);

        this.facade = new BrokerageFacade(adapterFactory, connectionManager, aggregator, tradingService);
        log.info("Brokerage module started: {}", config);
    }

    /**
     * Production wiring from environment variables, with a process-local token cache and
     * Prometheus metrics on the default registry.
     */
    public static BrokerageModule fromEnv() {
        Clock clock = Clock.systemUTC();
        return create(BrokerageConfig.fromEnv(), new InMemoryKeyValueCache(clock), new PrometheusBrokerMetrics(),
            new InMemoryBrokerCredentialRepository(), clock);
    }

    public static BrokerageModule create(BrokerageConfig config, KeyValueCache cache, BrokerMetrics metrics,
                                         BrokerCredentialRepository credentialRepo, Clock clock) {
        return new BrokerageModule(config, cache, metrics, credentialRepo, clock);
    }

    public BrokerageFacade facade() {
        return facade;
    }

    public ConnectionManager connectionManager() {
        return connectionManager;
    }

    public BrokerageConfig config() {
        return config;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (dataSource != null) {
            dataSource.close();
        }
        log.info("Brokerage module stopped");
    }

    private static ExecutorService createExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "broker-aggregate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static HikariDataSource createDataSource(BrokerageConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("brokerage-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
