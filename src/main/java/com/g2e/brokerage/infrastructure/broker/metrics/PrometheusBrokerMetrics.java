package com.g2e.brokerage.infrastructure.broker.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of BrokerMetrics.
 *
 * Key Metrics:
 * - broker_vendor_calls_total{broker, operation, status}
 * - broker_vendor_call_latency_seconds{broker, operation}
 * - broker_oauth_exchanges_total{broker, status}
 * - broker_token_refreshes_total{broker, status}
 * - broker_aggregation_failures_total{broker, reason}
 */
public class PrometheusBrokerMetrics implements BrokerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusBrokerMetrics.class);

    private final CollectorRegistry registry;

    private final Counter vendorCallCounter;
    private final Histogram vendorCallLatency;
    private final Counter oauthExchangeCounter;
    private final Counter tokenRefreshCounter;
    private final Counter aggregationFailureCounter;

    public PrometheusBrokerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBrokerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.vendorCallCounter = Counter.build()
            .name("broker_vendor_calls_total")
            .help("Vendor API calls by broker, operation and outcome")
            .labelNames("broker", "operation", "status")
            .register(registry);

        this.vendorCallLatency = Histogram.build()
            .name("broker_vendor_call_latency_seconds")
            .help("Vendor API call latency")
            .labelNames("broker", "operation")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 15.0)
            .register(registry);

        this.oauthExchangeCounter = Counter.build()
            .name("broker_oauth_exchanges_total")
            .help("OAuth token exchanges by broker and outcome")
            .labelNames("broker", "status")
            .register(registry);

        this.tokenRefreshCounter = Counter.build()
            .name("broker_token_refreshes_total")
            .help("Token refresh attempts by broker and outcome")
            .labelNames("broker", "status")
            .register(registry);

        this.aggregationFailureCounter = Counter.build()
            .name("broker_aggregation_failures_total")
            .help("Per-broker failures during portfolio aggregation")
            .labelNames("broker", "reason")
            .register(registry);

        log.info("Prometheus broker metrics initialized");
    }

    @Override
    public void recordVendorCall(String brokerCode, String operation, boolean success, Duration latency) {
        vendorCallCounter.labels(brokerCode, operation, status(success)).inc();
        vendorCallLatency.labels(brokerCode, operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOAuthExchange(String brokerCode, boolean success) {
        oauthExchangeCounter.labels(brokerCode, status(success)).inc();
    }

    @Override
    public void recordTokenRefresh(String brokerCode, boolean success) {
        tokenRefreshCounter.labels(brokerCode, status(success)).inc();
    }

    @Override
    public void recordAggregationFailure(String brokerCode, String reason) {
        aggregationFailureCounter.labels(brokerCode, reason).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static String status(boolean success) {
        return success ? "success" : "failure";
    }
}
