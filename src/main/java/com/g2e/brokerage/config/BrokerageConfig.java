package com.g2e.brokerage.config;

import com.g2e.brokerage.util.Env;

import java.time.Duration;

/**
 * Immutable runtime configuration, read once at startup.
 */
public record BrokerageConfig(
    String alpacaClientId,
    String alpacaClientSecret,
    boolean alpacaPaper,
    String etradeConsumerKey,
    String etradeConsumerSecret,
    boolean etradeSandbox,
    Duration tokenTtl,
    Duration oauthStateTtl,
    Duration quoteCacheTtl,
    Duration vendorHttpTimeout,
    Duration aggregationTimeout,
    int aggregationThreads,
    Persistence persistence,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize
) {
    public enum Persistence { MEMORY, POSTGRES }

    public static final long DEFAULT_TOKEN_TTL_SECONDS = 7200;
    public static final long DEFAULT_OAUTH_STATE_TTL_SECONDS = 600;
    public static final long DEFAULT_QUOTE_CACHE_TTL_SECONDS = 15;
    public static final long DEFAULT_VENDOR_HTTP_TIMEOUT_SECONDS = 15;
    public static final long DEFAULT_AGGREGATION_TIMEOUT_SECONDS = 15;
    public static final int DEFAULT_AGGREGATION_THREADS = 8;

    public BrokerageConfig {
        if (aggregationThreads <= 0) {
            throw new IllegalArgumentException("aggregationThreads must be positive");
        }
        requirePositive(tokenTtl, "tokenTtl");
        requirePositive(oauthStateTtl, "oauthStateTtl");
        requirePositive(quoteCacheTtl, "quoteCacheTtl");
        requirePositive(vendorHttpTimeout, "vendorHttpTimeout");
        requirePositive(aggregationTimeout, "aggregationTimeout");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public static BrokerageConfig fromEnv() {
        String persistence = Env.get("PERSISTENCE", "memory");
        return new BrokerageConfig(
            Env.get("ALPACA_CLIENT_ID", ""),
            Env.get("ALPACA_CLIENT_SECRET", ""),
            Env.getBool("ALPACA_PAPER", true),
            Env.get("ETRADE_CONSUMER_KEY", ""),
            Env.get("ETRADE_CONSUMER_SECRET", ""),
            Env.getBool("ETRADE_SANDBOX", true),
            Duration.ofSeconds(Env.getLong("TOKEN_TTL_SECONDS", DEFAULT_TOKEN_TTL_SECONDS)),
            Duration.ofSeconds(Env.getLong("OAUTH_STATE_TTL_SECONDS", DEFAULT_OAUTH_STATE_TTL_SECONDS)),
            Duration.ofSeconds(Env.getLong("QUOTE_CACHE_TTL_SECONDS", DEFAULT_QUOTE_CACHE_TTL_SECONDS)),
            Duration.ofSeconds(Env.getLong("VENDOR_HTTP_TIMEOUT_SECONDS", DEFAULT_VENDOR_HTTP_TIMEOUT_SECONDS)),
            Duration.ofSeconds(Env.getLong("AGGREGATION_TIMEOUT_SECONDS", DEFAULT_AGGREGATION_TIMEOUT_SECONDS)),
            Env.getInt("AGGREGATION_THREADS", DEFAULT_AGGREGATION_THREADS),
            "postgres".equalsIgnoreCase(persistence) ? Persistence.POSTGRES : Persistence.MEMORY,
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/brokerage"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10)
        );
    }

    /**
     * Defaults with no vendor credentials and in-memory persistence.
     */
    public static BrokerageConfig defaults() {
        return new BrokerageConfig(
            "", "", true, "", "", true,
            Duration.ofSeconds(DEFAULT_TOKEN_TTL_SECONDS),
            Duration.ofSeconds(DEFAULT_OAUTH_STATE_TTL_SECONDS),
            Duration.ofSeconds(DEFAULT_QUOTE_CACHE_TTL_SECONDS),
            Duration.ofSeconds(DEFAULT_VENDOR_HTTP_TIMEOUT_SECONDS),
            Duration.ofSeconds(DEFAULT_AGGREGATION_TIMEOUT_SECONDS),
            DEFAULT_AGGREGATION_THREADS,
            Persistence.MEMORY,
            null, null, null, 10
        );
    }

    @Override
    public String toString() {
        return "BrokerageConfig[alpacaPaper=" + alpacaPaper + ", etradeSandbox=" + etradeSandbox
            + ", tokenTtl=" + tokenTtl + ", oauthStateTtl=" + oauthStateTtl
            + ", aggregationTimeout=" + aggregationTimeout + ", aggregationThreads=" + aggregationThreads
            + ", persistence=" + persistence + ", dbUrl=" + dbUrl + "]";
    }
}
