package com.g2e.brokerage.service.portfolio;

import com.g2e.brokerage.broker.exception.BrokerageException;
import com.g2e.brokerage.broker.exception.TokensUnavailableException;
import com.g2e.brokerage.broker.exception.VendorRejectedException;
import com.g2e.brokerage.broker.exception.VendorUnavailableException;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one task per connection concurrently, each bounded by the per-call timeout.
 *
 * A failing or slow broker yields an error outcome; it never fails the whole call.
 */
public class BrokerFanOut {
    private static final Logger log = LoggerFactory.getLogger(BrokerFanOut.class);

    private final ExecutorService executor;
    private final Duration perCallTimeout;
    private final BrokerMetrics metrics;

    public BrokerFanOut(ExecutorService executor, Duration perCallTimeout, BrokerMetrics metrics) {
        this.executor = executor;
        this.perCallTimeout = perCallTimeout;
        this.metrics = metrics;
    }

    public Duration perCallTimeout() {
        return perCallTimeout;
    }

    /**
     * Outcomes are returned in the order of the given connections.
     */
    public <T> List<BrokerOutcome<T>> run(List<BrokerConnection> connections, String label,
                                          Function<BrokerConnection, T> task) {
        List<CompletableFuture<BrokerOutcome<T>>> futures = new ArrayList<>();
        for (BrokerConnection connection : connections) {
            futures.add(CompletableFuture
                .supplyAsync(() -> task.apply(connection), executor)
                .orTimeout(perCallTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, error) -> error == null
                    ? BrokerOutcome.success(connection, value)
                    : BrokerOutcome.failure(connection, describe(connection, label, error))));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            log.warn("[AGGREGATE] {} interrupted; abandoning outstanding broker calls", label);
        } catch (ExecutionException e) {
            // unreachable: handle() completes every future normally
            throw new IllegalStateException("Unexpected fan-out failure", e.getCause());
        }

        List<BrokerOutcome<T>> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<BrokerOutcome<T>> future = futures.get(i);
            if (future.isDone() && !future.isCancelled()) {
                outcomes.add(future.join());
            } else {
                outcomes.add(BrokerOutcome.failure(connections.get(i), "Request cancelled"));
            }
        }
        return outcomes;
    }

    private String describe(BrokerConnection connection, String label, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }

        String reason;
        String message;
        if (cause instanceof TimeoutException) {
            reason = "timeout";
            message = "Timed out after " + perCallTimeout.toSeconds() + "s";
        } else if (cause instanceof CancellationException) {
            reason = "cancelled";
            message = "Request cancelled";
        } else if (cause instanceof VendorRejectedException) {
            reason = "rejected";
            message = cause.getMessage();
        } else if (cause instanceof VendorUnavailableException) {
            reason = "unavailable";
            message = cause.getMessage();
        } else if (cause instanceof TokensUnavailableException) {
            reason = "tokens";
            message = cause.getMessage();
        } else if (cause instanceof BrokerageException) {
            reason = "error";
            message = cause.getMessage();
        } else {
            reason = "error";
            message = "Unexpected error: " + cause.getMessage();
        }

        log.warn("[AGGREGATE] {} failed for {} connection={}: {}", label, connection.brokerId(), connection.id(), message);
        if (metrics != null) {
            metrics.recordAggregationFailure(connection.brokerId().code(), reason);
        }
        return message;
    }
}
