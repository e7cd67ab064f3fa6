package com.g2e.brokerage.service.trading;

import com.g2e.brokerage.broker.exception.BrokerageException;
import com.g2e.brokerage.domain.broker.BrokerConnection;
import com.g2e.brokerage.domain.broker.BrokerFeatures;
import com.g2e.brokerage.domain.broker.BrokerId;
import com.g2e.brokerage.domain.model.Balance;
import com.g2e.brokerage.domain.model.OrderRequest;
import com.g2e.brokerage.domain.model.Position;
import com.g2e.brokerage.domain.model.Quote;
import com.g2e.brokerage.service.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Estimates cost, buying-power impact and concentration of an order before it is placed.
 *
 * Warnings never throw. Insufficient buying power and unsupported short sales block
 * execution; concentration warnings do not.
 */
public class OrderPreviewEngine {
    private static final Logger log = LoggerFactory.getLogger(OrderPreviewEngine.class);

    static final BigDecimal HIGH_CONCENTRATION_PERCENT = BigDecimal.valueOf(20);
    static final BigDecimal MODERATE_CONCENTRATION_PERCENT = BigDecimal.valueOf(10);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_SCALE = 10;

    private final ConnectionManager connectionManager;

    public OrderPreviewEngine(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public OrderPreview preview(UUID userId, BrokerId brokerId, String accountId, OrderRequest request) {
        Optional<BrokerConnection> found = connectionManager.findActive(userId, brokerId);
        if (found.isEmpty()) {
            log.info("[PREVIEW] No active {} connection for user={}", brokerId, userId);
            return blocked(brokerId, accountId, request, "No active connection to " + brokerId.code());
        }
        BrokerConnection connection = found.get();
        BrokerFeatures features = connectionManager.adapterFor(connection).features();
        List<String> warnings = new ArrayList<>();

        BigDecimal price = request.limitPrice();
        try {
            Quote quote = connectionManager.execute(connection, "quote",
                (a, t) -> a.getQuote(request.symbol(), t));
            if (price == null) {
                price = quote.last();
            }
        } catch (BrokerageException e) {
            log.warn("[PREVIEW] Quote for {} failed: {}", request.symbol(), e.getMessage());
            warnings.add("Could not get quote: " + e.getMessage());
        }

        Balance balance;
        List<Position> positions;
        try {
            balance = connectionManager.execute(connection, "balance", (a, t) -> a.getAccountBalance(accountId, t));
            positions = connectionManager.execute(connection, "positions", (a, t) -> a.getPositions(accountId, t));
        } catch (BrokerageException e) {
            log.warn("[PREVIEW] Account data for {} failed: {}", accountId, e.getMessage());
            warnings.add("Could not fetch account data: " + e.getMessage());
            BigDecimal fallback = price != null ? price : fallbackPrice(request, null);
            return new OrderPreview(brokerId, accountId, request.symbol(), request.side(), request.quantity(),
                request.orderType(), fallback, request.quantity().multiply(fallback), BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                risk(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, features), warnings, false);
        }

        BigDecimal currentQty = BigDecimal.ZERO;
        Position held = null;
        for (Position position : positions) {
            if (request.symbol().equalsIgnoreCase(position.symbol())) {
                currentQty = currentQty.add(position.quantity());
                held = position;
            }
        }
        if (price == null) {
            price = fallbackPrice(request, held);
        }

        PreviewFigures figures = compute(request, price, balance, currentQty, features);
        warnings.addAll(figures.warnings());

        log.info("[PREVIEW] {} {} {} @ {} on {}: cost={} canExecute={} warnings={}",
            request.side(), request.quantity(), request.symbol(), price, brokerId,
            figures.estimatedCost(), figures.canExecute(), figures.warnings().size());

        return new OrderPreview(
            brokerId,
            accountId,
            request.symbol(),
            request.side(),
            request.quantity(),
            request.orderType(),
            price,
            figures.estimatedCost(),
            BigDecimal.ZERO,
            figures.buyingPowerImpact(),
            balance.buyingPower().add(figures.buyingPowerImpact()),
            figures.positionAfter(),
            risk(figures.concentrationPercent(), figures.estimatedCost(), currentQty, features),
            warnings,
            figures.canExecute()
        );
    }

    record PreviewFigures(
        BigDecimal estimatedCost,
        BigDecimal buyingPowerImpact,
        BigDecimal positionAfter,
        BigDecimal concentrationPercent,
        List<String> warnings,
        boolean canExecute
    ) {}

    /**
     * Pure decision policy over already-fetched inputs.
     */
    static PreviewFigures compute(OrderRequest request, BigDecimal price, Balance balance,
                                  BigDecimal currentQty, BrokerFeatures features) {
        List<String> warnings = new ArrayList<>();
        boolean canExecute = true;
        boolean buy = request.side().isBuy();

        BigDecimal estimatedCost = request.quantity().multiply(price);
        BigDecimal impact = buy ? estimatedCost.negate() : estimatedCost;
        BigDecimal positionAfter = buy ? currentQty.add(request.quantity()) : currentQty.subtract(request.quantity());

        if (buy && estimatedCost.compareTo(balance.buyingPower()) > 0) {
            warnings.add(PreviewWarning.INSUFFICIENT_BUYING_POWER.message());
            canExecute = false;
        }

        if (!buy && request.quantity().compareTo(currentQty) > 0) {
            warnings.add(PreviewWarning.SELLING_MORE_THAN_OWNED.message());
            if (!features.shortSelling()) {
                warnings.add(PreviewWarning.SHORT_SELLING_NOT_SUPPORTED.message());
                canExecute = false;
            }
        }

        BigDecimal concentration = concentrationPercent(estimatedCost, balance.portfolioValue());
        if (concentration.compareTo(HIGH_CONCENTRATION_PERCENT) >= 0) {
            warnings.add(PreviewWarning.HIGH_CONCENTRATION.message());
        } else if (concentration.compareTo(MODERATE_CONCENTRATION_PERCENT) >= 0) {
            warnings.add(PreviewWarning.MODERATE_CONCENTRATION.message());
        }

        return new PreviewFigures(estimatedCost, impact, positionAfter, concentration, warnings, canExecute);
    }

    static BigDecimal concentrationPercent(BigDecimal estimatedCost, BigDecimal portfolioValue) {
        if (portfolioValue == null || portfolioValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return estimatedCost.multiply(HUNDRED).divide(portfolioValue, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Price when no quote is available: limit, then stop, then the held position's last price, then zero.
     */
    private static BigDecimal fallbackPrice(OrderRequest request, Position held) {
        if (request.limitPrice() != null) return request.limitPrice();
        if (request.stopPrice() != null) return request.stopPrice();
        if (held != null && held.currentPrice() != null && held.currentPrice().signum() > 0) {
            return held.currentPrice();
        }
        return BigDecimal.ZERO;
    }

    private static RiskAssessment risk(BigDecimal concentration, BigDecimal positionSize, BigDecimal currentQty,
                                       BrokerFeatures features) {
        return new RiskAssessment(
            concentration,
            concentration.compareTo(MODERATE_CONCENTRATION_PERCENT) > 0,
            positionSize,
            currentQty,
            features.extendedHours(),
            features.fractionalShares(),
            features.shortSelling()
        );
    }

    private OrderPreview blocked(BrokerId brokerId, String accountId, OrderRequest request, String warning) {
        BigDecimal price = fallbackPrice(request, null);
        return new OrderPreview(brokerId, accountId, request.symbol(), request.side(), request.quantity(),
            request.orderType(), price, request.quantity().multiply(price), BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            new RiskAssessment(BigDecimal.ZERO, false, BigDecimal.ZERO, BigDecimal.ZERO, false, false, false),
            List.of(warning), false);
    }
}
