package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.*;
import com.ricemill.stockkeeper.exception.ComputationException;
import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.model.Product;
import com.ricemill.stockkeeper.model.StockMovement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CancellationException;

/**
 * Metric computations over one tenant's movements. Access control has already
 * happened by the time a scope reaches this class.
 *
 * <p>All arithmetic is on {@link BigDecimal}. Each method re-reads persisted rows,
 * so concurrent writers never leave a running total out of step.
 */
@Slf4j
@Component
public class DashboardMetricsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final int PERCENT_SCALE = 2;
    static final int AVERAGE_SCALE = 4;

    private final TenantScopedQueryService queries;

    public DashboardMetricsCalculator(TenantScopedQueryService queries) {
        this.queries = queries;
    }

    /**
     * In minus out per product, with the product's live price. Products with no
     * movements appear with zero stock.
     */
    public List<StockLevelRow> stockLevels(TenantScope scope) {
        List<Product> products = queries.products(scope);
        Map<Long, BigDecimal> in = queries.quintalsByProduct(scope, MovementType.STOCK_IN);
        checkCancelled();
        Map<Long, BigDecimal> out = queries.quintalsByProduct(scope, MovementType.STOCK_OUT);

        List<StockLevelRow> rows = new ArrayList<>(products.size());
        for (Product product : products) {
            BigDecimal totalIn = nonNegative(in.get(product.getId()), product, "stock-in");
            BigDecimal totalOut = nonNegative(out.get(product.getId()), product, "stock-out");
            rows.add(new StockLevelRow(product.getId(), product.getName(), product.getSku(),
                    product.getPricePerQuintal(), totalIn, totalOut, totalIn.subtract(totalOut)));
        }
        return rows;
    }

    public InventoryMetrics inventoryMetrics(TenantScope scope) {
        BigDecimal totalStock = BigDecimal.ZERO;
        BigDecimal totalValue = BigDecimal.ZERO;
        long inStock = 0;
        for (StockLevelRow row : stockLevels(scope)) {
            totalStock = totalStock.add(row.availableStock());
            totalValue = totalValue.add(row.availableStock().multiply(row.pricePerQuintal()));
            if (row.availableStock().signum() > 0) {
                inStock++;
            }
        }
        return new InventoryMetrics(totalStock, inStock, totalValue);
    }

    /**
     * Products below {@code threshold}, lowest stock first. Zero or negative stock
     * is out of stock.
     */
    public List<StockAlert> stockAlerts(TenantScope scope, BigDecimal threshold) {
        List<StockAlert> alerts = new ArrayList<>();
        for (StockLevelRow row : stockLevels(scope)) {
            BigDecimal stock = row.availableStock();
            if (stock.compareTo(threshold) >= 0) {
                continue;
            }
            AlertSeverity severity = stock.signum() <= 0 ? AlertSeverity.OUT_OF_STOCK : AlertSeverity.LOW_STOCK;
            alerts.add(new StockAlert(row.productId(), row.productName(), row.sku(), stock, threshold, severity));
        }
        alerts.sort(Comparator.comparing(StockAlert::currentStock).thenComparing(StockAlert::productId));
        return alerts;
    }

    public FinancialMetrics financialMetrics(TenantScope scope, DateRange period) {
        MovementTotals purchases = queries.totals(scope, MovementType.STOCK_IN, period);
        checkCancelled();
        MovementTotals sales = queries.totals(scope, MovementType.STOCK_OUT, period);
        return new FinancialMetrics(period,
                purchases.totalPrice(),
                sales.totalPrice(),
                sales.totalPrice().subtract(purchases.totalPrice()),
                purchases.count(),
                sales.count());
    }

    public TrendSeries trendSeries(TenantScope scope, DateRange period) {
        Map<LocalDate, BigDecimal> in = queries.dailyQuintals(scope, MovementType.STOCK_IN, period);
        checkCancelled();
        Map<LocalDate, BigDecimal> out = queries.dailyQuintals(scope, MovementType.STOCK_OUT, period);

        List<LocalDate> dates = period.dates();
        List<BigDecimal> inValues = new ArrayList<>(dates.size());
        List<BigDecimal> outValues = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            inValues.add(in.getOrDefault(date, BigDecimal.ZERO));
            outValues.add(out.getOrDefault(date, BigDecimal.ZERO));
        }
        return new TrendSeries(dates, inValues, outValues);
    }

    /**
     * Top {@code limit} entities by quantity. Percentages are shares of the
     * returned rows' combined quantity.
     */
    public List<RankedEntity> topEntities(TenantScope scope, DateRange period, TopEntityKind kind, int limit) {
        List<RankingRow> rows = kind.isByProduct()
                ? queries.productRanking(scope, kind.getMovementType(), period, limit)
                : queries.partyRanking(scope, kind.getMovementType(), period, limit);

        BigDecimal displayedTotal = BigDecimal.ZERO;
        for (RankingRow row : rows) {
            displayedTotal = displayedTotal.add(row.quantity());
        }

        List<RankedEntity> ranked = new ArrayList<>(rows.size());
        int rank = 1;
        for (RankingRow row : rows) {
            BigDecimal average = row.transactionCount() > 0
                    ? row.quantity().divide(BigDecimal.valueOf(row.transactionCount()), AVERAGE_SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            BigDecimal percentage = displayedTotal.signum() > 0
                    ? row.quantity().multiply(HUNDRED).divide(displayedTotal, PERCENT_SCALE, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO;
            ranked.add(new RankedEntity(rank++, row.key(), row.label(), row.quantity(), row.amount(),
                    row.transactionCount(), average, percentage));
        }
        return ranked;
    }

    public PerformanceComparison performanceComparison(TenantScope scope, ResolvedPeriod period) {
        BigDecimal currentIn = queries.totals(scope, MovementType.STOCK_IN, period.current()).totalQuintals();
        BigDecimal previousIn = queries.totals(scope, MovementType.STOCK_IN, period.previous()).totalQuintals();
        checkCancelled();
        BigDecimal currentOut = queries.totals(scope, MovementType.STOCK_OUT, period.current()).totalQuintals();
        BigDecimal previousOut = queries.totals(scope, MovementType.STOCK_OUT, period.previous()).totalQuintals();

        return new PerformanceComparison(period.current(), period.previous(),
                currentIn, previousIn, percentageChange(currentIn, previousIn),
                currentOut, previousOut, percentageChange(currentOut, previousOut));
    }

    public List<MovementView> recent(TenantScope scope, MovementType type, int limit) {
        List<? extends StockMovement> movements = queries.recent(scope, type, limit);
        List<MovementView> views = new ArrayList<>(movements.size());
        for (StockMovement movement : movements) {
            views.add(MovementView.of(movement));
        }
        return views;
    }

    /**
     * {@code (current - previous) / previous * 100}, two decimals. Growth from
     * nothing is reported as 100, and no movement in either period as 0.
     */
    public static BigDecimal percentageChange(BigDecimal current, BigDecimal previous) {
        BigDecimal cur = current != null ? current : BigDecimal.ZERO;
        BigDecimal prev = previous != null ? previous : BigDecimal.ZERO;
        if (prev.signum() == 0) {
            return cur.signum() == 0
                    ? BigDecimal.ZERO.setScale(PERCENT_SCALE)
                    : HUNDRED.setScale(PERCENT_SCALE);
        }
        return cur.subtract(prev)
                .multiply(HUNDRED)
                .divide(prev.abs(), PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNegative(BigDecimal sum, Product product, String kind) {
        if (sum == null) {
            return BigDecimal.ZERO;
        }
        if (sum.signum() < 0) {
            log.error("Negative {} total {} for product {}", kind, sum, product.getId());
            throw new ComputationException("Negative " + kind + " total for product " + product.getId());
        }
        return sum;
    }

    // Abandoned requests must not finish and populate the cache with a partial result
    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Metric computation cancelled");
        }
    }
}
