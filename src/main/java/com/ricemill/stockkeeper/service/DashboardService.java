package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.config.DashboardProperties;
import com.ricemill.stockkeeper.dto.*;
import com.ricemill.stockkeeper.event.TenantDataChangedEvent;
import com.ricemill.stockkeeper.event.TenantEventBus;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.security.Action;
import com.ricemill.stockkeeper.security.AuthorizationService;
import com.ricemill.stockkeeper.security.TenantRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for dashboard reads. Every call checks the actor's capability,
 * resolves the tenant scope and then serves the metric from the cache.
 */
@Slf4j
@Service
public class DashboardService {

    public static final String WIDGET_INVENTORY = "inventory";
    public static final String WIDGET_FINANCIAL = "financial";
    public static final String WIDGET_STOCK_ALERTS = "stock_alerts";
    public static final String WIDGET_TREND = "trend";
    public static final String WIDGET_TOP_PRODUCTS_IN = "top_products_in";
    public static final String WIDGET_TOP_PRODUCTS_OUT = "top_products_out";
    public static final String WIDGET_TOP_FARMERS = "top_farmers";
    public static final String WIDGET_TOP_CUSTOMERS = "top_customers";
    public static final String WIDGET_PERFORMANCE = "performance";
    public static final String WIDGET_RECENT_STOCK_INS = "recent_stock_ins";
    public static final String WIDGET_RECENT_STOCK_OUTS = "recent_stock_outs";

    public static final List<String> WIDGETS = List.of(
            WIDGET_INVENTORY, WIDGET_FINANCIAL, WIDGET_STOCK_ALERTS, WIDGET_TREND,
            WIDGET_TOP_PRODUCTS_IN, WIDGET_TOP_PRODUCTS_OUT, WIDGET_TOP_FARMERS, WIDGET_TOP_CUSTOMERS,
            WIDGET_PERFORMANCE, WIDGET_RECENT_STOCK_INS, WIDGET_RECENT_STOCK_OUTS);

    private final AuthorizationService authorizationService;
    private final TenantScopedQueryService queries;
    private final PeriodResolver periodResolver;
    private final DashboardMetricsCalculator calculator;
    private final DashboardCache cache;
    private final TenantSettingsService settingsService;
    private final DashboardProperties properties;
    private final TenantEventBus eventBus;

    public DashboardService(AuthorizationService authorizationService,
            TenantScopedQueryService queries,
            PeriodResolver periodResolver,
            DashboardMetricsCalculator calculator,
            DashboardCache cache,
            TenantSettingsService settingsService,
            DashboardProperties properties,
            TenantEventBus eventBus) {
        this.authorizationService = authorizationService;
        this.queries = queries;
        this.periodResolver = periodResolver;
        this.calculator = calculator;
        this.cache = cache;
        this.settingsService = settingsService;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    public ResolvedPeriod resolvePeriod(PeriodSelector selector) {
        return periodResolver.resolve(selector);
    }

    public InventoryMetrics getInventoryMetrics(Long tenantId, User actor) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        return cache.inventoryMetrics(scope.tenantId(), () -> calculator.inventoryMetrics(scope));
    }

    public FinancialMetrics getFinancialMetrics(Long tenantId, User actor, PeriodSelector selector) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_FINANCIAL_METRICS);
        DateRange range = periodResolver.resolve(selector).current();
        return cache.financialMetrics(scope.tenantId(), range, () -> calculator.financialMetrics(scope, range));
    }

    public List<StockAlert> getStockAlerts(Long tenantId, User actor) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        BigDecimal threshold = settingsService.lowStockThreshold(scope.tenant());
        return cache.stockAlerts(scope.tenantId(), () -> calculator.stockAlerts(scope, threshold));
    }

    public TrendSeries getTrendSeries(Long tenantId, User actor, PeriodSelector selector) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        DateRange range = periodResolver.resolve(selector).current();
        return cache.trendSeries(scope.tenantId(), range, () -> calculator.trendSeries(scope, range));
    }

    /**
     * Ranked top entities. {@code n} outside 1 to the configured limit means the
     * configured limit. Amounts are removed for actors who may not see money figures.
     */
    public List<RankedEntity> getTopEntities(Long tenantId, User actor, PeriodSelector selector, TopEntityKind kind,
            Integer n) {
        if (kind == null) {
            throw new IllegalArgumentException("Ranking kind is required");
        }
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        DateRange range = periodResolver.resolve(selector).current();
        int max = kind.isByProduct() ? properties.topProductsLimit() : properties.topPartiesLimit();
        int limit = n == null || n < 1 || n > max ? max : n;

        List<RankedEntity> ranked = cache.topEntities(scope.tenantId(), metricKind(kind), range, limit,
                () -> calculator.topEntities(scope, range, kind, limit));
        if (canSeeAmounts(actor, scope)) {
            return ranked;
        }
        return ranked.stream().map(RankedEntity::withoutAmount).collect(Collectors.toList());
    }

    public PerformanceComparison getPerformanceComparison(Long tenantId, User actor, PeriodSelector selector) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        ResolvedPeriod period = periodResolver.resolve(selector);
        return cache.performanceComparison(scope.tenantId(), period,
                () -> calculator.performanceComparison(scope, period));
    }

    /**
     * Latest movements of one type regardless of period. Not cached so a new
     * movement shows up immediately.
     */
    public List<MovementView> getRecentTransactions(Long tenantId, User actor, MovementType type) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        List<MovementView> recent = calculator.recent(scope, type, properties.recentTransactionsLimit());
        if (canSeeAmounts(actor, scope)) {
            return recent;
        }
        return recent.stream().map(MovementView::withoutAmounts).collect(Collectors.toList());
    }

    /**
     * Every widget the actor may see, for one period. A widget that fails is
     * reported under its name in {@code errors} and the rest still load.
     */
    public DashboardSnapshot getDashboard(Long tenantId, User actor, PeriodSelector selector) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        ResolvedPeriod period = periodResolver.resolve(selector);
        PeriodSelector effective = period.selector();

        Map<String, Object> widgets = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        widget(WIDGET_INVENTORY, widgets, errors, () -> getInventoryMetrics(tenantId, actor));
        if (canSeeAmounts(actor, scope)) {
            widget(WIDGET_FINANCIAL, widgets, errors, () -> getFinancialMetrics(tenantId, actor, effective));
        }
        widget(WIDGET_STOCK_ALERTS, widgets, errors, () -> getStockAlerts(tenantId, actor));
        widget(WIDGET_TREND, widgets, errors, () -> getTrendSeries(tenantId, actor, effective));
        widget(WIDGET_TOP_PRODUCTS_IN, widgets, errors,
                () -> getTopEntities(tenantId, actor, effective, TopEntityKind.PRODUCTS_IN, null));
        widget(WIDGET_TOP_PRODUCTS_OUT, widgets, errors,
                () -> getTopEntities(tenantId, actor, effective, TopEntityKind.PRODUCTS_OUT, null));
        widget(WIDGET_TOP_FARMERS, widgets, errors,
                () -> getTopEntities(tenantId, actor, effective, TopEntityKind.FARMERS, null));
        widget(WIDGET_TOP_CUSTOMERS, widgets, errors,
                () -> getTopEntities(tenantId, actor, effective, TopEntityKind.CUSTOMERS, null));
        widget(WIDGET_PERFORMANCE, widgets, errors, () -> getPerformanceComparison(tenantId, actor, effective));
        widget(WIDGET_RECENT_STOCK_INS, widgets, errors,
                () -> getRecentTransactions(tenantId, actor, MovementType.STOCK_IN));
        widget(WIDGET_RECENT_STOCK_OUTS, widgets, errors,
                () -> getRecentTransactions(tenantId, actor, MovementType.STOCK_OUT));

        return new DashboardSnapshot(period, widgets, errors);
    }

    /**
     * Registers for change signals on a tenant the actor may read. The caller
     * closes the subscription when its session ends.
     */
    public TenantEventBus.Subscription subscribe(Long tenantId, User actor, Consumer<TenantDataChangedEvent> listener) {
        TenantScope scope = open(tenantId, actor, Action.VIEW_REPORTS);
        log.debug("Actor {} subscribed to changes on tenant {}", actor.getId(), scope.tenantId());
        return eventBus.subscribe(scope.tenantId(), listener);
    }

    private TenantScope open(Long tenantId, User actor, Action action) {
        authorizationService.authorize(actor, action, TenantRef.of(tenantId));
        return queries.scope(actor, tenantId);
    }

    private boolean canSeeAmounts(User actor, TenantScope scope) {
        return authorizationService.can(actor, Action.VIEW_FINANCIAL_METRICS, scope);
    }

    private void widget(String name, Map<String, Object> widgets, Map<String, String> errors, Supplier<Object> loader) {
        try {
            widgets.put(name, loader.get());
        } catch (UnauthorizedException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Dashboard widget {} failed: {}", name, e.getMessage());
            errors.put(name, e.getMessage());
        }
    }

    private static MetricKind metricKind(TopEntityKind kind) {
        switch (kind) {
            case PRODUCTS_IN:
                return MetricKind.TOP_PRODUCTS_IN;
            case PRODUCTS_OUT:
                return MetricKind.TOP_PRODUCTS_OUT;
            case FARMERS:
                return MetricKind.TOP_FARMERS;
            default:
                return MetricKind.TOP_CUSTOMERS;
        }
    }
}
