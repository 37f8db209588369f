package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.config.DashboardProperties;
import com.ricemill.stockkeeper.dto.*;
import com.ricemill.stockkeeper.event.ChangeType;
import com.ricemill.stockkeeper.event.InMemoryTenantEventBus;
import com.ricemill.stockkeeper.event.TenantDataChangedEvent;
import com.ricemill.stockkeeper.event.TenantEventBus;
import com.ricemill.stockkeeper.exception.DegradedDataException;
import com.ricemill.stockkeeper.exception.InvalidPeriodException;
import com.ricemill.stockkeeper.exception.TenantMismatchException;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.*;
import com.ricemill.stockkeeper.security.AuthorizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);
    private static final DateRange MARCH = new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 4, 1));
    private static final DateRange FEBRUARY = new DateRange(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 3, 1));

    @Mock
    private TenantScopedQueryService queries;
    @Mock
    private DashboardMetricsCalculator calculator;
    @Mock
    private TenantSettingsService settingsService;

    private DashboardCache cache;
    private TenantEventBus eventBus;
    private DashboardService dashboardService;

    private Tenant tenant;
    private User operator;
    private User viewer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        cache = new DashboardCache(DashboardProperties.defaults());
        eventBus = new InMemoryTenantEventBus(Runnable::run);
        dashboardService = new DashboardService(new AuthorizationService(), queries,
                new PeriodResolver(clock, DashboardProperties.defaults()), calculator, cache, settingsService,
                DashboardProperties.defaults(), eventBus);

        tenant = new Tenant();
        tenant.setId(1L);
        operator = user(10L, UserRole.OPERATOR);
        viewer = user(11L, UserRole.VIEWER);
    }

    private User user(Long id, UserRole role) {
        User user = new User();
        user.setId(id);
        user.setRole(role);
        user.setTenantId(1L);
        return user;
    }

    private TenantScope scopeFor(User actor) {
        TenantScope scope = new TenantScope(tenant, actor);
        when(queries.scope(actor, 1L)).thenReturn(scope);
        return scope;
    }

    @Test
    void getFinancialMetrics_ShouldRejectViewer() {
        assertThrows(UnauthorizedException.class,
                () -> dashboardService.getFinancialMetrics(1L, viewer, PeriodSelector.DEFAULT));
        verifyNoInteractions(queries, calculator);
    }

    @Test
    void getFinancialMetrics_ShouldSucceedForOperatorOnSameTenant() {
        TenantScope scope = scopeFor(operator);
        FinancialMetrics expected = new FinancialMetrics(MARCH, BigDecimal.TEN, BigDecimal.ONE,
                new BigDecimal("-9"), 1, 1);
        when(calculator.financialMetrics(scope, MARCH)).thenReturn(expected);

        assertEquals(expected, dashboardService.getFinancialMetrics(1L, operator, PeriodSelector.DEFAULT));
    }

    @Test
    void getInventoryMetrics_ShouldRejectOtherTenant() {
        assertThrows(UnauthorizedException.class, () -> dashboardService.getInventoryMetrics(2L, operator));
        verifyNoInteractions(queries, calculator);
    }

    @Test
    void getInventoryMetrics_ShouldPropagateTenantMismatchFromScope() {
        User companyAdmin = user(12L, UserRole.COMPANY_ADMIN);
        when(queries.scope(companyAdmin, 2L)).thenThrow(new TenantMismatchException(12L, 2L));

        assertThrows(TenantMismatchException.class, () -> dashboardService.getInventoryMetrics(2L, companyAdmin));
        verifyNoInteractions(calculator);
    }

    @Test
    void getInventoryMetrics_ShouldServeFromCacheUntilInvalidated() {
        TenantScope scope = scopeFor(operator);
        InventoryMetrics first = new InventoryMetrics(new BigDecimal("70"), 1, new BigDecimal("140000"));
        InventoryMetrics second = new InventoryMetrics(new BigDecimal("75"), 1, new BigDecimal("150000"));
        when(calculator.inventoryMetrics(scope)).thenReturn(first, second);

        assertEquals(first, dashboardService.getInventoryMetrics(1L, operator));
        assertEquals(first, dashboardService.getInventoryMetrics(1L, operator));
        cache.invalidateTenant(1L);
        assertEquals(second, dashboardService.getInventoryMetrics(1L, operator));
        verify(calculator, times(2)).inventoryMetrics(scope);
    }

    @Test
    void getStockAlerts_ShouldUseTenantThreshold() {
        TenantScope scope = scopeFor(operator);
        when(settingsService.lowStockThreshold(tenant)).thenReturn(new BigDecimal("80"));
        when(calculator.stockAlerts(scope, new BigDecimal("80"))).thenReturn(List.of());

        assertTrue(dashboardService.getStockAlerts(1L, operator).isEmpty());
    }

    @Test
    void getTopEntities_ShouldClampLimitAndRedactAmountsForViewer() {
        TenantScope scope = scopeFor(viewer);
        RankedEntity row = new RankedEntity(1, "Ramesh", "Ramesh", new BigDecimal("60"), new BigDecimal("120000"), 3,
                new BigDecimal("20"), new BigDecimal("100.00"));
        when(calculator.topEntities(scope, MARCH, TopEntityKind.FARMERS, 10)).thenReturn(List.of(row));

        List<RankedEntity> ranked = dashboardService.getTopEntities(1L, viewer, PeriodSelector.DEFAULT,
                TopEntityKind.FARMERS, 50);

        assertEquals(1, ranked.size());
        assertNull(ranked.get(0).amount());
        assertEquals(new BigDecimal("60"), ranked.get(0).quantity());
    }

    @Test
    void getTopEntities_ShouldKeepAmountsForOperatorAndHonourSmallN() {
        TenantScope scope = scopeFor(operator);
        RankedEntity row = new RankedEntity(1, "100", "Sona Masoori", new BigDecimal("60"), new BigDecimal("120000"),
                3, new BigDecimal("20"), new BigDecimal("100.00"));
        when(calculator.topEntities(scope, MARCH, TopEntityKind.PRODUCTS_IN, 2)).thenReturn(List.of(row));

        List<RankedEntity> ranked = dashboardService.getTopEntities(1L, operator, PeriodSelector.DEFAULT,
                TopEntityKind.PRODUCTS_IN, 2);

        assertEquals(new BigDecimal("120000"), ranked.get(0).amount());
    }

    @Test
    void getPerformanceComparison_ShouldNotShareCacheAcrossDifferentPreviousRanges() {
        TenantScope scope = scopeFor(operator);
        when(calculator.performanceComparison(eq(scope), any())).thenAnswer(invocation -> {
            ResolvedPeriod period = invocation.getArgument(1);
            return new PerformanceComparison(period.current(), period.previous(), BigDecimal.ZERO, BigDecimal.ZERO,
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        });

        PerformanceComparison thisMonth = dashboardService.getPerformanceComparison(1L, operator,
                PeriodSelector.named(PeriodName.THIS_MONTH));
        PerformanceComparison customMarch = dashboardService.getPerformanceComparison(1L, operator,
                PeriodSelector.custom(MARCH.start(), MARCH.end()));

        assertEquals(MARCH, thisMonth.currentPeriod());
        assertEquals(FEBRUARY, thisMonth.previousPeriod());
        assertEquals(MARCH, customMarch.currentPeriod());
        assertEquals(new DateRange(LocalDate.of(2026, 1, 29), LocalDate.of(2026, 3, 1)), customMarch.previousPeriod());
        verify(calculator, times(2)).performanceComparison(eq(scope), any());
    }

    @Test
    void getTrendSeries_ShouldRejectOverlongCustomRange() {
        assertThrows(InvalidPeriodException.class, () -> dashboardService.getTrendSeries(1L, operator,
                PeriodSelector.custom(LocalDate.of(1, 1, 1), LocalDate.of(9999, 12, 31))));
        verifyNoInteractions(calculator);
    }

    @Test
    void subscribe_ShouldDeliverOnlyOwnTenantChanges() {
        scopeFor(viewer);
        List<TenantDataChangedEvent> received = new ArrayList<>();

        try (TenantEventBus.Subscription ignored = dashboardService.subscribe(1L, viewer, received::add)) {
            eventBus.publish(1L, new TenantDataChangedEvent(1L, ChangeType.STOCK_IN_RECORDED, 5L, Instant.EPOCH));
            eventBus.publish(2L, new TenantDataChangedEvent(2L, ChangeType.STOCK_IN_RECORDED, 6L, Instant.EPOCH));
        }
        eventBus.publish(1L, new TenantDataChangedEvent(1L, ChangeType.STOCK_OUT_RECORDED, 7L, Instant.EPOCH));

        assertEquals(1, received.size());
        assertEquals(5L, received.get(0).resourceId());
    }

    @Test
    void subscribe_ShouldRejectOtherTenant() {
        assertThrows(UnauthorizedException.class, () -> dashboardService.subscribe(2L, viewer, event -> {
        }));
        verifyNoInteractions(queries);
    }

    @Test
    void getRecentTransactions_ShouldRedactPricesForViewer() {
        TenantScope scope = scopeFor(viewer);
        MovementView view = new MovementView(1L, MovementType.STOCK_IN, TODAY, 100L, "Sona Masoori", "Ramesh", null,
                null, 10, new BigDecimal("50"), new BigDecimal("5.00"), new BigDecimal("2000"),
                new BigDecimal("10000.00"), LocalDateTime.of(2026, 3, 15, 9, 0));
        when(calculator.recent(scope, MovementType.STOCK_IN, 10)).thenReturn(List.of(view));

        MovementView result = dashboardService.getRecentTransactions(1L, viewer, MovementType.STOCK_IN).get(0);

        assertNull(result.totalPrice());
        assertNull(result.pricePerQuintal());
        assertEquals(new BigDecimal("5.00"), result.totalQuintals());
    }

    @Test
    void getDashboard_ShouldIsolateFailingWidget() {
        TenantScope scope = scopeFor(operator);
        when(calculator.inventoryMetrics(scope)).thenThrow(new DegradedDataException("down", null));
        when(calculator.financialMetrics(eq(scope), any())).thenReturn(
                new FinancialMetrics(MARCH, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0));
        when(settingsService.lowStockThreshold(tenant)).thenReturn(new BigDecimal("50"));
        when(calculator.stockAlerts(eq(scope), any())).thenReturn(List.of());
        when(calculator.trendSeries(eq(scope), any())).thenReturn(new TrendSeries(List.of(), List.of(), List.of()));
        when(calculator.topEntities(eq(scope), any(), any(), anyInt())).thenReturn(List.of());
        when(calculator.performanceComparison(eq(scope), any())).thenReturn(new PerformanceComparison(MARCH, MARCH,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));
        when(calculator.recent(eq(scope), any(), anyInt())).thenReturn(List.of());

        DashboardSnapshot snapshot = dashboardService.getDashboard(1L, operator, PeriodSelector.DEFAULT);

        assertTrue(snapshot.errors().containsKey(DashboardService.WIDGET_INVENTORY));
        assertFalse(snapshot.widgets().containsKey(DashboardService.WIDGET_INVENTORY));
        assertTrue(snapshot.widgets().containsKey(DashboardService.WIDGET_FINANCIAL));
        assertTrue(snapshot.widgets().containsKey(DashboardService.WIDGET_TREND));
        assertEquals(MARCH, snapshot.period().current());
    }

    @Test
    void getDashboard_ShouldOmitFinancialWidgetForViewer() {
        TenantScope scope = scopeFor(viewer);
        when(calculator.inventoryMetrics(scope)).thenReturn(new InventoryMetrics(BigDecimal.ZERO, 0, BigDecimal.ZERO));
        when(settingsService.lowStockThreshold(tenant)).thenReturn(new BigDecimal("50"));
        when(calculator.stockAlerts(eq(scope), any())).thenReturn(List.of());
        when(calculator.trendSeries(eq(scope), any())).thenReturn(new TrendSeries(List.of(), List.of(), List.of()));
        when(calculator.topEntities(eq(scope), any(), any(), anyInt())).thenReturn(List.of());
        when(calculator.performanceComparison(eq(scope), any())).thenReturn(new PerformanceComparison(MARCH, MARCH,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));
        when(calculator.recent(eq(scope), any(), anyInt())).thenReturn(List.of());

        DashboardSnapshot snapshot = dashboardService.getDashboard(1L, viewer, PeriodSelector.DEFAULT);

        assertFalse(snapshot.widgets().containsKey(DashboardService.WIDGET_FINANCIAL));
        assertTrue(snapshot.errors().isEmpty());
        verify(calculator, never()).financialMetrics(any(), any());
    }
}
