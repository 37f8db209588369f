package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.dto.*;
import com.ricemill.stockkeeper.event.TenantEventBus;
import com.ricemill.stockkeeper.model.DashboardPreference;
import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.DashboardPreferenceService;
import com.ricemill.stockkeeper.service.DashboardService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/tenants/{tenantId}/dashboard")
public class DashboardController {

    static final long EVENT_STREAM_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final DashboardService dashboardService;
    private final DashboardPreferenceService preferenceService;
    private final CurrentActorResolver actorResolver;

    public DashboardController(DashboardService dashboardService,
            DashboardPreferenceService preferenceService,
            CurrentActorResolver actorResolver) {
        this.dashboardService = dashboardService;
        this.preferenceService = preferenceService;
        this.actorResolver = actorResolver;
    }

    /**
     * Without a {@code period} parameter the user's saved default period applies.
     */
    @GetMapping
    public DashboardSnapshot dashboard(@PathVariable Long tenantId,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        User actor = actorResolver.currentActor();
        String key = period;
        if ((key == null || key.isBlank()) && actor != null && actor.getId() != null) {
            DashboardPreference preference = preferenceService.getOrCreate(actor);
            key = preference.getDefaultPeriod();
        }
        return dashboardService.getDashboard(tenantId, actor, PeriodSelector.parse(key, start, end));
    }

    @GetMapping("/period")
    public ResolvedPeriod period(@RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return dashboardService.resolvePeriod(PeriodSelector.parse(period, start, end));
    }

    @GetMapping("/inventory")
    public InventoryMetrics inventory(@PathVariable Long tenantId) {
        return dashboardService.getInventoryMetrics(tenantId, actorResolver.currentActor());
    }

    @GetMapping("/financial")
    public FinancialMetrics financial(@PathVariable Long tenantId,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return dashboardService.getFinancialMetrics(tenantId, actorResolver.currentActor(),
                PeriodSelector.parse(period, start, end));
    }

    @GetMapping("/alerts")
    public List<StockAlert> alerts(@PathVariable Long tenantId) {
        return dashboardService.getStockAlerts(tenantId, actorResolver.currentActor());
    }

    @GetMapping("/trend")
    public TrendSeries trend(@PathVariable Long tenantId,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return dashboardService.getTrendSeries(tenantId, actorResolver.currentActor(),
                PeriodSelector.parse(period, start, end));
    }

    /**
     * {@code kind} is one of products_in, products_out, farmers, customers.
     */
    @GetMapping("/top/{kind}")
    public List<RankedEntity> top(@PathVariable Long tenantId,
            @PathVariable String kind,
            @RequestParam(required = false) Integer n,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        TopEntityKind entityKind;
        try {
            entityKind = TopEntityKind.valueOf(kind.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ranking: " + kind);
        }
        return dashboardService.getTopEntities(tenantId, actorResolver.currentActor(),
                PeriodSelector.parse(period, start, end), entityKind, n);
    }

    @GetMapping("/performance")
    public PerformanceComparison performance(@PathVariable Long tenantId,
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return dashboardService.getPerformanceComparison(tenantId, actorResolver.currentActor(),
                PeriodSelector.parse(period, start, end));
    }

    @GetMapping("/recent/stock-ins")
    public List<MovementView> recentStockIns(@PathVariable Long tenantId) {
        return dashboardService.getRecentTransactions(tenantId, actorResolver.currentActor(), MovementType.STOCK_IN);
    }

    @GetMapping("/recent/stock-outs")
    public List<MovementView> recentStockOuts(@PathVariable Long tenantId) {
        return dashboardService.getRecentTransactions(tenantId, actorResolver.currentActor(), MovementType.STOCK_OUT);
    }

    /**
     * Server-sent "tenant-data-changed" events for this tenant. Clients refetch
     * the widgets they show when one arrives.
     */
    @GetMapping("/events")
    public SseEmitter events(@PathVariable Long tenantId) {
        SseEmitter emitter = new SseEmitter(EVENT_STREAM_TIMEOUT_MS);
        TenantEventBus.Subscription subscription = dashboardService.subscribe(tenantId, actorResolver.currentActor(),
                event -> {
                    try {
                        emitter.send(SseEmitter.event().name("tenant-data-changed").data(event));
                    } catch (IOException e) {
                        log.debug("Event stream for tenant {} closed: {}", tenantId, e.getMessage());
                        emitter.completeWithError(e);
                    }
                });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        return emitter;
    }
}
