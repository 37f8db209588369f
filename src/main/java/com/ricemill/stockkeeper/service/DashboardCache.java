package com.ricemill.stockkeeper.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ricemill.stockkeeper.config.DashboardProperties;
import com.ricemill.stockkeeper.dto.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoized dashboard metrics keyed by tenant, metric and the date ranges the
 * metric was computed over. Each metric has its own typed cache.
 *
 * <p>Invalidation is per tenant. Each tenant has a generation number that is part
 * of every key; bumping it makes loads that started before the write unable to
 * store their result under a key a later reader would look up. The old entries
 * are then removed eagerly.
 *
 * <p>Concurrent misses for one key share a single computation. A computation that
 * throws leaves nothing behind.
 */
@Slf4j
@Component
public class DashboardCache {

    /**
     * {@code range} and {@code previous} are null for metrics that do not use them.
     */
    record Key(Long tenantId, long generation, MetricKind kind, DateRange range, DateRange previous, int variant) {
    }

    private final Cache<Key, InventoryMetrics> inventory;
    private final Cache<Key, FinancialMetrics> financial;
    private final Cache<Key, List<StockAlert>> alerts;
    private final Cache<Key, TrendSeries> trends;
    private final Cache<Key, List<RankedEntity>> rankings;
    private final Cache<Key, PerformanceComparison> performance;
    private final List<Cache<Key, ?>> caches;

    private final Map<Long, AtomicLong> generations = new ConcurrentHashMap<>();

    @Autowired
    public DashboardCache(DashboardProperties properties) {
        this(properties.cacheTtl(), properties.cacheMaxEntries(), Ticker.systemTicker());
    }

    /**
     * {@code maxEntries} bounds each metric's cache separately.
     */
    public DashboardCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.inventory = build(ttl, maxEntries, ticker);
        this.financial = build(ttl, maxEntries, ticker);
        this.alerts = build(ttl, maxEntries, ticker);
        this.trends = build(ttl, maxEntries, ticker);
        this.rankings = build(ttl, maxEntries, ticker);
        this.performance = build(ttl, maxEntries, ticker);
        this.caches = List.of(inventory, financial, alerts, trends, rankings, performance);
    }

    private static <V> Cache<Key, V> build(Duration ttl, long maxEntries, Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .build();
    }

    public InventoryMetrics inventoryMetrics(Long tenantId, Supplier<InventoryMetrics> loader) {
        return load(inventory, key(tenantId, MetricKind.INVENTORY, null, null, 0), loader);
    }

    public FinancialMetrics financialMetrics(Long tenantId, DateRange range, Supplier<FinancialMetrics> loader) {
        return load(financial, key(tenantId, MetricKind.FINANCIAL, range, null, 0), loader);
    }

    public List<StockAlert> stockAlerts(Long tenantId, Supplier<List<StockAlert>> loader) {
        return load(alerts, key(tenantId, MetricKind.STOCK_ALERTS, null, null, 0), loader);
    }

    public TrendSeries trendSeries(Long tenantId, DateRange range, Supplier<TrendSeries> loader) {
        return load(trends, key(tenantId, MetricKind.TREND, range, null, 0), loader);
    }

    /**
     * Rankings differ by kind and by how many rows were asked for.
     */
    public List<RankedEntity> topEntities(Long tenantId, MetricKind kind, DateRange range, int limit,
            Supplier<List<RankedEntity>> loader) {
        return load(rankings, key(tenantId, kind, range, null, limit), loader);
    }

    /**
     * Keyed by both ranges: two selectors can share a current range and still
     * compare against different previous ranges.
     */
    public PerformanceComparison performanceComparison(Long tenantId, ResolvedPeriod period,
            Supplier<PerformanceComparison> loader) {
        return load(performance, key(tenantId, MetricKind.PERFORMANCE, period.current(), period.previous(), 0),
                loader);
    }

    public void invalidateTenant(Long tenantId) {
        if (tenantId == null) {
            return;
        }
        generation(tenantId).incrementAndGet();
        for (Cache<Key, ?> cache : caches) {
            cache.asMap().keySet().removeIf(key -> tenantId.equals(key.tenantId()));
        }
        log.debug("Invalidated dashboard cache for tenant {}", tenantId);
    }

    long size() {
        long size = 0;
        for (Cache<Key, ?> cache : caches) {
            cache.cleanUp();
            size += cache.estimatedSize();
        }
        return size;
    }

    private Key key(Long tenantId, MetricKind kind, DateRange range, DateRange previous, int variant) {
        return new Key(tenantId, generation(tenantId).get(), kind, range, previous, variant);
    }

    private <V> V load(Cache<Key, V> cache, Key key, Supplier<V> loader) {
        return cache.get(key, k -> {
            log.debug("Cache miss for tenant {} {} {}", k.tenantId(), k.kind(), k.range());
            return loader.get();
        });
    }

    private AtomicLong generation(Long tenantId) {
        return generations.computeIfAbsent(tenantId, id -> new AtomicLong());
    }
}
