package com.ricemill.stockkeeper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Dashboard tuning, read from the "stockkeeper.dashboard" prefix:
 *
 * stockkeeper.dashboard.cache-ttl=30s
 * stockkeeper.dashboard.low-stock-threshold=50
 * stockkeeper.dashboard.read-retry-attempts=2
 * stockkeeper.dashboard.max-custom-range-days=1096
 */
@ConfigurationProperties(prefix = "stockkeeper.dashboard")
public record DashboardProperties(
        @DefaultValue("30s") Duration cacheTtl,
        @DefaultValue("10000") long cacheMaxEntries,
        @DefaultValue("50") BigDecimal lowStockThreshold,
        @DefaultValue("10") int recentTransactionsLimit,
        @DefaultValue("5") int topProductsLimit,
        @DefaultValue("10") int topPartiesLimit,
        @DefaultValue("2") int readRetryAttempts,
        @DefaultValue("200ms") Duration readRetryBackoff,
        @DefaultValue("1096") int maxCustomRangeDays) {

    public static DashboardProperties defaults() {
        return new DashboardProperties(Duration.ofSeconds(30), 10_000, new BigDecimal("50"), 10, 5, 10, 2,
                Duration.ofMillis(200), 1096);
    }
}
