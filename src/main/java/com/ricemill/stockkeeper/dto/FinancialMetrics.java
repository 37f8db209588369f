package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

public record FinancialMetrics(
        DateRange period,
        BigDecimal totalPurchases,
        BigDecimal totalSales,
        BigDecimal grossMargin,
        long stockInCount,
        long stockOutCount) {
}
