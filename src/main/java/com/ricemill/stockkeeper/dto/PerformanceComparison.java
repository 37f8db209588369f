package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

public record PerformanceComparison(
        DateRange currentPeriod,
        DateRange previousPeriod,
        BigDecimal currentStockIn,
        BigDecimal previousStockIn,
        BigDecimal stockInChange,
        BigDecimal currentStockOut,
        BigDecimal previousStockOut,
        BigDecimal stockOutChange) {
}
