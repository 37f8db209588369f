package com.ricemill.stockkeeper.dto;

public record ResolvedPeriod(PeriodSelector selector, DateRange current, DateRange previous) {
}
