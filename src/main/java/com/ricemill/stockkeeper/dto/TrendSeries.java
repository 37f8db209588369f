package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily quintal totals. The three lists are index-aligned and cover every day of the period.
 */
public record TrendSeries(List<LocalDate> dates, List<BigDecimal> stockInValues, List<BigDecimal> stockOutValues) {
}
