package com.ricemill.stockkeeper.dto;

import java.util.Map;

/**
 * All widgets for one dashboard load. A widget that failed to compute appears in
 * {@code errors} instead of {@code widgets}; the others are unaffected.
 */
public record DashboardSnapshot(ResolvedPeriod period, Map<String, Object> widgets, Map<String, String> errors) {
}
