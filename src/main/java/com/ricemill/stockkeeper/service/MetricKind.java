package com.ricemill.stockkeeper.service;

public enum MetricKind {
    INVENTORY,
    FINANCIAL,
    STOCK_ALERTS,
    TREND,
    TOP_PRODUCTS_IN,
    TOP_PRODUCTS_OUT,
    TOP_FARMERS,
    TOP_CUSTOMERS,
    PERFORMANCE
}
