package com.ricemill.stockkeeper.dto;

public enum AlertSeverity {
    OUT_OF_STOCK,
    LOW_STOCK
}
