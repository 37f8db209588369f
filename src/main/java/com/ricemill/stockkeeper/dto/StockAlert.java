package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

public record StockAlert(
        Long productId,
        String productName,
        String sku,
        BigDecimal currentStock,
        BigDecimal threshold,
        AlertSeverity severity) {
}
