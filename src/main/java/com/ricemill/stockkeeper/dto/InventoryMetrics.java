package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

public record InventoryMetrics(BigDecimal totalStock, long productCount, BigDecimal totalValue) {
}
