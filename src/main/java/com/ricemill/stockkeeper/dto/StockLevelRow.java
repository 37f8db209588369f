package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

public record StockLevelRow(
        Long productId,
        String productName,
        String sku,
        BigDecimal pricePerQuintal,
        BigDecimal totalIn,
        BigDecimal totalOut,
        BigDecimal availableStock) {

    public StockLevelRow withoutPrice() {
        return new StockLevelRow(productId, productName, sku, null, totalIn, totalOut, availableStock);
    }
}
