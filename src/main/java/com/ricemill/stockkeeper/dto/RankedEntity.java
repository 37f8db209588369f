package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

/**
 * A top-N row. {@code percentage} is relative to the quantity of the returned rows only.
 * {@code amount} is null when the caller may not see money figures.
 */
public record RankedEntity(
        int rank,
        String key,
        String label,
        BigDecimal quantity,
        BigDecimal amount,
        long transactionCount,
        BigDecimal averageQuantity,
        BigDecimal percentage) {

    public RankedEntity withoutAmount() {
        return new RankedEntity(rank, key, label, quantity, null, transactionCount, averageQuantity, percentage);
    }
}
