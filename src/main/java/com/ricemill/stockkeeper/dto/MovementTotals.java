package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

/**
 * Sums over a set of movements. Built by JPQL constructor expressions, so sums
 * over an empty set arrive as null and are normalised to zero here.
 */
public record MovementTotals(BigDecimal totalQuintals, BigDecimal totalPrice, Long count) {

    public static final MovementTotals EMPTY = new MovementTotals(BigDecimal.ZERO, BigDecimal.ZERO, 0L);

    public MovementTotals {
        totalQuintals = totalQuintals != null ? totalQuintals : BigDecimal.ZERO;
        totalPrice = totalPrice != null ? totalPrice : BigDecimal.ZERO;
        count = count != null ? count : 0L;
    }
}
