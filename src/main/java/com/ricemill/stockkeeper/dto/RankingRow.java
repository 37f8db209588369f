package com.ricemill.stockkeeper.dto;

import java.math.BigDecimal;

/**
 * One grouped row as read from the store, before ranking decoration.
 */
public record RankingRow(String key, String label, BigDecimal quantity, BigDecimal amount, long transactionCount) {
}
