package com.ricemill.stockkeeper.dto;

import com.ricemill.stockkeeper.exception.InvalidPeriodException;

import java.util.Locale;

public enum PeriodName {
    TODAY,
    THIS_WEEK,
    THIS_MONTH,
    LAST_MONTH,
    THIS_QUARTER,
    THIS_YEAR,
    CUSTOM;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PeriodName fromKey(String key) {
        if (key == null || key.isBlank()) {
            return THIS_MONTH;
        }
        for (PeriodName name : values()) {
            if (name.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return name;
            }
        }
        throw new InvalidPeriodException("Unknown period: " + key);
    }
}
