package com.ricemill.stockkeeper.dto;

import com.ricemill.stockkeeper.exception.InvalidPeriodException;

import java.time.LocalDate;

/**
 * A named period or an explicit custom range. Custom bounds follow {@link DateRange}: end is exclusive.
 */
public record PeriodSelector(PeriodName name, LocalDate customStart, LocalDate customEnd) {

    public static final PeriodSelector DEFAULT = named(PeriodName.THIS_MONTH);

    public PeriodSelector {
        if (name == null) {
            name = PeriodName.THIS_MONTH;
        }
        if (name == PeriodName.CUSTOM) {
            // Validates presence and ordering
            new DateRange(customStart, customEnd);
        } else {
            customStart = null;
            customEnd = null;
        }
    }

    public static PeriodSelector named(PeriodName name) {
        if (name == PeriodName.CUSTOM) {
            throw new InvalidPeriodException("A custom period needs explicit start and end dates");
        }
        return new PeriodSelector(name, null, null);
    }

    public static PeriodSelector custom(LocalDate start, LocalDate end) {
        return new PeriodSelector(PeriodName.CUSTOM, start, end);
    }

    /**
     * Parses the request form: a period key ("this_month", ..., "custom") plus
     * optional bounds. A blank key means the default period.
     */
    public static PeriodSelector parse(String key, LocalDate start, LocalDate end) {
        PeriodName name = PeriodName.fromKey(key);
        if (name == PeriodName.CUSTOM) {
            return custom(start, end);
        }
        return named(name);
    }
}
