package com.ricemill.stockkeeper.dto;

import com.ricemill.stockkeeper.exception.InvalidPeriodException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open day range {@code [start, end)}.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new InvalidPeriodException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidPeriodException("Start date " + start + " is after end date " + end);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; d.isBefore(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
