package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.config.DashboardProperties;
import com.ricemill.stockkeeper.dto.DateRange;
import com.ricemill.stockkeeper.dto.PeriodSelector;
import com.ricemill.stockkeeper.dto.ResolvedPeriod;
import com.ricemill.stockkeeper.exception.InvalidPeriodException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Turns a period selector into a current and a previous half-open range,
 * relative to today on the injected clock.
 *
 * <p>Calendar periods (month, quarter, year) compare against the previous
 * calendar unit, so their lengths can differ. Day, week and custom periods
 * compare against the range of the same length that ends where the current
 * one starts. Custom ranges longer than the configured maximum are rejected.
 */
@Component
public class PeriodResolver {

    private final Clock clock;
    private final int maxCustomDays;

    @Autowired
    public PeriodResolver(Clock clock, DashboardProperties properties) {
        this(clock, properties.maxCustomRangeDays());
    }

    public PeriodResolver(Clock clock, int maxCustomDays) {
        this.clock = clock;
        this.maxCustomDays = maxCustomDays;
    }

    public ResolvedPeriod resolve(PeriodSelector selector) {
        PeriodSelector effective = selector != null ? selector : PeriodSelector.DEFAULT;
        LocalDate today = LocalDate.now(clock);

        switch (effective.name()) {
            case TODAY: {
                DateRange current = new DateRange(today, today.plusDays(1));
                return new ResolvedPeriod(effective, current, precedingOfSameLength(current));
            }
            case THIS_WEEK: {
                LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                DateRange current = new DateRange(monday, monday.plusWeeks(1));
                return new ResolvedPeriod(effective, current, precedingOfSameLength(current));
            }
            case LAST_MONTH: {
                LocalDate first = today.withDayOfMonth(1).minusMonths(1);
                return new ResolvedPeriod(effective, months(first, 1), months(first.minusMonths(1), 1));
            }
            case THIS_QUARTER: {
                int firstMonth = ((today.getMonthValue() - 1) / 3) * 3 + 1;
                LocalDate first = LocalDate.of(today.getYear(), firstMonth, 1);
                return new ResolvedPeriod(effective, months(first, 3), months(first.minusMonths(3), 3));
            }
            case THIS_YEAR: {
                LocalDate first = today.withDayOfYear(1);
                return new ResolvedPeriod(effective, months(first, 12), months(first.minusYears(1), 12));
            }
            case CUSTOM: {
                DateRange current = new DateRange(effective.customStart(), effective.customEnd());
                if (current.days() > maxCustomDays) {
                    throw new InvalidPeriodException("Custom period " + current + " is longer than "
                            + maxCustomDays + " days");
                }
                return new ResolvedPeriod(effective, current, precedingOfSameLength(current));
            }
            case THIS_MONTH:
            default: {
                LocalDate first = today.withDayOfMonth(1);
                return new ResolvedPeriod(effective, months(first, 1), months(first.minusMonths(1), 1));
            }
        }
    }

    private static DateRange months(LocalDate first, int count) {
        return new DateRange(first, first.plusMonths(count));
    }

    private static DateRange precedingOfSameLength(DateRange range) {
        return new DateRange(range.start().minusDays(range.days()), range.start());
    }
}
