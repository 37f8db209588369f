package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.*;
import com.ricemill.stockkeeper.exception.InvalidPeriodException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class PeriodResolverTest {

    // Sunday, 15 March 2026
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);

    private final PeriodResolver resolver = new PeriodResolver(
            Clock.fixed(TODAY.atTime(10, 30).toInstant(ZoneOffset.UTC), ZoneOffset.UTC), 366);

    private static DateRange range(String start, String end) {
        return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    @Test
    void resolve_ThisMonth_ShouldCompareWithPreviousCalendarMonth() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.THIS_MONTH));

        assertEquals(range("2026-03-01", "2026-04-01"), period.current());
        assertEquals(range("2026-02-01", "2026-03-01"), period.previous());
    }

    @Test
    void resolve_NullSelector_ShouldDefaultToThisMonth() {
        ResolvedPeriod period = resolver.resolve(null);

        assertEquals(PeriodName.THIS_MONTH, period.selector().name());
        assertEquals(range("2026-03-01", "2026-04-01"), period.current());
    }

    @Test
    void resolve_Today_ShouldEndAtStartOfTomorrow() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.TODAY));

        assertEquals(range("2026-03-15", "2026-03-16"), period.current());
        assertEquals(range("2026-03-14", "2026-03-15"), period.previous());
        assertTrue(period.current().contains(TODAY));
    }

    @Test
    void resolve_ThisWeek_ShouldStartOnMonday() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.THIS_WEEK));

        assertEquals(range("2026-03-09", "2026-03-16"), period.current());
        assertEquals(range("2026-03-02", "2026-03-09"), period.previous());
    }

    @Test
    void resolve_LastMonth_ShouldCoverFebruary() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.LAST_MONTH));

        assertEquals(range("2026-02-01", "2026-03-01"), period.current());
        assertEquals(range("2026-01-01", "2026-02-01"), period.previous());
    }

    @Test
    void resolve_ThisQuarter_ShouldCoverFirstQuarter() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.THIS_QUARTER));

        assertEquals(range("2026-01-01", "2026-04-01"), period.current());
        assertEquals(range("2025-10-01", "2026-01-01"), period.previous());
    }

    @Test
    void resolve_ThisYear_ShouldCoverCalendarYear() {
        ResolvedPeriod period = resolver.resolve(PeriodSelector.named(PeriodName.THIS_YEAR));

        assertEquals(range("2026-01-01", "2027-01-01"), period.current());
        assertEquals(range("2025-01-01", "2026-01-01"), period.previous());
    }

    @Test
    void resolve_Custom_ShouldPrecedeWithRangeOfSameLength() {
        ResolvedPeriod period = resolver.resolve(
                PeriodSelector.custom(LocalDate.parse("2026-02-10"), LocalDate.parse("2026-02-20")));

        assertEquals(range("2026-02-10", "2026-02-20"), period.current());
        assertEquals(range("2026-01-31", "2026-02-10"), period.previous());
        assertEquals(period.current().days(), period.previous().days());
    }

    @Test
    void resolve_EveryNamedPeriod_ShouldBeAdjacentToItsPrevious() {
        for (PeriodName name : PeriodName.values()) {
            if (name == PeriodName.CUSTOM) {
                continue;
            }
            ResolvedPeriod period = resolver.resolve(PeriodSelector.named(name));
            assertEquals(period.previous().end(), period.current().start(), name.key());
            assertTrue(period.current().contains(TODAY) || name == PeriodName.LAST_MONTH, name.key());
        }
    }

    @Test
    void custom_ShouldRejectInvertedRange() {
        assertThrows(InvalidPeriodException.class,
                () -> PeriodSelector.custom(LocalDate.parse("2026-03-10"), LocalDate.parse("2026-03-01")));
        assertThrows(InvalidPeriodException.class, () -> PeriodSelector.custom(null, LocalDate.parse("2026-03-01")));
    }

    @Test
    void resolve_Custom_ShouldRejectRangeLongerThanLimit() {
        PeriodSelector wholeCalendar = PeriodSelector.custom(LocalDate.of(1, 1, 1), LocalDate.of(9999, 12, 31));
        PeriodSelector justOver = PeriodSelector.custom(LocalDate.parse("2025-01-01"), LocalDate.parse("2026-01-03"));

        assertThrows(InvalidPeriodException.class, () -> resolver.resolve(wholeCalendar));
        assertThrows(InvalidPeriodException.class, () -> resolver.resolve(justOver));
        assertEquals(366, resolver.resolve(PeriodSelector.custom(LocalDate.parse("2025-01-01"),
                LocalDate.parse("2026-01-02"))).current().days());
    }

    @Test
    void parse_ShouldRejectUnknownKeyAndDefaultBlank() {
        assertThrows(InvalidPeriodException.class, () -> PeriodSelector.parse("fortnight", null, null));
        assertEquals(PeriodName.THIS_MONTH, PeriodSelector.parse("  ", null, null).name());
        assertEquals(PeriodName.LAST_MONTH, PeriodSelector.parse("LAST_MONTH", null, null).name());
    }
}
