package com.rg.chrono.range;

import com.rg.chrono.CalendarArithmetic;
import com.rg.chrono.CalendarDate;

import java.util.Objects;

/**
 * An inclusive [startDate, endDate] period of one {@link RangeKind}.
 *
 * Every variant can be built from a start or an end date and walked with {@link #prior()} and
 * {@link #next()}, which return the adjacent, non-overlapping period of the same kind.
 * Ranges are immutable; walking produces new values.
 */
public sealed interface DateRange
    permits WeeklyRange, BiWeeklyRange, SemiMonthlyRange, MonthlyRange, QuarterlyRange, SemiAnnualRange, AnnualRange {

  CalendarDate startDate();

  CalendarDate endDate();

  RangeKind kind();

  DateRange prior();

  DateRange next();

  default boolean contains(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return date.isOnOrAfter(startDate()) && date.isOnOrBefore(endDate());
  }

  default long lengthInDays() {
    return CalendarArithmetic.daysBetween(startDate(), endDate()) + 1;
  }
}
