package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYearMonth;

import java.util.Objects;

/** A calendar month, 1st to last day. */
public record MonthlyRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  public MonthlyRange {
    RangeInvariants.checkBounds(RangeKind.MONTHLY, startDate, endDate);
    RangeInvariants.check(startDate.day() == 1 && endDate.equals(startDate.lastDayOfMonth()),
        RangeKind.MONTHLY, startDate, endDate, "covers one whole calendar month");
  }

  public static MonthlyRange withStartDate(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return of(date.toYearMonth());
  }

  public static MonthlyRange of(CalendarYearMonth yearMonth) {
    Objects.requireNonNull(yearMonth, "yearMonth");
    return new MonthlyRange(yearMonth.firstDayOfMonth(), yearMonth.lastDayOfMonth());
  }

  public static MonthlyRange withEndDate(CalendarDate date) {
    return withStartDate(date);
  }

  public CalendarYearMonth yearMonth() {
    return startDate.toYearMonth();
  }

  @Override
  public RangeKind kind() {
    return RangeKind.MONTHLY;
  }

  @Override
  public MonthlyRange prior() {
    return of(yearMonth().minusMonths(1));
  }

  @Override
  public MonthlyRange next() {
    return of(yearMonth().plusMonths(1));
  }
}
