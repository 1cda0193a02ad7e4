package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYearMonth;

import java.util.Objects;

/** A calendar quarter: Jan-Mar, Apr-Jun, Jul-Sep or Oct-Dec. */
public record QuarterlyRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  static final int MONTHS = 3;

  public QuarterlyRange {
    RangeInvariants.checkBounds(RangeKind.QUARTERLY, startDate, endDate);
    RangeInvariants.check(
        startDate.day() == 1 && (startDate.month() - 1) % MONTHS == 0
            && endDate.equals(startDate.plusMonths(MONTHS - 1).lastDayOfMonth()),
        RangeKind.QUARTERLY, startDate, endDate, "covers one whole calendar quarter");
  }

  public static QuarterlyRange withStartDate(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return startingAt(CalendarYearMonth.of(date.year(), firstMonthOf(date.month(), MONTHS)));
  }

  private static QuarterlyRange startingAt(CalendarYearMonth first) {
    return new QuarterlyRange(first.firstDayOfMonth(), first.plusMonths(MONTHS - 1).lastDayOfMonth());
  }

  public static QuarterlyRange withEndDate(CalendarDate date) {
    return withStartDate(date);
  }

  /** 1 to 4. */
  public int quarter() {
    return (startDate.month() - 1) / MONTHS + 1;
  }

  static int firstMonthOf(int month, int monthsPerPeriod) {
    return ((month - 1) / monthsPerPeriod) * monthsPerPeriod + 1;
  }

  @Override
  public RangeKind kind() {
    return RangeKind.QUARTERLY;
  }

  @Override
  public QuarterlyRange prior() {
    return startingAt(startDate.toYearMonth().minusMonths(MONTHS));
  }

  @Override
  public QuarterlyRange next() {
    return startingAt(startDate.toYearMonth().plusMonths(MONTHS));
  }
}
