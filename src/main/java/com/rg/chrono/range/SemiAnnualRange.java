package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYearMonth;

import java.util.Objects;

/** January to June, or July to December. */
public record SemiAnnualRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  static final int MONTHS = 6;

  public SemiAnnualRange {
    RangeInvariants.checkBounds(RangeKind.SEMI_ANNUAL, startDate, endDate);
    RangeInvariants.check(
        startDate.day() == 1 && (startDate.month() == 1 || startDate.month() == 7)
            && endDate.equals(startDate.plusMonths(MONTHS - 1).lastDayOfMonth()),
        RangeKind.SEMI_ANNUAL, startDate, endDate, "covers one whole half year");
  }

  public static SemiAnnualRange withStartDate(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return startingAt(CalendarYearMonth.of(date.year(), QuarterlyRange.firstMonthOf(date.month(), MONTHS)));
  }

  private static SemiAnnualRange startingAt(CalendarYearMonth first) {
    return new SemiAnnualRange(first.firstDayOfMonth(), first.plusMonths(MONTHS - 1).lastDayOfMonth());
  }

  public static SemiAnnualRange withEndDate(CalendarDate date) {
    return withStartDate(date);
  }

  public boolean isFirstHalf() {
    return startDate.month() == 1;
  }

  @Override
  public RangeKind kind() {
    return RangeKind.SEMI_ANNUAL;
  }

  @Override
  public SemiAnnualRange prior() {
    return startingAt(startDate.toYearMonth().minusMonths(MONTHS));
  }

  @Override
  public SemiAnnualRange next() {
    return startingAt(startDate.toYearMonth().plusMonths(MONTHS));
  }
}
