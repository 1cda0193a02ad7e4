package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYearMonth;

import java.util.Objects;

/** The 1st to the 15th, or the 16th to the last day of a month. */
public record SemiMonthlyRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  static final int FIRST_HALF_LAST_DAY = 15;

  public SemiMonthlyRange {
    RangeInvariants.checkBounds(RangeKind.SEMI_MONTHLY, startDate, endDate);
    boolean firstHalf = startDate.day() == 1
        && endDate.equals(startDate.withDayOfMonth(FIRST_HALF_LAST_DAY));
    boolean secondHalf = startDate.day() == FIRST_HALF_LAST_DAY + 1
        && endDate.equals(startDate.lastDayOfMonth());
    RangeInvariants.check(firstHalf || secondHalf, RangeKind.SEMI_MONTHLY, startDate, endDate,
        "covers 1st-15th or 16th-end of one month");
  }

  public static SemiMonthlyRange withStartDate(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    if (date.day() <= FIRST_HALF_LAST_DAY) {
      return firstHalfOf(date);
    }
    return secondHalfOf(date);
  }

  public static SemiMonthlyRange withEndDate(CalendarDate date) {
    return withStartDate(date);
  }

  private static SemiMonthlyRange firstHalfOf(CalendarDate date) {
    return new SemiMonthlyRange(date.withDayOfMonth(1), date.withDayOfMonth(FIRST_HALF_LAST_DAY));
  }

  private static SemiMonthlyRange secondHalfOf(CalendarDate date) {
    return new SemiMonthlyRange(date.withDayOfMonth(FIRST_HALF_LAST_DAY + 1), date.lastDayOfMonth());
  }

  public CalendarYearMonth yearMonth() {
    return startDate.toYearMonth();
  }

  public boolean isFirstHalf() {
    return startDate.day() == 1;
  }

  @Override
  public RangeKind kind() {
    return RangeKind.SEMI_MONTHLY;
  }

  @Override
  public SemiMonthlyRange prior() {
    if (isFirstHalf()) {
      return secondHalfOf(startDate.minusMonths(1));
    }
    return firstHalfOf(startDate);
  }

  @Override
  public SemiMonthlyRange next() {
    if (isFirstHalf()) {
      return secondHalfOf(startDate);
    }
    return firstHalfOf(startDate.firstDayOfNextMonth());
  }
}
