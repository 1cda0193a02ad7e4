package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYear;

import java.time.Month;
import java.util.Objects;

/** January 1st to December 31st of one year. */
public record AnnualRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  public AnnualRange {
    RangeInvariants.checkBounds(RangeKind.ANNUAL, startDate, endDate);
    RangeInvariants.check(startDate.month() == 1 && startDate.day() == 1
            && endDate.equals(startDate.lastDayOfYear()),
        RangeKind.ANNUAL, startDate, endDate, "covers one whole calendar year");
  }

  public static AnnualRange withStartDate(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return of(CalendarYear.from(date));
  }

  public static AnnualRange of(CalendarYear year) {
    Objects.requireNonNull(year, "year");
    return new AnnualRange(year.atDay(1), year.atMonthDay(Month.DECEMBER, 31));
  }

  public static AnnualRange withEndDate(CalendarDate date) {
    return withStartDate(date);
  }

  public int year() {
    return startDate.year();
  }

  @Override
  public RangeKind kind() {
    return RangeKind.ANNUAL;
  }

  @Override
  public AnnualRange prior() {
    return of(CalendarYear.from(startDate).minus(1));
  }

  @Override
  public AnnualRange next() {
    return of(CalendarYear.from(startDate).plus(1));
  }
}
