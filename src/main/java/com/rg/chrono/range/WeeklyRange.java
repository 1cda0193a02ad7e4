package com.rg.chrono.range;

import com.rg.chrono.CalendarArithmetic;
import com.rg.chrono.CalendarDate;

import java.time.DayOfWeek;
import java.util.Objects;

/** Seven days starting on the first day of the week (Monday unless told otherwise). */
public record WeeklyRange(CalendarDate startDate, CalendarDate endDate) implements DateRange {

  public WeeklyRange {
    RangeInvariants.checkBounds(RangeKind.WEEKLY, startDate, endDate);
    RangeInvariants.check(CalendarArithmetic.daysBetween(startDate, endDate) == 6,
        RangeKind.WEEKLY, startDate, endDate, "spans exactly 7 days");
  }

  public static WeeklyRange withStartDate(CalendarDate date) {
    return withStartDate(date, DayOfWeek.MONDAY);
  }

  public static WeeklyRange withStartDate(CalendarDate date, DayOfWeek firstDayOfWeek) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(firstDayOfWeek, "firstDayOfWeek");
    CalendarDate start = date.previousOrSame(firstDayOfWeek);
    return new WeeklyRange(start, start.plusDays(6));
  }

  public static WeeklyRange withEndDate(CalendarDate date) {
    return withStartDate(date, DayOfWeek.MONDAY);
  }

  public static WeeklyRange withEndDate(CalendarDate date, DayOfWeek firstDayOfWeek) {
    return withStartDate(date, firstDayOfWeek);
  }

  public DayOfWeek firstDayOfWeek() {
    return startDate.dayOfWeek();
  }

  @Override
  public RangeKind kind() {
    return RangeKind.WEEKLY;
  }

  @Override
  public WeeklyRange prior() {
    return new WeeklyRange(startDate.minusWeeks(1), endDate.minusWeeks(1));
  }

  @Override
  public WeeklyRange next() {
    return new WeeklyRange(startDate.plusWeeks(1), endDate.plusWeeks(1));
  }
}
