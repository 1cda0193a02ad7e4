package com.rg.chrono;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.Month;
import java.time.Year;
import java.util.Objects;

/** A year in the proleptic Gregorian calendar, with no month or day. */
public record CalendarYear(int value) implements Comparable<CalendarYear> {

  public CalendarYear {
    if (value < Year.MIN_VALUE || value > Year.MAX_VALUE) {
      throw new InvalidDateException(DateField.YEAR, value, "must be " + Year.MIN_VALUE + ".." + Year.MAX_VALUE);
    }
  }

  public static CalendarYear of(int value) {
    return new CalendarYear(value);
  }

  public static CalendarYear from(CalendarDate date) {
    return new CalendarYear(Objects.requireNonNull(date, "date").year());
  }

  public static CalendarYear now(CalendarClock clock) {
    return from(Objects.requireNonNull(clock, "clock").today());
  }

  public boolean isLeap() {
    return CalendarArithmetic.isLeapYear(value);
  }

  /** 365 or 366. */
  public int length() {
    return CalendarArithmetic.daysInYear(value);
  }

  public CalendarYear plus(long years) {
    if (years == 0) return this;
    return new CalendarYear(CalendarArithmetic.checkYear(Math.addExact((long) value, years)));
  }

  public CalendarYear minus(long years) {
    return plus(Math.negateExact(years));
  }

  /** The date with the given day-of-year; day 366 only exists in leap years. */
  public CalendarDate atDay(int dayOfYear) {
    return CalendarDate.of(value, 1, 1).withDayOfYear(dayOfYear);
  }

  public CalendarDate atMonthDay(Month month, int day) {
    return CalendarDate.of(value, month, day);
  }

  /** February 29 becomes February 28 outside leap years. */
  public CalendarDate atMonthDay(CalendarMonthDay monthDay) {
    return Objects.requireNonNull(monthDay, "monthDay").atYear(value);
  }

  public CalendarYearMonth atMonth(int month) {
    return CalendarYearMonth.of(value, month);
  }

  public boolean isBefore(CalendarYear other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarYear other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(CalendarYear other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
