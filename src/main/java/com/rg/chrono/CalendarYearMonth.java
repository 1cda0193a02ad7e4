package com.rg.chrono;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.Month;
import java.time.Year;
import java.util.Objects;

/**
 * A month of a particular year, such as 2024-02. Month arithmetic never touches a day, so
 * nothing is clamped; {@link #atDay(int)} is where day validity is checked.
 */
public record CalendarYearMonth(int year, int month) implements Comparable<CalendarYearMonth> {

  public CalendarYearMonth {
    if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
      throw new InvalidDateException(DateField.YEAR, year, "must be " + Year.MIN_VALUE + ".." + Year.MAX_VALUE);
    }
    if (month < 1 || month > 12) {
      throw new InvalidDateException(DateField.MONTH, month, "must be 1..12");
    }
  }

  public static CalendarYearMonth of(int year, int month) {
    return new CalendarYearMonth(year, month);
  }

  public static CalendarYearMonth of(int year, Month month) {
    return new CalendarYearMonth(year, Objects.requireNonNull(month, "month").getValue());
  }

  public static CalendarYearMonth from(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return new CalendarYearMonth(date.year(), date.month());
  }

  public static CalendarYearMonth now(CalendarClock clock) {
    return from(Objects.requireNonNull(clock, "clock").today());
  }

  /** Parses ISO-8601 such as {@code 2024-02}. */
  public static CalendarYearMonth parse(String text) {
    return CalendarParsers.parseYearMonth(text);
  }

  public Month monthOfYear() {
    return Month.of(month);
  }

  public boolean isLeapYear() {
    return CalendarArithmetic.isLeapYear(year);
  }

  public int lengthOfMonth() {
    return CalendarArithmetic.daysInMonth(year, month);
  }

  public int lengthOfYear() {
    return CalendarArithmetic.daysInYear(year);
  }

  public CalendarYearMonth plusMonths(long months) {
    if (months == 0) return this;
    long total = Math.addExact(year * 12L + (month - 1), months);
    int newYear = CalendarArithmetic.checkYear(Math.floorDiv(total, 12));
    return new CalendarYearMonth(newYear, (int) Math.floorMod(total, 12) + 1);
  }

  public CalendarYearMonth minusMonths(long months) {
    return plusMonths(Math.negateExact(months));
  }

  public CalendarYearMonth plusYears(long years) {
    if (years == 0) return this;
    return new CalendarYearMonth(CalendarArithmetic.checkYear(Math.addExact((long) year, years)), month);
  }

  public CalendarYearMonth minusYears(long years) {
    return plusYears(Math.negateExact(years));
  }

  public CalendarYearMonth withYear(int year) {
    return new CalendarYearMonth(year, month);
  }

  public CalendarYearMonth withMonth(int month) {
    return new CalendarYearMonth(year, month);
  }

  /** Whole months from this month to {@code end}; negative if {@code end} is earlier. */
  public long monthsUntil(CalendarYearMonth end) {
    Objects.requireNonNull(end, "end");
    return (end.year * 12L + end.month) - (year * 12L + month);
  }

  /** Strict: a day past the end of this month fails with {@link InvalidDateException}. */
  public CalendarDate atDay(int day) {
    return new CalendarDate(year, month, day);
  }

  public CalendarDate firstDayOfMonth() {
    return new CalendarDate(year, month, 1);
  }

  public CalendarDate lastDayOfMonth() {
    return new CalendarDate(year, month, lengthOfMonth());
  }

  public boolean contains(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return date.year() == year && date.month() == month;
  }

  public boolean isBefore(CalendarYearMonth other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarYearMonth other) {
    return compareTo(other) > 0;
  }

  public boolean isOnOrBefore(CalendarYearMonth other) {
    return compareTo(other) <= 0;
  }

  public boolean isOnOrAfter(CalendarYearMonth other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(CalendarYearMonth other) {
    int cmp = Integer.compare(year, other.year);
    return cmp != 0 ? cmp : Integer.compare(month, other.month);
  }

  /** ISO-8601 form, e.g. {@code 2024-02}. */
  @Override
  public String toString() {
    return java.time.YearMonth.of(year, month).toString();
  }
}
