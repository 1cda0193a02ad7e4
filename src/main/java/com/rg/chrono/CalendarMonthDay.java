package com.rg.chrono;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.Month;
import java.util.Objects;

/**
 * A month and day with no year, such as an anniversary. February 29 is allowed; it lands on
 * February 28 in years that do not have one.
 */
public record CalendarMonthDay(int month, int day) implements Comparable<CalendarMonthDay> {

  public CalendarMonthDay {
    if (month < 1 || month > 12) {
      throw new InvalidDateException(DateField.MONTH, month, "must be 1..12");
    }
    int max = Month.of(month).maxLength();
    if (day < 1 || day > max) {
      throw new InvalidDateException(DateField.DAY, day, "must be 1.." + max + " for " + Month.of(month));
    }
  }

  public static CalendarMonthDay of(int month, int day) {
    return new CalendarMonthDay(month, day);
  }

  public static CalendarMonthDay of(Month month, int day) {
    return new CalendarMonthDay(Objects.requireNonNull(month, "month").getValue(), day);
  }

  public static CalendarMonthDay from(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    return new CalendarMonthDay(date.month(), date.day());
  }

  /** Parses ISO-8601 such as {@code --02-29}. */
  public static CalendarMonthDay parse(String text) {
    return CalendarParsers.parseMonthDay(text);
  }

  public Month monthOfYear() {
    return Month.of(month);
  }

  /** True if this day exists in {@code year} without clamping. */
  public boolean isValidYear(int year) {
    return day <= CalendarArithmetic.daysInMonth(year, month);
  }

  /** This month and day in {@code year}, clamping February 29 to the 28th outside leap years. */
  public CalendarDate atYear(int year) {
    return new CalendarDate(year, month, Math.min(day, CalendarArithmetic.daysInMonth(year, month)));
  }

  public boolean isBefore(CalendarMonthDay other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarMonthDay other) {
    return compareTo(other) > 0;
  }

  public boolean isOnOrBefore(CalendarMonthDay other) {
    return compareTo(other) <= 0;
  }

  public boolean isOnOrAfter(CalendarMonthDay other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(CalendarMonthDay other) {
    int cmp = Integer.compare(month, other.month);
    return cmp != 0 ? cmp : Integer.compare(day, other.day);
  }

  /** ISO-8601 form, e.g. {@code --02-29}. */
  @Override
  public String toString() {
    return java.time.MonthDay.of(month, day).toString();
  }
}
