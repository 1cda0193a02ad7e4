package com.rg.chrono;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.Year;
import java.util.Objects;
import java.util.Optional;

/**
 * A date in the proleptic Gregorian calendar.
 *
 * The canonical constructor rejects any (year, month, day) triple that does not exist, so every
 * instance is a real date. Arithmetic returns new instances and clamps month/year results to the
 * end of the target month instead of failing.
 */
public record CalendarDate(int year, int month, int day) implements CalendarTemporal<CalendarDate> {

  public CalendarDate {
    if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
      throw new InvalidDateException(DateField.YEAR, year, "must be " + Year.MIN_VALUE + ".." + Year.MAX_VALUE);
    }
    if (month < 1 || month > 12) {
      throw new InvalidDateException(DateField.MONTH, month, "must be 1..12");
    }
    int length = CalendarArithmetic.daysInMonth(year, month);
    if (day < 1 || day > length) {
      throw new InvalidDateException(DateField.DAY, day,
          "must be 1.." + length + " for " + Month.of(month) + " " + year);
    }
  }

  public static CalendarDate of(int year, int month, int day) {
    return new CalendarDate(year, month, day);
  }

  public static CalendarDate of(int year, Month month, int day) {
    return new CalendarDate(year, Objects.requireNonNull(month, "month").getValue(), day);
  }

  /** Same as {@link #of(int, int, int)} but reports an impossible date as an empty result. */
  public static Optional<CalendarDate> tryOf(int year, int month, int day) {
    try {
      return Optional.of(new CalendarDate(year, month, day));
    } catch (InvalidDateException e) {
      return Optional.empty();
    }
  }

  public static CalendarDate ofEpochDay(long epochDay) {
    return CalendarArithmetic.fromEpochDay(epochDay);
  }

  public static CalendarDate from(LocalDate date) {
    Objects.requireNonNull(date, "date");
    return new CalendarDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  /** Parses an ISO-8601 local date such as {@code 2024-02-29}. */
  public static CalendarDate parse(String text) {
    return CalendarParsers.parseDate(text);
  }

  public static CalendarDate today(CalendarClock clock) {
    return Objects.requireNonNull(clock, "clock").today();
  }

  // ---- queries ----

  public Month monthOfYear() {
    return Month.of(month);
  }

  public DayOfWeek dayOfWeek() {
    // 1970-01-01 was a Thursday
    return DayOfWeek.of((int) Math.floorMod(toEpochDay() + 3, 7L) + 1);
  }

  public int dayOfYear() {
    return monthOfYear().firstDayOfYear(isLeapYear()) + day - 1;
  }

  public int lengthOfMonth() {
    return CalendarArithmetic.daysInMonth(year, month);
  }

  public int lengthOfYear() {
    return CalendarArithmetic.daysInYear(year);
  }

  public boolean isLeapYear() {
    return CalendarArithmetic.isLeapYear(year);
  }

  public long toEpochDay() {
    return CalendarArithmetic.toEpochDay(this);
  }

  public CalendarYearMonth toYearMonth() {
    return CalendarYearMonth.of(year, month);
  }

  public CalendarMonthDay toMonthDay() {
    return CalendarMonthDay.of(month, day);
  }

  public LocalDate toLocalDate() {
    return LocalDate.of(year, month, day);
  }

  // ---- arithmetic ----

  public CalendarDate plusDays(long days) {
    return CalendarArithmetic.plusDays(this, days);
  }

  public CalendarDate plusWeeks(long weeks) {
    return CalendarArithmetic.plusWeeks(this, weeks);
  }

  public CalendarDate plusMonths(long months) {
    return CalendarArithmetic.plusMonths(this, months);
  }

  public CalendarDate plusYears(long years) {
    return CalendarArithmetic.plusYears(this, years);
  }

  public CalendarDate minusDays(long days) {
    return CalendarArithmetic.plusDays(this, Math.negateExact(days));
  }

  public CalendarDate minusWeeks(long weeks) {
    return CalendarArithmetic.plusWeeks(this, Math.negateExact(weeks));
  }

  public CalendarDate minusMonths(long months) {
    return CalendarArithmetic.plusMonths(this, Math.negateExact(months));
  }

  public CalendarDate minusYears(long years) {
    return CalendarArithmetic.plusYears(this, Math.negateExact(years));
  }

  public CalendarDate plus(Period period) {
    return Objects.requireNonNull(period, "period").addTo(this);
  }

  public CalendarDate minus(Period period) {
    return Objects.requireNonNull(period, "period").subtractFrom(this);
  }

  @Override
  public CalendarDate plus(long amount, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").addTo(this, amount);
  }

  public CalendarDate minus(long amount, ChronoUnit unit) {
    return plus(Math.negateExact(amount), unit);
  }

  @Override
  public long until(CalendarDate end, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").between(this, end);
  }

  /** The calendar-field difference to {@code end}, as years, months and days. */
  public Period until(CalendarDate end) {
    return Period.between(this, end);
  }

  // ---- field replacement (strict: never clamps) ----

  public CalendarDate withYear(int year) {
    return new CalendarDate(year, month, day);
  }

  public CalendarDate withMonth(int month) {
    return new CalendarDate(year, month, day);
  }

  public CalendarDate withDayOfMonth(int day) {
    return new CalendarDate(year, month, day);
  }

  public CalendarDate withDayOfYear(int dayOfYear) {
    if (dayOfYear < 1 || dayOfYear > lengthOfYear()) {
      throw new InvalidDateException(DateField.DAY_OF_YEAR, dayOfYear, "must be 1.." + lengthOfYear() + " in " + year);
    }
    return firstDayOfYear().plusDays(dayOfYear - 1L);
  }

  // ---- adjusters ----

  public CalendarDate firstDayOfMonth() {
    return day == 1 ? this : new CalendarDate(year, month, 1);
  }

  public CalendarDate lastDayOfMonth() {
    int last = lengthOfMonth();
    return day == last ? this : new CalendarDate(year, month, last);
  }

  public CalendarDate firstDayOfNextMonth() {
    return firstDayOfMonth().plusMonths(1);
  }

  public CalendarDate firstDayOfYear() {
    return new CalendarDate(year, 1, 1);
  }

  public CalendarDate lastDayOfYear() {
    return new CalendarDate(year, 12, 31);
  }

  public CalendarDate firstDayOfNextYear() {
    return firstDayOfYear().plusYears(1);
  }

  public CalendarDate firstInMonth(DayOfWeek dayOfWeek) {
    return firstDayOfMonth().nextOrSame(dayOfWeek);
  }

  public CalendarDate lastInMonth(DayOfWeek dayOfWeek) {
    return lastDayOfMonth().previousOrSame(dayOfWeek);
  }

  /** The first matching day strictly after this date. */
  public CalendarDate next(DayOfWeek dayOfWeek) {
    int ahead = daysAhead(dayOfWeek);
    return plusDays(ahead == 0 ? 7 : ahead);
  }

  public CalendarDate nextOrSame(DayOfWeek dayOfWeek) {
    return plusDays(daysAhead(dayOfWeek));
  }

  /** The last matching day strictly before this date. */
  public CalendarDate previous(DayOfWeek dayOfWeek) {
    int behind = daysBehind(dayOfWeek);
    return minusDays(behind == 0 ? 7 : behind);
  }

  public CalendarDate previousOrSame(DayOfWeek dayOfWeek) {
    return minusDays(daysBehind(dayOfWeek));
  }

  private int daysAhead(DayOfWeek target) {
    Objects.requireNonNull(target, "dayOfWeek");
    return Math.floorMod(target.getValue() - dayOfWeek().getValue(), 7);
  }

  private int daysBehind(DayOfWeek target) {
    Objects.requireNonNull(target, "dayOfWeek");
    return Math.floorMod(dayOfWeek().getValue() - target.getValue(), 7);
  }

  // ---- combination and comparison ----

  public CalendarDateTime atTime(TimeOfDay time) {
    return new CalendarDateTime(this, time);
  }

  public CalendarDateTime atTime(int hour, int minute) {
    return new CalendarDateTime(this, TimeOfDay.of(hour, minute));
  }

  public CalendarDateTime atStartOfDay() {
    return new CalendarDateTime(this, TimeOfDay.MIDNIGHT);
  }

  public boolean isBefore(CalendarDate other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarDate other) {
    return compareTo(other) > 0;
  }

  public boolean isOnOrBefore(CalendarDate other) {
    return compareTo(other) <= 0;
  }

  public boolean isOnOrAfter(CalendarDate other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(CalendarDate other) {
    int cmp = Integer.compare(year, other.year);
    if (cmp != 0) return cmp;
    cmp = Integer.compare(month, other.month);
    if (cmp != 0) return cmp;
    return Integer.compare(day, other.day);
  }

  /** ISO-8601 form, e.g. {@code 2024-02-29}. */
  @Override
  public String toString() {
    return toLocalDate().toString();
  }
}
