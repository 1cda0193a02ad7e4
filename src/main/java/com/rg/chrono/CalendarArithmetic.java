package com.rg.chrono;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.Year;
import java.util.Objects;

/**
 * Calendar arithmetic over {@link CalendarDate} and {@link CalendarDateTime}.
 *
 * Rules:
 *  1) Months and years move the (year, month) pair by an integer offset, then clamp the day to
 *     the length of the target month (Jan 31 + 1 month = Feb 28/29, Feb 29 + 1 year = Feb 28).
 *  2) Days and weeks are exact; no clamping is ever needed.
 *  3) Hours, minutes, seconds and nanos are elapsed time and carry into the date.
 *  4) "Between" counts whole units elapsed, truncated toward zero, and is anti-symmetric.
 *
 * Notes:
 *  - Leap-year and month-length facts come from java.time (Year.isLeap, Month.length), as does
 *    epoch-day conversion.
 *  - Clamping is a result policy, not an error: it never throws and never logs.
 */
public final class CalendarArithmetic {
  private CalendarArithmetic() {}

  public static final long NANOS_PER_MILLI = 1_000_000L;
  public static final long NANOS_PER_SECOND = 1_000_000_000L;
  public static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
  public static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;
  public static final long NANOS_PER_DAY = 24 * NANOS_PER_HOUR;
  public static final long SECONDS_PER_DAY = 86_400L;

  public static boolean isLeapYear(long year) {
    return Year.isLeap(year);
  }

  public static int daysInMonth(int year, int month) {
    if (month < 1 || month > 12) {
      throw new InvalidDateException(DateField.MONTH, month, "must be 1..12");
    }
    return Month.of(month).length(Year.isLeap(year));
  }

  public static int daysInYear(int year) {
    return Year.isLeap(year) ? 366 : 365;
  }

  // ---- epoch-day bridge ----

  public static long toEpochDay(CalendarDate date) {
    return LocalDate.of(date.year(), date.month(), date.day()).toEpochDay();
  }

  public static CalendarDate fromEpochDay(long epochDay) {
    try {
      LocalDate d = LocalDate.ofEpochDay(epochDay);
      return new CalendarDate(d.getYear(), d.getMonthValue(), d.getDayOfMonth());
    } catch (DateTimeException e) {
      throw new InvalidDateException(DateField.EPOCH_DAY, epochDay, "outside the supported year range", e);
    }
  }

  // ---- date arithmetic ----

  public static CalendarDate plusDays(CalendarDate date, long days) {
    Objects.requireNonNull(date, "date");
    if (days == 0) return date;
    return fromEpochDay(Math.addExact(toEpochDay(date), days));
  }

  public static CalendarDate plusWeeks(CalendarDate date, long weeks) {
    return plusDays(date, Math.multiplyExact(weeks, 7L));
  }

  public static CalendarDate plusMonths(CalendarDate date, long months) {
    Objects.requireNonNull(date, "date");
    if (months == 0) return date;

    // Work on a zero-based month count so floorDiv/floorMod handle negative offsets.
    long total = Math.addExact(date.year() * 12L + (date.month() - 1), months);
    int year = checkYear(Math.floorDiv(total, 12));
    int month = (int) Math.floorMod(total, 12) + 1;
    return clampedDate(year, month, date.day());
  }

  public static CalendarDate plusYears(CalendarDate date, long years) {
    Objects.requireNonNull(date, "date");
    if (years == 0) return date;
    int year = checkYear(Math.addExact((long) date.year(), years));
    return clampedDate(year, date.month(), date.day());
  }

  private static CalendarDate clampedDate(int year, int month, int day) {
    return new CalendarDate(year, month, Math.min(day, daysInMonth(year, month)));
  }

  static int checkYear(long year) {
    if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
      throw new InvalidDateException(DateField.YEAR, year,
          "must be " + Year.MIN_VALUE + ".." + Year.MAX_VALUE);
    }
    return (int) year;
  }

  // ---- time-of-day arithmetic with carry into the date ----

  public static CalendarDateTime plusHours(CalendarDateTime dateTime, long hours) {
    return plusTimeUnits(dateTime, hours, NANOS_PER_HOUR);
  }

  public static CalendarDateTime plusMinutes(CalendarDateTime dateTime, long minutes) {
    return plusTimeUnits(dateTime, minutes, NANOS_PER_MINUTE);
  }

  public static CalendarDateTime plusSeconds(CalendarDateTime dateTime, long seconds) {
    return plusTimeUnits(dateTime, seconds, NANOS_PER_SECOND);
  }

  public static CalendarDateTime plusMillis(CalendarDateTime dateTime, long millis) {
    return plusTimeUnits(dateTime, millis, NANOS_PER_MILLI);
  }

  public static CalendarDateTime plusNanos(CalendarDateTime dateTime, long nanos) {
    return plusTimeUnits(dateTime, nanos, 1L);
  }

  /**
   * Adds {@code amount} units of {@code nanosPerUnit} nanoseconds each. The unit must divide a
   * day evenly. Whole days are split off first so large amounts do not overflow the nano count.
   */
  static CalendarDateTime plusTimeUnits(CalendarDateTime dateTime, long amount, long nanosPerUnit) {
    Objects.requireNonNull(dateTime, "dateTime");
    if (amount == 0) return dateTime;

    long unitsPerDay = NANOS_PER_DAY / nanosPerUnit;
    long days = Math.floorDiv(amount, unitsPerDay);
    long nanoOfDay = dateTime.time().toNanoOfDay() + Math.floorMod(amount, unitsPerDay) * nanosPerUnit;

    // nanoOfDay is now in [0, 2 days)
    days += nanoOfDay / NANOS_PER_DAY;
    nanoOfDay %= NANOS_PER_DAY;

    return new CalendarDateTime(plusDays(dateTime.date(), days), TimeOfDay.ofNanoOfDay(nanoOfDay));
  }

  // ---- between ----

  public static long daysBetween(CalendarDate start, CalendarDate end) {
    return toEpochDay(end) - toEpochDay(start);
  }

  public static long weeksBetween(CalendarDate start, CalendarDate end) {
    return daysBetween(start, end) / 7;
  }

  /**
   * Whole months from {@code start} to {@code end}. A month counts once the later date's
   * day-of-month reaches the earlier date's day, clamped to the later month's length, so
   * Jan 31 to Feb 28 of a common year is one month.
   */
  public static long monthsBetween(CalendarDate start, CalendarDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.compareTo(end) > 0) return -monthsBetween(end, start);

    long months = (end.year() * 12L + end.month()) - (start.year() * 12L + start.month());
    int dayToReach = Math.min(start.day(), daysInMonth(end.year(), end.month()));
    if (months > 0 && end.day() < dayToReach) {
      months--;
    }
    return months;
  }

  public static long yearsBetween(CalendarDate start, CalendarDate end) {
    return monthsBetween(start, end) / 12;
  }

  /**
   * Whole time units between two date-times, truncated toward zero. Works from a day count and a
   * same-sign nano remainder so spans of many years stay in range for every unit but nanos.
   */
  static long timeUnitsBetween(CalendarDateTime start, CalendarDateTime end, long nanosPerUnit) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");

    long days = daysBetween(start.date(), end.date());
    long nanos = end.time().toNanoOfDay() - start.time().toNanoOfDay();
    if (days > 0 && nanos < 0) {
      days--;
      nanos += NANOS_PER_DAY;
    } else if (days < 0 && nanos > 0) {
      days++;
      nanos -= NANOS_PER_DAY;
    }

    long unitsPerDay = NANOS_PER_DAY / nanosPerUnit;
    return Math.addExact(Math.multiplyExact(days, unitsPerDay), nanos / nanosPerUnit);
  }

  /** Elapsed time between two date-times as a {@link Duration}. */
  static Duration durationBetween(CalendarDateTime start, CalendarDateTime end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    long seconds = Math.multiplyExact(daysBetween(start.date(), end.date()), SECONDS_PER_DAY);
    return Duration.ofSeconds(seconds, end.time().toNanoOfDay() - start.time().toNanoOfDay());
  }
}
