package com.rg.chrono;

import static com.rg.chrono.CalendarArithmetic.NANOS_PER_DAY;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_HOUR;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_MILLI;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_MINUTE;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_SECOND;

import com.rg.chrono.InvalidDateException.DateField;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A time of day with nanosecond precision and no date. Arithmetic wraps around midnight;
 * use {@link CalendarDateTime} when the overflow has to carry into a date.
 */
public record TimeOfDay(int hour, int minute, int second, int nano) implements CalendarTemporal<TimeOfDay> {

  public static final TimeOfDay MIDNIGHT = new TimeOfDay(0, 0, 0, 0);
  public static final TimeOfDay NOON = new TimeOfDay(12, 0, 0, 0);

  private static final long MILLIS_PER_DAY = CalendarArithmetic.SECONDS_PER_DAY * 1000;

  public TimeOfDay {
    if (hour < 0 || hour > 23) throw new InvalidDateException(DateField.HOUR, hour, "must be 0..23");
    if (minute < 0 || minute > 59) throw new InvalidDateException(DateField.MINUTE, minute, "must be 0..59");
    if (second < 0 || second > 59) throw new InvalidDateException(DateField.SECOND, second, "must be 0..59");
    if (nano < 0 || nano > 999_999_999) throw new InvalidDateException(DateField.NANO, nano, "must be 0..999999999");
  }

  public static TimeOfDay of(int hour, int minute) {
    return new TimeOfDay(hour, minute, 0, 0);
  }

  public static TimeOfDay of(int hour, int minute, int second) {
    return new TimeOfDay(hour, minute, second, 0);
  }

  public static TimeOfDay of(int hour, int minute, int second, int nano) {
    return new TimeOfDay(hour, minute, second, nano);
  }

  public static TimeOfDay ofNanoOfDay(long nanoOfDay) {
    if (nanoOfDay < 0 || nanoOfDay >= NANOS_PER_DAY) {
      throw new InvalidDateException(DateField.NANO, nanoOfDay, "nano-of-day must be 0.." + (NANOS_PER_DAY - 1));
    }
    int hours = (int) (nanoOfDay / NANOS_PER_HOUR);
    nanoOfDay -= hours * NANOS_PER_HOUR;
    int minutes = (int) (nanoOfDay / NANOS_PER_MINUTE);
    nanoOfDay -= minutes * NANOS_PER_MINUTE;
    int seconds = (int) (nanoOfDay / NANOS_PER_SECOND);
    nanoOfDay -= seconds * NANOS_PER_SECOND;
    return new TimeOfDay(hours, minutes, seconds, (int) nanoOfDay);
  }

  public static TimeOfDay ofSecondOfDay(long secondOfDay) {
    return ofNanoOfDay(Math.multiplyExact(secondOfDay, NANOS_PER_SECOND));
  }

  public static TimeOfDay from(LocalTime time) {
    Objects.requireNonNull(time, "time");
    return new TimeOfDay(time.getHour(), time.getMinute(), time.getSecond(), time.getNano());
  }

  public static TimeOfDay parse(String text) {
    return CalendarParsers.parseTime(text);
  }

  public long toNanoOfDay() {
    return hour * NANOS_PER_HOUR + minute * NANOS_PER_MINUTE + second * NANOS_PER_SECOND + nano;
  }

  public int toSecondOfDay() {
    return hour * 3600 + minute * 60 + second;
  }

  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute, second, nano);
  }

  // ---- wrapping arithmetic ----

  public TimeOfDay plusHours(long hours) {
    return plusNanos(Math.floorMod(hours, 24L) * NANOS_PER_HOUR);
  }

  public TimeOfDay plusMinutes(long minutes) {
    return plusNanos(Math.floorMod(minutes, 24L * 60) * NANOS_PER_MINUTE);
  }

  public TimeOfDay plusSeconds(long seconds) {
    return plusNanos(Math.floorMod(seconds, CalendarArithmetic.SECONDS_PER_DAY) * NANOS_PER_SECOND);
  }

  public TimeOfDay plusMillis(long millis) {
    return plusNanos(Math.floorMod(millis, MILLIS_PER_DAY) * NANOS_PER_MILLI);
  }

  public TimeOfDay plusNanos(long nanos) {
    if (nanos == 0) return this;
    return ofNanoOfDay(Math.floorMod(toNanoOfDay() + Math.floorMod(nanos, NANOS_PER_DAY), NANOS_PER_DAY));
  }

  public TimeOfDay minusHours(long hours) {
    return plusHours(-Math.floorMod(hours, 24L));
  }

  public TimeOfDay minusMinutes(long minutes) {
    return plusMinutes(-Math.floorMod(minutes, 24L * 60));
  }

  public TimeOfDay minusSeconds(long seconds) {
    return plusSeconds(-Math.floorMod(seconds, CalendarArithmetic.SECONDS_PER_DAY));
  }

  public TimeOfDay minusMillis(long millis) {
    return plusMillis(-Math.floorMod(millis, MILLIS_PER_DAY));
  }

  public TimeOfDay minusNanos(long nanos) {
    return plusNanos(-Math.floorMod(nanos, NANOS_PER_DAY));
  }

  @Override
  public TimeOfDay plus(long amount, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").addTo(this, amount);
  }

  public TimeOfDay minus(long amount, ChronoUnit unit) {
    return plus(Math.negateExact(amount), unit);
  }

  @Override
  public long until(TimeOfDay end, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").between(this, end);
  }

  public TimeOfDay withHour(int hour) {
    return new TimeOfDay(hour, minute, second, nano);
  }

  public TimeOfDay withMinute(int minute) {
    return new TimeOfDay(hour, minute, second, nano);
  }

  public TimeOfDay withSecond(int second) {
    return new TimeOfDay(hour, minute, second, nano);
  }

  public TimeOfDay withNano(int nano) {
    return new TimeOfDay(hour, minute, second, nano);
  }

  public CalendarDateTime atDate(CalendarDate date) {
    return new CalendarDateTime(date, this);
  }

  public boolean isBefore(TimeOfDay other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(TimeOfDay other) {
    return compareTo(other) > 0;
  }

  public boolean isOnOrBefore(TimeOfDay other) {
    return compareTo(other) <= 0;
  }

  public boolean isOnOrAfter(TimeOfDay other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(TimeOfDay other) {
    return Long.compare(toNanoOfDay(), other.toNanoOfDay());
  }

  /** ISO-8601 form, e.g. {@code 09:30} or {@code 23:59:59.5}. */
  @Override
  public String toString() {
    return toLocalTime().toString();
  }
}
