package com.rg.chrono;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A {@link CalendarDate} with a {@link TimeOfDay}. Date units keep the time unchanged; time units
 * are elapsed time and carry into the date (23:30 plus 2 hours is 01:30 the next day).
 */
public record CalendarDateTime(CalendarDate date, TimeOfDay time) implements CalendarTemporal<CalendarDateTime> {

  public CalendarDateTime {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(time, "time");
  }

  public static CalendarDateTime of(CalendarDate date, TimeOfDay time) {
    return new CalendarDateTime(date, time);
  }

  public static CalendarDateTime of(int year, int month, int day, int hour, int minute) {
    return new CalendarDateTime(CalendarDate.of(year, month, day), TimeOfDay.of(hour, minute));
  }

  public static CalendarDateTime of(int year, int month, int day, int hour, int minute, int second) {
    return new CalendarDateTime(CalendarDate.of(year, month, day), TimeOfDay.of(hour, minute, second));
  }

  public static CalendarDateTime of(int year, int month, int day, int hour, int minute, int second, int nano) {
    return new CalendarDateTime(CalendarDate.of(year, month, day), TimeOfDay.of(hour, minute, second, nano));
  }

  public static CalendarDateTime from(LocalDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime");
    return new CalendarDateTime(CalendarDate.from(dateTime.toLocalDate()), TimeOfDay.from(dateTime.toLocalTime()));
  }

  public static CalendarDateTime parse(String text) {
    return CalendarParsers.parseDateTime(text);
  }

  public static CalendarDateTime now(CalendarClock clock) {
    return Objects.requireNonNull(clock, "clock").now();
  }

  public int year() {
    return date.year();
  }

  public int month() {
    return date.month();
  }

  public int day() {
    return date.day();
  }

  public int hour() {
    return time.hour();
  }

  public int minute() {
    return time.minute();
  }

  public int second() {
    return time.second();
  }

  public int nano() {
    return time.nano();
  }

  public DayOfWeek dayOfWeek() {
    return date.dayOfWeek();
  }

  public int dayOfYear() {
    return date.dayOfYear();
  }

  public int lengthOfMonth() {
    return date.lengthOfMonth();
  }

  public int lengthOfYear() {
    return date.lengthOfYear();
  }

  public boolean isLeapYear() {
    return date.isLeapYear();
  }

  public LocalDateTime toLocalDateTime() {
    return LocalDateTime.of(date.toLocalDate(), time.toLocalTime());
  }

  // ---- date units ----

  public CalendarDateTime plusYears(long years) {
    return withDate(date.plusYears(years));
  }

  public CalendarDateTime plusMonths(long months) {
    return withDate(date.plusMonths(months));
  }

  public CalendarDateTime plusWeeks(long weeks) {
    return withDate(date.plusWeeks(weeks));
  }

  public CalendarDateTime plusDays(long days) {
    return withDate(date.plusDays(days));
  }

  public CalendarDateTime minusYears(long years) {
    return withDate(date.minusYears(years));
  }

  public CalendarDateTime minusMonths(long months) {
    return withDate(date.minusMonths(months));
  }

  public CalendarDateTime minusWeeks(long weeks) {
    return withDate(date.minusWeeks(weeks));
  }

  public CalendarDateTime minusDays(long days) {
    return withDate(date.minusDays(days));
  }

  // ---- time units, carrying ----

  public CalendarDateTime plusHours(long hours) {
    return CalendarArithmetic.plusHours(this, hours);
  }

  public CalendarDateTime plusMinutes(long minutes) {
    return CalendarArithmetic.plusMinutes(this, minutes);
  }

  public CalendarDateTime plusSeconds(long seconds) {
    return CalendarArithmetic.plusSeconds(this, seconds);
  }

  public CalendarDateTime plusMillis(long millis) {
    return CalendarArithmetic.plusMillis(this, millis);
  }

  public CalendarDateTime plusNanos(long nanos) {
    return CalendarArithmetic.plusNanos(this, nanos);
  }

  public CalendarDateTime minusHours(long hours) {
    return CalendarArithmetic.plusHours(this, Math.negateExact(hours));
  }

  public CalendarDateTime minusMinutes(long minutes) {
    return CalendarArithmetic.plusMinutes(this, Math.negateExact(minutes));
  }

  public CalendarDateTime minusSeconds(long seconds) {
    return CalendarArithmetic.plusSeconds(this, Math.negateExact(seconds));
  }

  public CalendarDateTime minusMillis(long millis) {
    return CalendarArithmetic.plusMillis(this, Math.negateExact(millis));
  }

  public CalendarDateTime minusNanos(long nanos) {
    return CalendarArithmetic.plusNanos(this, Math.negateExact(nanos));
  }

  public CalendarDateTime plus(CalendarAmount amount) {
    return Objects.requireNonNull(amount, "amount").addTo(this);
  }

  public CalendarDateTime minus(CalendarAmount amount) {
    return Objects.requireNonNull(amount, "amount").subtractFrom(this);
  }

  @Override
  public CalendarDateTime plus(long amount, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").addTo(this, amount);
  }

  public CalendarDateTime minus(long amount, ChronoUnit unit) {
    return plus(Math.negateExact(amount), unit);
  }

  @Override
  public long until(CalendarDateTime end, ChronoUnit unit) {
    return Objects.requireNonNull(unit, "unit").between(this, end);
  }

  public CalendarDateTime withDate(CalendarDate date) {
    return date.equals(this.date) ? this : new CalendarDateTime(date, time);
  }

  public CalendarDateTime withTime(TimeOfDay time) {
    return time.equals(this.time) ? this : new CalendarDateTime(date, time);
  }

  // ---- field replacement, strict like CalendarDate and TimeOfDay ----

  public CalendarDateTime withYear(int year) {
    return withDate(date.withYear(year));
  }

  public CalendarDateTime withMonth(int month) {
    return withDate(date.withMonth(month));
  }

  public CalendarDateTime withDayOfMonth(int day) {
    return withDate(date.withDayOfMonth(day));
  }

  public CalendarDateTime withDayOfYear(int dayOfYear) {
    return withDate(date.withDayOfYear(dayOfYear));
  }

  public CalendarDateTime withHour(int hour) {
    return withTime(time.withHour(hour));
  }

  public CalendarDateTime withMinute(int minute) {
    return withTime(time.withMinute(minute));
  }

  public CalendarDateTime withSecond(int second) {
    return withTime(time.withSecond(second));
  }

  public CalendarDateTime withNano(int nano) {
    return withTime(time.withNano(nano));
  }

  // ---- adjusters, keeping the time of day ----

  public CalendarDateTime firstDayOfMonth() {
    return withDate(date.firstDayOfMonth());
  }

  public CalendarDateTime lastDayOfMonth() {
    return withDate(date.lastDayOfMonth());
  }

  public CalendarDateTime firstDayOfNextMonth() {
    return withDate(date.firstDayOfNextMonth());
  }

  public CalendarDateTime firstDayOfYear() {
    return withDate(date.firstDayOfYear());
  }

  public CalendarDateTime lastDayOfYear() {
    return withDate(date.lastDayOfYear());
  }

  public CalendarDateTime firstDayOfNextYear() {
    return withDate(date.firstDayOfNextYear());
  }

  public CalendarDateTime firstInMonth(DayOfWeek dayOfWeek) {
    return withDate(date.firstInMonth(dayOfWeek));
  }

  public CalendarDateTime lastInMonth(DayOfWeek dayOfWeek) {
    return withDate(date.lastInMonth(dayOfWeek));
  }

  public CalendarDateTime next(DayOfWeek dayOfWeek) {
    return withDate(date.next(dayOfWeek));
  }

  public CalendarDateTime nextOrSame(DayOfWeek dayOfWeek) {
    return withDate(date.nextOrSame(dayOfWeek));
  }

  public CalendarDateTime previous(DayOfWeek dayOfWeek) {
    return withDate(date.previous(dayOfWeek));
  }

  public CalendarDateTime previousOrSame(DayOfWeek dayOfWeek) {
    return withDate(date.previousOrSame(dayOfWeek));
  }

  public boolean isBefore(CalendarDateTime other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(CalendarDateTime other) {
    return compareTo(other) > 0;
  }

  public boolean isOnOrBefore(CalendarDateTime other) {
    return compareTo(other) <= 0;
  }

  public boolean isOnOrAfter(CalendarDateTime other) {
    return compareTo(other) >= 0;
  }

  @Override
  public int compareTo(CalendarDateTime other) {
    int cmp = date.compareTo(other.date);
    return cmp != 0 ? cmp : time.compareTo(other.time);
  }

  /** ISO-8601 form, e.g. {@code 2024-02-29T23:30}. */
  @Override
  public String toString() {
    return date + "T" + time;
  }
}
