package com.rg.chrono;

import static com.rg.chrono.CalendarArithmetic.NANOS_PER_MILLI;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_SECOND;
import static com.rg.chrono.CalendarArithmetic.SECONDS_PER_DAY;

import java.util.Objects;

/**
 * An elapsed amount of time in seconds plus a nano adjustment. The sign lives on
 * {@code seconds}; {@code nanos} is always 0..999,999,999, so -0.5s is (-1, 500_000_000).
 */
public record Duration(long seconds, int nanos) implements CalendarAmount, Comparable<Duration> {

  public static final Duration ZERO = new Duration(0, 0);

  public Duration {
    if (nanos < 0 || nanos >= NANOS_PER_SECOND) {
      throw new IllegalArgumentException("nanos must be 0..999999999, got " + nanos);
    }
  }

  public static Duration ofDays(long days) {
    return new Duration(Math.multiplyExact(days, SECONDS_PER_DAY), 0);
  }

  public static Duration ofHours(long hours) {
    return new Duration(Math.multiplyExact(hours, 3600L), 0);
  }

  public static Duration ofMinutes(long minutes) {
    return new Duration(Math.multiplyExact(minutes, 60L), 0);
  }

  public static Duration ofSeconds(long seconds) {
    return new Duration(seconds, 0);
  }

  /** Seconds plus any nano adjustment, positive or negative, normalised into range. */
  public static Duration ofSeconds(long seconds, long nanoAdjustment) {
    long secs = Math.addExact(seconds, Math.floorDiv(nanoAdjustment, NANOS_PER_SECOND));
    return new Duration(secs, (int) Math.floorMod(nanoAdjustment, NANOS_PER_SECOND));
  }

  public static Duration ofMillis(long millis) {
    return ofSeconds(Math.floorDiv(millis, 1000L), Math.floorMod(millis, 1000L) * NANOS_PER_MILLI);
  }

  public static Duration ofNanos(long nanos) {
    return ofSeconds(0, nanos);
  }

  /** Elapsed time from {@code start} to {@code end}; negative if {@code end} is earlier. */
  public static Duration between(CalendarDateTime start, CalendarDateTime end) {
    return CalendarArithmetic.durationBetween(start, end);
  }

  /** Parses ISO-8601 such as {@code PT1H30M} or {@code P2DT3H}. */
  public static Duration parse(String text) {
    return CalendarParsers.parseDuration(text);
  }

  @Override
  public boolean isZero() {
    return seconds == 0 && nanos == 0;
  }

  @Override
  public boolean isNegative() {
    return seconds < 0;
  }

  public boolean isPositive() {
    return !isZero() && !isNegative();
  }

  public Duration plus(Duration other) {
    Objects.requireNonNull(other, "other");
    return ofSeconds(Math.addExact(seconds, other.seconds), (long) nanos + other.nanos);
  }

  public Duration minus(Duration other) {
    return plus(Objects.requireNonNull(other, "other").negated());
  }

  public Duration plusDays(long days) {
    return plus(ofDays(days));
  }

  public Duration plusHours(long hours) {
    return plus(ofHours(hours));
  }

  public Duration plusMinutes(long minutes) {
    return plus(ofMinutes(minutes));
  }

  public Duration plusSeconds(long seconds) {
    return plus(ofSeconds(seconds));
  }

  public Duration plusMillis(long millis) {
    return plus(ofMillis(millis));
  }

  public Duration plusNanos(long nanos) {
    return plus(ofNanos(nanos));
  }

  public Duration minusDays(long days) {
    return minus(ofDays(days));
  }

  public Duration minusHours(long hours) {
    return minus(ofHours(hours));
  }

  public Duration minusMinutes(long minutes) {
    return minus(ofMinutes(minutes));
  }

  public Duration minusSeconds(long seconds) {
    return minus(ofSeconds(seconds));
  }

  public Duration minusMillis(long millis) {
    return minus(ofMillis(millis));
  }

  public Duration minusNanos(long nanos) {
    return minus(ofNanos(nanos));
  }

  public Duration negated() {
    if (isZero()) return this;
    return ofSeconds(Math.negateExact(seconds), -nanos);
  }

  public Duration abs() {
    return isNegative() ? negated() : this;
  }

  // ---- whole units, truncated toward zero ----

  public long toSeconds() {
    // (-1, 500_000_000) is -0.5s, which truncates to 0
    return (seconds < 0 && nanos > 0) ? seconds + 1 : seconds;
  }

  public long toDays() {
    return toSeconds() / SECONDS_PER_DAY;
  }

  public long toHours() {
    return toSeconds() / 3600;
  }

  public long toMinutes() {
    return toSeconds() / 60;
  }

  public long toMillis() {
    return Math.addExact(Math.multiplyExact(seconds, 1000L), nanos / NANOS_PER_MILLI);
  }

  public long toNanos() {
    return Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND), nanos);
  }

  @Override
  public CalendarDateTime addTo(CalendarDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime");
    return dateTime.plusSeconds(seconds).plusNanos(nanos);
  }

  @Override
  public CalendarDateTime subtractFrom(CalendarDateTime dateTime) {
    return negated().addTo(dateTime);
  }

  public TimeOfDay addTo(TimeOfDay time) {
    Objects.requireNonNull(time, "time");
    return time.plusSeconds(seconds).plusNanos(nanos);
  }

  @Override
  public int compareTo(Duration other) {
    int cmp = Long.compare(seconds, other.seconds);
    return cmp != 0 ? cmp : Integer.compare(nanos, other.nanos);
  }

  /** ISO-8601 form, e.g. {@code PT1H30M}. */
  @Override
  public String toString() {
    return java.time.Duration.ofSeconds(seconds, nanos).toString();
  }
}
