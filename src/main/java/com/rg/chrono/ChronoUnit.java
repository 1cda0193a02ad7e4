package com.rg.chrono;

import static com.rg.chrono.CalendarArithmetic.NANOS_PER_DAY;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_HOUR;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_MILLI;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_MINUTE;
import static com.rg.chrono.CalendarArithmetic.NANOS_PER_SECOND;

import java.util.Objects;

/**
 * The units calendar values can be added in and measured by.
 *
 * Time-based units (up to {@link #HALF_DAYS}) apply to {@link TimeOfDay} and
 * {@link CalendarDateTime}; date-based units ({@link #DAYS} and up) apply to {@link CalendarDate}
 * and {@link CalendarDateTime}. Any other pairing fails with {@link UnsupportedUnitException}.
 */
public enum ChronoUnit {
  NANOS(1L),
  MILLIS(NANOS_PER_MILLI),
  SECONDS(NANOS_PER_SECOND),
  MINUTES(NANOS_PER_MINUTE),
  HOURS(NANOS_PER_HOUR),
  HALF_DAYS(12 * NANOS_PER_HOUR),
  DAYS(NANOS_PER_DAY),
  WEEKS(7 * NANOS_PER_DAY),
  MONTHS(30 * NANOS_PER_DAY),
  YEARS(365 * NANOS_PER_DAY);

  // exact for time-based units, an estimate for months and years
  private final long nanos;

  ChronoUnit(long nanos) {
    this.nanos = nanos;
  }

  public boolean isTimeBased() {
    return compareTo(DAYS) < 0;
  }

  public boolean isDateBased() {
    return compareTo(DAYS) >= 0;
  }

  /** Length of one unit; months and years are approximated as 30 and 365 days. */
  public Duration duration() {
    return Duration.ofSeconds(nanos / NANOS_PER_SECOND, nanos % NANOS_PER_SECOND);
  }

  /** Returns {@code date} moved by {@code amount} of this unit; only date-based units apply. */
  public CalendarDate addTo(CalendarDate date, long amount) {
    Objects.requireNonNull(date, "date");
    return switch (this) {
      case DAYS -> CalendarArithmetic.plusDays(date, amount);
      case WEEKS -> CalendarArithmetic.plusWeeks(date, amount);
      case MONTHS -> CalendarArithmetic.plusMonths(date, amount);
      case YEARS -> CalendarArithmetic.plusYears(date, amount);
      default -> throw new UnsupportedUnitException(this, CalendarDate.class);
    };
  }

  /** Time-based units carry into the date; date-based units keep the time of day. */
  public CalendarDateTime addTo(CalendarDateTime dateTime, long amount) {
    Objects.requireNonNull(dateTime, "dateTime");
    if (isTimeBased()) {
      return CalendarArithmetic.plusTimeUnits(dateTime, amount, nanos);
    }
    return dateTime.withDate(addTo(dateTime.date(), amount));
  }

  /** Wraps around midnight; only time-based units apply. */
  public TimeOfDay addTo(TimeOfDay time, long amount) {
    Objects.requireNonNull(time, "time");
    if (!isTimeBased()) {
      throw new UnsupportedUnitException(this, TimeOfDay.class);
    }
    long unitsPerDay = NANOS_PER_DAY / nanos;
    return time.plusNanos(Math.floorMod(amount, unitsPerDay) * nanos);
  }

  /**
   * Whole units elapsed from {@code start} to {@code end}, truncated toward zero.
   * Always satisfies {@code between(a, b) == -between(b, a)}.
   */
  public <T extends CalendarTemporal<T>> long between(T start, T end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.getClass() != end.getClass()) {
      throw new UnsupportedUnitException(this, start.getClass(), end.getClass());
    }

    if (start instanceof CalendarDate s) {
      return betweenDates(s, (CalendarDate) end);
    } else if (start instanceof CalendarDateTime s) {
      return betweenDateTimes(s, (CalendarDateTime) end);
    } else if (start instanceof TimeOfDay s) {
      return betweenTimes(s, (TimeOfDay) end);
    }
    throw new UnsupportedUnitException(this, start.getClass());
  }

  private long betweenDates(CalendarDate start, CalendarDate end) {
    return switch (this) {
      case DAYS -> CalendarArithmetic.daysBetween(start, end);
      case WEEKS -> CalendarArithmetic.weeksBetween(start, end);
      case MONTHS -> CalendarArithmetic.monthsBetween(start, end);
      case YEARS -> CalendarArithmetic.yearsBetween(start, end);
      default -> throw new UnsupportedUnitException(this, CalendarDate.class);
    };
  }

  private long betweenDateTimes(CalendarDateTime start, CalendarDateTime end) {
    if (isTimeBased()) {
      return CalendarArithmetic.timeUnitsBetween(start, end, nanos);
    }
    if (start.isAfter(end)) {
      return -betweenDateTimes(end, start);
    }
    // the last day only counts once its time of day has reached the start's
    CalendarDate endDate = end.date();
    if (endDate.isAfter(start.date()) && end.time().isBefore(start.time())) {
      endDate = endDate.minusDays(1);
    }
    return betweenDates(start.date(), endDate);
  }

  private long betweenTimes(TimeOfDay start, TimeOfDay end) {
    if (!isTimeBased()) {
      throw new UnsupportedUnitException(this, TimeOfDay.class);
    }
    return (end.toNanoOfDay() - start.toNanoOfDay()) / nanos;
  }
}
