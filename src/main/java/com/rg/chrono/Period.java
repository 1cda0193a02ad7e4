package com.rg.chrono;

import java.util.Objects;

/**
 * A calendar-field amount: years, months and days, each signed and kept separately.
 * {@code P1M} means "one calendar month", which is 28 to 31 days depending on where it is applied.
 */
public record Period(int years, int months, int days) implements CalendarAmount {

  public static final Period ZERO = new Period(0, 0, 0);

  public static Period of(int years, int months, int days) {
    return new Period(years, months, days);
  }

  public static Period ofYears(int years) {
    return new Period(years, 0, 0);
  }

  public static Period ofMonths(int months) {
    return new Period(0, months, 0);
  }

  public static Period ofWeeks(int weeks) {
    return new Period(0, 0, Math.multiplyExact(weeks, 7));
  }

  public static Period ofDays(int days) {
    return new Period(0, 0, days);
  }

  /**
   * The years, months and days from {@code start} to {@code end}. Whole months are counted the
   * same way as {@link ChronoUnit#MONTHS}; the days are what remains after adding them. All
   * fields share one sign, so counting backwards across a month end can give fewer months than
   * {@code MONTHS.between}: 2021-02-28 to 2021-01-31 is {@code P-28D}, not {@code P-1M3D}.
   * In every case {@code between(start, end).addTo(start)} is {@code end}.
   */
  public static Period between(CalendarDate start, CalendarDate end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    long totalMonths = CalendarArithmetic.monthsBetween(start, end);
    long days = CalendarArithmetic.daysBetween(start.plusMonths(totalMonths), end);
    while (totalMonths < 0 && days > 0) {
      totalMonths++;
      days = CalendarArithmetic.daysBetween(start.plusMonths(totalMonths), end);
    }
    while (totalMonths > 0 && days < 0) {
      totalMonths--;
      days = CalendarArithmetic.daysBetween(start.plusMonths(totalMonths), end);
    }
    return new Period(
        Math.toIntExact(totalMonths / 12),
        (int) (totalMonths % 12),
        Math.toIntExact(days));
  }

  /** Parses ISO-8601 such as {@code P1Y2M3D} or {@code P2W}. */
  public static Period parse(String text) {
    return CalendarParsers.parsePeriod(text);
  }

  @Override
  public boolean isZero() {
    return years == 0 && months == 0 && days == 0;
  }

  /** True if any field is negative. */
  @Override
  public boolean isNegative() {
    return years < 0 || months < 0 || days < 0;
  }

  public long toTotalMonths() {
    return years * 12L + months;
  }

  public Period plus(Period other) {
    Objects.requireNonNull(other, "other");
    return new Period(
        Math.addExact(years, other.years),
        Math.addExact(months, other.months),
        Math.addExact(days, other.days));
  }

  public Period minus(Period other) {
    return plus(Objects.requireNonNull(other, "other").negated());
  }

  public Period plusYears(int years) {
    return new Period(Math.addExact(this.years, years), months, days);
  }

  public Period plusMonths(int months) {
    return new Period(years, Math.addExact(this.months, months), days);
  }

  public Period plusDays(int days) {
    return new Period(years, months, Math.addExact(this.days, days));
  }

  public Period minusYears(int years) {
    return plusYears(Math.negateExact(years));
  }

  public Period minusMonths(int months) {
    return plusMonths(Math.negateExact(months));
  }

  public Period minusDays(int days) {
    return plusDays(Math.negateExact(days));
  }

  public Period negated() {
    return multipliedBy(-1);
  }

  public Period multipliedBy(int scalar) {
    if (scalar == 1 || isZero()) return this;
    return new Period(
        Math.multiplyExact(years, scalar),
        Math.multiplyExact(months, scalar),
        Math.multiplyExact(days, scalar));
  }

  /** Folds months into years (14 months becomes 1 year 2 months); days are left alone. */
  public Period normalized() {
    long totalMonths = toTotalMonths();
    return new Period(Math.toIntExact(totalMonths / 12), (int) (totalMonths % 12), days);
  }

  /** Applies years and months first (clamping to month end), then days. */
  public CalendarDate addTo(CalendarDate date) {
    Objects.requireNonNull(date, "date");
    CalendarDate result = date;
    if (years != 0 && months != 0) {
      result = result.plusMonths(toTotalMonths());
    } else if (years != 0) {
      result = result.plusYears(years);
    } else if (months != 0) {
      result = result.plusMonths(months);
    }
    return days == 0 ? result : result.plusDays(days);
  }

  public CalendarDate subtractFrom(CalendarDate date) {
    return negated().addTo(date);
  }

  @Override
  public CalendarDateTime addTo(CalendarDateTime dateTime) {
    Objects.requireNonNull(dateTime, "dateTime");
    return dateTime.withDate(addTo(dateTime.date()));
  }

  @Override
  public CalendarDateTime subtractFrom(CalendarDateTime dateTime) {
    return negated().addTo(dateTime);
  }

  /** ISO-8601 form, e.g. {@code P1Y2M3D}; zero is {@code P0D}. */
  @Override
  public String toString() {
    return java.time.Period.of(years, months, days).toString();
  }
}
