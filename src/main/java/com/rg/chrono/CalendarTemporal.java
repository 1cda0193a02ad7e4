package com.rg.chrono;

/**
 * A calendar value that {@link ChronoUnit} can add to and measure between:
 * a {@link CalendarDate}, a {@link TimeOfDay} or a {@link CalendarDateTime}.
 */
public sealed interface CalendarTemporal<T extends CalendarTemporal<T>> extends Comparable<T>
    permits CalendarDate, TimeOfDay, CalendarDateTime {

  /** Adds an amount of the given unit, failing with {@link UnsupportedUnitException} if it does not apply. */
  T plus(long amount, ChronoUnit unit);

  /** Whole units from this value to {@code end}, truncated toward zero. */
  long until(T end, ChronoUnit unit);
}
