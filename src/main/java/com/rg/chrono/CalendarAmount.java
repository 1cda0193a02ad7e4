package com.rg.chrono;

/**
 * An amount of time that can be added to a {@link CalendarDateTime}: either a calendar
 * {@link Period} (years, months, days) or an elapsed {@link Duration}.
 */
public sealed interface CalendarAmount permits Period, Duration {

  CalendarDateTime addTo(CalendarDateTime dateTime);

  CalendarDateTime subtractFrom(CalendarDateTime dateTime);

  boolean isZero();

  boolean isNegative();
}
