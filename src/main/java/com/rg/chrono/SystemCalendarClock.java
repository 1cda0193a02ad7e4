package com.rg.chrono;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Reads the JDK system clock; the zone only affects how the instant maps to a date. */
public record SystemCalendarClock(ZoneId zone) implements CalendarClock {
  public SystemCalendarClock {
    zone = (zone == null) ? ZoneOffset.UTC : zone;
  }

  @Override
  public Instant instant() {
    return Instant.now();
  }

  @Override
  public CalendarClock withZone(ZoneId zone) {
    return new SystemCalendarClock(zone);
  }
}
