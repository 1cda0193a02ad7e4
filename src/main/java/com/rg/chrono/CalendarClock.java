package com.rg.chrono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Minimal abstraction for "what time is it":
 * - the current instant
 * - the zone used to turn that instant into a calendar date and time
 *
 * Inject a fixed clock in tests so date logic does not depend on the wall clock.
 */
public interface CalendarClock {
  Instant instant();

  ZoneId zone();

  CalendarClock withZone(ZoneId zone);

  default CalendarDate today() {
    return now().date();
  }

  default CalendarDateTime now() {
    return CalendarDateTime.from(LocalDateTime.ofInstant(instant(), zone()));
  }

  default ZoneOffset offset() {
    return zoneOffset(zone(), instant());
  }

  static CalendarClock system(ZoneId zone) {
    return new SystemCalendarClock(zone);
  }

  static CalendarClock systemUtc() {
    return new SystemCalendarClock(ZoneOffset.UTC);
  }

  static CalendarClock fixed(Instant instant, ZoneId zone) {
    return new FixedCalendarClock(instant, zone);
  }

  /** Offset from UTC in effect for {@code zone} at {@code instant}, per the JDK zone rules. */
  static ZoneOffset zoneOffset(ZoneId zone, Instant instant) {
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(instant, "instant");
    return zone.getRules().getOffset(instant);
  }
}
