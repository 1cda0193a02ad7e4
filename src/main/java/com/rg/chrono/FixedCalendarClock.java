package com.rg.chrono;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/** Always reports the same instant. */
public record FixedCalendarClock(Instant instant, ZoneId zone) implements CalendarClock {
  public FixedCalendarClock {
    Objects.requireNonNull(instant, "instant");
    zone = (zone == null) ? ZoneOffset.UTC : zone;
  }

  @Override
  public CalendarClock withZone(ZoneId zone) {
    return new FixedCalendarClock(instant, zone);
  }
}
