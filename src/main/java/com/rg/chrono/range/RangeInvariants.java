package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.InvalidRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Checks run by every range constructor. A failure means a range rule is wrong. */
final class RangeInvariants {
  private static final Logger log = LoggerFactory.getLogger(RangeInvariants.class);

  private RangeInvariants() {}

  static void checkBounds(RangeKind kind, CalendarDate start, CalendarDate end) {
    Objects.requireNonNull(start, "startDate");
    Objects.requireNonNull(end, "endDate");
    check(start.isOnOrBefore(end), kind, start, end, "start <= end");
  }

  static void check(boolean holds, RangeKind kind, CalendarDate start, CalendarDate end, String rule) {
    if (holds) return;
    InvalidRangeException e = new InvalidRangeException(kind.name(), start, end, rule);
    log.error("Inconsistent {} range [{}, {}]: {}", kind, start, end, rule);
    throw e;
  }
}
