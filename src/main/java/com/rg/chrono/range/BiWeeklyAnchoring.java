package com.rg.chrono.range;

import com.rg.chrono.CalendarArithmetic;
import com.rg.chrono.CalendarDate;

import java.util.Objects;

/**
 * How a bi-weekly range lines up with the calendar. The caller picks one:
 * - {@link Floating}: the 14-day window starts exactly at the given start date (or ends exactly at
 *   the given end date); no two constructions need to agree on alignment.
 * - {@link Anchored}: fortnights are counted from a fixed anchor date, so a start or end date
 *   snaps to the fortnight containing it.
 */
public sealed interface BiWeeklyAnchoring permits BiWeeklyAnchoring.Floating, BiWeeklyAnchoring.Anchored {

  static BiWeeklyAnchoring floating() {
    return new Floating();
  }

  static BiWeeklyAnchoring anchoredAt(CalendarDate anchor) {
    return new Anchored(anchor);
  }

  /** First day of the window built from {@code date} as a start date. */
  CalendarDate startFromStartDate(CalendarDate date);

  /** First day of the window built from {@code date} as an end date. */
  CalendarDate startFromEndDate(CalendarDate date);

  boolean isAligned(CalendarDate start);

  record Floating() implements BiWeeklyAnchoring {
    @Override
    public CalendarDate startFromStartDate(CalendarDate date) {
      return date;
    }

    @Override
    public CalendarDate startFromEndDate(CalendarDate date) {
      return date.minusDays(BiWeeklyRange.LENGTH_DAYS - 1);
    }

    @Override
    public boolean isAligned(CalendarDate start) {
      return true;
    }
  }

  record Anchored(CalendarDate anchor) implements BiWeeklyAnchoring {
    public Anchored {
      Objects.requireNonNull(anchor, "anchor");
    }

    @Override
    public CalendarDate startFromStartDate(CalendarDate date) {
      return date.minusDays(offset(date));
    }

    @Override
    public CalendarDate startFromEndDate(CalendarDate date) {
      return startFromStartDate(date);
    }

    @Override
    public boolean isAligned(CalendarDate start) {
      return offset(start) == 0;
    }

    private long offset(CalendarDate date) {
      return Math.floorMod(CalendarArithmetic.daysBetween(anchor, date), (long) BiWeeklyRange.LENGTH_DAYS);
    }
  }
}
