package com.rg.chrono.range;

import com.rg.chrono.CalendarArithmetic;
import com.rg.chrono.CalendarDate;

import java.util.Objects;

/**
 * Fourteen days. Where the window sits is decided by its {@link BiWeeklyAnchoring}; the default
 * is floating, i.e. the window starts on exactly the date given.
 */
public record BiWeeklyRange(CalendarDate startDate, CalendarDate endDate, BiWeeklyAnchoring anchoring)
    implements DateRange {

  static final int LENGTH_DAYS = 14;

  public BiWeeklyRange {
    Objects.requireNonNull(anchoring, "anchoring");
    RangeInvariants.checkBounds(RangeKind.BI_WEEKLY, startDate, endDate);
    RangeInvariants.check(CalendarArithmetic.daysBetween(startDate, endDate) == LENGTH_DAYS - 1,
        RangeKind.BI_WEEKLY, startDate, endDate, "spans exactly 14 days");
    RangeInvariants.check(anchoring.isAligned(startDate),
        RangeKind.BI_WEEKLY, startDate, endDate, "starts on a fortnight boundary of " + anchoring);
  }

  public static BiWeeklyRange withStartDate(CalendarDate date) {
    return withStartDate(date, BiWeeklyAnchoring.floating());
  }

  public static BiWeeklyRange withStartDate(CalendarDate date, BiWeeklyAnchoring anchoring) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(anchoring, "anchoring");
    return startingAt(anchoring.startFromStartDate(date), anchoring);
  }

  public static BiWeeklyRange withEndDate(CalendarDate date) {
    return withEndDate(date, BiWeeklyAnchoring.floating());
  }

  public static BiWeeklyRange withEndDate(CalendarDate date, BiWeeklyAnchoring anchoring) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(anchoring, "anchoring");
    return startingAt(anchoring.startFromEndDate(date), anchoring);
  }

  private static BiWeeklyRange startingAt(CalendarDate start, BiWeeklyAnchoring anchoring) {
    return new BiWeeklyRange(start, start.plusDays(LENGTH_DAYS - 1), anchoring);
  }

  @Override
  public RangeKind kind() {
    return RangeKind.BI_WEEKLY;
  }

  @Override
  public BiWeeklyRange prior() {
    return startingAt(startDate.minusDays(LENGTH_DAYS), anchoring);
  }

  @Override
  public BiWeeklyRange next() {
    return startingAt(startDate.plusDays(LENGTH_DAYS), anchoring);
  }
}
