package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** The period kinds a {@link DateRange} can have, with construction by kind. */
public enum RangeKind {
  WEEKLY,
  BI_WEEKLY,
  SEMI_MONTHLY,
  MONTHLY,
  QUARTERLY,
  SEMI_ANNUAL,
  ANNUAL;

  public DateRange withStartDate(CalendarDate date) {
    return withStartDate(date, CalendarSettings.defaults());
  }

  /** Week and bi-weekly alignment come from {@code settings}; other kinds ignore them. */
  public DateRange withStartDate(CalendarDate date, CalendarSettings settings) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(settings, "settings");
    return switch (this) {
      case WEEKLY -> WeeklyRange.withStartDate(date, settings.firstDayOfWeek());
      case BI_WEEKLY -> BiWeeklyRange.withStartDate(date, settings.biWeeklyAnchoring());
      case SEMI_MONTHLY -> SemiMonthlyRange.withStartDate(date);
      case MONTHLY -> MonthlyRange.withStartDate(date);
      case QUARTERLY -> QuarterlyRange.withStartDate(date);
      case SEMI_ANNUAL -> SemiAnnualRange.withStartDate(date);
      case ANNUAL -> AnnualRange.withStartDate(date);
    };
  }

  public DateRange withEndDate(CalendarDate date) {
    return withEndDate(date, CalendarSettings.defaults());
  }

  public DateRange withEndDate(CalendarDate date, CalendarSettings settings) {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(settings, "settings");
    return switch (this) {
      case WEEKLY -> WeeklyRange.withEndDate(date, settings.firstDayOfWeek());
      case BI_WEEKLY -> BiWeeklyRange.withEndDate(date, settings.biWeeklyAnchoring());
      case SEMI_MONTHLY -> SemiMonthlyRange.withEndDate(date);
      case MONTHLY -> MonthlyRange.withEndDate(date);
      case QUARTERLY -> QuarterlyRange.withEndDate(date);
      case SEMI_ANNUAL -> SemiAnnualRange.withEndDate(date);
      case ANNUAL -> AnnualRange.withEndDate(date);
    };
  }

  /**
   * Consecutive ranges of this kind, starting with the one built from {@code from}, up to and
   * including the one that contains {@code to}.
   *
   * Example: MONTHLY from 2024-01-20 to 2024-03-02 gives January, February and March 2024.
   */
  public List<DateRange> covering(CalendarDate from, CalendarDate to, CalendarSettings settings) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("to must not be before from. from=" + from + ", to=" + to);
    }

    List<DateRange> ranges = new ArrayList<>();
    DateRange current = withStartDate(from, settings);
    while (current.startDate().isOnOrBefore(to)) {
      ranges.add(current);
      current = current.next();
    }
    return List.copyOf(ranges);
  }

  public List<DateRange> covering(CalendarDate from, CalendarDate to) {
    return covering(from, to, CalendarSettings.defaults());
  }
}
