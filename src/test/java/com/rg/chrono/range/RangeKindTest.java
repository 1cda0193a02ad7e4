package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarSettings;
import com.rg.chrono.CalendarSettingsBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeKindTest {

  private static final CalendarDate FIRST = CalendarDate.of(2023, 11, 20);
  private static final CalendarDate LAST = CalendarDate.of(2025, 2, 10);

  private static final CalendarSettings SUNDAY_ANCHORED = CalendarSettingsBuilder.builder()
      .firstDayOfWeek(DayOfWeek.SUNDAY)
      .biWeeklyAnchoredAt(CalendarDate.of(2024, 1, 7))
      .build();

  @Test
  void dispatchesToTheMatchingRange() {
    CalendarDate d = CalendarDate.of(2024, 5, 20);
    assertTrue(RangeKind.WEEKLY.withStartDate(d) instanceof WeeklyRange);
    assertTrue(RangeKind.BI_WEEKLY.withStartDate(d) instanceof BiWeeklyRange);
    assertTrue(RangeKind.SEMI_MONTHLY.withEndDate(d) instanceof SemiMonthlyRange);
    assertEquals(MonthlyRange.withStartDate(d), RangeKind.MONTHLY.withStartDate(d));
    assertEquals(QuarterlyRange.withEndDate(d), RangeKind.QUARTERLY.withEndDate(d));
    assertEquals(SemiAnnualRange.withStartDate(d), RangeKind.SEMI_ANNUAL.withStartDate(d));
    assertEquals(AnnualRange.withStartDate(d), RangeKind.ANNUAL.withStartDate(d));
  }

  @Test
  void passesSettingsThrough() {
    CalendarDate wednesday = CalendarDate.of(2024, 3, 13);
    assertEquals(CalendarDate.of(2024, 3, 10), RangeKind.WEEKLY.withStartDate(wednesday, SUNDAY_ANCHORED).startDate());
    // 66 days after the anchor, 66 mod 14 = 10
    assertEquals(CalendarDate.of(2024, 3, 3), RangeKind.BI_WEEKLY.withEndDate(wednesday, SUNDAY_ANCHORED).startDate());
  }

  @Test
  void coveringListsConsecutiveRanges() {
    List<DateRange> months = RangeKind.MONTHLY.covering(CalendarDate.of(2024, 1, 20), CalendarDate.of(2024, 3, 2));
    assertEquals(3, months.size());
    assertEquals(CalendarDate.of(2024, 1, 1), months.get(0).startDate());
    assertEquals(CalendarDate.of(2024, 2, 29), months.get(1).endDate());
    assertEquals(CalendarDate.of(2024, 3, 31), months.get(2).endDate());

    assertEquals(1, RangeKind.ANNUAL.covering(CalendarDate.of(2024, 3, 2), CalendarDate.of(2024, 3, 2)).size());
    assertThrows(IllegalArgumentException.class,
        () -> RangeKind.WEEKLY.covering(CalendarDate.of(2024, 3, 2), CalendarDate.of(2024, 3, 1)));
  }

  @ParameterizedTest
  @EnumSource(RangeKind.class)
  void builtRangesContainTheirDateAndWalkBothWays(RangeKind kind) {
    for (CalendarDate d = FIRST; d.isOnOrBefore(LAST); d = d.plusDays(1)) {
      for (CalendarSettings settings : List.of(CalendarSettings.defaults(), SUNDAY_ANCHORED)) {
        DateRange byStart = kind.withStartDate(d, settings);
        DateRange byEnd = kind.withEndDate(d, settings);
        assertEquals(kind, byStart.kind());
        assertTrue(byStart.contains(d), kind + " from start " + d);
        assertTrue(byEnd.contains(d), kind + " from end " + d);

        assertEquals(byStart, byStart.next().prior(), kind + " next/prior " + d);
        assertEquals(byStart, byStart.prior().next(), kind + " prior/next " + d);
        assertEquals(byStart.endDate().plusDays(1), byStart.next().startDate());
        assertEquals(byStart.startDate().minusDays(1), byStart.prior().endDate());

        // rebuilding from a range's own bounds gives the same range
        assertEquals(byStart, kind.withStartDate(byStart.startDate(), settings));
        assertEquals(byStart, kind.withEndDate(byStart.endDate(), settings));
      }
    }
  }
}
