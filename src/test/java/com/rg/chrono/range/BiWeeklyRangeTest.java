package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.InvalidRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BiWeeklyRangeTest {

  private static final BiWeeklyAnchoring JAN_1 = BiWeeklyAnchoring.anchoredAt(CalendarDate.of(2024, 1, 1));

  @Test
  void floatingWindowStartsOrEndsOnTheGivenDate() {
    BiWeeklyRange r = BiWeeklyRange.withStartDate(CalendarDate.of(2024, 3, 13));
    assertEquals(CalendarDate.of(2024, 3, 26), r.endDate());
    assertEquals(14, r.lengthInDays());

    BiWeeklyRange byEnd = BiWeeklyRange.withEndDate(CalendarDate.of(2024, 3, 26));
    assertEquals(r, byEnd);

    assertEquals(CalendarDate.of(2024, 3, 27), r.next().startDate());
    assertEquals(CalendarDate.of(2024, 4, 9), r.next().endDate());
    assertEquals(CalendarDate.of(2024, 2, 28), r.prior().startDate());
  }

  @Test
  void anchoredWindowSnapsToItsFortnight() {
    // 2024-03-13 is 72 days after the anchor; 72 mod 14 = 2
    BiWeeklyRange r = BiWeeklyRange.withStartDate(CalendarDate.of(2024, 3, 13), JAN_1);
    assertEquals(CalendarDate.of(2024, 3, 11), r.startDate());
    assertEquals(CalendarDate.of(2024, 3, 24), r.endDate());
    assertEquals(r, BiWeeklyRange.withEndDate(CalendarDate.of(2024, 3, 24), JAN_1));
    assertEquals(r, BiWeeklyRange.withEndDate(CalendarDate.of(2024, 3, 11), JAN_1));
    assertEquals(JAN_1, r.next().anchoring());
  }

  @Test
  void anchoredWindowWorksBeforeTheAnchor() {
    BiWeeklyRange r = BiWeeklyRange.withStartDate(CalendarDate.of(2023, 12, 31), JAN_1);
    assertEquals(CalendarDate.of(2023, 12, 18), r.startDate());
    assertEquals(CalendarDate.of(2023, 12, 31), r.endDate());
    assertEquals(CalendarDate.of(2024, 1, 1), r.next().startDate());
  }

  @Test
  void rejectsMisalignedStart() {
    assertThrows(InvalidRangeException.class,
        () -> new BiWeeklyRange(CalendarDate.of(2024, 3, 12), CalendarDate.of(2024, 3, 25), JAN_1));
    assertThrows(InvalidRangeException.class,
        () -> new BiWeeklyRange(CalendarDate.of(2024, 3, 12), CalendarDate.of(2024, 3, 24), BiWeeklyAnchoring.floating()));
  }
}
