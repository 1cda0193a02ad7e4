package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.InvalidRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuarterlyRangeTest {

  @Test
  void snapsToCalendarQuarter() {
    QuarterlyRange q2 = QuarterlyRange.withStartDate(CalendarDate.of(2024, 5, 20));
    assertEquals(2, q2.quarter());
    assertEquals(CalendarDate.of(2024, 4, 1), q2.startDate());
    assertEquals(CalendarDate.of(2024, 6, 30), q2.endDate());
    assertEquals(q2, QuarterlyRange.withEndDate(CalendarDate.of(2024, 6, 30)));
  }

  @Test
  void walksAcrossYears() {
    QuarterlyRange q1 = QuarterlyRange.withStartDate(CalendarDate.of(2024, 2, 29));
    assertEquals(91, q1.lengthInDays());
    assertEquals(new QuarterlyRange(CalendarDate.of(2023, 10, 1), CalendarDate.of(2023, 12, 31)), q1.prior());
    assertEquals(4, q1.prior().quarter());
    assertEquals(CalendarDate.of(2024, 4, 1), q1.next().startDate());
  }

  @Test
  void rejectsNonQuarter() {
    assertThrows(InvalidRangeException.class,
        () -> new QuarterlyRange(CalendarDate.of(2024, 2, 1), CalendarDate.of(2024, 4, 30)));
  }
}
