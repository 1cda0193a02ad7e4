package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.InvalidRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SemiAnnualRangeTest {

  @Test
  void halvesTheYear() {
    SemiAnnualRange h1 = SemiAnnualRange.withStartDate(CalendarDate.of(2024, 6, 30));
    assertTrue(h1.isFirstHalf());
    assertEquals(CalendarDate.of(2024, 1, 1), h1.startDate());
    assertEquals(CalendarDate.of(2024, 6, 30), h1.endDate());

    SemiAnnualRange h2 = SemiAnnualRange.withEndDate(CalendarDate.of(2024, 7, 1));
    assertFalse(h2.isFirstHalf());
    assertEquals(CalendarDate.of(2024, 12, 31), h2.endDate());
    assertEquals(h2, h1.next());
  }

  @Test
  void walksIntoNeighbouringYears() {
    SemiAnnualRange h2 = SemiAnnualRange.withStartDate(CalendarDate.of(2024, 9, 9));
    assertEquals(new SemiAnnualRange(CalendarDate.of(2025, 1, 1), CalendarDate.of(2025, 6, 30)), h2.next());
    SemiAnnualRange h1 = SemiAnnualRange.withStartDate(CalendarDate.of(2024, 1, 1));
    assertEquals(new SemiAnnualRange(CalendarDate.of(2023, 7, 1), CalendarDate.of(2023, 12, 31)), h1.prior());
  }

  @Test
  void rejectsOffsetHalf() {
    assertThrows(InvalidRangeException.class,
        () -> new SemiAnnualRange(CalendarDate.of(2024, 4, 1), CalendarDate.of(2024, 9, 30)));
  }
}
