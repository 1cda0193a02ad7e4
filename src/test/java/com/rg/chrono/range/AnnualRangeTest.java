package com.rg.chrono.range;

import com.rg.chrono.CalendarDate;
import com.rg.chrono.CalendarYear;
import com.rg.chrono.InvalidRangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnnualRangeTest {

  @Test
  void coversCalendarYear() {
    AnnualRange y2023 = AnnualRange.withStartDate(CalendarDate.of(2023, 6, 15));
    assertEquals(2023, y2023.year());
    assertEquals(CalendarDate.of(2023, 1, 1), y2023.startDate());
    assertEquals(CalendarDate.of(2023, 12, 31), y2023.endDate());
    assertEquals(365, y2023.lengthInDays());
  }

  @Test
  void nextYearStartsTheDayAfter() {
    AnnualRange y2023 = AnnualRange.withEndDate(CalendarDate.of(2023, 12, 31));
    AnnualRange y2024 = y2023.next();
    assertEquals(CalendarDate.of(2024, 1, 1), y2024.startDate());
    assertEquals(366, y2024.lengthInDays());
    assertEquals(y2023, y2024.prior());
  }

  @Test
  void leapDayStartsItsYear() {
    assertEquals(AnnualRange.withStartDate(CalendarDate.of(2024, 1, 1)),
        AnnualRange.withStartDate(CalendarDate.of(2024, 2, 29)));
    assertEquals(2025, AnnualRange.withStartDate(CalendarDate.of(2024, 2, 29)).next().year());
  }

  @Test
  void rejectsFiscalYear() {
    assertThrows(InvalidRangeException.class,
        () -> new AnnualRange(CalendarDate.of(2023, 4, 1), CalendarDate.of(2024, 3, 31)));
  }

  @Test
  void buildsFromYear() {
    AnnualRange y2000 = AnnualRange.of(CalendarYear.of(2000));
    assertEquals(CalendarDate.of(2000, 1, 1), y2000.startDate());
    assertEquals(CalendarDate.of(2000, 12, 31), y2000.endDate());
    assertEquals(366, y2000.lengthInDays());
    assertEquals(1999, y2000.prior().year());
  }
}
