package com.rg.chrono;

import com.rg.chrono.range.BiWeeklyAnchoring;
import com.rg.chrono.range.RangeKind;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class CalendarParsersTest {

  @Test
  void parsesTimeBasedAmountsAsDuration() {
    CalendarAmount amount = CalendarParsers.parseAmount("PT48H");
    assertTrue(amount instanceof Duration);
    assertEquals(Duration.ofHours(48), amount);

    // P1DT2H = 1 day + 2 hours of elapsed time
    assertEquals(Duration.ofHours(26), CalendarParsers.parseAmount("P1DT2H"));
  }

  @Test
  void parsesDateBasedAmountsAsPeriod() {
    // P7D is valid for both; calendar days win
    CalendarAmount days = CalendarParsers.parseAmount("P7D");
    assertTrue(days instanceof Period);
    assertEquals(Period.ofDays(7), days);

    assertEquals(Period.ofMonths(12), CalendarParsers.parseAmount("P12M"));
    assertEquals(Period.of(1, 2, 3), CalendarParsers.parseAmount(" p1y2m3d "));
  }

  @Test
  void rejectsInvalidAmounts() {
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseAmount("7 days"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseAmount("junk"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseDuration("P1Y"));
  }

  @Test
  void parsesIsoDatesAndTimes() {
    assertEquals(CalendarDate.of(2024, 2, 29), CalendarParsers.parseDate("2024-02-29"));
    assertEquals(TimeOfDay.of(23, 30), CalendarParsers.parseTime("23:30"));
    assertEquals(CalendarDateTime.of(2024, 2, 29, 23, 30, 15), CalendarParsers.parseDateTime("2024-02-29T23:30:15"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CalendarParsers.parseDate("2023-02-29"));
    assertTrue(ex.getMessage().contains("Invalid ISO-8601 date"));
  }

  @Test
  void parsesPartialDates() {
    assertEquals(CalendarYearMonth.of(2024, 2), CalendarParsers.parseYearMonth("2024-02"));
    assertEquals(CalendarMonthDay.of(2, 29), CalendarParsers.parseMonthDay("--02-29"));

    IllegalArgumentException ym = assertThrows(IllegalArgumentException.class,
        () -> CalendarParsers.parseYearMonth("2024-13"));
    assertTrue(ym.getMessage().contains("Invalid ISO-8601 year-month"));
    IllegalArgumentException md = assertThrows(IllegalArgumentException.class,
        () -> CalendarParsers.parseMonthDay("--02-30"));
    assertTrue(md.getMessage().contains("Invalid ISO-8601 month-day"));
  }

  @Test
  void rejectsNullAndBlank() {
    IllegalArgumentException nul = assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseDate(null));
    assertEquals("date must be non-null", nul.getMessage());

    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseUnit("  "));
    assertEquals("unit must not be blank", blank.getMessage());
  }

  @Test
  void parsesUnitsLeniently() {
    assertEquals(ChronoUnit.HALF_DAYS, CalendarParsers.parseUnit("half-days"));
    assertEquals(ChronoUnit.MILLIS, CalendarParsers.parseUnit("Millis"));
    assertEquals(ChronoUnit.WEEKS, CalendarParsers.parseUnit("WEEKS"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CalendarParsers.parseUnit("fortnights"));
    assertTrue(ex.getMessage().contains("Unknown unit"));
  }

  @Test
  void parsesRangeKindsAndAliases() {
    assertEquals(RangeKind.SEMI_MONTHLY, CalendarParsers.parseRangeKind("semi-monthly"));
    assertEquals(RangeKind.SEMI_MONTHLY, CalendarParsers.parseRangeKind("SemiMonthly"));
    assertEquals(RangeKind.BI_WEEKLY, CalendarParsers.parseRangeKind("bi weekly"));
    assertEquals(RangeKind.BI_WEEKLY, CalendarParsers.parseRangeKind("fortnightly"));
    assertEquals(RangeKind.SEMI_ANNUAL, CalendarParsers.parseRangeKind("semiannually"));
    assertEquals(RangeKind.ANNUAL, CalendarParsers.parseRangeKind("yearly"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseRangeKind("daily"));
  }

  @Test
  void parsesSettingValues() {
    assertEquals(BiWeeklyAnchoring.floating(), CalendarParsers.parseAnchoring("Floating"));
    assertEquals(BiWeeklyAnchoring.anchoredAt(CalendarDate.of(2024, 1, 1)), CalendarParsers.parseAnchoring("2024-01-01"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseAnchoring("sometimes"));

    assertEquals(DayOfWeek.SUNDAY, CalendarParsers.parseDayOfWeek("sunday"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseDayOfWeek("funday"));

    assertEquals(ZoneId.of("Europe/Paris"), CalendarParsers.parseZone("Europe/Paris"));
    assertThrows(IllegalArgumentException.class, () -> CalendarParsers.parseZone("Mars/Base"));
  }
}
