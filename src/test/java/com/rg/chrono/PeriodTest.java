package com.rg.chrono;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PeriodTest {

  @Test
  void keepsFieldsSeparate() {
    Period p = Period.of(1, 14, 40);
    assertEquals(1, p.years());
    assertEquals(14, p.months());
    assertEquals(40, p.days());
    assertEquals(26, p.toTotalMonths());
    assertEquals(Period.of(2, 2, 40), p.normalized());
  }

  @Test
  void factoriesAndArithmetic() {
    assertEquals(Period.of(0, 0, 14), Period.ofWeeks(2));
    assertEquals(Period.of(1, 2, 3), Period.ofYears(1).plusMonths(2).plusDays(3));
    assertEquals(Period.of(1, 1, 1), Period.of(2, 3, 4).minus(Period.of(1, 2, 3)));
    assertEquals(Period.of(-1, -2, -3), Period.of(1, 2, 3).negated());
    assertEquals(Period.of(3, 6, 9), Period.of(1, 2, 3).multipliedBy(3));
    assertEquals(Period.of(0, -1, 0), Period.ofMonths(1).minusMonths(2));
    assertTrue(Period.ZERO.isZero());
    assertTrue(Period.of(1, -1, 0).isNegative());
    assertFalse(Period.of(1, 1, 0).isNegative());
  }

  @Test
  void addsYearsAndMonthsBeforeDays() {
    CalendarDate jan31 = CalendarDate.of(2023, 1, 31);
    // Feb 28, then one day
    assertEquals(CalendarDate.of(2023, 3, 1), Period.of(0, 1, 1).addTo(jan31));
    assertEquals(CalendarDate.of(2024, 2, 29), Period.of(1, 1, 0).addTo(jan31));
    assertEquals(CalendarDate.of(2022, 12, 31), Period.ofMonths(1).subtractFrom(jan31));
    assertEquals(CalendarDate.of(2023, 2, 28), jan31.plus(Period.ofMonths(1)));
    assertEquals(CalendarDate.of(2023, 1, 24), jan31.minus(Period.ofWeeks(1)));
  }

  @Test
  void betweenSplitsIntoMonthsAndRemainingDays() {
    assertEquals(Period.of(0, 1, 0), Period.between(CalendarDate.of(2021, 1, 31), CalendarDate.of(2021, 2, 28)));
    assertEquals(Period.of(0, 1, 1), Period.between(CalendarDate.of(2021, 1, 31), CalendarDate.of(2021, 3, 1)));
    assertEquals(Period.of(1, 0, 0), Period.between(CalendarDate.of(2020, 2, 29), CalendarDate.of(2021, 2, 28)));
    assertEquals(Period.of(0, -1, -1), Period.between(CalendarDate.of(2021, 3, 1), CalendarDate.of(2021, 1, 31)));
    assertEquals(Period.ZERO, Period.between(CalendarDate.of(2021, 3, 1), CalendarDate.of(2021, 3, 1)));
  }

  @Test
  void betweenThenAddReachesTheEndDate() {
    CalendarDate start = CalendarDate.of(2020, 1, 15);
    CalendarDate end = CalendarDate.of(2020, 1, 15);
    for (int i = 0; i < 500; i++) {
      assertEquals(end, Period.between(start, end).addTo(start), "to " + end);
      end = end.plusDays(1);
    }
  }

  @Test
  void backwardBetweenKeepsOneSign() {
    // one "month" back by MONTHS, but Jan 28 + 3 days would mix signs
    assertEquals(Period.ofDays(-28), Period.between(CalendarDate.of(2021, 2, 28), CalendarDate.of(2021, 1, 31)));
    assertEquals(-1, ChronoUnit.MONTHS.between(CalendarDate.of(2021, 2, 28), CalendarDate.of(2021, 1, 31)));
    assertEquals(Period.of(0, -1, -1), Period.between(CalendarDate.of(2021, 3, 1), CalendarDate.of(2021, 1, 31)));

    CalendarDate start = CalendarDate.of(2021, 3, 31);
    for (int i = 0; i < 800; i++) {
      CalendarDate end = start.minusDays(i);
      Period p = Period.between(start, end);
      assertFalse(p.years() > 0 || p.months() > 0 || p.days() > 0, "positive field in " + p + " to " + end);
      assertEquals(end, p.addTo(start), "to " + end);
    }
  }

  @Test
  void rendersAndParsesIso() {
    assertEquals("P1Y2M3D", Period.of(1, 2, 3).toString());
    assertEquals("P0D", Period.ZERO.toString());
    assertEquals(Period.of(1, 2, 3), Period.parse("P1Y2M3D"));
    assertEquals(Period.ofDays(14), Period.parse("p2w"));
  }
}
