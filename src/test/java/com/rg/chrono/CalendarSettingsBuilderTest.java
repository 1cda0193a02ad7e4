package com.rg.chrono;

import com.rg.chrono.range.BiWeeklyAnchoring;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CalendarSettingsBuilderTest {

  @Test
  void defaultsWhenNothingIsSet() {
    CalendarSettings s = CalendarSettingsBuilder.builder().build();

    assertEquals(DayOfWeek.MONDAY, s.firstDayOfWeek());
    assertEquals(BiWeeklyAnchoring.floating(), s.biWeeklyAnchoring());
    assertEquals(ZoneOffset.UTC, s.zone());
    assertEquals(CalendarSettings.defaults(), s);
  }

  @Test
  void buildsUsingStrings() {
    CalendarSettings s = CalendarSettingsBuilder.builder()
        .firstDayOfWeek("sunday")
        .biWeeklyAnchoring("2024-01-01")
        .zone("Europe/Paris")
        .build();

    assertEquals(DayOfWeek.SUNDAY, s.firstDayOfWeek());
    assertEquals(BiWeeklyAnchoring.anchoredAt(CalendarDate.of(2024, 1, 1)), s.biWeeklyAnchoring());
    assertEquals(ZoneId.of("Europe/Paris"), s.zone());
  }

  @Test
  void buildsUsingTypedValues() {
    CalendarSettings s = CalendarSettingsBuilder.builder()
        .firstDayOfWeek(DayOfWeek.SATURDAY)
        .biWeeklyAnchoredAt(CalendarDate.of(2023, 12, 30))
        .zone(ZoneOffset.ofHours(9))
        .build();

    assertEquals(DayOfWeek.SATURDAY, s.firstDayOfWeek());
    assertEquals(new BiWeeklyAnchoring.Anchored(CalendarDate.of(2023, 12, 30)), s.biWeeklyAnchoring());
    assertEquals(ZoneOffset.ofHours(9), s.zone());
  }

  @Test
  void appliesPresentPropertiesAndIgnoresUnknownOnes() {
    Properties props = new Properties();
    props.setProperty(CalendarSettings.FIRST_DAY_OF_WEEK_KEY, "SUNDAY");
    props.setProperty("chrono.week.last-day", "SATURDAY");
    props.setProperty("unrelated.key", "x");

    CalendarSettings s = CalendarSettingsBuilder.builder()
        .zone("Asia/Tokyo")
        .fromProperties(props)
        .build();

    assertEquals(DayOfWeek.SUNDAY, s.firstDayOfWeek());
    assertEquals(BiWeeklyAnchoring.floating(), s.biWeeklyAnchoring());
    assertEquals(ZoneId.of("Asia/Tokyo"), s.zone());
  }

  @Test
  void rejectsBadValues() {
    CalendarSettingsBuilder b = CalendarSettingsBuilder.builder();
    assertThrows(IllegalArgumentException.class, () -> b.firstDayOfWeek("someday"));
    assertThrows(IllegalArgumentException.class, () -> b.zone("Nowhere/Special"));
    assertThrows(NullPointerException.class, () -> b.zone((ZoneId) null));

    Properties props = new Properties();
    props.setProperty(CalendarSettings.BIWEEKLY_ANCHOR_KEY, "2023-02-30");
    assertThrows(IllegalArgumentException.class, () -> b.fromProperties(props));
  }
}
