package com.rg.chrono;

import com.rg.chrono.range.BiWeeklyAnchoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Fluent builder for CalendarSettings.
 *
 * Defaults:
 * - firstDayOfWeek = MONDAY
 * - biWeeklyAnchoring = floating
 * - zone = UTC
 */
public final class CalendarSettingsBuilder {
  private static final Logger log = LoggerFactory.getLogger(CalendarSettingsBuilder.class);

  private static final Set<String> KNOWN_KEYS = Set.of(
      CalendarSettings.FIRST_DAY_OF_WEEK_KEY,
      CalendarSettings.BIWEEKLY_ANCHOR_KEY,
      CalendarSettings.ZONE_KEY);

  private DayOfWeek firstDayOfWeek = DayOfWeek.MONDAY;
  private BiWeeklyAnchoring biWeeklyAnchoring = BiWeeklyAnchoring.floating();
  private ZoneId zone = ZoneOffset.UTC;

  private CalendarSettingsBuilder() {}

  public static CalendarSettingsBuilder builder() {
    return new CalendarSettingsBuilder();
  }

  public CalendarSettingsBuilder firstDayOfWeek(DayOfWeek day) {
    this.firstDayOfWeek = Objects.requireNonNull(day, "firstDayOfWeek");
    return this;
  }

  /** Day name in any case, e.g. "sunday". */
  public CalendarSettingsBuilder firstDayOfWeek(String day) {
    this.firstDayOfWeek = CalendarParsers.parseDayOfWeek(day);
    return this;
  }

  public CalendarSettingsBuilder biWeeklyAnchoring(BiWeeklyAnchoring anchoring) {
    this.biWeeklyAnchoring = Objects.requireNonNull(anchoring, "biWeeklyAnchoring");
    return this;
  }

  /** "floating" or an ISO date such as "2024-01-01" to count fortnights from. */
  public CalendarSettingsBuilder biWeeklyAnchoring(String anchoring) {
    this.biWeeklyAnchoring = CalendarParsers.parseAnchoring(anchoring);
    return this;
  }

  public CalendarSettingsBuilder biWeeklyAnchoredAt(CalendarDate anchor) {
    this.biWeeklyAnchoring = BiWeeklyAnchoring.anchoredAt(anchor);
    return this;
  }

  public CalendarSettingsBuilder zone(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
    return this;
  }

  public CalendarSettingsBuilder zone(String zone) {
    this.zone = CalendarParsers.parseZone(zone);
    return this;
  }

  /**
   * Applies the "chrono.*" keys present in {@code props}; absent keys keep their current value.
   * Unknown "chrono.*" keys are logged and ignored.
   */
  public CalendarSettingsBuilder fromProperties(Properties props) {
    if (props == null) return this;

    String day = props.getProperty(CalendarSettings.FIRST_DAY_OF_WEEK_KEY);
    if (day != null) firstDayOfWeek(day);

    String anchor = props.getProperty(CalendarSettings.BIWEEKLY_ANCHOR_KEY);
    if (anchor != null) biWeeklyAnchoring(anchor);

    String zoneId = props.getProperty(CalendarSettings.ZONE_KEY);
    if (zoneId != null) zone(zoneId);

    for (String key : props.stringPropertyNames()) {
      if (key.startsWith("chrono.") && !KNOWN_KEYS.contains(key)) {
        log.warn("Ignoring unknown calendar setting {}", key);
      }
    }
    return this;
  }

  public CalendarSettings build() {
    return new CalendarSettings(firstDayOfWeek, biWeeklyAnchoring, zone);
  }
}
