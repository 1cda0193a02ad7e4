package com.rg.chrono;

import com.rg.chrono.range.BiWeeklyAnchoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

/**
 * Caller-chosen calendar conventions:
 * - firstDayOfWeek: where weekly ranges start (default MONDAY)
 * - biWeeklyAnchoring: floating windows or fortnights counted from an anchor (default floating)
 * - zone: the zone the system clock reads dates in (default UTC)
 */
public record CalendarSettings(
    DayOfWeek firstDayOfWeek,
    BiWeeklyAnchoring biWeeklyAnchoring,
    ZoneId zone
) {
  private static final Logger log = LoggerFactory.getLogger(CalendarSettings.class);

  public static final String DEFAULT_RESOURCE = "chrono.properties";
  public static final String FIRST_DAY_OF_WEEK_KEY = "chrono.week.first-day";
  public static final String BIWEEKLY_ANCHOR_KEY = "chrono.biweekly.anchor";
  public static final String ZONE_KEY = "chrono.zone";

  public CalendarSettings {
    firstDayOfWeek = (firstDayOfWeek == null) ? DayOfWeek.MONDAY : firstDayOfWeek;
    biWeeklyAnchoring = (biWeeklyAnchoring == null) ? BiWeeklyAnchoring.floating() : biWeeklyAnchoring;
    zone = (zone == null) ? ZoneOffset.UTC : zone;
  }

  public static CalendarSettings defaults() {
    return new CalendarSettings(null, null, null);
  }

  /** Reads {@value #DEFAULT_RESOURCE} from the classpath; defaults if it is not there. */
  public static CalendarSettings load() {
    return load(DEFAULT_RESOURCE);
  }

  public static CalendarSettings load(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) loader = CalendarSettings.class.getClassLoader();

    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No {} on the classpath, using default calendar settings", resource);
        return defaults();
      }
      Properties props = new Properties();
      props.load(in);
      CalendarSettings settings = CalendarSettingsBuilder.builder().fromProperties(props).build();
      log.info("Loaded calendar settings from {}: {}", resource, settings);
      return settings;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read calendar settings from " + resource, e);
    }
  }

  /** A system clock reading dates in {@link #zone()}. */
  public CalendarClock clock() {
    return CalendarClock.system(zone);
  }
}
