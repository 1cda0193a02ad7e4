package com.rg.chrono;

import com.rg.chrono.range.BiWeeklyAnchoring;
import com.rg.chrono.range.RangeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Text to calendar values. ISO-8601 parsing itself is done by java.time; this class maps the
 * results onto our types and turns parse failures into {@link IllegalArgumentException}.
 */
public final class CalendarParsers {
  private static final Logger log = LoggerFactory.getLogger(CalendarParsers.class);

  private static final Map<String, RangeKind> RANGE_KIND_ALIASES = Map.of(
      "FORTNIGHTLY", RangeKind.BI_WEEKLY,
      "SEMIANNUALLY", RangeKind.SEMI_ANNUAL,
      "ANNUALLY", RangeKind.ANNUAL,
      "YEARLY", RangeKind.ANNUAL);

  private CalendarParsers() {}

  public static CalendarDate parseDate(String text) {
    String norm = normalize(text, "date");
    try {
      return CalendarDate.from(LocalDate.parse(norm));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 date: " + text, e);
    }
  }

  public static TimeOfDay parseTime(String text) {
    String norm = normalize(text, "time");
    try {
      return TimeOfDay.from(LocalTime.parse(norm));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 time: " + text, e);
    }
  }

  public static CalendarDateTime parseDateTime(String text) {
    String norm = normalize(text, "dateTime");
    try {
      return CalendarDateTime.from(LocalDateTime.parse(norm));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 date-time: " + text, e);
    }
  }

  public static CalendarYearMonth parseYearMonth(String text) {
    String norm = normalize(text, "yearMonth");
    try {
      YearMonth ym = YearMonth.parse(norm);
      return CalendarYearMonth.of(ym.getYear(), ym.getMonthValue());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 year-month: " + text, e);
    }
  }

  public static CalendarMonthDay parseMonthDay(String text) {
    String norm = normalize(text, "monthDay");
    try {
      MonthDay md = MonthDay.parse(norm);
      return CalendarMonthDay.of(md.getMonthValue(), md.getDayOfMonth());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 month-day: " + text, e);
    }
  }

  public static Period parsePeriod(String text) {
    String norm = normalize(text, "period").toUpperCase(Locale.ROOT);
    try {
      java.time.Period p = java.time.Period.parse(norm);
      return Period.of(p.getYears(), p.getMonths(), p.getDays());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 period: " + text, e);
    }
  }

  public static Duration parseDuration(String text) {
    String norm = normalize(text, "duration").toUpperCase(Locale.ROOT);
    try {
      java.time.Duration d = java.time.Duration.parse(norm);
      return new Duration(d.getSeconds(), d.getNano());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid ISO-8601 duration: " + text, e);
    }
  }

  /**
   * Parses an ISO-8601 amount into a Period or a Duration.
   *
   * Rules:
   * - A time part (PT.., P1DT2H) means elapsed time -> Duration
   * - Otherwise (P1Y, P3M, P2W, P7D) it is calendar fields -> Period
   *
   * Note: "P7D" parses as both in java.time; we treat it as a Period because
   * seven calendar days and 168 elapsed hours differ once a date-time is involved.
   */
  public static CalendarAmount parseAmount(String text) {
    String norm = normalize(text, "amount").toUpperCase(Locale.ROOT);
    AmountKind kind = classify(norm);
    log.debug("Classified amount {} as {}", text, kind);
    return switch (kind) {
      case DURATION -> parseDuration(norm);
      case PERIOD -> parsePeriod(norm);
    };
  }

  /** Accepts enum names in any case, with '-' or ' ' for '_' (e.g. "half-days"). */
  public static ChronoUnit parseUnit(String text) {
    String norm = enumName(text, "unit");
    try {
      return ChronoUnit.valueOf(norm);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown unit: " + text + ". Expected one of " + Arrays.toString(ChronoUnit.values()), e);
    }
  }

  /** Accepts "SEMI_MONTHLY", "semi-monthly", "semimonthly" and a few aliases such as "fortnightly". */
  public static RangeKind parseRangeKind(String text) {
    String compact = enumName(text, "rangeKind").replace("_", "");
    for (RangeKind kind : RangeKind.values()) {
      if (kind.name().replace("_", "").equals(compact)) return kind;
    }
    RangeKind alias = RANGE_KIND_ALIASES.get(compact);
    if (alias != null) return alias;
    throw new IllegalArgumentException(
        "Unknown range kind: " + text + ". Expected one of " + Arrays.toString(RangeKind.values()));
  }

  /** "floating", or an ISO date to anchor fortnights at. */
  public static BiWeeklyAnchoring parseAnchoring(String text) {
    String norm = normalize(text, "anchoring");
    if (norm.equalsIgnoreCase("floating")) {
      return BiWeeklyAnchoring.floating();
    }
    return BiWeeklyAnchoring.anchoredAt(parseDate(norm));
  }

  public static DayOfWeek parseDayOfWeek(String text) {
    String norm = enumName(text, "dayOfWeek");
    try {
      return DayOfWeek.valueOf(norm);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown day of week: " + text, e);
    }
  }

  public static ZoneId parseZone(String text) {
    String norm = normalize(text, "zone");
    try {
      return ZoneId.of(norm);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Unknown zone: " + text, e);
    }
  }

  private enum AmountKind { DURATION, PERIOD }

  private static AmountKind classify(String s) {
    // In ISO-8601 'T' separates the date part from the time part
    if (s.contains("T")) return AmountKind.DURATION;
    return AmountKind.PERIOD;
  }

  private static String enumName(String text, String what) {
    return normalize(text, what).toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
  }

  private static String normalize(String text, String what) {
    if (text == null) {
      throw new IllegalArgumentException(what + " must be non-null");
    }
    String norm = text.trim();
    if (norm.isEmpty()) {
      throw new IllegalArgumentException(what + " must not be blank");
    }
    return norm;
  }
}
