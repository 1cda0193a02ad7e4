package com.rg.chrono;

/**
 * A date range whose bounds break its period rule. Range factories never produce one, so seeing
 * this means a range rule is wrong, not that the caller passed bad input.
 */
public class InvalidRangeException extends IllegalStateException {

  private final String kind;
  private final CalendarDate start;
  private final CalendarDate end;

  public InvalidRangeException(String kind, CalendarDate start, CalendarDate end, String rule) {
    super(kind + " range [" + start + ", " + end + "] violates: " + rule);
    this.kind = kind;
    this.start = start;
    this.end = end;
  }

  public String kind() {
    return kind;
  }

  public CalendarDate start() {
    return start;
  }

  public CalendarDate end() {
    return end;
  }
}
