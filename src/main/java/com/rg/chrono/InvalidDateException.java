package com.rg.chrono;

import java.util.Objects;

/**
 * Thrown when a calendar field is outside its valid range at construction time.
 * Arithmetic that clamps the day-of-month never throws this.
 */
public class InvalidDateException extends IllegalArgumentException {

  public enum DateField {
    YEAR("year"),
    MONTH("month"),
    DAY("day-of-month"),
    DAY_OF_YEAR("day-of-year"),
    EPOCH_DAY("epoch-day"),
    HOUR("hour"),
    MINUTE("minute"),
    SECOND("second"),
    NANO("nano-of-second");

    private final String displayName;

    DateField(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }
  }

  private final DateField field;
  private final long value;

  public InvalidDateException(DateField field, long value, String detail) {
    super("Invalid " + Objects.requireNonNull(field, "field").displayName() + " " + value + ": " + detail);
    this.field = field;
    this.value = value;
  }

  public InvalidDateException(DateField field, long value, String detail, Throwable cause) {
    this(field, value, detail);
    initCause(cause);
  }

  public DateField field() {
    return field;
  }

  public long value() {
    return value;
  }
}
