package com.rg.chrono;

/** Thrown when a {@link ChronoUnit} cannot operate on the given kind of value. */
public class UnsupportedUnitException extends UnsupportedOperationException {

  private final ChronoUnit unit;
  private final Class<?> valueType;

  public UnsupportedUnitException(ChronoUnit unit, Class<?> valueType) {
    super(unit + " is not supported for " + valueType.getSimpleName());
    this.unit = unit;
    this.valueType = valueType;
  }

  public UnsupportedUnitException(ChronoUnit unit, Class<?> startType, Class<?> endType) {
    super(unit + ".between requires two values of the same type, got "
        + startType.getSimpleName() + " and " + endType.getSimpleName());
    this.unit = unit;
    this.valueType = startType;
  }

  public ChronoUnit unit() {
    return unit;
  }

  public Class<?> valueType() {
    return valueType;
  }
}
