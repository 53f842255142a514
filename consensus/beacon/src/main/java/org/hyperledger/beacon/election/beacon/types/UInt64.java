package org.hyperledger.beacon.election.beacon.types;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An unsigned 64-bit integer, stored in the bits of a {@code long}.
 *
 * <p>Arithmetic is exact: any result that does not fit in 64 unsigned bits throws {@link
 * ArithmeticException} instead of wrapping around.
 */
public record UInt64(long value) implements Comparable<UInt64> {

  public static final UInt64 ZERO = new UInt64(0);
  public static final UInt64 ONE = new UInt64(1);
  public static final UInt64 MAX_VALUE = new UInt64(-1L);

  /**
   * Wraps a non-negative {@code long}.
   *
   * @param value the value, must be non-negative
   * @return the unsigned value
   */
  public static UInt64 valueOf(final long value) {
    checkArgument(value >= 0, "Negative value for an unsigned integer: %s", value);
    return new UInt64(value);
  }

  /**
   * Parses a decimal string in {@code [0, 2^64)}, as found in beacon API payloads.
   *
   * @param value the decimal string
   * @return the unsigned value
   * @throws NumberFormatException if the string is not an unsigned 64-bit decimal
   */
  public static UInt64 valueOf(final String value) {
    return new UInt64(Long.parseUnsignedLong(value));
  }

  public UInt64 plus(final long other) {
    return plus(valueOf(other));
  }

  public UInt64 plus(final UInt64 other) {
    final long result = value + other.value;
    if (Long.compareUnsigned(result, value) < 0) {
      throw new ArithmeticException("uint64 overflow: " + this + " + " + other);
    }
    return new UInt64(result);
  }

  public UInt64 minus(final long other) {
    return minus(valueOf(other));
  }

  public UInt64 minus(final UInt64 other) {
    if (Long.compareUnsigned(value, other.value) < 0) {
      throw new ArithmeticException("uint64 underflow: " + this + " - " + other);
    }
    return new UInt64(value - other.value);
  }

  public UInt64 times(final long other) {
    return times(valueOf(other));
  }

  public UInt64 times(final UInt64 other) {
    if (value == 0 || other.value == 0) {
      return ZERO;
    }
    if (Long.compareUnsigned(other.value, Long.divideUnsigned(-1L, value)) > 0) {
      throw new ArithmeticException("uint64 overflow: " + this + " * " + other);
    }
    return new UInt64(value * other.value);
  }

  public UInt64 dividedBy(final long divisor) {
    checkArgument(divisor > 0, "Divisor must be positive: %s", divisor);
    return new UInt64(Long.divideUnsigned(value, divisor));
  }

  public UInt64 mod(final long divisor) {
    checkArgument(divisor > 0, "Divisor must be positive: %s", divisor);
    return new UInt64(Long.remainderUnsigned(value, divisor));
  }

  public boolean isLessThan(final UInt64 other) {
    return compareTo(other) < 0;
  }

  public boolean isGreaterThanOrEqualTo(final UInt64 other) {
    return compareTo(other) >= 0;
  }

  /**
   * Returns the value as an {@code int}.
   *
   * @return the value
   * @throws ArithmeticException if the value does not fit in a non-negative {@code int}
   */
  public int intValue() {
    if (Long.compareUnsigned(value, Integer.MAX_VALUE) > 0) {
      throw new ArithmeticException("uint64 value does not fit in an int: " + this);
    }
    return (int) value;
  }

  @Override
  public int compareTo(final UInt64 other) {
    return Long.compareUnsigned(value, other.value);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
