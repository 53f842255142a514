package org.hyperledger.beacon.election.beacon.types;

/** An epoch number. */
public record Epoch(UInt64 value) implements Comparable<Epoch> {

  public static final Epoch GENESIS = new Epoch(UInt64.ZERO);

  /** Marks an activation or exit that has not been scheduled. */
  public static final Epoch FAR_FUTURE_EPOCH = new Epoch(UInt64.MAX_VALUE);

  public static Epoch of(final long epoch) {
    return new Epoch(UInt64.valueOf(epoch));
  }

  public static Epoch fromString(final String epoch) {
    return new Epoch(UInt64.valueOf(epoch));
  }

  public Epoch next() {
    return new Epoch(value.plus(1));
  }

  public boolean isBefore(final Epoch other) {
    return value.isLessThan(other.value);
  }

  public boolean isAtOrAfter(final Epoch other) {
    return value.isGreaterThanOrEqualTo(other.value);
  }

  @Override
  public int compareTo(final Epoch other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
