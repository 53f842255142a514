package org.hyperledger.beacon.election.beacon.types;

/** A slot number. */
public record Slot(UInt64 value) implements Comparable<Slot> {

  public static Slot of(final long slot) {
    return new Slot(UInt64.valueOf(slot));
  }

  public static Slot fromString(final String slot) {
    return new Slot(UInt64.valueOf(slot));
  }

  public Slot plus(final long slots) {
    return new Slot(value.plus(slots));
  }

  @Override
  public int compareTo(final Slot other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
