package org.hyperledger.beacon.election.beacon.types;

/** An amount in Gwei. */
public record Gwei(UInt64 value) {

  public static Gwei of(final long amount) {
    return new Gwei(UInt64.valueOf(amount));
  }

  public static Gwei fromString(final String amount) {
    return new Gwei(UInt64.valueOf(amount));
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
