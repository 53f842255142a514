package org.hyperledger.beacon.election.beacon.types;

import static com.google.common.base.Preconditions.checkArgument;

/** Position of a validator in the registry. Stable for the validator's lifetime. */
public record ValidatorIndex(int value) implements Comparable<ValidatorIndex> {

  public ValidatorIndex {
    checkArgument(value >= 0, "Negative validator index: %s", value);
  }

  public static ValidatorIndex of(final int index) {
    return new ValidatorIndex(index);
  }

  public static ValidatorIndex fromString(final String index) {
    return new ValidatorIndex(UInt64.valueOf(index).intValue());
  }

  @Override
  public int compareTo(final ValidatorIndex other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
