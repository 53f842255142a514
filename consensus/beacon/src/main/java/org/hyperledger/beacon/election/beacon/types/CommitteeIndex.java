package org.hyperledger.beacon.election.beacon.types;

import static com.google.common.base.Preconditions.checkArgument;

/** Index of a committee within a slot. */
public record CommitteeIndex(int value) implements Comparable<CommitteeIndex> {

  public CommitteeIndex {
    checkArgument(value >= 0, "Negative committee index: %s", value);
  }

  public static CommitteeIndex of(final int index) {
    return new CommitteeIndex(index);
  }

  public static CommitteeIndex fromString(final String index) {
    return new CommitteeIndex(UInt64.valueOf(index).intValue());
  }

  @Override
  public int compareTo(final CommitteeIndex other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }
}
