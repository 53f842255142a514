package org.hyperledger.beacon.election.beacon.committee;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.types.Epoch;

/**
 * The committee shuffling of one epoch: the attester seed, the active validator indices in
 * registry order, the same indices after shuffling, and the per-slot committee count.
 *
 * <p>Instances are immutable once built, so committees of the epoch can be sliced out of the
 * shuffled sequence concurrently.
 */
public final class EpochShuffling {

  private final Epoch epoch;
  private final Bytes32 seed;
  private final int[] activeIndices;
  private final int[] shuffledIndices;
  private final int committeesPerSlot;

  EpochShuffling(
      final Epoch epoch,
      final Bytes32 seed,
      final int[] activeIndices,
      final int[] shuffledIndices,
      final int committeesPerSlot) {
    this.epoch = checkNotNull(epoch, "epoch");
    this.seed = checkNotNull(seed, "seed");
    this.activeIndices = activeIndices;
    this.shuffledIndices = shuffledIndices;
    this.committeesPerSlot = committeesPerSlot;
  }

  public Epoch epoch() {
    return epoch;
  }

  public Bytes32 seed() {
    return seed;
  }

  public int activeCount() {
    return activeIndices.length;
  }

  public int committeesPerSlot() {
    return committeesPerSlot;
  }

  /** A copy of the active indices in registry order. */
  public int[] activeIndices() {
    return activeIndices.clone();
  }

  /** A copy of the shuffled active indices. */
  public int[] shuffledIndices() {
    return shuffledIndices.clone();
  }

  int[] shuffledSlice(final int start, final int end) {
    return Arrays.copyOfRange(shuffledIndices, start, end);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EpochShuffling)) {
      return false;
    }
    final EpochShuffling that = (EpochShuffling) o;
    return committeesPerSlot == that.committeesPerSlot
        && epoch.equals(that.epoch)
        && seed.equals(that.seed)
        && Arrays.equals(activeIndices, that.activeIndices)
        && Arrays.equals(shuffledIndices, that.shuffledIndices);
  }

  @Override
  public int hashCode() {
    return 31 * epoch.hashCode() + seed.hashCode();
  }

  @Override
  public String toString() {
    return "EpochShuffling{epoch="
        + epoch
        + ", seed="
        + seed
        + ", activeCount="
        + activeIndices.length
        + ", committeesPerSlot="
        + committeesPerSlot
        + "}";
  }
}
