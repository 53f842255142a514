package org.hyperledger.beacon.election.beacon.containers.beacon_state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.types.Epoch;

/**
 * The ring of historical RANDAO mixes, indexed by {@code epoch mod length}.
 *
 * <p>The ring is immutable. Slots that were never populated read as {@link Bytes32#ZERO}. Updating
 * a slot with {@link #withMix(Epoch, Bytes32)} produces a new ring, leaving rings already handed
 * to in-flight computations untouched.
 */
public final class RandaoMixes {

  private final Bytes32[] mixes;

  private RandaoMixes(final Bytes32[] mixes) {
    this.mixes = mixes;
  }

  /**
   * Creates a ring whose slots all hold the zero mix.
   *
   * @param length ring length, {@code EPOCHS_PER_HISTORICAL_VECTOR}
   * @return the empty ring
   */
  public static RandaoMixes empty(final int length) {
    checkArgument(length > 0, "Ring length must be positive: %s", length);
    final Bytes32[] mixes = new Bytes32[length];
    Arrays.fill(mixes, Bytes32.ZERO);
    return new RandaoMixes(mixes);
  }

  public int length() {
    return mixes.length;
  }

  /**
   * Returns the mix stored for {@code epoch}, wrapping around the ring.
   *
   * @param epoch the epoch
   * @return the mix at ring position {@code epoch mod length}
   */
  public Bytes32 get(final Epoch epoch) {
    return mixes[position(epoch)];
  }

  /**
   * Returns the mix at a raw ring position.
   *
   * @param position position in {@code [0, length)}
   * @return the mix
   */
  public Bytes32 getAt(final int position) {
    checkArgument(
        position >= 0 && position < mixes.length,
        "Ring position %s out of range [0, %s)",
        position,
        mixes.length);
    return mixes[position];
  }

  /**
   * Returns a copy of this ring with the slot of {@code epoch} replaced.
   *
   * @param epoch the epoch whose slot is written
   * @param mix the new mix
   * @return the updated ring
   */
  public RandaoMixes withMix(final Epoch epoch, final Bytes32 mix) {
    return withMixAt(position(epoch), mix);
  }

  /**
   * Returns a copy of this ring with the slot at {@code position} replaced.
   *
   * @param position position in {@code [0, length)}
   * @param mix the new mix
   * @return the updated ring
   */
  public RandaoMixes withMixAt(final int position, final Bytes32 mix) {
    checkNotNull(mix, "mix");
    checkArgument(
        position >= 0 && position < mixes.length,
        "Ring position %s out of range [0, %s)",
        position,
        mixes.length);
    final Bytes32[] copy = mixes.clone();
    copy[position] = mix;
    return new RandaoMixes(copy);
  }

  private int position(final Epoch epoch) {
    return (int) epoch.value().mod(mixes.length).value();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RandaoMixes)) {
      return false;
    }
    return Arrays.equals(mixes, ((RandaoMixes) o).mixes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(mixes);
  }

  @Override
  public String toString() {
    final long populated = Arrays.stream(mixes).filter(mix -> !mix.isZero()).count();
    return "RandaoMixes{length=" + mixes.length + ", populated=" + populated + "}";
  }
}
