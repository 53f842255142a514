package org.hyperledger.beacon.election.beacon.shuffling;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.helpers.Hashing;
import org.hyperledger.beacon.election.beacon.helpers.Serialization;
import org.hyperledger.beacon.election.config.ChainConfig;

/**
 * The swap-or-not shuffle used to elect committees.
 *
 * <p>Two forms are provided. {@link #computeShuffledIndex(int, int, Bytes32)} follows one index
 * through every round and suits callers that need a single position. {@link #shuffleList(int[],
 * Bytes32)} permutes a whole list in place, hashing each 256-position block once per round. For
 * the same seed, {@code shuffleList} applied to {@code [0, n)} leaves {@code
 * computeShuffledIndex(i, n, seed)} at position {@code i}.
 */
public class SwapOrNotShuffle {

  private static final int SEED_LENGTH = Bytes32.SIZE;
  private static final int PIVOT_PREIMAGE_LENGTH = SEED_LENGTH + 1;
  private static final int SOURCE_PREIMAGE_LENGTH = SEED_LENGTH + 1 + 4;

  private final int roundCount;

  public SwapOrNotShuffle(final int roundCount) {
    checkArgument(
        roundCount > 0 && roundCount <= 256, "Round count must be in [1, 256]: %s", roundCount);
    this.roundCount = roundCount;
  }

  public static SwapOrNotShuffle forConfig(final ChainConfig config) {
    return new SwapOrNotShuffle(config.shuffleRoundCount());
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#compute_shuffled_index
  /**
   * Returns the position {@code index} is moved to when shuffling {@code indexCount} elements.
   *
   * @param index the original position
   * @param indexCount number of elements being shuffled
   * @param seed the shuffling seed
   * @return the shuffled position
   * @throws IllegalArgumentException if {@code indexCount} is not positive or {@code index} is
   *     outside {@code [0, indexCount)}
   */
  public int computeShuffledIndex(final int index, final int indexCount, final Bytes32 seed) {
    checkNotNull(seed, "seed");
    checkArgument(indexCount > 0, "Cannot shuffle an empty index range");
    checkArgument(
        index >= 0 && index < indexCount, "Index %s out of range [0, %s)", index, indexCount);

    int current = index;
    for (int round = 0; round < roundCount; round++) {
      final Bytes roundBytes = Serialization.uint8(round);
      final long pivot =
          Long.remainderUnsigned(
              Serialization.bytesToUint64(Hashing.sha256(seed, roundBytes)), indexCount);
      final int flip = (int) ((pivot + indexCount - current) % indexCount);
      final int position = Math.max(current, flip);
      final Bytes32 source =
          Hashing.sha256(seed, roundBytes, Serialization.uint32(position / 256));
      final int bits = source.get((position % 256) / 8);
      if (((bits >> (position % 8)) & 1) != 0) {
        current = flip;
      }
    }
    return current;
  }

  /**
   * Shuffles {@code elements} in place.
   *
   * <p>The caller hands over exclusive write access to the array for the duration of the call.
   *
   * @param elements the values to permute
   * @param seed the shuffling seed
   * @throws IllegalArgumentException if {@code elements} is empty
   */
  public void shuffleList(final int[] elements, final Bytes32 seed) {
    checkNotNull(elements, "elements");
    checkNotNull(seed, "seed");
    checkArgument(elements.length > 0, "Cannot shuffle an empty list");

    final long listSize = elements.length;
    final byte[] buffer = new byte[SOURCE_PREIMAGE_LENGTH];
    System.arraycopy(seed.toArrayUnsafe(), 0, buffer, 0, SEED_LENGTH);

    for (int round = roundCount - 1; round >= 0; round--) {
      buffer[SEED_LENGTH] = (byte) round;
      final long pivot =
          Long.remainderUnsigned(
              Serialization.bytesToUint64(
                  Bytes.wrap(Hashing.sha256(buffer, PIVOT_PREIMAGE_LENGTH))),
              listSize);
      final long mirror1 = (pivot + 2) / 2;
      final long mirror2 = (pivot + listSize) / 2;

      byte[] source = null;
      for (long i = mirror1; i <= mirror2; i++) {
        final long flip;
        final int bitIndex;
        if (i <= pivot) {
          flip = pivot - i;
          bitIndex = (int) (i & 0xff);
          if (bitIndex == 0 || i == mirror1) {
            source = hashBlock(buffer, i >> 8);
          }
        } else {
          flip = pivot + listSize - i;
          bitIndex = (int) (flip & 0xff);
          if (bitIndex == 0xff || i == pivot + 1) {
            source = hashBlock(buffer, flip >> 8);
          }
        }
        if (((source[bitIndex >> 3] >> (bitIndex & 0x07)) & 1) != 0) {
          final int tmp = elements[(int) i];
          elements[(int) i] = elements[(int) flip];
          elements[(int) flip] = tmp;
        }
      }
    }
  }

  /**
   * Returns a shuffled copy of {@code elements}, leaving the input untouched.
   *
   * @param elements the values to permute
   * @param seed the shuffling seed
   * @return the permuted copy
   */
  public int[] shuffle(final int[] elements, final Bytes32 seed) {
    final int[] shuffled = elements.clone();
    shuffleList(shuffled, seed);
    return shuffled;
  }

  private static byte[] hashBlock(final byte[] buffer, final long block) {
    buffer[SEED_LENGTH + 1] = (byte) block;
    buffer[SEED_LENGTH + 2] = (byte) (block >> 8);
    buffer[SEED_LENGTH + 3] = (byte) (block >> 16);
    buffer[SEED_LENGTH + 4] = (byte) (block >> 24);
    return Hashing.sha256(buffer, SOURCE_PREIMAGE_LENGTH);
  }
}
