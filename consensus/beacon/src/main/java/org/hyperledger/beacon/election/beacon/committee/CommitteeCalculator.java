package org.hyperledger.beacon.election.beacon.committee;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.LightState;
import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.helpers.ActiveValidators;
import org.hyperledger.beacon.election.beacon.helpers.ChainMath;
import org.hyperledger.beacon.election.beacon.helpers.Seeds;
import org.hyperledger.beacon.election.beacon.shuffling.SwapOrNotShuffle;
import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.DomainType;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;
import org.hyperledger.beacon.election.config.ChainConfig;

/** Splits the shuffled active validator set of an epoch into beacon committees. */
public class CommitteeCalculator {

  private static final Logger LOG = LogManager.getLogger(CommitteeCalculator.class);

  private final ChainConfig config;
  private final SwapOrNotShuffle shuffle;

  public CommitteeCalculator(final ChainConfig config) {
    this(config, SwapOrNotShuffle.forConfig(config));
  }

  public CommitteeCalculator(final ChainConfig config, final SwapOrNotShuffle shuffle) {
    this.config = checkNotNull(config, "config");
    this.shuffle = checkNotNull(shuffle, "shuffle");
  }

  public ChainConfig config() {
    return config;
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#get_committee_count_per_slot
  /**
   * Number of committees in each slot for an epoch with {@code activeValidatorCount} active
   * validators, clamped to {@code [1, MAX_COMMITTEES_PER_SLOT]}.
   */
  public int committeeCountPerSlot(final int activeValidatorCount) {
    final int target =
        activeValidatorCount / config.slotsPerEpoch() / config.targetCommitteeSize();
    return Math.max(1, Math.min(config.maxCommitteesPerSlot(), target));
  }

  public int getCommitteeCountPerSlot(final LightState state, final Epoch epoch) {
    checkConfig(state);
    return committeeCountPerSlot(ActiveValidators.activeIndices(state.validators(), epoch).length);
  }

  /**
   * Computes the committee shuffling of {@code epoch}: filters the active validators, derives the
   * attester seed and shuffles the active set once.
   *
   * @param state the light state
   * @param epoch the epoch
   * @return the shuffling
   * @throws IllegalStateException if no validator is active at {@code epoch}
   */
  public EpochShuffling computeShuffling(final LightState state, final Epoch epoch) {
    checkConfig(state);
    final int[] activeIndices = ActiveValidators.activeIndices(state.validators(), epoch);
    checkState(activeIndices.length > 0, "No active validator at epoch %s", epoch);

    final Bytes32 seed = Seeds.computeSeed(state, epoch, DomainType.BEACON_ATTESTER);
    final int[] shuffled = shuffle.shuffle(activeIndices, seed);
    final int committeesPerSlot = committeeCountPerSlot(activeIndices.length);
    LOG.debug(
        "Shuffled {} active validators for epoch {} with seed {}, {} committees per slot",
        activeIndices.length,
        epoch,
        seed,
        committeesPerSlot);
    return new EpochShuffling(epoch, seed, activeIndices, shuffled, committeesPerSlot);
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#get_beacon_committee
  /**
   * Returns the committee at {@code (slot, index)}, recomputing the shuffling of the slot's epoch.
   * Use {@link #getBeaconCommittee(EpochShuffling, Slot, CommitteeIndex)} when several committees
   * of the same epoch are needed.
   */
  public BeaconCommittee getBeaconCommittee(
      final LightState state, final Slot slot, final CommitteeIndex index) {
    final Epoch epoch = ChainMath.epochFromSlot(config, slot);
    return getBeaconCommittee(computeShuffling(state, epoch), slot, index);
  }

  /**
   * Returns the committee at {@code (slot, index)} from a precomputed shuffling.
   *
   * @param shuffling the shuffling of the slot's epoch
   * @param slot the slot
   * @param index the committee index within the slot
   * @return the committee
   * @throws IllegalArgumentException if the slot is not in the shuffling's epoch or the index is
   *     not below the committee count per slot
   */
  public BeaconCommittee getBeaconCommittee(
      final EpochShuffling shuffling, final Slot slot, final CommitteeIndex index) {
    final Epoch epoch = ChainMath.epochFromSlot(config, slot);
    checkArgument(
        epoch.equals(shuffling.epoch()),
        "Slot %s belongs to epoch %s, not to the shuffled epoch %s",
        slot,
        epoch,
        shuffling.epoch());
    checkArgument(
        index.value() < shuffling.committeesPerSlot(),
        "Committee index %s out of range, epoch %s has %s committees per slot",
        index,
        epoch,
        shuffling.committeesPerSlot());

    final int slotOffset =
        slot.value().minus(ChainMath.firstSlotOfEpoch(config, epoch).value()).intValue();
    final int committeeCount = committeeCount(shuffling);
    final int position = slotOffset * shuffling.committeesPerSlot() + index.value();
    return toCommittee(slot, index, computeCommittee(shuffling, position, committeeCount));
  }

  /**
   * Materialises every committee of the shuffled epoch, ordered by slot then committee index.
   *
   * <p>Each committee is an independent slice of the shuffled sequence; slices are computed in
   * parallel.
   *
   * @param shuffling the shuffling of the epoch
   * @return the committees in canonical order
   */
  public List<BeaconCommittee> computeEpochCommittees(final EpochShuffling shuffling) {
    final int committeesPerSlot = shuffling.committeesPerSlot();
    final int committeeCount = committeeCount(shuffling);
    final Slot firstSlot = ChainMath.firstSlotOfEpoch(config, shuffling.epoch());
    return IntStream.range(0, committeeCount)
        .parallel()
        .mapToObj(
            position ->
                toCommittee(
                    firstSlot.plus(position / committeesPerSlot),
                    CommitteeIndex.of(position % committeesPerSlot),
                    computeCommittee(shuffling, position, committeeCount)))
        .collect(Collectors.toList());
  }

  public List<BeaconCommittee> computeEpochCommittees(final LightState state, final Epoch epoch) {
    return computeEpochCommittees(computeShuffling(state, epoch));
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#compute_committee
  /**
   * Returns slice {@code [n * position / count, n * (position + 1) / count)} of the shuffled
   * indices, {@code n} being the active validator count.
   */
  static int[] computeCommittee(
      final EpochShuffling shuffling, final int position, final int committeeCount) {
    checkArgument(
        position >= 0 && position < committeeCount,
        "Committee position %s out of range [0, %s)",
        position,
        committeeCount);
    final long activeCount = shuffling.activeCount();
    final int start = Ints.checkedCast(activeCount * position / committeeCount);
    final int end = Ints.checkedCast(activeCount * (position + 1) / committeeCount);
    return shuffling.shuffledSlice(start, end);
  }

  private int committeeCount(final EpochShuffling shuffling) {
    return Math.multiplyExact(shuffling.committeesPerSlot(), config.slotsPerEpoch());
  }

  private static BeaconCommittee toCommittee(
      final Slot slot, final CommitteeIndex index, final int[] members) {
    final List<ValidatorIndex> validators = new ArrayList<>(members.length);
    for (final int member : members) {
      validators.add(ValidatorIndex.of(member));
    }
    return new BeaconCommittee(slot, index, validators);
  }

  private void checkConfig(final LightState state) {
    checkArgument(
        config.equals(state.config()),
        "State chain config %s differs from the calculator's %s",
        state.config(),
        config);
  }
}
