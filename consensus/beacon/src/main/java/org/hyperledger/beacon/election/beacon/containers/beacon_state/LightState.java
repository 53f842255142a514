package org.hyperledger.beacon.election.beacon.containers.beacon_state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.helpers.ChainMath;
import org.hyperledger.beacon.election.beacon.helpers.Seeds;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.config.ChainConfig;

/**
 * The subset of the beacon state the committee election reads: the current slot, the validator
 * registry (a validator's index is its position in the list) and the RANDAO mix ring.
 */
public record LightState(
    ChainConfig config,
    Slot slot,
    List<Validator> validators,
    RandaoMixes randaoMixes
) {

  public LightState {
    checkNotNull(config, "config");
    checkNotNull(slot, "slot");
    checkNotNull(randaoMixes, "randaoMixes");
    checkArgument(
        randaoMixes.length() == config.epochsPerHistoricalVector(),
        "RANDAO ring length %s does not match EPOCHS_PER_HISTORICAL_VECTOR %s",
        randaoMixes.length(),
        config.epochsPerHistoricalVector());
    validators = List.copyOf(validators);
  }

  /**
   * Builds the state used to start an election run at {@code startEpoch}.
   *
   * <p>The ring is empty except for {@code seedMix}, which is stored in the slot read when deriving
   * seeds for {@code startEpoch}. The current slot is the first slot of that epoch.
   *
   * @param config chain constants
   * @param startEpoch first epoch to elect committees for
   * @param validators the validator registry
   * @param seedMix the RANDAO value (a block's {@code prev_randao}) for the start epoch
   * @return the initial state
   */
  public static LightState fromSnapshot(
      final ChainConfig config,
      final Epoch startEpoch,
      final List<Validator> validators,
      final Bytes32 seedMix) {
    return new LightState(
            config,
            ChainMath.firstSlotOfEpoch(config, startEpoch),
            validators,
            RandaoMixes.empty(config.epochsPerHistoricalVector()))
        .withSeedMix(startEpoch, seedMix);
  }

  public Epoch currentEpoch() {
    return ChainMath.epochFromSlot(config, slot);
  }

  /**
   * Returns a new state whose ring holds {@code mix} in the slot read when deriving seeds for
   * {@code epoch}.
   *
   * @param epoch the epoch the mix seeds
   * @param mix the RANDAO value
   * @return the updated state
   */
  public LightState withSeedMix(final Epoch epoch, final Bytes32 mix) {
    final int position = Seeds.seedRingPosition(config, epoch);
    return new LightState(config, slot, validators, randaoMixes.withMixAt(position, mix));
  }

  public LightState withSlot(final Slot newSlot) {
    return new LightState(config, newSlot, validators, randaoMixes);
  }
}
