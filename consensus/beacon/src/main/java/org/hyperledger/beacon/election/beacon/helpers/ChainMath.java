package org.hyperledger.beacon.election.beacon.helpers;

import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.config.ChainConfig;

/** Conversions between slots and epochs. */
public final class ChainMath {

  private ChainMath() {}

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#compute_epoch_at_slot
  public static Epoch epochFromSlot(final ChainConfig config, final Slot slot) {
    return new Epoch(slot.value().dividedBy(config.slotsPerEpoch()));
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#compute_start_slot_at_epoch
  /**
   * Returns the first slot of {@code epoch}.
   *
   * @throws ArithmeticException if the slot number overflows 64 bits
   */
  public static Slot firstSlotOfEpoch(final ChainConfig config, final Epoch epoch) {
    return new Slot(epoch.value().times(config.slotsPerEpoch()));
  }
}
