package org.hyperledger.beacon.election.beacon.helpers;

import java.util.Arrays;
import java.util.List;

import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.types.Epoch;

/** Filters the validator registry down to the validators active at an epoch. */
public final class ActiveValidators {

  private ActiveValidators() {}

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#is_active_validator
  public static boolean isActive(final Validator validator, final Epoch epoch) {
    return epoch.isAtOrAfter(validator.activationEpoch()) && epoch.isBefore(validator.exitEpoch());
  }

  // https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#get_active_validator_indices
  /**
   * Returns the registry indices of the validators active at {@code epoch}, in ascending order.
   *
   * <p>The result may be empty; shuffling an empty set is rejected further down.
   *
   * @param validators the registry
   * @param epoch the epoch
   * @return the active indices
   */
  public static int[] activeIndices(final List<Validator> validators, final Epoch epoch) {
    final int[] active = new int[validators.size()];
    int count = 0;
    for (int i = 0; i < validators.size(); i++) {
      if (isActive(validators.get(i), epoch)) {
        active[count++] = i;
      }
    }
    return count == active.length ? active : Arrays.copyOf(active, count);
  }
}
