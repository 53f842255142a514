package org.hyperledger.beacon.election.beacon.verification;

import java.util.List;

import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

/**
 * A committee whose recomputed members differ from the expected ones. A committee missing on one
 * side is reported with an empty member list on that side.
 */
public record CommitteeMismatch(
    Slot slot,
    CommitteeIndex index,
    List<ValidatorIndex> computed,
    List<ValidatorIndex> expected
) {
  public CommitteeMismatch {
    computed = List.copyOf(computed);
    expected = List.copyOf(expected);
  }
}
