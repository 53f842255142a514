package org.hyperledger.beacon.election.beacon.containers.misc;

import java.util.List;

import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

public record BeaconCommittee(
    Slot slot,
    CommitteeIndex index,
    List<ValidatorIndex> validators
) {
  public BeaconCommittee {
    validators = List.copyOf(validators);
  }

  public int size() {
    return validators.size();
  }
}
