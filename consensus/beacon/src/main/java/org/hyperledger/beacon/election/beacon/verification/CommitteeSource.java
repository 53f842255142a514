package org.hyperledger.beacon.election.beacon.verification;

import java.util.List;

import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.types.Epoch;

/** Supplies the committees a chain actually used, to check recomputed committees against. */
@FunctionalInterface
public interface CommitteeSource {

  /**
   * Returns every committee of {@code epoch}, ordered by slot then committee index.
   *
   * @param epoch the epoch
   * @return the committees
   * @throws org.hyperledger.beacon.election.beacon.loader.ChainDataException if the committees
   *     cannot be obtained
   */
  List<BeaconCommittee> committeesForEpoch(Epoch epoch);
}
