package org.hyperledger.beacon.election.beacon.containers.misc;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.hyperledger.beacon.election.beacon.types.BLSPubKey;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Gwei;

// https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#validator
// Only the fields the committee election reads are kept.
public record Validator(
    BLSPubKey pubkey, Gwei effectiveBalance, Epoch activationEpoch, Epoch exitEpoch) {

  public Validator {
    checkNotNull(pubkey, "pubkey");
    checkNotNull(effectiveBalance, "effectiveBalance");
    checkNotNull(activationEpoch, "activationEpoch");
    checkNotNull(exitEpoch, "exitEpoch");
    checkArgument(
        !exitEpoch.isBefore(activationEpoch),
        "Validator exits at epoch %s before its activation at epoch %s",
        exitEpoch,
        activationEpoch);
  }
}
