package org.hyperledger.beacon.election.beacon.verification;

import java.util.List;
import java.util.OptionalInt;

import org.hyperledger.beacon.election.beacon.types.Epoch;

/**
 * Outcome of checking the recomputed committees of one epoch against the expected ones.
 *
 * @param epoch the verified epoch
 * @param passed whether the concatenated committees are identical
 * @param computedLength number of validator indices in the recomputed committees
 * @param expectedLength number of validator indices in the expected committees
 * @param firstMismatch first position at which the concatenated sequences differ, if any
 * @param mismatches the individual committees that differ
 */
public record VerificationResult(
    Epoch epoch,
    boolean passed,
    int computedLength,
    int expectedLength,
    OptionalInt firstMismatch,
    List<CommitteeMismatch> mismatches
) {
  public VerificationResult {
    mismatches = List.copyOf(mismatches);
  }
}
