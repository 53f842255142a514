package org.hyperledger.beacon.election.beacon.verification;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hyperledger.beacon.election.beacon.committee.CommitteeCalculator;
import org.hyperledger.beacon.election.beacon.committee.EpochShuffling;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.LightState;
import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;

/**
 * Recomputes the committees of an epoch and compares them with the committees the chain used.
 *
 * <p>A mismatch is reported in the returned {@link VerificationResult}; it is never thrown. The
 * state is only read.
 */
public class ElectionVerifier {

  private static final Logger LOG = LogManager.getLogger(ElectionVerifier.class);

  private final CommitteeCalculator calculator;

  public ElectionVerifier(final CommitteeCalculator calculator) {
    this.calculator = checkNotNull(calculator, "calculator");
  }

  public VerificationResult verifyEpoch(
      final LightState state, final Epoch epoch, final CommitteeSource source) {
    final Stopwatch fetch = Stopwatch.createStarted();
    final List<BeaconCommittee> expected = source.committeesForEpoch(epoch);
    LOG.info("Loaded {} expected committees for epoch {} ({})", expected.size(), epoch, fetch);
    return verifyEpoch(state, epoch, expected);
  }

  /**
   * Recomputes every committee of {@code epoch} and compares the concatenation, in slot then
   * committee index order, with the concatenation of {@code expected}.
   *
   * @param state the light state
   * @param epoch the epoch
   * @param expected the expected committees, ordered by slot then committee index
   * @return the comparison outcome
   */
  public VerificationResult verifyEpoch(
      final LightState state, final Epoch epoch, final List<BeaconCommittee> expected) {
    final Stopwatch shuffleTime = Stopwatch.createStarted();
    final EpochShuffling shuffling = calculator.computeShuffling(state, epoch);
    LOG.info(
        "Shuffled {} active validators of epoch {} ({})",
        shuffling.activeCount(),
        epoch,
        shuffleTime);

    final Stopwatch committeeTime = Stopwatch.createStarted();
    final List<BeaconCommittee> computed = calculator.computeEpochCommittees(shuffling);
    LOG.info(
        "Computed {} committees for epoch {} ({})", computed.size(), epoch, committeeTime);

    final VerificationResult result = compare(epoch, computed, expected);
    if (result.passed()) {
      LOG.info("Election for epoch {} passed", epoch);
    } else {
      LOG.warn(
          "Election for epoch {} failed: {} committees differ, first difference at position {}",
          epoch,
          result.mismatches().size(),
          result.firstMismatch().isPresent() ? result.firstMismatch().getAsInt() : "none");
      result.mismatches().forEach(mismatch -> LOG.debug("Mismatch {}", mismatch));
    }
    return result;
  }

  /**
   * Verifies every epoch from {@code fromEpoch} to {@code toEpoch}, both inclusive, against the
   * same state.
   *
   * @param state the light state
   * @param fromEpoch first epoch
   * @param toEpoch last epoch
   * @param source the expected committees
   * @return one result per epoch, in epoch order
   */
  public List<VerificationResult> verifyRange(
      final LightState state,
      final Epoch fromEpoch,
      final Epoch toEpoch,
      final CommitteeSource source) {
    checkArgument(
        !toEpoch.isBefore(fromEpoch), "Epoch range [%s, %s] is empty", fromEpoch, toEpoch);
    final List<VerificationResult> results = new ArrayList<>();
    Epoch epoch = fromEpoch;
    while (true) {
      LOG.info("Election for epoch {}/{}", epoch, toEpoch);
      results.add(verifyEpoch(state, epoch, source));
      if (epoch.equals(toEpoch)) {
        break;
      }
      epoch = epoch.next();
    }
    return results;
  }

  static VerificationResult compare(
      final Epoch epoch,
      final List<BeaconCommittee> computed,
      final List<BeaconCommittee> expected) {
    final List<ValidatorIndex> computedFlat = flatten(computed);
    final List<ValidatorIndex> expectedFlat = flatten(expected);
    final OptionalInt firstMismatch = firstMismatch(computedFlat, expectedFlat);
    return new VerificationResult(
        epoch,
        firstMismatch.isEmpty(),
        computedFlat.size(),
        expectedFlat.size(),
        firstMismatch,
        committeeMismatches(computed, expected));
  }

  private static List<ValidatorIndex> flatten(final List<BeaconCommittee> committees) {
    final List<ValidatorIndex> flat = new ArrayList<>();
    committees.forEach(committee -> flat.addAll(committee.validators()));
    return flat;
  }

  private static OptionalInt firstMismatch(
      final List<ValidatorIndex> computed, final List<ValidatorIndex> expected) {
    final int common = Math.min(computed.size(), expected.size());
    for (int i = 0; i < common; i++) {
      if (!computed.get(i).equals(expected.get(i))) {
        return OptionalInt.of(i);
      }
    }
    return computed.size() == expected.size() ? OptionalInt.empty() : OptionalInt.of(common);
  }

  private static List<CommitteeMismatch> committeeMismatches(
      final List<BeaconCommittee> computed, final List<BeaconCommittee> expected) {
    final Map<CommitteeKey, BeaconCommittee> expectedByKey = new LinkedHashMap<>();
    expected.forEach(committee -> expectedByKey.put(CommitteeKey.of(committee), committee));

    final List<CommitteeMismatch> mismatches = new ArrayList<>();
    for (final BeaconCommittee committee : computed) {
      final BeaconCommittee match = expectedByKey.remove(CommitteeKey.of(committee));
      final List<ValidatorIndex> expectedMembers =
          match == null ? Collections.emptyList() : match.validators();
      if (!committee.validators().equals(expectedMembers)) {
        mismatches.add(
            new CommitteeMismatch(
                committee.slot(), committee.index(), committee.validators(), expectedMembers));
      }
    }
    // expected committees the computation did not produce
    expectedByKey
        .values()
        .forEach(
            committee ->
                mismatches.add(
                    new CommitteeMismatch(
                        committee.slot(),
                        committee.index(),
                        Collections.emptyList(),
                        committee.validators())));
    return mismatches;
  }

  private record CommitteeKey(Slot slot, CommitteeIndex index) {
    static CommitteeKey of(final BeaconCommittee committee) {
      return new CommitteeKey(committee.slot(), committee.index());
    }
  }
}
