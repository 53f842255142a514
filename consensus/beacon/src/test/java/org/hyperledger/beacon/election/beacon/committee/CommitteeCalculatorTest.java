package org.hyperledger.beacon.election.beacon.committee;

import static org.hyperledger.beacon.election.beacon.ValidatorFixtures.SEED_MIX;
import static org.hyperledger.beacon.election.beacon.ValidatorFixtures.SMALL_CONFIG;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.ValidatorFixtures;
import org.hyperledger.beacon.election.beacon.containers.beacon_state.LightState;
import org.hyperledger.beacon.election.beacon.containers.misc.BeaconCommittee;
import org.hyperledger.beacon.election.beacon.containers.misc.Validator;
import org.hyperledger.beacon.election.beacon.types.CommitteeIndex;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.hyperledger.beacon.election.beacon.types.Slot;
import org.hyperledger.beacon.election.beacon.types.ValidatorIndex;
import org.hyperledger.beacon.election.config.ChainConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CommitteeCalculatorTest {

  private static final Bytes32 GENESIS_SEED =
      Bytes32.fromHexString("0x717b2e2ba115f0dd051431d6e0a31ea25413599f1179050866e3142c251ecbdd");

  private static final int[][] GENESIS_COMMITTEES = {{3, 2}, {5, 7, 0}, {6, 4}, {9, 8, 1}};

  private final CommitteeCalculator calculator = new CommitteeCalculator(SMALL_CONFIG);

  private static LightState smallState(final List<Validator> validators) {
    return LightState.fromSnapshot(SMALL_CONFIG, Epoch.GENESIS, validators, SEED_MIX);
  }

  @Test
  @DisplayName("Ten validators at genesis form the known committees")
  void knownCommittees() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(10));

    final EpochShuffling shuffling = calculator.computeShuffling(state, Epoch.GENESIS);
    final List<BeaconCommittee> committees = calculator.computeEpochCommittees(shuffling);

    assertEquals(GENESIS_SEED, shuffling.seed());
    assertArrayEquals(new int[] {3, 2, 5, 7, 0, 6, 4, 9, 8, 1}, shuffling.shuffledIndices());
    assertEquals(1, shuffling.committeesPerSlot());
    assertEquals(4, committees.size());
    for (int slot = 0; slot < 4; slot++) {
      final BeaconCommittee committee = committees.get(slot);
      assertEquals(Slot.of(slot), committee.slot());
      assertEquals(CommitteeIndex.of(0), committee.index());
      assertEquals(indices(GENESIS_COMMITTEES[slot]), committee.validators());
    }
  }

  @Test
  @DisplayName("Inactive validators never sit in a committee")
  void inactiveValidatorsAreSkipped() {
    final List<Validator> validators = new ArrayList<>(ValidatorFixtures.activeValidators(10));
    // exited at genesis, pending activation
    validators.add(ValidatorFixtures.validator(10, Epoch.GENESIS, Epoch.GENESIS));
    validators.add(ValidatorFixtures.validator(11, Epoch.of(3), Epoch.FAR_FUTURE_EPOCH));

    final List<BeaconCommittee> committees =
        calculator.computeEpochCommittees(smallState(validators), Epoch.GENESIS);

    for (int slot = 0; slot < 4; slot++) {
      assertEquals(indices(GENESIS_COMMITTEES[slot]), committees.get(slot).validators());
    }
  }

  @Test
  @DisplayName("Committees partition the active set with sizes differing by at most one")
  void committeesPartitionActiveSet() {
    final CommitteeCalculator minimal = new CommitteeCalculator(ChainConfig.MINIMAL);
    final LightState state =
        LightState.fromSnapshot(
            ChainConfig.MINIMAL, Epoch.of(3), ValidatorFixtures.activeValidators(1000), SEED_MIX);

    final List<BeaconCommittee> committees = minimal.computeEpochCommittees(state, Epoch.of(3));

    // 1000 / 8 / 4 = 31, clamped to 4 committees per slot
    assertEquals(32, committees.size());
    final List<Integer> members =
        committees.stream()
            .flatMap(committee -> committee.validators().stream())
            .map(ValidatorIndex::value)
            .sorted()
            .collect(Collectors.toList());
    assertEquals(IntStream.range(0, 1000).boxed().collect(Collectors.toList()), members);

    final int smallest = committees.stream().mapToInt(BeaconCommittee::size).min().orElseThrow();
    final int largest = committees.stream().mapToInt(BeaconCommittee::size).max().orElseThrow();
    assertTrue(largest - smallest <= 1, "sizes range from " + smallest + " to " + largest);

    for (int position = 0; position < committees.size(); position++) {
      final BeaconCommittee committee = committees.get(position);
      assertEquals(Slot.of(24 + position / 4), committee.slot());
      assertEquals(CommitteeIndex.of(position % 4), committee.index());
    }
  }

  @ParameterizedTest(name = "{0} active validators -> {1} committees per slot")
  @CsvSource({"0, 1", "1, 1", "4095, 1", "4096, 1", "8191, 1", "8192, 2", "262143, 63",
    "262144, 64", "1000000, 64"})
  void committeeCountIsClamped(final int activeCount, final int expected) {
    assertEquals(
        expected, new CommitteeCalculator(ChainConfig.MAINNET).committeeCountPerSlot(activeCount));
  }

  @Test
  void committeeCountOfStateCountsOnlyActiveValidators() {
    final List<Validator> validators = new ArrayList<>(ValidatorFixtures.activeValidators(63));
    validators.add(ValidatorFixtures.validator(63, Epoch.of(2), Epoch.FAR_FUTURE_EPOCH));
    final LightState state =
        LightState.fromSnapshot(ChainConfig.MINIMAL, Epoch.GENESIS, validators, SEED_MIX);

    // 64 validators would give two committees per slot
    assertEquals(
        1,
        new CommitteeCalculator(ChainConfig.MINIMAL)
            .getCommitteeCountPerSlot(state, Epoch.GENESIS));
  }

  @Test
  @DisplayName("A single committee lookup agrees with the whole-epoch computation")
  void singleCommitteeMatchesEpochCommittees() {
    final CommitteeCalculator minimal = new CommitteeCalculator(ChainConfig.MINIMAL);
    final LightState state =
        LightState.fromSnapshot(
            ChainConfig.MINIMAL, Epoch.of(2), ValidatorFixtures.activeValidators(300), SEED_MIX);
    final EpochShuffling shuffling = minimal.computeShuffling(state, Epoch.of(2));
    final List<BeaconCommittee> committees = minimal.computeEpochCommittees(shuffling);

    for (final BeaconCommittee committee : committees) {
      assertEquals(
          committee, minimal.getBeaconCommittee(shuffling, committee.slot(), committee.index()));
    }
    final BeaconCommittee last = committees.get(committees.size() - 1);
    assertEquals(last, minimal.getBeaconCommittee(state, last.slot(), last.index()));
  }

  @Test
  void shufflingIsDeterministic() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(64));

    assertEquals(
        calculator.computeShuffling(state, Epoch.GENESIS),
        calculator.computeShuffling(state, Epoch.GENESIS));
  }

  @Test
  @DisplayName("A different RANDAO mix gives a different shuffling")
  void mixDrivesTheShuffling() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(64));
    final LightState reseeded =
        state.withSeedMix(Epoch.GENESIS, Bytes32.fromHexString("0x" + "cd".repeat(32)));

    final EpochShuffling original = calculator.computeShuffling(state, Epoch.GENESIS);
    final EpochShuffling changed = calculator.computeShuffling(reseeded, Epoch.GENESIS);

    assertNotEquals(original.seed(), changed.seed());
    assertArrayEquals(original.activeIndices(), changed.activeIndices());
    assertFalse(Arrays.equals(original.shuffledIndices(), changed.shuffledIndices()));
  }

  @Test
  void rejectsCommitteeIndexBeyondCommitteeCount() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(10));
    final EpochShuffling shuffling = calculator.computeShuffling(state, Epoch.GENESIS);

    assertThrows(
        IllegalArgumentException.class,
        () -> calculator.getBeaconCommittee(shuffling, Slot.of(1), CommitteeIndex.of(1)));
  }

  @Test
  void rejectsSlotOutsideShuffledEpoch() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(10));
    final EpochShuffling shuffling = calculator.computeShuffling(state, Epoch.GENESIS);

    assertThrows(
        IllegalArgumentException.class,
        () -> calculator.getBeaconCommittee(shuffling, Slot.of(4), CommitteeIndex.of(0)));
  }

  @Test
  @DisplayName("An epoch without active validators cannot be shuffled")
  void rejectsEmptyActiveSet() {
    final LightState state =
        smallState(
            List.of(
                ValidatorFixtures.validator(0, Epoch.of(5), Epoch.FAR_FUTURE_EPOCH),
                ValidatorFixtures.validator(1, Epoch.of(5), Epoch.FAR_FUTURE_EPOCH)));

    assertThrows(
        IllegalStateException.class, () -> calculator.computeShuffling(state, Epoch.GENESIS));
  }

  @Test
  void rejectsStateBuiltForAnotherConfig() {
    final LightState state = smallState(ValidatorFixtures.activeValidators(10));

    assertThrows(
        IllegalArgumentException.class,
        () -> new CommitteeCalculator(ChainConfig.MINIMAL).computeShuffling(state, Epoch.GENESIS));
  }

  private static List<ValidatorIndex> indices(final int... values) {
    return Arrays.stream(values).mapToObj(ValidatorIndex::of).collect(Collectors.toList());
  }
}
