package org.hyperledger.beacon.election.beacon.containers.beacon_state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.tuweni.bytes.Bytes32;
import org.hyperledger.beacon.election.beacon.types.Epoch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RandaoMixesTest {

  private static final Bytes32 MIX = Bytes32.fromHexString("0x" + "5a".repeat(32));

  @Test
  void unpopulatedSlotsReadAsZero() {
    final RandaoMixes mixes = RandaoMixes.empty(8);
    assertEquals(8, mixes.length());
    for (int epoch = 0; epoch < 8; epoch++) {
      assertEquals(Bytes32.ZERO, mixes.get(Epoch.of(epoch)));
    }
  }

  @Test
  @DisplayName("get(epoch) wraps around the ring")
  void wrapsAround() {
    final RandaoMixes mixes = RandaoMixes.empty(8).withMix(Epoch.of(3), MIX);
    assertEquals(MIX, mixes.get(Epoch.of(3)));
    assertEquals(MIX, mixes.get(Epoch.of(11)));
    assertEquals(MIX, mixes.get(Epoch.of(8 * 1_000_003L + 3)));
    assertEquals(mixes.get(Epoch.of(8)), mixes.get(Epoch.of(0)));
    // 2^64 - 1 = 7 mod 8
    assertEquals(mixes.getAt(7), mixes.get(Epoch.FAR_FUTURE_EPOCH));
  }

  @Test
  @DisplayName("Writing a slot leaves the original ring untouched")
  void writesProduceNewRing() {
    final RandaoMixes empty = RandaoMixes.empty(8);
    final RandaoMixes updated = empty.withMix(Epoch.of(13), MIX);

    assertEquals(Bytes32.ZERO, empty.get(Epoch.of(5)));
    assertEquals(MIX, updated.getAt(5));
    assertNotEquals(empty, updated);
    assertEquals(updated, RandaoMixes.empty(8).withMixAt(5, MIX));
  }

  @Test
  void rejectsInvalidPositions() {
    final RandaoMixes mixes = RandaoMixes.empty(8);
    assertThrows(IllegalArgumentException.class, () -> mixes.getAt(8));
    assertThrows(IllegalArgumentException.class, () -> mixes.withMixAt(-1, MIX));
    assertThrows(IllegalArgumentException.class, () -> RandaoMixes.empty(0));
  }
}
