package org.hyperledger.beacon.election.beacon.types;

import org.apache.tuweni.bytes.Bytes;

// https://ethereum.github.io/consensus-specs/specs/phase0/beacon-chain/#domain-types
public enum DomainType {
  BEACON_PROPOSER("0x00000000"),
  BEACON_ATTESTER("0x01000000"),
  RANDAO("0x02000000"),
  DEPOSIT("0x03000000"),
  VOLUNTARY_EXIT("0x04000000"),
  SELECTION_PROOF("0x05000000"),
  AGGREGATE_AND_PROOF("0x06000000"),
  APPLICATION_MASK("0x00000001");

  private final Bytes tag;

  DomainType(final String tag) {
    this.tag = Bytes.fromHexString(tag);
  }

  /**
   * The 4-byte domain tag prepended to hashed preimages.
   *
   * @return the tag
   */
  public Bytes tag() {
    return tag;
  }
}
