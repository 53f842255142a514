package org.hyperledger.beacon.election.beacon.types;

import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.tuweni.bytes.Bytes48;

/** A compressed BLS12-381 public key. Carried for identification only, never verified here. */
public record BLSPubKey(Bytes48 bytes) {

  public BLSPubKey {
    checkNotNull(bytes, "bytes");
  }

  public static BLSPubKey fromHexString(final String hex) {
    return new BLSPubKey(Bytes48.fromHexString(hex));
  }

  @Override
  public String toString() {
    return bytes.toHexString();
  }
}
