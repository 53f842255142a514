package org.hyperledger.beacon.election.beacon.helpers;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.Bytes32;

/** SHA-256, the hash function of the consensus layer. */
public final class Hashing {

  private static final String SHA256 = "SHA-256";

  private static final ThreadLocal<MessageDigest> DIGEST =
      ThreadLocal.withInitial(Hashing::newDigest);

  private Hashing() {}

  public static Bytes32 sha256(final Bytes... parts) {
    final MessageDigest digest = DIGEST.get();
    for (final Bytes part : parts) {
      digest.update(part.toArrayUnsafe());
    }
    return Bytes32.wrap(digest.digest());
  }

  /**
   * Hashes the first {@code length} bytes of {@code input}.
   *
   * @param input the buffer holding the preimage
   * @param length preimage length
   * @return the 32-byte digest
   */
  public static byte[] sha256(final byte[] input, final int length) {
    final MessageDigest digest = DIGEST.get();
    digest.update(input, 0, length);
    return digest.digest();
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(SHA256);
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException(SHA256 + " is not available", e);
    }
  }
}
