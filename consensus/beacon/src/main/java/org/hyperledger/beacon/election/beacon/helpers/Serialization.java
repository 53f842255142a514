package org.hyperledger.beacon.election.beacon.helpers;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.ByteOrder;

import org.apache.tuweni.bytes.Bytes;

/** Fixed-width little-endian encodings of unsigned integers (SSZ {@code uint8/32/64}). */
public final class Serialization {

  private Serialization() {}

  public static Bytes uint8(final int value) {
    checkArgument(value >= 0 && value <= 0xff, "Value out of uint8 range: %s", value);
    return Bytes.of((byte) value);
  }

  public static Bytes uint32(final long value) {
    checkArgument(value >= 0 && value <= 0xffffffffL, "Value out of uint32 range: %s", value);
    return Bytes.ofUnsignedInt(value, ByteOrder.LITTLE_ENDIAN);
  }

  /** Encodes the 64 bits of {@code value} as an unsigned integer. */
  public static Bytes uint64(final long value) {
    return Bytes.ofUnsignedLong(value, ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Reads the first 8 bytes of {@code bytes} as a little-endian unsigned integer.
   *
   * @return the raw 64 bits, to be used with unsigned arithmetic
   */
  public static long bytesToUint64(final Bytes bytes) {
    checkArgument(bytes.size() >= 8, "Need at least 8 bytes, got %s", bytes.size());
    return bytes.slice(0, 8).toLong(ByteOrder.LITTLE_ENDIAN);
  }
}
