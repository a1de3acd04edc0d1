package com.codeheadsystems.cipherscore.codec;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * An encrypted non-negative integer.
 * <p>
 * Instances are produced only by {@link OpaqueValueCodec} (encryption, engine results, or
 * validated re-hydration via {@link OpaqueValueCodec#wrap(byte[])}), so every instance has the
 * active backend's fixed length. Immutable; equality is byte equality.
 */
public final class OpaqueValue {

  private final byte[] bytes;

  OpaqueValue(byte[] bytes) {
    this.bytes = bytes.clone();
  }

  /**
   * Returns a copy of the ciphertext bytes, e.g. for persistence.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  /**
   * Hex encoding of the ciphertext. Safe to log or audit: it carries no plaintext.
   *
   * @return the hex string
   */
  public String toHex() {
    return Hex.toHexString(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OpaqueValue other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "OpaqueValue[" + bytes.length + " bytes, " + Hex.toHexString(bytes, 0, Math.min(4, bytes.length)) + "...]";
  }
}
