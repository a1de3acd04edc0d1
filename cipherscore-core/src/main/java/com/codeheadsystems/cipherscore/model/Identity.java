package com.codeheadsystems.cipherscore.model;

import java.util.Locale;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Opaque, comparable principal identifier supplied by the calling context.
 * <p>
 * Values are normalised to lower case so that checksummed and plain wallet addresses
 * compare equal.
 *
 * @param value the identifier, e.g. a {@code 0x}-prefixed wallet address
 */
public record Identity(String value) implements Comparable<Identity> {

  private static final int ADDRESS_LENGTH = 20;

  public Identity {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Identity value must not be blank");
    }
    value = value.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Shorthand for {@code new Identity(value)}.
   *
   * @param value the value
   * @return the identity
   */
  public static Identity of(String value) {
    return new Identity(value);
  }

  /**
   * Derives an address-style identity from an uncompressed secp256k1 public key:
   * the last 20 bytes of Keccak-256 over the 64-byte {@code x || y} encoding.
   *
   * @param publicKey 64-byte {@code x || y}, or 65 bytes with the leading {@code 0x04} SEC1 tag
   * @return the identity
   */
  public static Identity fromPublicKey(byte[] publicKey) {
    byte[] xy;
    if (publicKey.length == 65 && publicKey[0] == 0x04) {
      xy = new byte[64];
      System.arraycopy(publicKey, 1, xy, 0, 64);
    } else if (publicKey.length == 64) {
      xy = publicKey;
    } else {
      throw new IllegalArgumentException("Expected an uncompressed public key, got " + publicKey.length + " bytes");
    }
    KeccakDigest digest = new KeccakDigest(256);
    digest.update(xy, 0, xy.length);
    byte[] hash = new byte[digest.getDigestSize()];
    digest.doFinal(hash, 0);
    byte[] address = new byte[ADDRESS_LENGTH];
    System.arraycopy(hash, hash.length - ADDRESS_LENGTH, address, 0, ADDRESS_LENGTH);
    return new Identity("0x" + Hex.toHexString(address));
  }

  @Override
  public int compareTo(Identity other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
