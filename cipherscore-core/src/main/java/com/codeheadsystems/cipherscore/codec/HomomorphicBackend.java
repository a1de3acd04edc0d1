package com.codeheadsystems.cipherscore.codec;

import java.math.BigInteger;

/**
 * Pluggable encryption provider behind the codec/engine boundary.
 * <p>
 * Implementations work on raw ciphertext bytes of a single fixed length. For all plaintexts
 * {@code x}, {@code y} and non-negative scalars {@code k} within the backend's plaintext modulus:
 * <ul>
 *   <li>{@code decrypt(add(encrypt(x), encrypt(y))) == x + y}</li>
 *   <li>{@code decrypt(multiply(encrypt(x), k)) == x * k}</li>
 *   <li>{@code signum(compare(encrypt(x), encrypt(y))) == signum(x - y)}</li>
 * </ul>
 * Implementations must be thread-safe. Callers pass only blobs that already passed
 * {@link #validate(byte[])}.
 */
public interface HomomorphicBackend {

  /**
   * Short backend name used in logs and health reports.
   */
  String name();

  /**
   * The fixed ciphertext length in bytes.
   */
  int ciphertextLength();

  /**
   * Upper bound (exclusive) of the plaintext space. Arithmetic wraps modulo this value.
   */
  BigInteger plaintextModulus();

  byte[] encrypt(BigInteger plaintext);

  BigInteger decrypt(byte[] ciphertext);

  byte[] add(byte[] a, byte[] b);

  byte[] multiply(byte[] a, BigInteger scalar);

  /**
   * Orders two ciphertexts by their plaintexts without returning either plaintext.
   *
   * @return negative, zero or positive as plaintext(a) is less than, equal to or greater than plaintext(b)
   */
  default int compare(byte[] a, byte[] b) {
    return decrypt(a).compareTo(decrypt(b));
  }

  /**
   * Structural validation beyond the length check.
   *
   * @param ciphertext a blob of {@link #ciphertextLength()} bytes
   * @return true if the blob is a well-formed ciphertext for this backend's key
   */
  boolean validate(byte[] ciphertext);
}
