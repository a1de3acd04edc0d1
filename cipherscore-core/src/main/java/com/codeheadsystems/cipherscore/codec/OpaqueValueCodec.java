package com.codeheadsystems.cipherscore.codec;

import com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes plaintext integers into {@link OpaqueValue}s and back over a pluggable
 * {@link HomomorphicBackend}.
 * <p>
 * Every plaintext must fit in {@link #PLAINTEXT_BITS} bits. Output length is the backend's fixed
 * ciphertext length for every plaintext, so magnitude never shows through size.
 * <p>
 * {@link #decrypt(OpaqueValue)} is the raw escape hatch; services reach it only through
 * {@code HomomorphicEngine#decrypt}, which enforces the decrypt capability.
 */
public class OpaqueValueCodec {

  private static final Logger log = LoggerFactory.getLogger(OpaqueValueCodec.class);

  /**
   * Fixed plaintext width accepted by {@link #encrypt(BigInteger)}.
   */
  public static final int PLAINTEXT_BITS = 256;

  private final HomomorphicBackend backend;

  /**
   * Instantiates a new codec.
   *
   * @param backend the backend
   */
  public OpaqueValueCodec(HomomorphicBackend backend) {
    if (backend.plaintextModulus().bitLength() <= PLAINTEXT_BITS) {
      throw new IllegalArgumentException("Backend " + backend.name() + " plaintext space is narrower than "
          + PLAINTEXT_BITS + " bits");
    }
    this.backend = backend;
    log.debug("OpaqueValueCodec using backend={} ciphertextLength={}", backend.name(), backend.ciphertextLength());
  }

  public HomomorphicBackend backend() {
    return backend;
  }

  public int ciphertextLength() {
    return backend.ciphertextLength();
  }

  /**
   * Encrypts a non-negative plaintext.
   *
   * @param plaintext the plaintext
   * @return the opaque value
   * @throws IllegalArgumentException if the plaintext is negative or wider than {@link #PLAINTEXT_BITS}
   */
  public OpaqueValue encrypt(BigInteger plaintext) {
    if (plaintext == null || plaintext.signum() < 0) {
      throw new IllegalArgumentException("Plaintext must be a non-negative integer");
    }
    if (plaintext.bitLength() > PLAINTEXT_BITS) {
      throw new IllegalArgumentException("Plaintext exceeds " + PLAINTEXT_BITS + " bits");
    }
    return new OpaqueValue(backend.encrypt(plaintext));
  }

  /**
   * Encrypts a non-negative plaintext.
   *
   * @param plaintext the plaintext
   * @return the opaque value
   */
  public OpaqueValue encrypt(long plaintext) {
    return encrypt(BigInteger.valueOf(plaintext));
  }

  /**
   * Decrypts an opaque value. Privileged.
   *
   * @param value the value
   * @return the plaintext
   * @throws MalformedCiphertextException if the value is not a valid ciphertext for this backend
   */
  public BigInteger decrypt(OpaqueValue value) {
    return backend.decrypt(open(value));
  }

  /**
   * Re-hydrates a stored ciphertext after checking its length and structure.
   *
   * @param ciphertext raw bytes previously obtained from {@link OpaqueValue#bytes()}
   * @return the opaque value
   * @throws MalformedCiphertextException if the blob is not a valid ciphertext for this backend
   */
  public OpaqueValue wrap(byte[] ciphertext) {
    if (ciphertext == null) {
      throw new IllegalArgumentException("Missing ciphertext");
    }
    checkLength(ciphertext.length);
    if (!backend.validate(ciphertext)) {
      throw new MalformedCiphertextException("Ciphertext failed " + backend.name() + " validation");
    }
    return new OpaqueValue(ciphertext);
  }

  /**
   * Checks that an opaque value belongs to this codec's backend and returns its raw bytes.
   *
   * @param value the value
   * @return a copy of the ciphertext bytes
   * @throws MalformedCiphertextException if the value has the wrong length or fails validation
   */
  public byte[] open(OpaqueValue value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing opaque value");
    }
    checkLength(value.length());
    byte[] bytes = value.bytes();
    if (!backend.validate(bytes)) {
      throw new MalformedCiphertextException("Ciphertext failed " + backend.name() + " validation");
    }
    return bytes;
  }

  /**
   * Validates an opaque value without exposing its bytes.
   *
   * @param value the value
   * @return the same value
   */
  public OpaqueValue requireValid(OpaqueValue value) {
    open(value);
    return value;
  }

  private void checkLength(int length) {
    if (length != backend.ciphertextLength()) {
      throw new MalformedCiphertextException("Expected " + backend.ciphertextLength()
          + "-byte ciphertext, got " + length);
    }
  }
}
