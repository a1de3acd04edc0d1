package com.codeheadsystems.cipherscore.common;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used by the Paillier backend for key generation and encryption randomness.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Creates a RandomProvider whose output is fully determined by {@code seed}.
   * <p>
   * Uses the {@code SHA1PRNG} algorithm, which is seeded exclusively by the first
   * {@link SecureRandom#setSeed(byte[])} call. For tests and reproducible dev setups only.
   *
   * @param seed the seed
   * @return a deterministic provider
   */
  public static RandomProvider seeded(byte[] seed) {
    try {
      SecureRandom random = SecureRandom.getInstance("SHA1PRNG");
      random.setSeed(seed);
      return new RandomProvider(random);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA1PRNG not available", e);
    }
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }
}
