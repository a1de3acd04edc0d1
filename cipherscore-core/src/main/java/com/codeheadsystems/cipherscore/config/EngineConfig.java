package com.codeheadsystems.cipherscore.config;

import com.codeheadsystems.cipherscore.codec.HomomorphicBackend;
import com.codeheadsystems.cipherscore.codec.PaillierBackend;
import com.codeheadsystems.cipherscore.codec.SimulatedBackend;
import com.codeheadsystems.cipherscore.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Configuration for the encryption backend behind the codec and engine.
 * <p>
 * {@code keySeed} is the HMAC key for {@link BackendType#SIMULATION}. For
 * {@link BackendType#PAILLIER} it seeds key generation so the same key is derived on every start;
 * when null a random key is generated. Encryption randomness always comes from
 * {@code randomProvider}.
 */
public record EngineConfig(
    BackendType backendType,
    int paillierKeyBits,
    byte[] keySeed,
    RandomProvider randomProvider
) {

  public static final int DEFAULT_PAILLIER_KEY_BITS = 2048;

  /**
   * Key size used by {@link #forTesting(BackendType)}; large enough for the 256-bit plaintext
   * width, small enough to keep key generation fast.
   */
  public static final int TEST_PAILLIER_KEY_BITS = 1024;

  private static final byte[] TEST_SEED =
      "cipherscore-simulation-test-key!".getBytes(StandardCharsets.US_ASCII);

  // Encryption noise for forTesting(PAILLIER); must not replay the key-generation stream.
  private static final byte[] TEST_NOISE_SEED =
      "cipherscore-paillier-test-noise".getBytes(StandardCharsets.US_ASCII);

  /**
   * Default configuration for production use: 2048-bit Paillier with a random key and a fresh
   * {@code SecureRandom}.
   */
  public static final EngineConfig DEFAULT = new EngineConfig(
      BackendType.PAILLIER, DEFAULT_PAILLIER_KEY_BITS, null, new RandomProvider());

  public EngineConfig {
    if (backendType == null) {
      throw new IllegalArgumentException("Missing backend type");
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("Missing random provider");
    }
    if (backendType == BackendType.SIMULATION && keySeed == null) {
      throw new IllegalArgumentException("The simulation backend requires a key");
    }
  }

  /**
   * Creates a test configuration with the deterministic simulation backend and a fixed key.
   */
  public static EngineConfig forTesting() {
    return withSimulation(TEST_SEED);
  }

  /**
   * Creates a fully reproducible test configuration for the given backend type.
   */
  public static EngineConfig forTesting(BackendType type) {
    return switch (type) {
      case SIMULATION -> forTesting();
      case PAILLIER -> new EngineConfig(BackendType.PAILLIER, TEST_PAILLIER_KEY_BITS, TEST_SEED.clone(),
          RandomProvider.seeded(TEST_NOISE_SEED));
    };
  }

  /**
   * Creates a Paillier configuration with a random key.
   */
  public static EngineConfig withPaillier(int keyBits, RandomProvider randomProvider) {
    return new EngineConfig(BackendType.PAILLIER, keyBits, null, randomProvider);
  }

  /**
   * Creates a Paillier configuration whose key is derived from {@code keySeed}.
   */
  public static EngineConfig withPaillier(int keyBits, byte[] keySeed, RandomProvider randomProvider) {
    return new EngineConfig(BackendType.PAILLIER, keyBits, keySeed.clone(), randomProvider);
  }

  /**
   * Creates a simulation configuration with the given HMAC key.
   */
  public static EngineConfig withSimulation(byte[] key) {
    return new EngineConfig(BackendType.SIMULATION, 0, key.clone(), new RandomProvider());
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public EngineConfig withRandomProvider(RandomProvider randomProvider) {
    return new EngineConfig(backendType, paillierKeyBits, keySeed, randomProvider);
  }

  /**
   * Builds the backend this configuration describes.
   */
  public HomomorphicBackend createBackend() {
    return switch (backendType) {
      case SIMULATION -> new SimulatedBackend(keySeed);
      case PAILLIER -> PaillierBackend.generate(paillierKeyBits,
          keySeed == null ? randomProvider : RandomProvider.seeded(keySeed),
          randomProvider);
    };
  }

  /**
   * Available backends.
   */
  public enum BackendType {
    SIMULATION,
    PAILLIER;

    /**
     * Case-insensitive lookup.
     *
     * @param name the name
     * @return the backend type
     */
    public static BackendType fromName(String name) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Missing backend name");
      }
      try {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown backend: " + name, e);
      }
    }
  }
}
