package com.codeheadsystems.cipherscore.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherscore.codec.HomomorphicBackend;
import com.codeheadsystems.cipherscore.codec.PaillierBackend;
import com.codeheadsystems.cipherscore.codec.SimulatedBackend;
import com.codeheadsystems.cipherscore.common.RandomProvider;
import com.codeheadsystems.cipherscore.config.EngineConfig.BackendType;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void default_isPaillier2048() {
    assertThat(EngineConfig.DEFAULT.backendType()).isEqualTo(BackendType.PAILLIER);
    assertThat(EngineConfig.DEFAULT.paillierKeyBits()).isEqualTo(2048);
    assertThat(EngineConfig.DEFAULT.keySeed()).isNull();
  }

  @Test
  void forTesting_buildsSimulation() {
    HomomorphicBackend backend = EngineConfig.forTesting().createBackend();

    assertThat(backend).isInstanceOf(SimulatedBackend.class);
    assertThat(backend.ciphertextLength()).isEqualTo(64);
  }

  @Test
  void forTestingPaillier_isReproducible() {
    HomomorphicBackend first = EngineConfig.forTesting(BackendType.PAILLIER).createBackend();
    HomomorphicBackend second = EngineConfig.forTesting(BackendType.PAILLIER).createBackend();

    assertThat(first).isInstanceOf(PaillierBackend.class);
    assertThat(first.name()).isEqualTo("paillier-" + EngineConfig.TEST_PAILLIER_KEY_BITS);
    assertThat(first.encrypt(BigInteger.TEN)).isEqualTo(second.encrypt(BigInteger.TEN));
  }

  @Test
  void forTestingPaillier_noiseStreamIsIndependentOfKeyStream() {
    EngineConfig config = EngineConfig.forTesting(BackendType.PAILLIER);

    byte[] keyStream = RandomProvider.seeded(config.keySeed()).randomBytes(64);
    byte[] noiseStream = config.randomProvider().randomBytes(64);

    assertThat(noiseStream).isNotEqualTo(keyStream);
  }

  @Test
  void withPaillier_seededKeyIsStableButNoiseIsFresh() {
    byte[] seed = "deployment-key-seed".getBytes(StandardCharsets.US_ASCII);
    PaillierBackend first = (PaillierBackend) EngineConfig.withPaillier(512, seed, new RandomProvider()).createBackend();
    PaillierBackend second = (PaillierBackend) EngineConfig.withPaillier(512, seed, new RandomProvider()).createBackend();

    assertThat(first.publicModulus()).isEqualTo(second.publicModulus());
    assertThat(first.encrypt(BigInteger.TEN)).isNotEqualTo(second.encrypt(BigInteger.TEN));
    assertThat(second.decrypt(first.encrypt(BigInteger.TEN))).isEqualTo(BigInteger.TEN);
  }

  @Test
  void withPaillier_rejectsSmallKeysAtBuildTime() {
    EngineConfig config = EngineConfig.withPaillier(256, new RandomProvider());

    assertThatThrownBy(config::createBackend).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void simulation_requiresKey() {
    assertThatThrownBy(() -> new EngineConfig(BackendType.SIMULATION, 0, null, new RandomProvider()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withRandomProvider_keepsEverythingElse() {
    RandomProvider provider = new RandomProvider();
    EngineConfig config = EngineConfig.forTesting().withRandomProvider(provider);

    assertThat(config.randomProvider()).isSameAs(provider);
    assertThat(config.backendType()).isEqualTo(BackendType.SIMULATION);
  }

  @Test
  void backendType_fromName_isCaseInsensitive() {
    assertThat(BackendType.fromName(" paillier ")).isEqualTo(BackendType.PAILLIER);
    assertThat(BackendType.fromName("Simulation")).isEqualTo(BackendType.SIMULATION);
    assertThatThrownBy(() -> BackendType.fromName("rsa"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown backend");
  }
}
