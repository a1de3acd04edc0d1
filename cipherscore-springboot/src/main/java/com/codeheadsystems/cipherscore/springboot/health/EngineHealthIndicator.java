package com.codeheadsystems.cipherscore.springboot.health;

import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the active backend and checks that a fresh encryption has the fixed ciphertext length.
 */
public class EngineHealthIndicator implements HealthIndicator {

  private final OpaqueValueCodec codec;

  public EngineHealthIndicator(OpaqueValueCodec codec) {
    this.codec = codec;
  }

  @Override
  public Health health() {
    String backend = codec.backend().name();
    OpaqueValue probe;
    try {
      probe = codec.encrypt(0);
    } catch (RuntimeException e) {
      return Health.down(e).withDetail("backend", backend).build();
    }
    if (probe.length() != codec.ciphertextLength()) {
      return Health.down()
          .withDetail("backend", backend)
          .withDetail("reason", "Encryption produced " + probe.length() + " bytes, expected "
              + codec.ciphertextLength())
          .build();
    }
    return Health.up()
        .withDetail("backend", backend)
        .withDetail("ciphertextLength", codec.ciphertextLength())
        .build();
  }
}
