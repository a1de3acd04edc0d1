package com.codeheadsystems.cipherscore.springboot.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.cipherscore.audit.AuditSink;
import com.codeheadsystems.cipherscore.audit.InMemoryAuditSink;
import com.codeheadsystems.cipherscore.audit.Slf4jAuditSink;
import com.codeheadsystems.cipherscore.auth.AuthorizationGate;
import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.codec.HomomorphicBackend;
import com.codeheadsystems.cipherscore.codec.PaillierBackend;
import com.codeheadsystems.cipherscore.codec.SimulatedBackend;
import com.codeheadsystems.cipherscore.engine.HomomorphicEngine;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.manager.CreditProfileManager;
import com.codeheadsystems.cipherscore.server.manager.LendingPoolManager;
import com.codeheadsystems.cipherscore.server.manager.ScoringManager;
import com.codeheadsystems.cipherscore.server.store.ProfileStore;
import com.codeheadsystems.cipherscore.springboot.health.EngineHealthIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class CipherScoreAutoConfigurationTest {

  private static final String SEED = "cipherscore.key-seed-hex=000102030405060708090a0b0c0d0e0f1011121314151617";

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(CipherScoreAutoConfiguration.class));

  @Test
  void simulationBackend_wiresEveryBean() {
    runner.withPropertyValues("cipherscore.backend=simulation", SEED, "cipherscore.owner-identity=0xOwner")
        .run(context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(HomomorphicBackend.class)).isInstanceOf(SimulatedBackend.class);
          assertThat(context.getBean(AuditSink.class)).isInstanceOf(Slf4jAuditSink.class);
          assertThat(context).hasSingleBean(HomomorphicEngine.class);
          assertThat(context).hasSingleBean(ProfileStore.class);
          assertThat(context).hasSingleBean(CreditProfileManager.class);
          assertThat(context).hasSingleBean(ScoringManager.class);
          assertThat(context).hasSingleBean(LendingPoolManager.class);
          assertThat(context).hasSingleBean(EngineHealthIndicator.class);
        });
  }

  @Test
  void serviceIdentity_isGrantedEngineUse() {
    runner.withPropertyValues("cipherscore.backend=SIMULATION", SEED, "cipherscore.owner-identity=0xOwner",
            "cipherscore.service-identity=scoring-service")
        .run(context -> {
          AuthorizationGate gate = context.getBean(AuthorizationGate.class);
          assertThat(gate.owner()).isEqualTo(Identity.of("0xowner"));
          assertThat(gate.isAuthorized(Identity.of("scoring-service"), Capability.ENGINE_USE)).isTrue();
          assertThat(gate.isAuthorized(Identity.of("scoring-service"), Capability.DECRYPT)).isFalse();
        });
  }

  @Test
  void paillierBackend_usesConfiguredKeySize() {
    runner.withPropertyValues("cipherscore.paillier-key-bits=512", "cipherscore.owner-identity=0xOwner")
        .run(context -> {
          HomomorphicBackend backend = context.getBean(HomomorphicBackend.class);
          assertThat(backend).isInstanceOf(PaillierBackend.class);
          assertThat(backend.name()).isEqualTo("paillier-512");
        });
  }

  @Test
  void missingOwnerIdentity_failsStartup() {
    runner.withPropertyValues("cipherscore.backend=SIMULATION", SEED)
        .run(context -> assertThat(context).hasFailed()
            .getFailure().hasRootCauseInstanceOf(IllegalStateException.class)
            .rootCause().hasMessageContaining("ownerIdentity"));
  }

  @Test
  void simulationWithoutSeed_failsStartup() {
    runner.withPropertyValues("cipherscore.backend=SIMULATION", "cipherscore.owner-identity=0xOwner")
        .run(context -> assertThat(context).hasFailed()
            .getFailure().hasRootCauseInstanceOf(IllegalStateException.class));
  }

  @Test
  void userAuditSink_backsOffDefault() {
    InMemoryAuditSink custom = new InMemoryAuditSink();
    runner.withPropertyValues("cipherscore.backend=SIMULATION", SEED, "cipherscore.owner-identity=0xOwner")
        .withBean(AuditSink.class, () -> custom)
        .run(context -> {
          assertThat(context.getBean(AuditSink.class)).isSameAs(custom);
          // the startup grant of the service identity lands in the custom sink
          assertThat(custom.records("auth.grant")).hasSize(1);
        });
  }
}
