package com.codeheadsystems.cipherscore.springboot.config;

import com.codeheadsystems.cipherscore.audit.AuditSink;
import com.codeheadsystems.cipherscore.audit.AuditTrail;
import com.codeheadsystems.cipherscore.audit.Slf4jAuditSink;
import com.codeheadsystems.cipherscore.auth.AuthorizationGate;
import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.codec.HomomorphicBackend;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import com.codeheadsystems.cipherscore.common.RandomProvider;
import com.codeheadsystems.cipherscore.config.EngineConfig;
import com.codeheadsystems.cipherscore.config.EngineConfig.BackendType;
import com.codeheadsystems.cipherscore.engine.HomomorphicEngine;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.manager.CreditProfileManager;
import com.codeheadsystems.cipherscore.server.manager.LendingPoolManager;
import com.codeheadsystems.cipherscore.server.manager.ScoringManager;
import com.codeheadsystems.cipherscore.server.registry.InMemoryPoolRegistry;
import com.codeheadsystems.cipherscore.server.registry.PoolRegistry;
import com.codeheadsystems.cipherscore.server.store.InMemoryProfileStore;
import com.codeheadsystems.cipherscore.server.store.ProfileStore;
import com.codeheadsystems.cipherscore.springboot.health.EngineHealthIndicator;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(CipherScoreProperties.class)
public class CipherScoreAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(CipherScoreAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance.  Override this bean to supply a custom implementation
   * (e.g. an HSM-backed or seeded provider for testing).
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditSink auditSink() {
    return new Slf4jAuditSink();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditTrail auditTrail(AuditSink auditSink, Clock clock) {
    return new AuditTrail(auditSink, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public EngineConfig engineConfig(CipherScoreProperties props, SecureRandom secureRandom) {
    BackendType type = BackendType.fromName(props.getBackend());
    String seedHex = props.getKeySeedHex();
    boolean hasSeed = seedHex != null && !seedHex.isEmpty();
    RandomProvider randomProvider = new RandomProvider(secureRandom);

    if (type == BackendType.SIMULATION) {
      if (!hasSeed) {
        throw new IllegalStateException(
            "cipherscore.keySeedHex must be configured for the simulation backend. "
                + "Generate a value with: openssl rand -hex 32");
      }
      log.warn("Simulation backend selected: ciphertexts are reversible. Do not use in production.");
      return EngineConfig.withSimulation(HexFormat.of().parseHex(seedHex)).withRandomProvider(randomProvider);
    }
    if (!hasSeed) {
      log.warn("No key seed configured; generating a random Paillier key. "
          + "All stored ciphertexts become unreadable on restart. Do not use in production.");
      return EngineConfig.withPaillier(props.getPaillierKeyBits(), randomProvider);
    }
    return EngineConfig.withPaillier(props.getPaillierKeyBits(), HexFormat.of().parseHex(seedHex), randomProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public HomomorphicBackend homomorphicBackend(EngineConfig engineConfig) {
    HomomorphicBackend backend = engineConfig.createBackend();
    log.info("cipherscore backend: {}", backend.name());
    return backend;
  }

  @Bean
  @ConditionalOnMissingBean
  public OpaqueValueCodec opaqueValueCodec(HomomorphicBackend backend) {
    return new OpaqueValueCodec(backend);
  }

  @Bean
  @Qualifier("cipherscoreServiceIdentity")
  @ConditionalOnMissingBean(name = "cipherscoreServiceIdentity")
  public Identity cipherscoreServiceIdentity(CipherScoreProperties props) {
    return Identity.of(props.getServiceIdentity());
  }

  /**
   * Gate owned by {@code cipherscore.ownerIdentity}. The pipeline's service identity is granted
   * engine use at startup.
   */
  @Bean
  @ConditionalOnMissingBean
  public AuthorizationGate authorizationGate(CipherScoreProperties props, AuditTrail auditTrail,
                                             @Qualifier("cipherscoreServiceIdentity") Identity serviceIdentity) {
    String ownerIdentity = props.getOwnerIdentity();
    if (ownerIdentity == null || ownerIdentity.isBlank()) {
      throw new IllegalStateException("cipherscore.ownerIdentity must be configured.");
    }
    Identity owner = Identity.of(ownerIdentity);
    AuthorizationGate gate = new AuthorizationGate(owner, auditTrail);
    gate.grant(owner, serviceIdentity, Capability.ENGINE_USE);
    return gate;
  }

  @Bean
  @ConditionalOnMissingBean
  public HomomorphicEngine homomorphicEngine(OpaqueValueCodec codec, AuthorizationGate gate,
                                             AuditTrail auditTrail) {
    return new HomomorphicEngine(codec, gate, auditTrail);
  }

  @Bean
  @ConditionalOnMissingBean
  public ProfileStore profileStore() {
    log.warn("Using in-memory profile store. All data will be lost on restart. Do not use in production.");
    return new InMemoryProfileStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public PoolRegistry poolRegistry() {
    log.warn("Using in-memory pool registry. All data will be lost on restart. Do not use in production.");
    return new InMemoryPoolRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public CreditProfileManager creditProfileManager(ProfileStore profileStore, OpaqueValueCodec codec, Clock clock) {
    return new CreditProfileManager(profileStore, codec, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public ScoringManager scoringManager(HomomorphicEngine engine, ProfileStore profileStore,
                                       @Qualifier("cipherscoreServiceIdentity") Identity serviceIdentity,
                                       Clock clock) {
    return new ScoringManager(engine, profileStore, serviceIdentity, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public LendingPoolManager lendingPoolManager(HomomorphicEngine engine, PoolRegistry poolRegistry,
                                               AuthorizationGate gate, AuditTrail auditTrail,
                                               @Qualifier("cipherscoreServiceIdentity") Identity serviceIdentity,
                                               Clock clock) {
    return new LendingPoolManager(engine, poolRegistry, gate, auditTrail, serviceIdentity, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public EngineHealthIndicator engineHealthIndicator(OpaqueValueCodec codec) {
    return new EngineHealthIndicator(codec);
  }
}
