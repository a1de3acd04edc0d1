package com.codeheadsystems.cipherscore.server.manager;

import com.codeheadsystems.cipherscore.audit.AuditTrail;
import com.codeheadsystems.cipherscore.auth.AuthorizationGate;
import com.codeheadsystems.cipherscore.auth.Capability;
import com.codeheadsystems.cipherscore.codec.OpaqueValue;
import com.codeheadsystems.cipherscore.codec.OpaqueValueCodec;
import com.codeheadsystems.cipherscore.engine.HomomorphicEngine;
import com.codeheadsystems.cipherscore.exceptions.UnauthorizedCallerException;
import com.codeheadsystems.cipherscore.model.Identity;
import com.codeheadsystems.cipherscore.server.exceptions.InvalidPoolException;
import com.codeheadsystems.cipherscore.server.exceptions.PoolInactiveException;
import com.codeheadsystems.cipherscore.server.model.LendingPool;
import com.codeheadsystems.cipherscore.server.registry.PoolRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lending pool registration and matching of opaque scores against opaque pool thresholds.
 * <p>
 * Matching never sees a plaintext score: eligibility is a single {@code compareAtLeast} per
 * pool and the loan amount is derived homomorphically, then capped by the pool maximum.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link UnauthorizedCallerException}: registrant lacks the grant, or caller is not the pool operator</li>
 *   <li>{@link InvalidPoolException}: pool id never assigned</li>
 *   <li>{@link PoolInactiveException}: pool deactivated</li>
 *   <li>{@link com.codeheadsystems.cipherscore.exceptions.MalformedCiphertextException}: bad opaque input</li>
 *   <li>{@link IllegalArgumentException}: bad plaintext terms</li>
 * </ul>
 */
public class LendingPoolManager {

  private static final Logger log = LoggerFactory.getLogger(LendingPoolManager.class);

  /**
   * Public multiplier from score to candidate loan amount.
   */
  public static final long LOAN_SCALE = 10;

  /**
   * Upper bound for {@code interestRateBps} (100%).
   */
  public static final int MAX_INTEREST_RATE_BPS = 10_000;

  private final HomomorphicEngine engine;
  private final OpaqueValueCodec codec;
  private final PoolRegistry registry;
  private final AuthorizationGate gate;
  private final AuditTrail auditTrail;
  private final Identity serviceIdentity;
  private final Clock clock;

  /**
   * Instantiates a new lending pool manager.
   *
   * @param engine          the engine
   * @param registry        the pool registry
   * @param gate            the authorization gate
   * @param auditTrail      the audit trail
   * @param serviceIdentity identity the matcher acts as on the engine; needs {@code ENGINE_USE}
   * @param clock           the clock
   */
  public LendingPoolManager(HomomorphicEngine engine, PoolRegistry registry, AuthorizationGate gate,
                            AuditTrail auditTrail, Identity serviceIdentity, Clock clock) {
    this.engine = engine;
    this.codec = engine.codec();
    this.registry = registry;
    this.gate = gate;
    this.auditTrail = auditTrail;
    this.serviceIdentity = serviceIdentity;
    this.clock = clock;
  }

  // ── Registry ──────────────────────────────────────────────────────────────

  /**
   * Registers an active pool and returns its permanent id.
   *
   * @throws UnauthorizedCallerException if {@code operator} lacks {@link Capability#POOL_REGISTRATION}
   */
  public int addPool(Identity operator, OpaqueValue minScore, OpaqueValue maxLoan,
                     int interestRateBps, String name) {
    gate.require(operator, Capability.POOL_REGISTRATION);
    codec.requireValid(minScore);
    codec.requireValid(maxLoan);
    if (interestRateBps < 0 || interestRateBps > MAX_INTEREST_RATE_BPS) {
      throw new IllegalArgumentException("interestRateBps must be between 0 and " + MAX_INTEREST_RATE_BPS);
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Missing required field: name");
    }
    LendingPool pool = registry.append(operator, minScore, maxLoan, interestRateBps, name.trim(), clock.instant());
    log.info("Registered lending pool {} '{}' for {}", pool.poolId(), pool.name(), operator);
    auditTrail.record("pool.add", operator, String.valueOf(pool.poolId()));
    return pool.poolId();
  }

  /**
   * Deactivates a pool. Only its operator may do so; deactivating twice is a no-op.
   *
   * @throws InvalidPoolException        if the id was never assigned
   * @throws UnauthorizedCallerException if {@code caller} is not the pool's operator
   */
  public void deactivate(Identity caller, int poolId) {
    LendingPool pool = getPool(poolId);
    if (!pool.operator().equals(caller)) {
      throw new UnauthorizedCallerException(caller, "Only the operator of pool " + poolId + " may deactivate it");
    }
    if (!registry.deactivate(poolId)) {
      return;
    }
    log.info("Deactivated lending pool {}", poolId);
    auditTrail.record("pool.deactivate", caller, String.valueOf(poolId));
  }

  /**
   * Loads a pool.
   *
   * @throws InvalidPoolException if the id was never assigned
   */
  public LendingPool getPool(int poolId) {
    return registry.get(poolId).orElseThrow(() -> new InvalidPoolException(poolId));
  }

  public int poolCount() {
    return registry.size();
  }

  public List<LendingPool> pools() {
    return registry.snapshot();
  }

  // ── Matching ──────────────────────────────────────────────────────────────

  /**
   * Ids of every active pool whose minimum score the given score meets, in registration order.
   */
  public List<Integer> findMatches(OpaqueValue opaqueScore) {
    codec.requireValid(opaqueScore);
    List<Integer> matches = new ArrayList<>();
    for (LendingPool pool : registry.snapshot()) {
      if (pool.active() && engine.compareAtLeast(serviceIdentity, opaqueScore, pool.minScore())) {
        matches.add(pool.poolId());
      }
    }
    log.debug("findMatches() matched {} pool(s)", matches.size());
    return matches;
  }

  /**
   * Opaque loan amount for a score in a pool: {@code score * LOAN_SCALE}, capped at the pool's
   * maximum. When the cap applies the pool's own max-loan value is returned unchanged.
   *
   * @throws InvalidPoolException  if the id was never assigned
   * @throws PoolInactiveException if the pool was deactivated
   */
  public OpaqueValue optimalLoanAmount(OpaqueValue opaqueScore, int poolId) {
    LendingPool pool = getPool(poolId);
    if (!pool.active()) {
      throw new PoolInactiveException(poolId);
    }
    log.debug("optimalLoanAmount() pool={}", poolId);
    OpaqueValue candidate = engine.scalarMultiply(serviceIdentity, opaqueScore, LOAN_SCALE);
    return engine.compareAtLeast(serviceIdentity, candidate, pool.maxLoan()) ? pool.maxLoan() : candidate;
  }
}
